package isms.ismsbackend.service.storage;

import isms.ismsbackend.config.IntegrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Microsoft Graph (SharePoint) 조회 클라이언트.
 * 404는 Optional.empty(), 그 외 실패는 RestClientException 으로 전달한다.
 */
@Slf4j
@Component
public class SharePointGraphClient {

    private final RestTemplate restTemplate;
    private final String graphBaseUrl;

    public SharePointGraphClient(@Qualifier("graphRestTemplate") RestTemplate restTemplate,
                                 IntegrationProperties properties) {
        this.restTemplate = restTemplate;
        this.graphBaseUrl = trimTrailingSlash(properties.getSharepoint().getGraphBaseUrl());
    }

    /**
     * driveItem 메타데이터 (name, webUrl) 조회
     */
    public Optional<SharePointItem> getItem(String accessToken, String siteId, String driveId, String itemId) {
        return get(accessToken, graphBaseUrl + "/sites/{siteId}/drives/{driveId}/items/{itemId}",
                siteId, driveId, itemId);
    }

    /**
     * 사이트 webUrl 조회 (항목 webUrl이 없을 때 대체 URL 생성용)
     */
    public Optional<String> getSiteWebUrl(String accessToken, String siteId) {
        return get(accessToken, graphBaseUrl + "/sites/{siteId}", siteId)
                .map(SharePointItem::getWebUrl);
    }

    private Optional<SharePointItem> get(String accessToken, String uriTemplate, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<SharePointItem> response = restTemplate.exchange(
                    uriTemplate, HttpMethod.GET, new HttpEntity<>(headers), SharePointItem.class, uriVariables);
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Graph 리소스 없음: {}", uriTemplate);
            return Optional.empty();
        }
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
