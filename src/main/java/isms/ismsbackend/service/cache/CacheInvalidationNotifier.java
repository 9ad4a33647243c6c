package isms.ismsbackend.service.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import isms.ismsbackend.config.IntegrationProperties;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * document-service의 PDF 렌더링 캐시 무효화 호출.
 * best-effort: 실패는 로그만 남기고 0을 반환한다.
 */
@Slf4j
@Service
public class CacheInvalidationNotifier {

    static final String INTERNAL_TOKEN_HEADER = "X-Internal-Service-Token";

    private final RestTemplate restTemplate;
    private final IntegrationProperties.DocumentService settings;

    public CacheInvalidationNotifier(@Qualifier("documentServiceRestTemplate") RestTemplate restTemplate,
                                     IntegrationProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getDocumentService();
    }

    /**
     * @return 무효화된 캐시 항목 수 (비활성/실패 시 0)
     */
    public int invalidate(String documentId) {
        String baseUrl = settings.getBaseUrl();
        if (!StringUtils.hasText(baseUrl)) {
            log.debug("document-service 미설정, 캐시 무효화 생략: documentId={}", documentId);
            return 0;
        }

        HttpHeaders headers = new HttpHeaders();
        if (StringUtils.hasText(settings.getInternalToken())) {
            headers.set(INTERNAL_TOKEN_HEADER, settings.getInternalToken());
        }

        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        try {
            ResponseEntity<InvalidationResponse> response = restTemplate.exchange(
                    trimmed + "/v1/cache/{documentId}", HttpMethod.DELETE, new HttpEntity<>(headers),
                    InvalidationResponse.class, documentId);
            InvalidationResponse body = response.getBody();
            int invalidated = body != null ? body.getInvalidated() : 0;
            log.info("PDF 캐시 무효화 완료: documentId={}, invalidated={}", documentId, invalidated);
            return invalidated;
        } catch (Exception e) {
            log.warn("PDF 캐시 무효화 실패: documentId={}, reason={}", documentId, e.getMessage());
            return 0;
        }
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InvalidationResponse {
        private int invalidated;
    }
}
