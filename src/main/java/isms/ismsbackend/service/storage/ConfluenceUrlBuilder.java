package isms.ismsbackend.service.storage;

import isms.ismsbackend.config.IntegrationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Confluence 페이지 URL 생성 (외부 호출 없음)
 */
@Component
@RequiredArgsConstructor
public class ConfluenceUrlBuilder {

    private final IntegrationProperties properties;

    public Optional<String> build(String spaceKey, String pageId) {
        String baseUrl = properties.getConfluence().getBaseUrl();
        if (!StringUtils.hasText(baseUrl) || !StringUtils.hasText(spaceKey) || !StringUtils.hasText(pageId)) {
            return Optional.empty();
        }
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return Optional.of(UriComponentsBuilder.fromHttpUrl(trimmed)
                .path("/pages/viewpage.action")
                .queryParam("pageId", pageId)
                .build()
                .toUriString());
    }
}
