package isms.ismsbackend.service.storage;

import isms.ismsbackend.enums.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * 저장소 식별자로부터 브라우저용 문서 URL을 만든다.
 * 어떤 실패도 예외로 올리지 않고 Optional.empty()로 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageLocationResolver {

    private static final String SHAREPOINT_VIEWER_PATH = "/_layouts/15/Doc.aspx?sourcedoc=";

    private final SharePointGraphClient graphClient;
    private final ConfluenceUrlBuilder confluenceUrlBuilder;

    public boolean identifiersComplete(StorageLocation location, StorageIdentifiers identifiers) {
        if (location == null || identifiers == null) {
            return false;
        }
        return switch (location) {
            case SHAREPOINT -> identifiers.isSharePointComplete();
            case CONFLUENCE -> identifiers.isConfluenceComplete();
        };
    }

    /**
     * @param accessToken SharePoint 조회용 Graph 토큰 (Confluence는 사용 안 함)
     */
    public Optional<String> resolve(StorageLocation location, StorageIdentifiers identifiers, String accessToken) {
        if (!identifiersComplete(location, identifiers)) {
            return Optional.empty();
        }
        return switch (location) {
            case SHAREPOINT -> resolveSharePoint(identifiers, accessToken);
            case CONFLUENCE -> {
                Optional<String> url = confluenceUrlBuilder.build(
                        identifiers.getConfluenceSpaceKey(), identifiers.getConfluencePageId());
                if (url.isEmpty()) {
                    log.warn("Confluence base URL 미설정으로 URL 생성 불가: pageId={}", identifiers.getConfluencePageId());
                }
                yield url;
            }
        };
    }

    private Optional<String> resolveSharePoint(StorageIdentifiers ids, String accessToken) {
        if (!StringUtils.hasText(accessToken)) {
            log.debug("Graph 토큰 없음, SharePoint URL 생성 생략: itemId={}", ids.getSharePointItemId());
            return Optional.empty();
        }

        try {
            Optional<SharePointItem> item = graphClient.getItem(accessToken,
                    ids.getSharePointSiteId(), ids.getSharePointDriveId(), ids.getSharePointItemId());
            if (item.isEmpty()) {
                log.warn("SharePoint 항목 없음, URL 비움: siteId={}, itemId={}",
                        ids.getSharePointSiteId(), ids.getSharePointItemId());
                return Optional.empty();
            }
            if (StringUtils.hasText(item.get().getWebUrl())) {
                return Optional.of(item.get().getWebUrl());
            }

            // 항목은 있으나 webUrl이 비어 있으면 사이트 URL 기반 뷰어 링크
            return graphClient.getSiteWebUrl(accessToken, ids.getSharePointSiteId())
                    .filter(StringUtils::hasText)
                    .map(siteUrl -> siteUrl + SHAREPOINT_VIEWER_PATH + ids.getSharePointItemId());
        } catch (RestClientException e) {
            log.warn("SharePoint URL 생성 실패: siteId={}, itemId={}, reason={}",
                    ids.getSharePointSiteId(), ids.getSharePointItemId(), e.getMessage());
            return Optional.empty();
        }
    }
}
