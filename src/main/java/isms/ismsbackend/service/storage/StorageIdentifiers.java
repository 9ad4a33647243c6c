package isms.ismsbackend.service.storage;

import isms.ismsbackend.entity.document.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.StringUtils;

/**
 * 외부 저장소 식별자 묶음. 활성 저장소에 해당하는 값만 의미가 있다.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class StorageIdentifiers {

    private final String sharePointSiteId;
    private final String sharePointDriveId;
    private final String sharePointItemId;
    private final String confluenceSpaceKey;
    private final String confluencePageId;

    public static StorageIdentifiers of(Document document) {
        return new StorageIdentifiers(
                document.getSharePointSiteId(),
                document.getSharePointDriveId(),
                document.getSharePointItemId(),
                document.getConfluenceSpaceKey(),
                document.getConfluencePageId());
    }

    public static StorageIdentifiers sharePoint(String siteId, String driveId, String itemId) {
        return new StorageIdentifiers(siteId, driveId, itemId, null, null);
    }

    public static StorageIdentifiers confluence(String spaceKey, String pageId) {
        return new StorageIdentifiers(null, null, null, spaceKey, pageId);
    }

    public boolean isSharePointComplete() {
        return StringUtils.hasText(sharePointSiteId)
                && StringUtils.hasText(sharePointDriveId)
                && StringUtils.hasText(sharePointItemId);
    }

    public boolean isConfluenceComplete() {
        return StringUtils.hasText(confluenceSpaceKey) && StringUtils.hasText(confluencePageId);
    }
}
