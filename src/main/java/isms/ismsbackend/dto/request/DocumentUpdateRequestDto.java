package isms.ismsbackend.dto.request;

import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.StorageLocation;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Optional;

/**
 * 문서 부분 수정 요청.
 * <p>
 * 일반 필드는 null 이면 "변경 없음".
 * Optional 필드는 세 가지 상태를 구분한다.
 * <ul>
 *     <li>null: 요청에 없음 (변경 없음)</li>
 *     <li>Optional.empty() 또는 빈 문자열: 값 비우기</li>
 *     <li>값 있음: 변경</li>
 * </ul>
 * 버전 라벨은 이 요청으로 바꿀 수 없다 (version-updates 사용).
 */
@Getter
@Setter
@NoArgsConstructor
public class DocumentUpdateRequestDto {

    private String title;
    private DocumentType type;
    private DocumentStatus status;
    private StorageLocation storageLocation;
    private String ownerUserId;
    private Boolean requiresAcknowledgement;

    private Optional<String> sharePointSiteId;
    private Optional<String> sharePointDriveId;
    private Optional<String> sharePointItemId;
    private Optional<String> confluenceSpaceKey;
    private Optional<String> confluencePageId;

    private Optional<String> lastChangedDate;
    private Optional<String> lastReviewDate;
    private Optional<String> nextReviewDate;

    // 현재 버전의 이력 노트 (null 이면 이력 변경 없음)
    private String versionNotes;
}
