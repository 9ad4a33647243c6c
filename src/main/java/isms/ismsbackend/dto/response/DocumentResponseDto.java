package isms.ismsbackend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.StorageLocation;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 문서 응답. 목록/등록/수정은 owner와 검토 플래그까지,
 * 상세 조회는 통제항목/리스크/현재 버전 노트까지 채운다.
 */
@Getter
@Setter
public class DocumentResponseDto {
    private String id;
    private String title;
    private DocumentType type;
    private StorageLocation storageLocation;
    private String sharePointSiteId;
    private String sharePointDriveId;
    private String sharePointItemId;
    private String confluenceSpaceKey;
    private String confluencePageId;
    private String documentUrl;
    private String version;
    private DocumentStatus status;
    private String ownerUserId;
    private OwnerSummaryDto owner;
    private Boolean requiresAcknowledgement;
    private LocalDateTime lastChangedDate;
    private LocalDateTime lastReviewDate;
    private LocalDateTime nextReviewDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // 검토 일정 (APPROVED / IN_REVIEW 에서만 true 가능)
    private Boolean isOverdueReview;
    private Boolean isUpcomingReview;

    // 상세 조회 전용
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ControlSummaryDto> controls;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> riskIds;
    private String currentVersionNotes;
}
