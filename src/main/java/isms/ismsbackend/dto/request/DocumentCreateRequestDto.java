package isms.ismsbackend.dto.request;

import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.StorageLocation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 문서 등록 요청
 * - 날짜 필드는 "yyyy-MM-dd" 또는 ISO-8601 시각 문자열
 * - requiresAcknowledgement 미지정 + POLICY 이면 true로 설정됨
 */
@Getter
@Setter
@NoArgsConstructor
public class DocumentCreateRequestDto {

    // 미지정 시 서버에서 UUID 발급
    private String id;

    @NotBlank
    private String title;

    @NotNull
    private DocumentType type;

    @NotNull
    private StorageLocation storageLocation;

    private String sharePointSiteId;
    private String sharePointDriveId;
    private String sharePointItemId;
    private String confluenceSpaceKey;
    private String confluencePageId;

    @NotBlank
    private String version;

    @NotNull
    private DocumentStatus status;

    @NotBlank
    private String ownerUserId;

    private Boolean requiresAcknowledgement;

    private String lastChangedDate;
    private String lastReviewDate;
    private String nextReviewDate;

    // 최초 버전 이력에 남길 노트
    private String versionNotes;
}
