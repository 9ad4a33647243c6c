package isms.ismsbackend.entity.document;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 문서 버전별 변경 노트 (버전당 1행).
 * - (document_id, version) 조합은 유일하며, 같은 버전에 대한 두 번째 기록은 기존 행을 갱신한다.
 * - 기록 시점의 저장소 식별자를 스냅샷으로 남긴다.
 */
@Entity
@Table(
        name = "document_version_history",
        indexes = {
                @Index(name = "idx_dvh_document", columnList = "document_id"),
                @Index(name = "idx_dvh_version", columnList = "version")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_dvh_document_version", columnNames = {"document_id", "version"})
        }
)
@Getter
@Setter
@NoArgsConstructor
public class DocumentVersionHistory {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    // FK 제약 생성용 읽기 전용 연관관계
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    private Document document;

    @Column(nullable = false, length = 100)
    private String version;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "sharepoint_site_id")
    private String sharePointSiteId;

    @Column(name = "sharepoint_drive_id")
    private String sharePointDriveId;

    @Column(name = "sharepoint_item_id")
    private String sharePointItemId;

    @Column(name = "confluence_space_key")
    private String confluenceSpaceKey;

    @Column(name = "confluence_page_id")
    private String confluencePageId;

    @Column(name = "created_by", length = 36, nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "updated_by", length = 36, nullable = false)
    private String updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
