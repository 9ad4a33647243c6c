package isms.ismsbackend.entity.document;

import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.StorageLocation;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 규정/절차 등 컴플라이언스 문서 메타데이터.
 * - 원본 파일은 SharePoint 또는 Confluence에 있고, 여기에는 식별자와 URL만 보관한다.
 * - version은 자유 형식 문자열이며 정렬 의미가 없다.
 */
@Entity
@Table(
        name = "documents",
        indexes = {
                @Index(name = "idx_documents_status", columnList = "status"),
                @Index(name = "idx_documents_owner", columnList = "owner_user_id"),
                @Index(name = "idx_documents_next_review", columnList = "next_review_date"),
                @Index(name = "idx_documents_sharepoint",
                        columnList = "sharepoint_site_id, sharepoint_drive_id, sharepoint_item_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Document {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_location", nullable = false, length = 20)
    private StorageLocation storageLocation;

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

    /**
     * 저장소 식별자로부터 만들어진 브라우저용 URL.
     * 활성 식별자 세트가 불완전하면 항상 null.
     */
    @Column(name = "document_url", columnDefinition = "TEXT")
    private String documentUrl;

    @Column(nullable = false, length = 100)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentStatus status;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_user_id", nullable = false)
    private UserEntity owner;

    @Column(name = "requires_acknowledgement", nullable = false)
    private boolean requiresAcknowledgement = false;

    @Column(name = "last_changed_date")
    private LocalDateTime lastChangedDate;

    @Column(name = "last_review_date")
    private LocalDateTime lastReviewDate;

    @Column(name = "next_review_date")
    private LocalDateTime nextReviewDate;

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

    public void clearSharePointIds() {
        this.sharePointSiteId = null;
        this.sharePointDriveId = null;
        this.sharePointItemId = null;
    }

    public void clearConfluenceIds() {
        this.confluenceSpaceKey = null;
        this.confluencePageId = null;
    }
}
