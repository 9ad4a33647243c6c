package isms.ismsbackend.entity.document;

import isms.ismsbackend.enums.ReviewTaskStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "review_tasks", indexes = {
        @Index(name = "idx_review_tasks_document", columnList = "document_id")
})
@Getter
@Setter
@NoArgsConstructor
public class ReviewTask {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    // FK 제약 생성용 읽기 전용 연관관계
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    private Document document;

    @Column(name = "reviewer_user_id", length = 36, nullable = false)
    private String reviewerUserId;

    @Column(name = "due_date", nullable = false)
    private LocalDateTime dueDate;

    @Column(name = "completed_date")
    private LocalDateTime completedDate;

    @Column(name = "change_notes", columnDefinition = "TEXT")
    private String changeNotes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReviewTaskStatus status = ReviewTaskStatus.PENDING;

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
