package isms.ismsbackend.entity.document;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 사용자의 문서 버전별 열람 확인 기록
 */
@Entity
@Table(name = "acknowledgments", indexes = {
        @Index(name = "idx_ack_document", columnList = "document_id"),
        @Index(name = "idx_ack_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Acknowledgment {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    // FK 제약 생성용 읽기 전용 연관관계
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    private Document document;

    @Column(name = "document_version", nullable = false, length = 100)
    private String documentVersion;

    @Column(name = "acknowledged_at", nullable = false)
    private LocalDateTime acknowledgedAt = LocalDateTime.now();
}
