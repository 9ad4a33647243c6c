package isms.ismsbackend.entity.document;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "document_risks", indexes = {
        @Index(name = "idx_document_risks_risk", columnList = "risk_id")
})
@IdClass(DocumentRiskId.class)
@Getter
@NoArgsConstructor
public class DocumentRisk {

    @Id
    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    // FK 제약 생성용 읽기 전용 연관관계
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    private Document document;

    @Id
    @Column(name = "risk_id", length = 36, nullable = false)
    private String riskId;

    public DocumentRisk(String documentId, String riskId) {
        this.documentId = documentId;
        this.riskId = riskId;
    }
}
