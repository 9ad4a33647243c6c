package isms.ismsbackend.entity.document;

import isms.ismsbackend.entity.control.Control;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 문서 - 통제항목 연결 (복합키)
 */
@Entity
@Table(name = "document_controls", indexes = {
        @Index(name = "idx_document_controls_control", columnList = "control_id")
})
@IdClass(DocumentControlId.class)
@Getter
@NoArgsConstructor
public class DocumentControl {

    @Id
    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    // FK 제약 생성용 읽기 전용 연관관계
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    private Document document;

    @Id
    @Column(name = "control_id", length = 36, nullable = false)
    private String controlId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "control_id", insertable = false, updatable = false)
    private Control control;

    public DocumentControl(String documentId, String controlId) {
        this.documentId = documentId;
        this.controlId = controlId;
    }
}
