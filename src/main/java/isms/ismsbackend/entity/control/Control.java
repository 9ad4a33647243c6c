package isms.ismsbackend.entity.control;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * ISO 27001 Annex A 등 통제항목. 문서 연결의 대상이 된다.
 */
@Entity
@Table(name = "controls", indexes = {
        @Index(name = "idx_controls_code", columnList = "code")
})
@Getter
@Setter
@NoArgsConstructor
public class Control {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(nullable = false, length = 50)
    private String code;

    @Column(nullable = false)
    private String title;

    @Column(length = 100)
    private String category;

    @Column(name = "is_standard_control", nullable = false)
    private boolean standardControl = true;
}
