package isms.ismsbackend.entity.document;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class DocumentControlId implements Serializable {
    private static final long serialVersionUID = 1L;

    private String documentId;
    private String controlId;
}
