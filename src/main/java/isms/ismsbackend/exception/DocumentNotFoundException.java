package isms.ismsbackend.exception;

import jakarta.persistence.EntityNotFoundException;
import lombok.Getter;

@Getter
public class DocumentNotFoundException extends EntityNotFoundException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
