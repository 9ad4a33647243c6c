package isms.ismsbackend.exception;

import jakarta.persistence.EntityNotFoundException;

public class ControlLinkNotFoundException extends EntityNotFoundException {

    public ControlLinkNotFoundException(String documentId, String controlId) {
        super("Control " + controlId + " is not linked to document " + documentId);
    }
}
