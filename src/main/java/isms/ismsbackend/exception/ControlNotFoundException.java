package isms.ismsbackend.exception;

import jakarta.persistence.EntityNotFoundException;

public class ControlNotFoundException extends EntityNotFoundException {

    public ControlNotFoundException(String controlId) {
        super("Control not found: " + controlId);
    }
}
