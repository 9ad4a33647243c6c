package isms.ismsbackend.exception;

import isms.ismsbackend.common.ResponseCode;
import isms.ismsbackend.common.ResponseMessage;

public class ControlAlreadyLinkedException extends DocumentConflictException {

    public ControlAlreadyLinkedException(String documentId, String controlId) {
        super(ResponseCode.LINK_CONFLICT,
                "Control " + controlId + " is already linked to document " + documentId);
    }

    public ControlAlreadyLinkedException(String documentId, String controlId, Throwable cause) {
        super(ResponseCode.LINK_CONFLICT,
                "Control " + controlId + " is already linked to document " + documentId, cause);
    }

    @Override
    public String getError() {
        return ResponseMessage.CONTROL_ALREADY_LINKED;
    }
}
