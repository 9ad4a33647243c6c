package isms.ismsbackend.exception;

import isms.ismsbackend.common.ResponseCode;
import isms.ismsbackend.common.ResponseMessage;
import lombok.Getter;

@Getter
public class VersionAlreadyExistsException extends DocumentConflictException {

    private final String version;

    public VersionAlreadyExistsException(String version, Throwable cause) {
        super(ResponseCode.VERSION_EXISTS,
                "Version \"" + version + "\" already exists for this document.", cause);
        this.version = version;
    }

    @Override
    public String getError() {
        return ResponseMessage.VERSION_EXISTS;
    }
}
