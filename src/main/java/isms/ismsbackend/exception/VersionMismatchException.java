package isms.ismsbackend.exception;

import isms.ismsbackend.common.ResponseCode;
import isms.ismsbackend.common.ResponseMessage;
import lombok.Getter;

/**
 * 요청한 expectedCurrentVersion이 저장된 버전과 다름.
 * 클라이언트가 재조회 없이 맞출 수 있도록 실제 버전을 담는다.
 */
@Getter
public class VersionMismatchException extends DocumentConflictException {

    private final String documentId;
    private final String currentVersion;

    public VersionMismatchException(String documentId, String currentVersion) {
        super(ResponseCode.VERSION_MISMATCH,
                "Document version has changed. Current version is \"" + currentVersion
                        + "\". Please refresh and try again.");
        this.documentId = documentId;
        this.currentVersion = currentVersion;
    }

    @Override
    public String getError() {
        return ResponseMessage.VERSION_MISMATCH;
    }
}
