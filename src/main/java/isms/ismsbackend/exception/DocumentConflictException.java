package isms.ismsbackend.exception;

import lombok.Getter;

/**
 * 409 계열 충돌. 호출자가 최신 상태로 다시 시도해야 한다.
 */
@Getter
public abstract class DocumentConflictException extends IllegalStateException {

    private final String code;

    protected DocumentConflictException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected DocumentConflictException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public abstract String getError();
}
