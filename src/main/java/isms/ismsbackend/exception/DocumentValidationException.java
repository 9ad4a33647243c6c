package isms.ismsbackend.exception;

/**
 * 변경 전에 걸러지는 잘못된 입력 (400)
 */
public class DocumentValidationException extends IllegalArgumentException {

    public DocumentValidationException(String message) {
        super(message);
    }

    public DocumentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
