package isms.ismsbackend.common;

public interface ResponseMessage {

    // 유효성 검사 실패를 나타내는 메시지
    String VALIDATION_FAIL = "Validation failed.";

    String AUTHORIZATION_FAIL = "Authentication required.";

    String DOCUMENT_NOT_FOUND = "Document not found";

    String VERSION_MISMATCH = "Version mismatch";

    String VERSION_EXISTS = "Version already exists";

    String CONTROL_ALREADY_LINKED = "Control is already linked to this document";

    String DELETE_TIMEOUT = "Delete operation timed out. The document may have too many related records.";

    // 데이터베이스 오류를 나타내는 메시지
    String DATABASE_ERROR = "Database Error.";
}
