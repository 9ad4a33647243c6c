package isms.ismsbackend.exception;

import isms.ismsbackend.common.ResponseMessage;
import lombok.Getter;

/**
 * 하드 삭제 트랜잭션이 제한 시간을 넘겨 전체 롤백됨.
 * 일반 실패와 구분해서 재시도/지원 요청을 안내한다.
 */
@Getter
public class DocumentDeleteTimeoutException extends RuntimeException {

    private final String documentId;

    public DocumentDeleteTimeoutException(String documentId, Throwable cause) {
        super(ResponseMessage.DELETE_TIMEOUT, cause);
        this.documentId = documentId;
    }
}
