package isms.ismsbackend.handler;

import isms.ismsbackend.common.ResponseCode;
import isms.ismsbackend.common.ResponseMessage;
import isms.ismsbackend.dto.response.ErrorResponseDto;
import isms.ismsbackend.exception.DocumentConflictException;
import isms.ismsbackend.exception.DocumentDeleteTimeoutException;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.exception.VersionMismatchException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * 문서 API 예외 → 응답 변환.
 * 알 수 없는 오류는 내부 정보 없이 500으로 응답한다.
 */
@Slf4j
@RestControllerAdvice
public class DocumentExceptionHandler {

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleDocumentNotFound(DocumentNotFoundException e, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ResponseCode.NOT_FOUND, ResponseMessage.DOCUMENT_NOT_FOUND, null, null, request);
    }

    // 통제항목 / 연결 없음
    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(EntityNotFoundException e, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ResponseCode.NOT_FOUND, e.getMessage(), null, null, request);
    }

    @ExceptionHandler(VersionMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleVersionMismatch(VersionMismatchException e, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, e.getCode(), e.getError(), e.getMessage(), e.getCurrentVersion(), request);
    }

    @ExceptionHandler(DocumentConflictException.class)
    public ResponseEntity<ErrorResponseDto> handleConflict(DocumentConflictException e, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, e.getCode(), e.getError(), e.getMessage(), null, request);
    }

    @ExceptionHandler(DocumentDeleteTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> handleDeleteTimeout(DocumentDeleteTimeoutException e, HttpServletRequest request) {
        return build(HttpStatus.REQUEST_TIMEOUT, ResponseCode.TIMEOUT, ResponseMessage.DELETE_TIMEOUT, null, null, request);
    }

    // DocumentValidationException 포함
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException e, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ResponseCode.VALIDATION_FAIL, ResponseMessage.VALIDATION_FAIL, e.getMessage(), null, request);
    }

    // @Valid 본문(MethodArgumentNotValidException) 및 쿼리 파라미터 바인딩
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponseDto> handleBind(BindException e, HttpServletRequest request) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(DocumentExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, ResponseCode.VALIDATION_FAIL, ResponseMessage.VALIDATION_FAIL, detail, null, request);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ErrorResponseDto> handleMalformedRequest(Exception e, HttpServletRequest request) {
        log.debug("잘못된 요청: uri={}, reason={}", request.getRequestURI(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, ResponseCode.VALIDATION_FAIL, ResponseMessage.VALIDATION_FAIL, null, null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("처리되지 않은 예외: method={}, uri={}", request.getMethod(), request.getRequestURI(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ResponseCode.DATABASE_ERROR, ResponseMessage.DATABASE_ERROR, null, null, request);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String error, String message,
                                                   String currentVersion, HttpServletRequest request) {
        ErrorResponseDto body = ErrorResponseDto.builder()
                .code(code)
                .error(error)
                .message(message)
                .currentVersion(currentVersion)
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
