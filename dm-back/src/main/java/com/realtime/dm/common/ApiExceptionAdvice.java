package com.realtime.dm.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 모든 실패를 {@code {kind, message[, resourceId][, errors]}} 형태로 내려준다.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    @ExceptionHandler(DmException.class)
    public ResponseEntity<Map<String, Object>> handle(DmException e) {
        Map<String, Object> body = body(e.getKind(), e.getMessage());
        if (e.getResourceId() != null) body.put("resourceId", e.getResourceId());
        return respond(e.getKind(), body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handle(MethodArgumentNotValidException e) {
        var errors = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(f -> f.getField(), f -> String.valueOf(f.getDefaultMessage()), (a, b) -> a));
        Map<String, Object> body = body(ErrorKind.INVALID_CONTENT, "입력값이 올바르지 않습니다.");
        body.put("errors", errors);
        return respond(ErrorKind.INVALID_CONTENT, body);
    }

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return respond(ErrorKind.BAD_REQUEST, body(ErrorKind.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(ErrorKind.BAD_REQUEST, body(ErrorKind.BAD_REQUEST, "요청 본문을 읽을 수 없습니다."));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleDenied(AccessDeniedException e) {
        return respond(ErrorKind.FORBIDDEN, body(ErrorKind.FORBIDDEN, "접근 권한이 없습니다."));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        log.debug("optimistic lock lost: {}", e.getMessage());
        Map<String, Object> body = body(ErrorKind.CONFLICT, "다른 요청이 먼저 처리되었습니다. 다시 조회해 주세요.");
        if (e.getIdentifier() != null) body.put("resourceId", e.getIdentifier().toString());
        return respond(ErrorKind.CONFLICT, body);
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleTransient(TransientDataAccessException e) {
        log.warn("transient data access failure: {}", e.getMessage());
        return respond(ErrorKind.TRANSIENT, body(ErrorKind.TRANSIENT, "일시적인 오류입니다. 잠시 후 다시 시도해 주세요."));
    }

    private static Map<String, Object> body(ErrorKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", kind.wireName());
        body.put("message", message == null ? "" : message);
        return body;
    }

    private static ResponseEntity<Map<String, Object>> respond(ErrorKind kind, Map<String, Object> body) {
        return ResponseEntity.status(kind.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
