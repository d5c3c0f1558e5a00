package com.realtime.dm.common;

import org.springframework.http.HttpStatus;

import java.util.Arrays;

/**
 * 도메인 오류 분류. 응답 본문의 {@code kind} 값과 HTTP 상태를 함께 가진다.
 */
public enum ErrorKind {
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND, false),
    SELF_REFERENCE("SelfReference", HttpStatus.BAD_REQUEST, false),
    ALREADY_EXISTS("AlreadyExists", HttpStatus.CONFLICT, false),
    NOT_FRIENDS("NotFriends", HttpStatus.FORBIDDEN, false),
    FORBIDDEN("Forbidden", HttpStatus.FORBIDDEN, false),
    INVALID_STATE("InvalidState", HttpStatus.CONFLICT, false),
    INVALID_CONTENT("InvalidContent", HttpStatus.BAD_REQUEST, false),
    BAD_REQUEST("BadRequest", HttpStatus.BAD_REQUEST, false),
    // 유니크 경합에서 진 쪽: 다시 읽으면 된다
    CONFLICT("Conflict", HttpStatus.CONFLICT, true),
    TRANSIENT("Transient", HttpStatus.SERVICE_UNAVAILABLE, true);

    private final String wireName;
    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(String wireName, HttpStatus status, boolean retryable) {
        this.wireName = wireName;
        this.status = status;
        this.retryable = retryable;
    }

    public String wireName() { return wireName; }
    public HttpStatus status() { return status; }
    public boolean retryable() { return retryable; }

    /** 응답 본문의 kind 문자열 → enum. 모르는 값은 상태코드로 추정 */
    public static ErrorKind fromWire(String wireName, int httpStatus) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(wireName))
                .findFirst()
                .orElseGet(() -> fromStatus(httpStatus));
    }

    public static ErrorKind fromStatus(int httpStatus) {
        if (httpStatus == 404) return NOT_FOUND;
        if (httpStatus == 403) return FORBIDDEN;
        if (httpStatus == 409) return CONFLICT;
        if (httpStatus >= 500) return TRANSIENT;
        return BAD_REQUEST;
    }
}
