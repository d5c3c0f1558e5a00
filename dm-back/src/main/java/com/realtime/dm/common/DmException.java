package com.realtime.dm.common;

import lombok.Getter;

@Getter
public class DmException extends RuntimeException {

    private final ErrorKind kind;
    /** 경합에서 진 쪽이 다시 읽을 수 있도록 기존 리소스 id (없으면 null) */
    private final String resourceId;

    public DmException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public DmException(ErrorKind kind, String message, Object resourceId) {
        this(kind, message, resourceId, null);
    }

    public DmException(ErrorKind kind, String message, Object resourceId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.resourceId = resourceId == null ? null : resourceId.toString();
    }

    public static DmException notFound(String message) {
        return new DmException(ErrorKind.NOT_FOUND, message);
    }

    public static DmException forbidden(String message) {
        return new DmException(ErrorKind.FORBIDDEN, message);
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
