package com.realtime.dm.friend.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 친구 관계 상태와 허용 전이표.
 * <pre>
 *   (없음)   → PENDING   : sendRequest
 *   PENDING  → ACCEPTED  : accept (받은 사람만)
 *   *        → BLOCKED   : block (양쪽 모두)
 *   *        → (없음)    : cancelOrRemove (삭제, 전이표 밖)
 * </pre>
 * BLOCKED → ACCEPTED 는 허용하지 않는다.
 */
public enum FriendshipStatus {
    PENDING,
    ACCEPTED,
    BLOCKED;

    public Set<FriendshipStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACCEPTED, BLOCKED);
            case ACCEPTED, BLOCKED -> EnumSet.of(BLOCKED);
        };
    }

    public boolean canTransitionTo(FriendshipStatus next) {
        return allowedNext().contains(next);
    }

    /** ?status=pending 같은 쿼리 파라미터 → enum. 모르는 값이면 IllegalArgumentException */
    public static FriendshipStatus fromParam(String raw) {
        String v = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.name().equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "status는 pending, accepted, blocked 중 하나여야 합니다: " + raw));
    }
}
