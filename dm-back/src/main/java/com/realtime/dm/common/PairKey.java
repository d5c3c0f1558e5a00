package com.realtime.dm.common;

import java.util.Objects;
import java.util.UUID;

/**
 * 순서 없는 사용자 쌍의 정규화 키. (min, max) 순서로 고정된다.
 */
public record PairKey(UUID low, UUID high) {

    public PairKey {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (low.compareTo(high) > 0) {
            throw new IllegalArgumentException("low must not be greater than high");
        }
    }

    public static PairKey of(UUID a, UUID b) {
        return (a.compareTo(b) < 0) ? new PairKey(a, b) : new PairKey(b, a);
    }

    /** DM 대화방 키: "low:high" */
    public String asKey() {
        return low + ":" + high;
    }

    public boolean contains(UUID userId) {
        return low.equals(userId) || high.equals(userId);
    }

    public UUID other(UUID userId) {
        if (low.equals(userId)) return high;
        if (high.equals(userId)) return low;
        throw new IllegalArgumentException("not a member of this pair: " + userId);
    }
}
