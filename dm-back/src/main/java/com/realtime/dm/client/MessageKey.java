package com.realtime.dm.client;

import com.realtime.dm.message.dto.MessageDto;

import java.time.Instant;
import java.util.Comparator;

/**
 * 타임라인 정렬 키 (createdAt, id) 오름차순.
 */
public record MessageKey(Instant createdAt, long id) implements Comparable<MessageKey> {

    private static final Comparator<MessageKey> ORDER =
            Comparator.comparing(MessageKey::createdAt).thenComparingLong(MessageKey::id);

    public static MessageKey of(MessageDto m) {
        return new MessageKey(m.createdAt(), m.id());
    }

    @Override
    public int compareTo(MessageKey other) {
        return ORDER.compare(this, other);
    }
}
