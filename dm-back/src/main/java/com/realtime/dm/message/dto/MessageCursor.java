package com.realtime.dm.message.dto;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * 페이지 커서. before 만 있으면 시각 커서, beforeId 까지 있으면 (시각, id) 복합 커서.
 * <p>
 * created_at 은 마이크로초 정밀도다. epoch millis 로 받은 before 는 밀리초 단위로 잘린 값이라
 * {@code wholeMillisecond} 가 켜진다. 이때 복합 커서는 그 밀리초 전체를 경계로 보고 id 로 가른다.
 * beforeId 없이 millis 만 오면 "그 밀리초 이전" 이라 같은 밀리초의 메시지는 나오지 않는다.
 */
public record MessageCursor(Instant before, Long beforeId, boolean wholeMillisecond) {

    public static final MessageCursor NONE = new MessageCursor(null, null);

    public MessageCursor {
        if (beforeId != null && before == null) {
            throw new IllegalArgumentException("beforeId는 before와 함께 보내야 합니다.");
        }
    }

    public MessageCursor(Instant before, Long beforeId) {
        this(before, beforeId, false);
    }

    /** before: ISO-8601 instant 또는 epoch millis */
    public static MessageCursor parse(String before, Long beforeId) {
        if (before == null || before.isBlank()) {
            return beforeId == null ? NONE : new MessageCursor(null, beforeId);
        }
        String raw = before.trim();
        if (raw.chars().allMatch(Character::isDigit)) {
            return new MessageCursor(Instant.ofEpochMilli(Long.parseLong(raw)), beforeId, true);
        }
        try {
            return new MessageCursor(Instant.parse(raw), beforeId);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("before 형식이 올바르지 않습니다: " + raw, e);
        }
    }

    public boolean isEmpty() {
        return before == null;
    }

    public boolean isComposite() {
        return before != null && beforeId != null;
    }

    /** wholeMillisecond 일 때 경계 구간의 끝(배타) */
    public Instant boundaryEnd() {
        return wholeMillisecond ? before.plusMillis(1) : before;
    }
}
