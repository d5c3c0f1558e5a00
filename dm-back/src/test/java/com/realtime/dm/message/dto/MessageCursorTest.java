package com.realtime.dm.message.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCursorTest {

    @Test
    @DisplayName("before 없으면 커서 없음")
    void empty() {
        assertThat(MessageCursor.parse(null, null).isEmpty()).isTrue();
        assertThat(MessageCursor.parse("  ", null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("ISO-8601 과 epoch millis 모두 받는다")
    void parsesBothFormats() {
        Instant t = Instant.parse("2024-05-01T10:15:30.123456Z");

        assertThat(MessageCursor.parse("2024-05-01T10:15:30.123456Z", null).before()).isEqualTo(t);
        assertThat(MessageCursor.parse(String.valueOf(t.toEpochMilli()), null).before())
                .isEqualTo(Instant.ofEpochMilli(t.toEpochMilli()));
    }

    @Test
    @DisplayName("beforeId 가 있으면 복합 커서")
    void composite() {
        MessageCursor c = MessageCursor.parse("2024-05-01T10:15:30Z", 42L);
        assertThat(c.isComposite()).isTrue();
        assertThat(c.beforeId()).isEqualTo(42L);
    }

    @Test
    @DisplayName("epoch millis 는 밀리초 전체를 경계로 본다")
    void millisCoversWholeMillisecond() {
        MessageCursor millis = MessageCursor.parse("1714558530123", 7L);
        MessageCursor iso = MessageCursor.parse("2024-05-01T10:15:30.123456Z", 7L);

        assertThat(millis.wholeMillisecond()).isTrue();
        assertThat(millis.boundaryEnd()).isEqualTo(Instant.ofEpochMilli(1714558530124L));
        assertThat(iso.wholeMillisecond()).isFalse();
        assertThat(iso.boundaryEnd()).isEqualTo(iso.before());
    }

    @Test
    @DisplayName("before 없이 beforeId 만 오면 거부")
    void beforeIdAlone() {
        assertThatThrownBy(() -> MessageCursor.parse(null, 3L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("형식이 틀리면 거부")
    void malformed() {
        assertThatThrownBy(() -> MessageCursor.parse("yesterday", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
