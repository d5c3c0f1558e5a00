package com.realtime.dm.client;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.realtime.dm.message.dto.MessageDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationTimelineTest {

    private static final UUID CONVERSATION = UUID.randomUUID();
    private static final UUID AUTHOR = UUID.randomUUID();
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ConversationTimeline timeline = new ConversationTimeline();

    static MessageDto msg(long id, long secondsAfterT0, String text) {
        return msg(id, secondsAfterT0, text, null);
    }

    static MessageDto msg(long id, long secondsAfterT0, String text, Instant updatedAt) {
        return new MessageDto(id, CONVERSATION, AUTHOR, JsonNodeFactory.instance.textNode(text),
                T0.plusSeconds(secondsAfterT0), updatedAt);
    }

    private List<Long> ids() {
        return timeline.snapshot().stream().map(MessageDto::id).toList();
    }

    @Test
    @DisplayName("INSERT 는 (createdAt, id) 위치에 들어간다 - 끝에 붙이지 않는다")
    void insertAtSortedPosition() {
        timeline.applyInsert(msg(1, 0, "a"));
        timeline.applyInsert(msg(3, 20, "c"));
        timeline.applyInsert(msg(2, 10, "b"));

        assertThat(ids()).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("같은 시각이면 id 로 정렬")
    void tieBreaksOnId() {
        timeline.applyInsert(msg(9, 5, "later id"));
        timeline.applyInsert(msg(4, 5, "earlier id"));

        assertThat(ids()).containsExactly(4L, 9L);
    }

    @Test
    @DisplayName("같은 INSERT 를 두 번 적용해도 결과는 한 번과 같다")
    void insertIsIdempotent() {
        assertThat(timeline.applyInsert(msg(1, 0, "a"))).isTrue();
        assertThat(timeline.applyInsert(msg(1, 0, "a"))).isFalse();

        assertThat(ids()).containsExactly(1L);
    }

    @Test
    @DisplayName("페이지와 이벤트가 겹쳐도 중복이 없다")
    void pageAndEventsOverlap() {
        timeline.applyInsert(msg(3, 30, "live"));

        int added = timeline.mergePage(List.of(msg(3, 30, "live"), msg(2, 20, "b"), msg(1, 10, "a")));

        assertThat(added).isEqualTo(2);
        assertThat(ids()).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("UPDATE 는 제자리 교체, 순서를 바꾸지 않는다")
    void updateInPlace() {
        timeline.mergePage(List.of(msg(1, 0, "a"), msg(2, 10, "b")));

        MessageDto edited = new MessageDto(1L, CONVERSATION, AUTHOR, JsonNodeFactory.instance.textNode("a!"),
                T0.plusSeconds(999), T0.plusSeconds(60));
        assertThat(timeline.applyUpdate(edited)).isTrue();

        assertThat(ids()).containsExactly(1L, 2L);
        MessageDto first = timeline.snapshot().get(0);
        assertThat(first.content().asText()).isEqualTo("a!");
        assertThat(first.createdAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("DELETE 는 id 로 제거, 없으면 무시")
    void deleteById() {
        timeline.mergePage(List.of(msg(1, 0, "a"), msg(2, 10, "b")));

        assertThat(timeline.applyDelete(1)).isTrue();
        assertThat(timeline.applyDelete(42)).isFalse();
        assertThat(ids()).containsExactly(2L);
    }

    @Test
    @DisplayName("삭제 전에 읽은 페이지가 삭제된 메시지를 되살리지 않는다")
    void tombstoneBlocksStalePage() {
        timeline.applyDelete(5);

        timeline.mergePage(List.of(msg(5, 0, "ghost"), msg(6, 1, "ok")));
        timeline.applyInsert(msg(5, 0, "ghost"));

        assertThat(ids()).containsExactly(6L);
        assertThat(timeline.isDeleted(5)).isTrue();
    }

    @Test
    @DisplayName("먼저 도착한 UPDATE 는 보관했다가 행이 들어올 때 적용")
    void parkedUpdateWins() {
        timeline.applyUpdate(msg(7, 0, "edited", T0.plusSeconds(30)));
        assertThat(timeline.size()).isZero();

        timeline.mergePage(List.of(msg(7, 0, "original")));

        assertThat(timeline.snapshot().get(0).content().asText()).isEqualTo("edited");
    }

    @Test
    @DisplayName("더 오래된 수정본은 새 수정본을 덮어쓰지 않는다")
    void staleUpdateIgnored() {
        timeline.applyInsert(msg(1, 0, "v2", T0.plusSeconds(20)));

        assertThat(timeline.applyUpdate(msg(1, 0, "v1", T0.plusSeconds(10)))).isFalse();
        timeline.mergePage(List.of(msg(1, 0, "v0")));

        assertThat(timeline.snapshot().get(0).content().asText()).isEqualTo("v2");
    }

    @Test
    @DisplayName("가장 오래된/최신 메시지")
    void oldestAndNewest() {
        assertThat(timeline.oldest()).isEmpty();

        timeline.mergePage(List.of(msg(2, 10, "b"), msg(1, 0, "a"), msg(3, 20, "c")));

        assertThat(timeline.oldest()).map(MessageDto::id).contains(1L);
        assertThat(timeline.newest()).map(MessageDto::id).contains(3L);
    }
}
