package com.realtime.dm.client;

import com.realtime.dm.message.dto.MessageDto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 페이지 결과와 라이브 이벤트를 합친 정렬/중복 없는 메시지 집합.
 * <p>
 * 모든 연산은 id 기준 멱등이라 도착 순서가 결과를 바꾸지 않는다.
 * 삭제된 id 는 tombstone 으로 남겨 오래된 페이지가 되살리지 못하게 하고,
 * 아직 모르는 id 의 수정 이벤트는 보관했다가 행이 들어올 때 적용한다.
 * <p>
 * 스레드 안전하지 않다. {@link ConversationView} 의 모니터 안에서만 쓴다.
 */
public class ConversationTimeline {

    private final TreeMap<MessageKey, MessageDto> ordered = new TreeMap<>();
    private final Map<Long, MessageKey> keysById = new HashMap<>();
    private final Set<Long> tombstones = new HashSet<>();
    private final Map<Long, MessageDto> parkedUpdates = new HashMap<>();

    /** @return 타임라인이 바뀌었으면 true */
    public boolean applyInsert(MessageDto m) {
        if (tombstones.contains(m.id()) || keysById.containsKey(m.id())) return false;
        put(newest(m, parkedUpdates.remove(m.id())));
        return true;
    }

    /** 제자리 교체. createdAt 이 그대로라 위치가 바뀌지 않는다 */
    public boolean applyUpdate(MessageDto m) {
        if (tombstones.contains(m.id())) return false;
        MessageKey key = keysById.get(m.id());
        if (key == null) {
            parkedUpdates.merge(m.id(), m, ConversationTimeline::newest);
            return false;
        }
        MessageDto current = ordered.get(key);
        if (isOlder(m, current)) return false;
        ordered.put(key, withKeyOf(current, m));
        return true;
    }

    public boolean applyDelete(long messageId) {
        tombstones.add(messageId);
        parkedUpdates.remove(messageId);
        MessageKey key = keysById.remove(messageId);
        return key != null && ordered.remove(key) != null;
    }

    /**
     * 페이지(순서 무관) 병합. 이미 있는 행은 더 새로 수정된 경우에만 교체한다.
     * @return 새로 추가된 메시지 수
     */
    public int mergePage(List<MessageDto> page) {
        int added = 0;
        for (MessageDto m : page) {
            if (tombstones.contains(m.id())) continue;
            MessageKey key = keysById.get(m.id());
            if (key == null) {
                put(newest(m, parkedUpdates.remove(m.id())));
                added++;
            } else if (isNewer(m, ordered.get(key))) {
                ordered.put(key, withKeyOf(ordered.get(key), m));
            }
        }
        return added;
    }

    public Optional<MessageDto> oldest() {
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.firstEntry().getValue());
    }

    public Optional<MessageDto> newest() {
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.lastEntry().getValue());
    }

    /** (createdAt, id) 오름차순 복사본 */
    public List<MessageDto> snapshot() {
        return List.copyOf(new ArrayList<>(ordered.values()));
    }

    public boolean contains(long messageId) {
        return keysById.containsKey(messageId);
    }

    public boolean isDeleted(long messageId) {
        return tombstones.contains(messageId);
    }

    public int size() {
        return ordered.size();
    }

    public void clear() {
        ordered.clear();
        keysById.clear();
        tombstones.clear();
        parkedUpdates.clear();
    }

    private void put(MessageDto m) {
        MessageKey key = MessageKey.of(m);
        ordered.put(key, m);
        keysById.put(m.id(), key);
    }

    // 정렬 키는 처음 본 행의 createdAt 으로 고정
    private static MessageDto withKeyOf(MessageDto current, MessageDto next) {
        if (next.createdAt().equals(current.createdAt())) return next;
        return new MessageDto(next.id(), next.conversationId(), next.authorId(), next.content(),
                current.createdAt(), next.updatedAt());
    }

    private static MessageDto newest(MessageDto a, MessageDto b) {
        if (b == null) return a;
        return isNewer(b, a) ? withKeyOf(a, b) : a;
    }

    private static boolean isNewer(MessageDto candidate, MessageDto current) {
        return compareEdits(candidate.updatedAt(), current.updatedAt()) > 0;
    }

    private static boolean isOlder(MessageDto candidate, MessageDto current) {
        return compareEdits(candidate.updatedAt(), current.updatedAt()) < 0;
    }

    // 수정된 적 없음(null) < 어떤 수정 시각
    private static int compareEdits(Instant a, Instant b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;
        return a.compareTo(b);
    }
}
