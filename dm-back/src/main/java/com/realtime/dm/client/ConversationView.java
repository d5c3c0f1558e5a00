package com.realtime.dm.client;

import com.realtime.dm.live.MessageEvent;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * 열린 대화 하나의 화면 상태: REST 페이지 + 라이브 이벤트를 {@link ConversationTimeline} 으로 합친다.
 * <p>
 * 구독을 먼저 열고 첫 페이지를 읽는다. 그 사이 도착한 이벤트는 id 병합으로 흡수된다.
 * 네트워크 호출은 모니터 밖에서 한다.
 * <p>
 * 스냅샷마다 순번을 매기고 전달은 별도 락으로 직렬화한다. 더 새 스냅샷이 이미 전달됐으면 버린다.
 */
@Slf4j
public class ConversationView implements AutoCloseable {

    public record Options(int pageSize, boolean refetchOnResubscribe, Duration groupingInterval) {
        public static Options defaults() {
            return new Options(50, true, MessageGrouping.DEFAULT_QUIET_INTERVAL);
        }
    }

    public interface Listener {
        /** 변경 후 오름차순 스냅샷. 한 뷰 안에서는 순서대로, 한 번에 하나씩 불린다 */
        void onChange(List<MessageDto> timeline);

        default void onError(Throwable error) {}
    }

    private static final Listener NO_OP = timeline -> {};

    private final UUID conversationId;
    private final MessageLogClient messageLog;
    private final Options options;
    private final Listener listener;
    private final ConversationTimeline timeline = new ConversationTimeline();
    private final Object deliveryLock = new Object();

    private LiveSubscription subscription;
    private boolean hasMore;
    private boolean loadingOlder;
    private boolean closed;
    private long changeSeq;
    private long deliveredSeq; // deliveryLock

    private ConversationView(UUID conversationId, MessageLogClient messageLog, Options options, Listener listener) {
        this.conversationId = conversationId;
        this.messageLog = messageLog;
        this.options = options;
        this.listener = listener == null ? NO_OP : listener;
    }

    public static ConversationView open(UUID conversationId, MessageLogClient messageLog, LiveEventChannel channel) {
        return open(conversationId, messageLog, channel, Options.defaults(), null);
    }

    public static ConversationView open(UUID conversationId, MessageLogClient messageLog, LiveEventChannel channel,
                                        Options options, Listener listener) {
        ConversationView view = new ConversationView(conversationId, messageLog, options, listener);
        LiveSubscription sub = channel.subscribe(conversationId, view.new Events());
        synchronized (view) {
            view.subscription = sub;
        }
        try {
            MessagePageDto first = messageLog.page(conversationId, options.pageSize(), MessageCursor.NONE);
            view.seed(first);
        } catch (RuntimeException e) {
            view.close();
            throw e;
        }
        return view;
    }

    private void seed(MessagePageDto first) {
        List<MessageDto> snapshot;
        long seq;
        synchronized (this) {
            if (closed) return;
            timeline.mergePage(first.messages());
            hasMore = first.hasMore();
            snapshot = timeline.snapshot();
            seq = ++changeSeq;
        }
        deliver(seq, snapshot);
    }

    /* ===== 라이브 이벤트 ===== */

    void apply(MessageEvent event) {
        List<MessageDto> snapshot;
        long seq;
        synchronized (this) {
            if (closed || !conversationId.equals(event.getConversationId())) return;
            boolean changed = switch (event.getType()) {
                case INSERT -> event.getMessage() != null && timeline.applyInsert(event.getMessage());
                case UPDATE -> event.getMessage() != null && timeline.applyUpdate(event.getMessage());
                case DELETE -> event.getMessageId() != null && timeline.applyDelete(event.getMessageId());
            };
            if (!changed) return;
            snapshot = timeline.snapshot();
            seq = ++changeSeq;
        }
        deliver(seq, snapshot);
    }

    /** 재구독 후 최신 페이지를 다시 읽어 끊긴 동안의 메시지를 메운다. hasMore 는 건드리지 않는다 */
    void refetchNewest() {
        synchronized (this) {
            if (closed) return;
        }
        MessagePageDto latest;
        try {
            latest = messageLog.page(conversationId, options.pageSize(), MessageCursor.NONE);
        } catch (RuntimeException e) {
            log.warn("refetch after resubscribe failed: conversation={} cause={}", conversationId, e.toString());
            listener.onError(e);
            return;
        }
        List<MessageDto> snapshot;
        long seq;
        synchronized (this) {
            if (closed) return;
            if (timeline.mergePage(latest.messages()) == 0) return;
            snapshot = timeline.snapshot();
            seq = ++changeSeq;
        }
        deliver(seq, snapshot);
    }

    /* ===== 이전 메시지 ===== */

    /**
     * 가장 오래된 메시지의 (createdAt, id) 이전 페이지를 읽어 앞쪽에 합친다.
     * 한 번에 하나만 진행되고 hasMore 가 false 면 호출하지 않는다.
     * 실패하면 상태를 바꾸지 않고 예외를 그대로 던진다.
     *
     * @return 실제로 요청했으면 true
     */
    public boolean loadOlder() {
        MessageCursor cursor;
        synchronized (this) {
            if (closed || !hasMore || loadingOlder) return false;
            cursor = timeline.oldest()
                    .map(m -> new MessageCursor(m.createdAt(), m.id()))
                    .orElse(MessageCursor.NONE);
            loadingOlder = true;
        }

        MessagePageDto older;
        try {
            older = messageLog.page(conversationId, options.pageSize(), cursor);
        } catch (RuntimeException e) {
            synchronized (this) {
                loadingOlder = false;
            }
            listener.onError(e);
            throw e;
        }

        List<MessageDto> snapshot;
        long seq;
        synchronized (this) {
            loadingOlder = false;
            if (closed) return true;
            timeline.mergePage(older.messages());
            hasMore = older.hasMore();
            snapshot = timeline.snapshot();
            seq = ++changeSeq;
        }
        deliver(seq, snapshot);
        return true;
    }

    private void deliver(long seq, List<MessageDto> snapshot) {
        synchronized (deliveryLock) {
            if (seq <= deliveredSeq) {
                log.debug("stale snapshot skipped: conversation={} seq={} delivered={}",
                        conversationId, seq, deliveredSeq);
                return;
            }
            deliveredSeq = seq;
            listener.onChange(snapshot);
        }
    }

    /* ===== 조회 ===== */

    public synchronized List<MessageDto> messages() {
        return timeline.snapshot();
    }

    public List<MessageGrouping.GroupedMessage> grouped() {
        return MessageGrouping.group(messages(), options.groupingInterval());
    }

    public synchronized boolean hasMore() {
        return hasMore;
    }

    public synchronized boolean isLoadingOlder() {
        return loadingOlder;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public UUID conversationId() {
        return conversationId;
    }

    /** 구독 해제 + 메모리 상태 폐기. 여러 번 불러도 된다 */
    @Override
    public void close() {
        LiveSubscription toRelease;
        synchronized (this) {
            if (closed) return;
            closed = true;
            hasMore = false;
            timeline.clear();
            toRelease = subscription;
            subscription = null;
        }
        if (toRelease != null) toRelease.close();
    }

    private class Events implements LiveEventListener {
        @Override
        public void onEvent(MessageEvent event) {
            apply(event);
        }

        @Override
        public void onResubscribed() {
            if (options.refetchOnResubscribe()) refetchNewest();
        }

        @Override
        public void onDisconnected(Throwable cause) {
            log.debug("live channel disconnected: conversation={} cause={}", conversationId, String.valueOf(cause));
        }
    }
}
