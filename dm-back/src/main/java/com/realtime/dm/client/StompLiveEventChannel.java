package com.realtime.dm.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.live.LiveTopics;
import com.realtime.dm.live.MessageEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;
import org.springframework.web.socket.sockjs.client.SockJsClient;
import org.springframework.web.socket.sockjs.client.WebSocketTransport;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * STOMP(SockJS) 위의 대화 구독. 구독마다 세션 하나.
 * <p>
 * 연결이 끊기면 같은 destination 으로 다시 구독한다. 재시도 간격은 {@link ReconnectBackoff}
 * (500ms 부터 2배, 최대 30s), 연결되면 초기화. 재연결 타이머는 호출자가 준 스케줄러에서 돈다.
 */
@Slf4j
public class StompLiveEventChannel implements LiveEventChannel {

    private final WebSocketStompClient stompClient;
    private final String url;
    private final Supplier<String> accessToken;
    private final ScheduledExecutorService scheduler;
    private final Supplier<ReconnectBackoff> backoffFactory;
    private final Duration connectTimeout;

    public StompLiveEventChannel(WebSocketStompClient stompClient, String url, Supplier<String> accessToken,
                                 ScheduledExecutorService scheduler) {
        this(stompClient, url, accessToken, scheduler, ReconnectBackoff::new, Duration.ofSeconds(10));
    }

    public StompLiveEventChannel(WebSocketStompClient stompClient, String url, Supplier<String> accessToken,
                                 ScheduledExecutorService scheduler, Supplier<ReconnectBackoff> backoffFactory,
                                 Duration connectTimeout) {
        this.stompClient = stompClient;
        this.url = url;
        this.accessToken = accessToken;
        this.scheduler = scheduler;
        this.backoffFactory = backoffFactory;
        this.connectTimeout = connectTimeout;
    }

    /** SockJS + Jackson(JavaTime 포함) 변환기를 갖춘 기본 클라이언트 */
    public static WebSocketStompClient defaultStompClient(ObjectMapper objectMapper) {
        SockJsClient sockJs = new SockJsClient(List.of(new WebSocketTransport(new StandardWebSocketClient())));
        WebSocketStompClient client = new WebSocketStompClient(sockJs);
        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
        converter.setObjectMapper(objectMapper);
        client.setMessageConverter(converter);
        return client;
    }

    /**
     * 첫 SUBSCRIBE 를 보낼 때까지 기다린다. 첫 연결 실패는 {@code Transient}.
     */
    @Override
    public LiveSubscription subscribe(UUID conversationId, LiveEventListener listener) {
        String destination = LiveTopics.destinationOf(LiveTopics.subscriptionKey(conversationId));
        Handle handle = new Handle(destination, listener, backoffFactory.get());
        handle.connect();
        try {
            handle.firstSubscribed.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return handle;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.close();
            throw new DmException(ErrorKind.TRANSIENT, "구독이 중단되었습니다.", destination, e);
        } catch (ExecutionException | TimeoutException e) {
            handle.close();
            throw new DmException(ErrorKind.TRANSIENT, "실시간 채널에 연결하지 못했습니다.", destination, e);
        }
    }

    private class Handle extends StompSessionHandlerAdapter implements LiveSubscription {

        private final String destination;
        private final LiveEventListener listener;
        private final ReconnectBackoff backoff;
        private final CompletableFuture<Void> firstSubscribed = new CompletableFuture<>();

        private volatile boolean closed;
        private StompSession session;
        private ScheduledFuture<?> pendingReconnect;

        Handle(String destination, LiveEventListener listener, ReconnectBackoff backoff) {
            this.destination = destination;
            this.listener = listener;
            this.backoff = backoff;
        }

        void connect() {
            synchronized (this) {
                if (closed) return;
                // 예약된 재연결이 지금 실행 중이다. 이번 시도의 실패는 새로 예약해야 한다
                pendingReconnect = null;
            }
            StompHeaders connectHeaders = new StompHeaders();
            connectHeaders.set(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken.get());
            stompClient.connectAsync(url, new WebSocketHttpHeaders(), connectHeaders, this)
                    .whenComplete((s, ex) -> {
                        if (ex != null) connectionLost(ex);
                    });
        }

        @Override
        public void afterConnected(StompSession newSession, StompHeaders connectedHeaders) {
            boolean resubscribed;
            synchronized (this) {
                if (closed) {
                    newSession.disconnect();
                    return;
                }
                session = newSession;
                newSession.subscribe(destination, this);
                resubscribed = firstSubscribed.isDone();
                backoff.reset();
            }
            if (resubscribed) {
                log.info("live channel resubscribed: {}", destination);
                listener.onResubscribed();
            } else {
                firstSubscribed.complete(null);
            }
        }

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return MessageEvent.class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            if (closed || !(payload instanceof MessageEvent event)) return;
            listener.onEvent(event);
        }

        @Override
        public void handleException(StompSession s, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.warn("live frame handling failed: destination={} command={}", destination, command, exception);
        }

        @Override
        public void handleTransportError(StompSession s, Throwable exception) {
            if (s.isConnected()) {
                log.warn("live transport error (still connected): destination={}", destination, exception);
                return;
            }
            connectionLost(exception);
        }

        private void connectionLost(Throwable cause) {
            if (closed) return;
            if (!firstSubscribed.isDone()) {
                // 첫 연결 실패는 subscribe() 호출자에게 돌려준다
                firstSubscribed.completeExceptionally(cause);
                return;
            }
            synchronized (this) {
                if (closed) return;
                session = null;
                // 연결 실패는 future 와 handleTransportError 양쪽으로 올 수 있다
                if (pendingReconnect != null && !pendingReconnect.isDone()) return;
                Duration delay = backoff.nextDelay();
                log.info("live channel lost: destination={} retryIn={}ms attempt={}",
                        destination, delay.toMillis(), backoff.attempts());
                pendingReconnect = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
            listener.onDisconnected(cause);
        }

        @Override
        public void close() {
            StompSession toDisconnect;
            synchronized (this) {
                if (closed) return;
                closed = true;
                if (pendingReconnect != null) pendingReconnect.cancel(false);
                toDisconnect = session;
                session = null;
            }
            firstSubscribed.cancel(false);
            if (toDisconnect != null && toDisconnect.isConnected()) {
                toDisconnect.disconnect();
            }
        }
    }
}
