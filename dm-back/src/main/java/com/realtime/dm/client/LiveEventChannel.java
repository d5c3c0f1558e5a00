package com.realtime.dm.client;

import java.util.UUID;

public interface LiveEventChannel {

    /**
     * 대화 하나의 이벤트 구독. 반환된 핸들을 닫을 때까지 재연결을 포함해 구독이 유지된다.
     */
    LiveSubscription subscribe(UUID conversationId, LiveEventListener listener);
}
