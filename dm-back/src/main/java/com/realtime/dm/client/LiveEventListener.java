package com.realtime.dm.client;

import com.realtime.dm.live.MessageEvent;

public interface LiveEventListener {

    void onEvent(MessageEvent event);

    /** 연결이 끊겼다가 같은 destination 으로 다시 구독됨. 사이의 이벤트는 보장되지 않는다 */
    default void onResubscribed() {}

    default void onDisconnected(Throwable cause) {}
}
