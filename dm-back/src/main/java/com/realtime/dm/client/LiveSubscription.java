package com.realtime.dm.client;

public interface LiveSubscription extends AutoCloseable {

    /** 여러 번 불러도 된다 */
    @Override
    void close();
}
