package com.realtime.dm.notify;

public enum NotifyType {
    FRIEND_REQUEST_RECEIVED,
    FRIEND_REQUEST_ACCEPTED,
    FRIENDSHIP_BLOCKED,
    // cancelOrRemove: 삭제 직전 상태에 따라 셋 중 하나
    FRIEND_REQUEST_CANCELLED,
    FRIEND_REMOVED,
    FRIEND_UNBLOCKED,
    CONVERSATION_DELETED
}
