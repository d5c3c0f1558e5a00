package com.realtime.dm.live;

import java.util.Optional;
import java.util.UUID;

/**
 * 구독 키 ↔ STOMP destination 매핑.
 * <ul>
 *   <li>{@code conversation:{id}} → {@code /topic/conversations/{id}}</li>
 *   <li>사용자 알림 → {@code /topic/notify/{userId}}</li>
 * </ul>
 */
public final class LiveTopics {

    public static final String CONVERSATION_PREFIX = "/topic/conversations/";
    public static final String NOTIFY_PREFIX = "/topic/notify/";
    public static final String SUBSCRIPTION_KEY_PREFIX = "conversation:";

    private LiveTopics() {}

    public static String conversation(UUID conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    public static String notify(UUID userId) {
        return NOTIFY_PREFIX + userId;
    }

    public static String subscriptionKey(UUID conversationId) {
        return SUBSCRIPTION_KEY_PREFIX + conversationId;
    }

    public static String destinationOf(String subscriptionKey) {
        if (subscriptionKey == null || !subscriptionKey.startsWith(SUBSCRIPTION_KEY_PREFIX)) {
            throw new IllegalArgumentException("unknown subscription key: " + subscriptionKey);
        }
        return conversation(UUID.fromString(subscriptionKey.substring(SUBSCRIPTION_KEY_PREFIX.length())));
    }

    public static Optional<UUID> conversationIdOf(String destination) {
        return idAfter(destination, CONVERSATION_PREFIX);
    }

    public static Optional<UUID> notifyUserOf(String destination) {
        return idAfter(destination, NOTIFY_PREFIX);
    }

    private static Optional<UUID> idAfter(String destination, String prefix) {
        if (destination == null || !destination.startsWith(prefix)) return Optional.empty();
        try {
            return Optional.of(UUID.fromString(destination.substring(prefix.length())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
