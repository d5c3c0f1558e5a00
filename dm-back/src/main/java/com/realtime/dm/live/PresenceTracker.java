package com.realtime.dm.live;

import com.realtime.dm.user.service.PresenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.AbstractSubProtocolEvent;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.UUID;

/** STOMP 세션 연결/해제 → Redis presence */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceTracker {

    private final PresenceService presenceService;

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        UUID userId = userOf(event);
        if (userId != null) presenceService.markOnline(userId);
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        UUID userId = userOf(event);
        if (userId != null) presenceService.markOffline(userId);
    }

    private static UUID userOf(AbstractSubProtocolEvent event) {
        Principal user = event.getUser();
        if (user == null) return null;
        try {
            return UUID.fromString(user.getName());
        } catch (IllegalArgumentException e) {
            log.debug("presence skipped: principal is not a UUID: {}", user.getName());
            return null;
        }
    }
}
