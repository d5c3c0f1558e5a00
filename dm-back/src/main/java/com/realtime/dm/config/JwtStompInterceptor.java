package com.realtime.dm.config;

import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.live.LiveTopics;
import com.realtime.dm.security.JwtProvider;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.security.Principal;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

@Component
@Slf4j
public class JwtStompInterceptor implements ChannelInterceptor {

    private final JwtProvider jwtProvider;
    private final ConversationParticipantRepository participantRepo;

    private static final String BEARER = "Bearer ";

    public JwtStompInterceptor(JwtProvider jwtProvider,
                               @Lazy ConversationParticipantRepository participantRepo) {
        this.jwtProvider = jwtProvider;
        this.participantRepo = participantRepo;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (acc == null) return message;

        if (StompCommand.CONNECT.equals(acc.getCommand())) {
            acc.setUser(authenticate(acc.getFirstNativeHeader("Authorization")));
        } else if (StompCommand.SUBSCRIBE.equals(acc.getCommand())) {
            checkSubscribe(acc.getUser(), acc.getDestination());
        }
        return message;
    }

    private Authentication authenticate(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER)) {
            // STOMP CONNECT 시 토큰이 없으면 거부
            throw new IllegalArgumentException("Missing or invalid Authorization header");
        }
        try {
            Claims claims = jwtProvider.parseAccessClaims(authHeader.substring(BEARER.length()));
            String userId = UUID.fromString(claims.getSubject()).toString();
            return new UsernamePasswordAuthenticationToken(userId, null, Collections.emptyList());
        } catch (SecurityException | IllegalArgumentException e) {
            log.warn("STOMP CONNECT token invalid: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid STOMP CONNECT token", e);
        }
    }

    private void checkSubscribe(Principal user, String destination) {
        if (user == null) throw new AccessDeniedException("인증되지 않은 구독입니다.");
        UUID me = UUID.fromString(user.getName());

        Optional<UUID> conversationId = LiveTopics.conversationIdOf(destination);
        if (conversationId.isPresent()) {
            if (!participantRepo.existsByConversationIdAndUserId(conversationId.get(), me)) {
                log.debug("SUBSCRIBE denied: user={} dest={}", me, destination);
                throw new AccessDeniedException("대화 참여자만 구독할 수 있습니다.");
            }
            return;
        }

        Optional<UUID> notifyUser = LiveTopics.notifyUserOf(destination);
        if (notifyUser.isPresent()) {
            if (!notifyUser.get().equals(me)) {
                throw new AccessDeniedException("본인 알림만 구독할 수 있습니다.");
            }
            return;
        }

        // 브로커에는 위 두 토픽만 있다. 형식이 틀린 id 도 여기서 걸린다
        log.debug("SUBSCRIBE denied: unknown destination user={} dest={}", me, destination);
        throw new AccessDeniedException("구독할 수 없는 destination 입니다.");
    }
}
