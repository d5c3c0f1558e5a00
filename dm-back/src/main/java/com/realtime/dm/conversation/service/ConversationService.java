package com.realtime.dm.conversation.service;

import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.common.PairKey;
import com.realtime.dm.conversation.dto.ConversationDto;
import com.realtime.dm.conversation.dto.ReadAck;
import com.realtime.dm.conversation.entity.Conversation;
import com.realtime.dm.conversation.entity.ConversationParticipant;
import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.conversation.repository.ConversationRepository;
import com.realtime.dm.friend.service.FriendshipService;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.entity.ChatMessage;
import com.realtime.dm.message.repository.ChatMessageRepository;
import com.realtime.dm.message.service.MessageMapper;
import com.realtime.dm.notify.NotifyEvent;
import com.realtime.dm.notify.NotifyType;
import com.realtime.dm.user.dto.UserSummaryDto;
import com.realtime.dm.user.entity.User;
import com.realtime.dm.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 1:1 대화방 디렉터리. 친구(ACCEPTED)끼리만, 쌍당 하나(uk_conversation_dm_key).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ConversationRepository conversationRepo;
    private final ConversationParticipantRepository participantRepo;
    private final ConversationWriter writer;
    private final ChatMessageRepository messageRepo;
    private final MessageMapper messageMapper;
    private final FriendshipService friendshipService;
    private final UserService userService;
    private final ApplicationEventPublisher events;

    /* ===== 열기(찾거나 만들기) ===== */

    public ConversationDto findOrCreate(UUID me, String participantUsername) {
        User other = userService.requireByUsername(participantUsername);
        return findOrCreate(me, other.getId());
    }

    /**
     * 트랜잭션 없음: 생성 경합에서 지면 이긴 쪽이 커밋한 행을 새로 읽는다.
     * 동시에 몇 번 불려도 같은 id 를 돌려준다.
     */
    public ConversationDto findOrCreate(UUID userA, UUID userB) {
        if (userA.equals(userB)) {
            throw new DmException(ErrorKind.SELF_REFERENCE, "자기 자신과는 대화방을 만들 수 없습니다.");
        }
        if (!friendshipService.areFriends(userA, userB)) {
            throw new DmException(ErrorKind.NOT_FRIENDS, "친구인 사용자와만 대화할 수 있습니다.");
        }

        PairKey pair = PairKey.of(userA, userB);
        Conversation conversation = conversationRepo.findByDmKey(pair.asKey())
                .orElseGet(() -> create(pair));
        return toDto(conversation, userA);
    }

    private Conversation create(PairKey pair) {
        try {
            Conversation created = writer.createDm(pair);
            log.info("conversation created: id={} pair={}", created.getId(), pair.asKey());
            return created;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            Conversation winner = conversationRepo.findByDmKey(pair.asKey())
                    .orElseThrow(() -> new DmException(ErrorKind.CONFLICT,
                            "대화방 생성이 충돌했습니다. 다시 시도해 주세요.", null, e));
            log.debug("conversation create race lost: pair={} winner={}", pair.asKey(), winner.getId());
            return winner;
        }
    }

    /* ===== 조회 ===== */

    @Transactional(readOnly = true)
    public ConversationDto get(UUID conversationId, UUID callerId) {
        Conversation c = requireConversation(conversationId);
        requireParticipant(conversationId, callerId);
        return toDto(c, callerId);
    }

    /** 최근 활동(마지막 메시지, 없으면 생성 시각) 내림차순 */
    @Transactional(readOnly = true)
    public List<ConversationDto> list(UUID callerId) {
        List<ConversationParticipant> mine = participantRepo.findByUserId(callerId);
        if (mine.isEmpty()) return List.of();

        Map<UUID, Integer> unreadByConversation = mine.stream()
                .collect(Collectors.toMap(ConversationParticipant::getConversationId,
                        ConversationParticipant::getUnreadCount, (a, b) -> a));
        Set<UUID> ids = unreadByConversation.keySet();

        List<Conversation> conversations = conversationRepo.findAllById(ids);
        Map<UUID, List<UUID>> participantsByConversation = participantRepo.findByConversationIdIn(ids).stream()
                .collect(Collectors.groupingBy(ConversationParticipant::getConversationId,
                        Collectors.mapping(ConversationParticipant::getUserId, Collectors.toList())));
        Map<UUID, ChatMessage> lastByConversation = messageRepo.findLastPerConversation(ids).stream()
                .collect(Collectors.toMap(ChatMessage::getConversationId, Function.identity(), (a, b) -> a));

        Set<UUID> userIds = new HashSet<>();
        participantsByConversation.values().forEach(userIds::addAll);
        Map<UUID, UserSummaryDto> users = userService.summaries(userIds);

        return conversations.stream()
                .map(c -> assemble(c,
                        participantsByConversation.getOrDefault(c.getId(), List.of()),
                        lastByConversation.get(c.getId()),
                        unreadByConversation.getOrDefault(c.getId(), 0),
                        users))
                .sorted(Comparator.comparing(ConversationDto::lastActivityAt).reversed()
                        .thenComparing(ConversationDto::id))
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean isParticipant(UUID conversationId, UUID userId) {
        return participantRepo.existsByConversationIdAndUserId(conversationId, userId);
    }

    /** 없는 대화 → NotFound, 참여자가 아니면 Forbidden */
    @Transactional(readOnly = true)
    public void requireParticipant(UUID conversationId, UUID userId) {
        if (participantRepo.existsByConversationIdAndUserId(conversationId, userId)) return;
        if (!conversationRepo.existsById(conversationId)) {
            throw DmException.notFound("대화방을 찾을 수 없습니다.");
        }
        throw DmException.forbidden("대화 참여자가 아닙니다.");
    }

    /* ===== 변경 ===== */

    /** 참여자/메시지까지 같은 트랜잭션에서 함께 삭제 */
    @Transactional
    public void delete(UUID conversationId, UUID callerId) {
        Conversation c = requireConversation(conversationId);
        requireParticipant(conversationId, callerId);

        List<UUID> participantIds = participantRepo.findParticipantIds(conversationId);
        int messages = messageRepo.deleteByConversationId(conversationId);
        participantRepo.deleteByConversationId(conversationId);
        conversationRepo.delete(c);
        log.info("conversation deleted: id={} by={} messages={}", conversationId, callerId, messages);

        Map<String, Object> payload = Map.of("conversationId", conversationId.toString());
        for (UUID uid : participantIds) {
            events.publishEvent(NotifyEvent.of(NotifyType.CONVERSATION_DELETED, callerId, uid, payload));
        }
    }

    @Transactional
    public ReadAck markRead(UUID conversationId, UUID callerId) {
        requireParticipant(conversationId, callerId);

        final int updated = participantRepo.resetUnread(conversationId, callerId);
        UUID peerId = participantRepo.findParticipantIds(conversationId).stream()
                .filter(id -> !id.equals(callerId))
                .findFirst()
                .orElse(null);
        return new ReadAck(conversationId, callerId, peerId, 0, updated > 0);
    }

    /* ===== 내부 ===== */

    private Conversation requireConversation(UUID conversationId) {
        return conversationRepo.findById(conversationId)
                .orElseThrow(() -> DmException.notFound("대화방을 찾을 수 없습니다."));
    }

    private ConversationDto toDto(Conversation c, UUID viewerId) {
        List<UUID> participantIds = participantRepo.findParticipantIds(c.getId());
        ChatMessage last = messageRepo.findLastPerConversation(List.of(c.getId())).stream()
                .findFirst()
                .orElse(null);
        int unread = participantRepo.findByConversationIdAndUserId(c.getId(), viewerId)
                .map(ConversationParticipant::getUnreadCount)
                .orElse(0);
        return assemble(c, participantIds, last, unread, userService.summaries(participantIds));
    }

    private ConversationDto assemble(Conversation c, List<UUID> participantIds, ChatMessage last,
                                     int unread, Map<UUID, UserSummaryDto> users) {
        MessageDto lastDto = last == null ? null : messageMapper.toDto(last);
        Instant lastActivity = last == null ? c.getCreatedAt() : last.getCreatedAt();
        List<UserSummaryDto> participants = participantIds.stream()
                .map(users::get)
                .filter(Objects::nonNull)
                .toList();
        return new ConversationDto(c.getId(), participants, lastDto, unread, c.getCreatedAt(), lastActivity);
    }
}
