package com.realtime.dm.friend.service;

import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.common.PairKey;
import com.realtime.dm.friend.dto.FriendshipDto;
import com.realtime.dm.friend.entity.FriendshipEdge;
import com.realtime.dm.friend.model.FriendshipStatus;
import com.realtime.dm.friend.repository.FriendshipEdgeRepository;
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
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 친구 관계 상태 머신. 쌍 유일성은 DB 제약(uk_friendship_pair)으로만 보장한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FriendshipService {

    private final FriendshipEdgeRepository edgeRepo;
    private final FriendshipWriter writer;
    private final UserService userService;
    private final ApplicationEventPublisher events;

    /* ========== 요청 ========== */

    /** username(대소문자 무시)으로 상대를 찾아 요청 */
    public FriendshipDto sendRequest(UUID requesterId, String addresseeUsername) {
        User addressee = userService.requireByUsername(addresseeUsername);
        return sendRequest(requesterId, addressee.getId());
    }

    /**
     * 트랜잭션을 걸지 않는다: 경합에서 진 경우 승자의 커밋된 행을 새로 읽어야 하므로
     * INSERT 는 {@link FriendshipWriter} 의 별도 트랜잭션에서 수행.
     */
    public FriendshipDto sendRequest(UUID requesterId, UUID addresseeId) {
        if (requesterId.equals(addresseeId)) {
            throw new DmException(ErrorKind.SELF_REFERENCE, "자기 자신에게는 친구 요청을 보낼 수 없습니다.");
        }
        userService.requireUser(requesterId);
        userService.requireUser(addresseeId);

        PairKey pair = PairKey.of(requesterId, addresseeId);
        edgeRepo.findByPairLowAndPairHigh(pair.low(), pair.high())
                .ifPresent(existing -> { throw alreadyExists(existing); });

        FriendshipEdge saved;
        try {
            saved = writer.insertPending(requesterId, addresseeId);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // 동시 요청에서 짐: 이긴 쪽 행을 돌려준다
            FriendshipEdge winner = edgeRepo.findByPairLowAndPairHigh(pair.low(), pair.high())
                    .orElseThrow(() -> new DmException(ErrorKind.CONFLICT,
                            "동시에 처리된 요청이 있습니다. 다시 시도해 주세요.", null, e));
            log.info("friend request race lost: requester={} addressee={} winnerEdge={}",
                    requesterId, addresseeId, winner.getId());
            throw alreadyExists(winner);
        }

        log.info("friend request sent: edge={} {} -> {}", saved.getId(), requesterId, addresseeId);
        FriendshipDto dto = toDto(saved);
        notifyBoth(NotifyType.FRIEND_REQUEST_RECEIVED, requesterId, saved);
        return dto;
    }

    /* ========== 상태 변경 ========== */

    @Transactional
    public FriendshipDto accept(Long edgeId, UUID actorId) {
        FriendshipEdge edge = requireEdge(edgeId);
        if (!edge.getAddresseeId().equals(actorId)) {
            throw DmException.forbidden("받은 요청만 수락할 수 있습니다.");
        }
        if (edge.getStatus() != FriendshipStatus.PENDING) {
            throw new DmException(ErrorKind.INVALID_STATE, invalidAcceptMessage(edge.getStatus()), edge.getId());
        }

        edge.transitionTo(FriendshipStatus.ACCEPTED, actorId);
        flush(edge);
        log.info("friend request accepted: edge={} by={}", edgeId, actorId);

        notifyBoth(NotifyType.FRIEND_REQUEST_ACCEPTED, actorId, edge);
        return toDto(edge);
    }

    /** 어느 쪽이든, 어떤 상태에서든 차단 가능 */
    @Transactional
    public FriendshipDto block(Long edgeId, UUID actorId) {
        FriendshipEdge edge = requireEdge(edgeId);
        requireParty(edge, actorId);

        FriendshipStatus prior = edge.getStatus();
        edge.transitionTo(FriendshipStatus.BLOCKED, actorId);
        flush(edge);
        log.info("friendship blocked: edge={} by={} prior={}", edgeId, actorId, prior);

        notifyBoth(NotifyType.FRIENDSHIP_BLOCKED, actorId, edge);
        return toDto(edge);
    }

    /** 요청 취소 / 친구 삭제 / 차단 해제 모두 행 삭제로 처리 */
    @Transactional
    public void cancelOrRemove(Long edgeId, UUID actorId) {
        FriendshipEdge edge = requireEdge(edgeId);
        requireParty(edge, actorId);

        FriendshipStatus prior = edge.getStatus();
        try {
            edgeRepo.delete(edge);
            edgeRepo.flush();
        } catch (ObjectOptimisticLockingFailureException e) {
            throw lostUpdate(edgeId, e);
        }

        NotifyType type = switch (prior) {
            case PENDING -> NotifyType.FRIEND_REQUEST_CANCELLED;
            case ACCEPTED -> NotifyType.FRIEND_REMOVED;
            case BLOCKED -> NotifyType.FRIEND_UNBLOCKED;
        };
        log.info("friendship removed: edge={} by={} prior={} ({})", edgeId, actorId, prior, type);
        notifyBoth(type, actorId, edge);
    }

    /* ========== 조회 ========== */

    @Transactional(readOnly = true)
    public List<FriendshipDto> listEdges(UUID userId, FriendshipStatus status) {
        List<FriendshipEdge> edges = edgeRepo.findInvolving(userId, status);
        Set<UUID> ids = new LinkedHashSet<>();
        edges.forEach(e -> { ids.add(e.getRequesterId()); ids.add(e.getAddresseeId()); });
        Map<UUID, UserSummaryDto> users = userService.summaries(ids);
        return edges.stream().map(e -> toDto(e, users)).toList();
    }

    /** 수락된 관계의 상대방 목록 */
    @Transactional(readOnly = true)
    public List<UserSummaryDto> listFriends(UUID userId) {
        List<UUID> friendIds = edgeRepo.findInvolving(userId, FriendshipStatus.ACCEPTED).stream()
                .map(e -> e.counterpartOf(userId))
                .toList();
        Map<UUID, UserSummaryDto> users = userService.summaries(friendIds);
        return friendIds.stream()
                .map(users::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean areFriends(UUID a, UUID b) {
        if (a.equals(b)) return false;
        PairKey pair = PairKey.of(a, b);
        return edgeRepo.existsByPairLowAndPairHighAndStatus(pair.low(), pair.high(), FriendshipStatus.ACCEPTED);
    }

    /* ========== 내부 ========== */

    private FriendshipEdge requireEdge(Long edgeId) {
        return edgeRepo.findById(edgeId)
                .orElseThrow(() -> DmException.notFound("친구 관계를 찾을 수 없습니다."));
    }

    private static void requireParty(FriendshipEdge edge, UUID actorId) {
        if (!edge.involves(actorId)) {
            throw DmException.forbidden("관계 당사자만 처리할 수 있습니다.");
        }
    }

    private void flush(FriendshipEdge edge) {
        try {
            edgeRepo.saveAndFlush(edge);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw lostUpdate(edge.getId(), e);
        }
    }

    private static DmException lostUpdate(Long edgeId, Exception cause) {
        return new DmException(ErrorKind.CONFLICT, "다른 요청이 먼저 처리되었습니다. 다시 조회해 주세요.", edgeId, cause);
    }

    private static DmException alreadyExists(FriendshipEdge existing) {
        String message = switch (existing.getStatus()) {
            case PENDING -> "이미 대기 중인 친구 요청이 있습니다.";
            case ACCEPTED -> "이미 친구입니다.";
            case BLOCKED -> "이 사용자에게는 친구 요청을 보낼 수 없습니다.";
        };
        return new DmException(ErrorKind.ALREADY_EXISTS, message, existing.getId());
    }

    private static String invalidAcceptMessage(FriendshipStatus status) {
        return switch (status) {
            case ACCEPTED -> "이미 수락된 요청입니다.";
            case BLOCKED -> "차단된 관계는 수락할 수 없습니다.";
            case PENDING -> "대기 중인 요청이 아닙니다.";
        };
    }

    private void notifyBoth(NotifyType type, UUID actorId, FriendshipEdge edge) {
        Map<String, Object> payload = Map.of(
                "friendshipId", edge.getId(),
                "status", edge.getStatus().name(),
                "requesterId", edge.getRequesterId().toString(),
                "addresseeId", edge.getAddresseeId().toString()
        );
        events.publishEvent(NotifyEvent.of(type, actorId, edge.getRequesterId(), payload));
        events.publishEvent(NotifyEvent.of(type, actorId, edge.getAddresseeId(), payload));
    }

    private FriendshipDto toDto(FriendshipEdge e) {
        return toDto(e, userService.summaries(List.of(e.getRequesterId(), e.getAddresseeId())));
    }

    private static FriendshipDto toDto(FriendshipEdge e, Map<UUID, UserSummaryDto> users) {
        return new FriendshipDto(
                e.getId(),
                users.get(e.getRequesterId()),
                users.get(e.getAddresseeId()),
                e.getStatus(),
                e.getLastActorId(),
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
