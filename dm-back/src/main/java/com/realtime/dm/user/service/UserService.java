package com.realtime.dm.user.service;

import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.common.Normalizer;
import com.realtime.dm.config.DmProps;
import com.realtime.dm.user.dto.UpdateProfileRequest;
import com.realtime.dm.user.dto.UserSummaryDto;
import com.realtime.dm.user.entity.User;
import com.realtime.dm.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepo;
    private final PresenceService presenceService;
    private final Normalizer normalizer;
    private final DmProps props;

    /* ===== 조회 ===== */

    @Transactional(readOnly = true)
    public User requireUser(UUID id) {
        return userRepo.findById(id)
                .orElseThrow(() -> DmException.notFound("사용자를 찾을 수 없습니다."));
    }

    /** username(대소문자 무시)으로 상대 찾기 */
    @Transactional(readOnly = true)
    public User requireByUsername(String username) {
        String normalized = normalizer.normalizeUsername(username);
        if (normalized == null) {
            throw new DmException(ErrorKind.NOT_FOUND, "사용자 이름이 비어 있습니다.");
        }
        return userRepo.findByUsernameCi(normalized)
                .orElseThrow(() -> DmException.notFound("존재하지 않는 사용자입니다: " + normalized));
    }

    @Transactional(readOnly = true)
    public UserSummaryDto me(UUID me) {
        return toSummary(requireUser(me));
    }

    @Transactional(readOnly = true)
    public List<UserSummaryDto> search(UUID me, String q, Integer limit) {
        int size = clamp(limit == null ? props.getSearchDefaultLimit() : limit, props.getSearchMaxLimit());
        String query = normalizer.normalizeQuery(q);
        if (query.isEmpty()) return List.of();
        return userRepo.search(me, query, PageRequest.of(0, size)).stream()
                .map(this::toSummary)
                .toList();
    }

    /* ===== 변경 ===== */

    @Transactional
    public UserSummaryDto updateMe(UUID me, UpdateProfileRequest req) {
        User u = requireUser(me);
        if (req.displayName() != null) u.setDisplayName(req.displayName().trim());
        if (req.status() != null) u.setStatus(req.status());
        return toSummary(u);
    }

    /* ===== 변환 ===== */

    public UserSummaryDto toSummary(User u) {
        return new UserSummaryDto(
                u.getId(),
                u.getUsername(),
                u.getDisplayName(),
                u.getAvatarUrl(),
                u.getStatus(),
                presenceService.isOnline(u.getId())
        );
    }

    /** id → 요약. 없는 사용자는 결과에서 빠진다 */
    @Transactional(readOnly = true)
    public Map<UUID, UserSummaryDto> summaries(Collection<UUID> ids) {
        if (ids.isEmpty()) return Map.of();
        return userRepo.findAllById(ids).stream()
                .map(this::toSummary)
                .collect(Collectors.toMap(UserSummaryDto::id, Function.identity(), (a, b) -> a));
    }

    private static int clamp(int limit, int max) {
        return Math.min(max, Math.max(1, limit));
    }
}
