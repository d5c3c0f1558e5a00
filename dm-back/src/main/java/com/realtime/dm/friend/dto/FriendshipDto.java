package com.realtime.dm.friend.dto;

import com.realtime.dm.friend.model.FriendshipStatus;
import com.realtime.dm.user.dto.UserSummaryDto;

import java.time.Instant;
import java.util.UUID;

public record FriendshipDto(
        Long id,
        UserSummaryDto requester,
        UserSummaryDto addressee,
        FriendshipStatus status,
        UUID lastActorId,
        Instant createdAt,
        Instant updatedAt
) {}
