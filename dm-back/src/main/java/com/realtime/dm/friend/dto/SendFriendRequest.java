package com.realtime.dm.friend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SendFriendRequest(
        @NotBlank(message = "상대 username을 입력하세요.")
        @Size(max = 50)
        String addresseeUsername
) {}
