package com.realtime.dm.user.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
        @Size(min = 1, max = 100, message = "표시 이름은 1~100자입니다.")
        String displayName,

        @Pattern(regexp = "online|idle|dnd|offline", message = "상태는 online, idle, dnd, offline 중 하나입니다.")
        String status
) {}
