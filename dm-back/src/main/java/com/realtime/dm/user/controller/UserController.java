package com.realtime.dm.user.controller;

import com.realtime.dm.user.dto.UpdateProfileRequest;
import com.realtime.dm.user.dto.UserSummaryDto;
import com.realtime.dm.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping("/me")
    public UserSummaryDto me(Authentication auth) {
        return userService.me(UUID.fromString(auth.getName()));
    }

    @PutMapping("/me")
    public UserSummaryDto updateMe(@Valid @RequestBody UpdateProfileRequest body, Authentication auth) {
        return userService.updateMe(UUID.fromString(auth.getName()), body);
    }

    /** username/표시명 검색 (본인 제외) */
    @GetMapping("/search")
    public List<UserSummaryDto> search(@RequestParam("q") String q,
                                       @RequestParam(value = "limit", required = false) Integer limit,
                                       Authentication auth) {
        return userService.search(UUID.fromString(auth.getName()), q, limit);
    }
}
