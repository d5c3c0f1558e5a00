package com.realtime.dm.friend.controller;

import com.realtime.dm.friend.dto.FriendshipDto;
import com.realtime.dm.friend.dto.SendFriendRequest;
import com.realtime.dm.friend.model.FriendshipStatus;
import com.realtime.dm.friend.service.FriendshipService;
import com.realtime.dm.user.dto.UserSummaryDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/friendships")
@RequiredArgsConstructor
public class FriendshipController {

    private final FriendshipService friendshipService;

    /* ======= 요청 보내기 ======= */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public FriendshipDto send(@Valid @RequestBody SendFriendRequest body, Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return friendshipService.sendRequest(myId, body.addresseeUsername());
    }

    /* ======= 수락 ======= */
    @PostMapping("/{id}/accept")
    public FriendshipDto accept(@PathVariable("id") Long id, Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return friendshipService.accept(id, myId);
    }

    /* ======= 차단 ======= */
    @PostMapping("/{id}/block")
    public FriendshipDto block(@PathVariable("id") Long id, Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return friendshipService.block(id, myId);
    }

    /* ======= 취소 / 친구 삭제 / 차단 해제 ======= */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@PathVariable("id") Long id, Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        friendshipService.cancelOrRemove(id, myId);
    }

    /** ?status=pending|accepted|blocked (생략 시 전체) */
    @GetMapping
    public List<FriendshipDto> list(@RequestParam(value = "status", required = false) String status,
                                    Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        FriendshipStatus filter = (status == null || status.isBlank()) ? null : FriendshipStatus.fromParam(status);
        return friendshipService.listEdges(myId, filter);
    }

    @GetMapping("/friends")
    public List<UserSummaryDto> friends(Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return friendshipService.listFriends(myId);
    }
}
