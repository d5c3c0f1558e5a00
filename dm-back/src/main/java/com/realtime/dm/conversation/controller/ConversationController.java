package com.realtime.dm.conversation.controller;

import com.realtime.dm.conversation.dto.ConversationDto;
import com.realtime.dm.conversation.dto.OpenConversationRequest;
import com.realtime.dm.conversation.dto.ReadAck;
import com.realtime.dm.conversation.service.ConversationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    /** 친구와의 1:1 대화방 열기 (없으면 생성, 있으면 기존 방) */
    @PostMapping
    public ConversationDto open(@Valid @RequestBody OpenConversationRequest body, Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return conversationService.findOrCreate(myId, body.participantUsername());
    }

    @GetMapping
    public List<ConversationDto> list(Authentication auth) {
        return conversationService.list(UUID.fromString(auth.getName()));
    }

    @GetMapping("/{id}")
    public ConversationDto get(@PathVariable("id") UUID id, Authentication auth) {
        return conversationService.get(id, UUID.fromString(auth.getName()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") UUID id, Authentication auth) {
        conversationService.delete(id, UUID.fromString(auth.getName()));
    }

    @PostMapping("/{id}/read")
    public ReadAck markRead(@PathVariable("id") UUID id, Authentication auth) {
        return conversationService.markRead(id, UUID.fromString(auth.getName()));
    }
}
