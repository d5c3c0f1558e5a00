package com.realtime.dm.message.controller;

import com.realtime.dm.message.dto.MessageContentRequest;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;
import com.realtime.dm.message.service.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class MessageController {

    private final MessageService messageService;

    /** 최신순 페이지. before 는 ISO-8601 또는 epoch millis. millis 는 beforeId 와 함께 보내야 같은 밀리초를 놓치지 않는다 */
    @GetMapping("/conversations/{conversationId}/messages")
    public MessagePageDto page(@PathVariable("conversationId") UUID conversationId,
                               @RequestParam(name = "limit", required = false) Integer limit,
                               @RequestParam(name = "before", required = false) String before,
                               @RequestParam(name = "beforeId", required = false) Long beforeId,
                               Authentication auth) {
        UUID myId = UUID.fromString(auth.getName());
        return messageService.page(conversationId, myId, limit, MessageCursor.parse(before, beforeId));
    }

    @PostMapping("/conversations/{conversationId}/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public MessageDto append(@PathVariable("conversationId") UUID conversationId,
                             @Valid @RequestBody MessageContentRequest body,
                             Authentication auth) {
        return messageService.append(conversationId, UUID.fromString(auth.getName()), body.content());
    }

    @GetMapping("/messages/{messageId}")
    public MessageDto getOne(@PathVariable("messageId") Long messageId, Authentication auth) {
        return messageService.get(messageId, UUID.fromString(auth.getName()));
    }

    @PutMapping("/messages/{messageId}")
    public MessageDto edit(@PathVariable("messageId") Long messageId,
                           @Valid @RequestBody MessageContentRequest body,
                           Authentication auth) {
        return messageService.edit(messageId, UUID.fromString(auth.getName()), body.content());
    }

    @DeleteMapping("/messages/{messageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("messageId") Long messageId, Authentication auth) {
        messageService.delete(messageId, UUID.fromString(auth.getName()));
    }
}
