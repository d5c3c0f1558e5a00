package com.realtime.dm.conversation.controller;

import com.realtime.dm.common.ApiExceptionAdvice;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.config.SecurityConfig;
import com.realtime.dm.conversation.dto.ConversationDto;
import com.realtime.dm.conversation.dto.ReadAck;
import com.realtime.dm.conversation.service.ConversationService;
import com.realtime.dm.security.JwtProvider;
import com.realtime.dm.user.dto.UserSummaryDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationController.class)
@Import({SecurityConfig.class, ApiExceptionAdvice.class})
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @MockBean
    private JwtProvider jwtProvider;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID conversationId = UUID.randomUUID();

    private ConversationDto conversation() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        return new ConversationDto(conversationId, List.of(
                new UserSummaryDto(alice, "alice", "Alice", null, "online", false),
                new UserSummaryDto(bob, "bob", "Bob", null, "online", true)),
                null, 0, now, now);
    }

    @Test
    @DisplayName("대화 열기 - 친구면 대화 반환")
    void open_Ok() throws Exception {
        // Given
        given(conversationService.findOrCreate(alice, "bob")).willReturn(conversation());

        // When & Then
        mockMvc.perform(post("/api/conversations")
                        .with(user(alice.toString()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participantUsername\":\"bob\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(conversationId.toString()))
                .andExpect(jsonPath("$.participants.length()").value(2))
                .andExpect(jsonPath("$.unreadCount").value(0));
    }

    @Test
    @DisplayName("친구가 아니면 403 NotFriends")
    void open_NotFriends() throws Exception {
        given(conversationService.findOrCreate(alice, "eve"))
                .willThrow(new DmException(ErrorKind.NOT_FRIENDS, "친구만 대화할 수 있습니다."));

        mockMvc.perform(post("/api/conversations")
                        .with(user(alice.toString()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participantUsername\":\"eve\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("NotFriends"));
    }

    @Test
    @DisplayName("목록 조회")
    void list_Ok() throws Exception {
        given(conversationService.list(alice)).willReturn(List.of(conversation()));

        mockMvc.perform(get("/api/conversations").with(user(alice.toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(conversationId.toString()));
    }

    @Test
    @DisplayName("id 가 UUID 가 아니면 400 BadRequest")
    void get_MalformedId() throws Exception {
        mockMvc.perform(get("/api/conversations/not-a-uuid").with(user(alice.toString())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("BadRequest"));
    }

    @Test
    @DisplayName("읽음 처리는 ReadAck 반환")
    void markRead_Ok() throws Exception {
        given(conversationService.markRead(conversationId, alice))
                .willReturn(new ReadAck(conversationId, alice, bob, 0, true));

        mockMvc.perform(post("/api/conversations/{id}/read", conversationId).with(user(alice.toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peerId").value(bob.toString()))
                .andExpect(jsonPath("$.unread").value(0))
                .andExpect(jsonPath("$.ok").value(true));
    }

    @Test
    @DisplayName("삭제는 204")
    void delete_NoContent() throws Exception {
        mockMvc.perform(delete("/api/conversations/{id}", conversationId).with(user(alice.toString())))
                .andExpect(status().isNoContent());

        then(conversationService).should().delete(conversationId, alice);
    }
}
