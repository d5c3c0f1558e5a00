package com.realtime.dm.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.dm.config.RabbitConfig;
import com.realtime.dm.conversation.repository.ConversationParticipantRepository;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.service.MessageContentValidator;
import com.realtime.dm.user.entity.User;
import com.realtime.dm.user.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class ChatEventBridgeTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @Mock
    private ConversationParticipantRepository participantRepo;

    @Mock
    private UserRepository userRepo;

    @Mock
    private MessageContentValidator contentValidator;

    @InjectMocks
    private ChatEventBridge bridge;

    private final UUID conversationId = UUID.randomUUID();
    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    private MessageDto message() {
        JsonNode doc = new ObjectMapper().createObjectNode().put("type", "doc");
        return new MessageDto(42L, conversationId, alice, doc, Instant.ofEpochMilli(1_700_000_000_000L), null);
    }

    @Test
    @DisplayName("INSERT 는 대화 토픽으로 보내고 작성자를 뺀 참여자에게 미리보기 알림")
    void insertNotifiesPeer() {
        // Given
        MessageDto m = message();
        given(userRepo.findById(alice)).willReturn(Optional.of(User.builder().id(alice).username("alice").build()));
        given(contentValidator.plainText(m.content())).willReturn("안녕 bob");
        given(participantRepo.findParticipantIds(conversationId)).willReturn(List.of(alice, bob));

        // When
        MessageEvent event = MessageEvent.insert(m);
        bridge.onEvent(event, RabbitConfig.ROUTING_KEY_PREFIX + conversationId);

        // Then
        then(messagingTemplate).should().convertAndSend(LiveTopics.conversation(conversationId), event);
        ArgumentCaptor<ChatNotify> notify = ArgumentCaptor.forClass(ChatNotify.class);
        then(messagingTemplate).should().convertAndSend(eq(LiveTopics.notify(bob)), notify.capture());
        then(messagingTemplate).should(never()).convertAndSend(eq(LiveTopics.notify(alice)), any(ChatNotify.class));

        assertThat(notify.getValue().getType()).isEqualTo("MESSAGE");
        assertThat(notify.getValue().getMessageId()).isEqualTo(42L);
        assertThat(notify.getValue().getUsername()).isEqualTo("alice");
        assertThat(notify.getValue().getPreview()).isEqualTo("안녕 bob");
        assertThat(notify.getValue().getCreatedAt()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    @DisplayName("DELETE 는 대화 토픽으로만 보낸다")
    void deleteOnlyRelays() {
        MessageEvent event = MessageEvent.delete(conversationId, 42L);

        bridge.onEvent(event, null);

        then(messagingTemplate).should().convertAndSend(LiveTopics.conversation(conversationId), event);
        then(participantRepo).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("페이로드에 대화 id 가 없으면 라우팅 키에서 찾는다")
    void conversationIdFromRoutingKey() {
        MessageEvent event = MessageEvent.builder().type(MessageEvent.Type.DELETE).messageId(1L).build();

        bridge.onEvent(event, RabbitConfig.ROUTING_KEY_PREFIX + conversationId);

        then(messagingTemplate).should().convertAndSend(LiveTopics.conversation(conversationId), event);
    }

    @Test
    @DisplayName("대화 id 를 알 수 없으면 버린다")
    void dropsWithoutConversation() {
        MessageEvent event = MessageEvent.builder().type(MessageEvent.Type.DELETE).messageId(1L).build();

        bridge.onEvent(event, "dm.conversation.not-a-uuid");

        then(messagingTemplate).should(never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    @DisplayName("미리보기는 최대 길이에서 말줄임")
    void abbreviate() {
        assertThat(ChatEventBridge.abbreviate(null, 5)).isEmpty();
        assertThat(ChatEventBridge.abbreviate("hello", 5)).isEqualTo("hello");
        assertThat(ChatEventBridge.abbreviate("hello world", 5)).isEqualTo("hell…");
    }
}
