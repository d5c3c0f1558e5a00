package com.realtime.dm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestMessageLogClientTest {

    private static final UUID CONVERSATION = UUID.fromString("5f0c7a8e-0000-4000-8000-000000000001");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private RestMessageLogClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://dm.test");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestMessageLogClient(builder.build(), objectMapper);
    }

    @Test
    @DisplayName("페이지 요청은 limit 과 복합 커서를 쿼리로 보낸다")
    void pageSendsCursor() {
        // Given
        String body = """
                {"messages":[{"id":7,"conversationId":"%s","authorId":"%s",
                  "content":{"type":"doc","content":[]},"createdAt":"2024-05-01T10:00:00Z","updatedAt":null}],
                 "hasMore":true,"nextBefore":"2024-05-01T10:00:00Z","nextBeforeId":7}
                """.formatted(CONVERSATION, UUID.randomUUID());
        server.expect(requestTo("http://dm.test/api/conversations/" + CONVERSATION
                        + "/messages?limit=20&before=2024-05-01T10:00:01Z&beforeId=9"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // When
        MessagePageDto page = client.page(CONVERSATION, 20,
                new MessageCursor(Instant.parse("2024-05-01T10:00:01Z"), 9L));

        // Then
        server.verify();
        assertThat(page.messages()).extracting(MessageDto::id).containsExactly(7L);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextBeforeId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("커서가 없으면 limit 만 보낸다")
    void pageWithoutCursor() {
        server.expect(requestTo("http://dm.test/api/conversations/" + CONVERSATION + "/messages?limit=50"))
                .andRespond(withSuccess("{\"messages\":[],\"hasMore\":false}", MediaType.APPLICATION_JSON));

        MessagePageDto page = client.page(CONVERSATION, 50, null);

        server.verify();
        assertThat(page.messages()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    @DisplayName("오류 본문의 kind 를 그대로 분류한다")
    void mapsErrorKind() {
        server.expect(requestTo("http://dm.test/api/conversations/" + CONVERSATION + "/messages?limit=50"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"kind\":\"Forbidden\",\"message\":\"대화 참여자가 아닙니다.\"}"));

        assertThatThrownBy(() -> client.page(CONVERSATION, 50, MessageCursor.NONE))
                .isInstanceOfSatisfying(DmException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(e.getMessage()).isEqualTo("대화 참여자가 아닙니다.");
                });
    }

    @Test
    @DisplayName("JSON 이 아닌 5xx 는 Transient")
    void nonJsonServerErrorIsTransient() {
        server.expect(requestTo("http://dm.test/api/conversations/" + CONVERSATION + "/messages?limit=50"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE)
                        .contentType(MediaType.TEXT_HTML)
                        .body("<html>upstream down</html>"));

        assertThatThrownBy(() -> client.page(CONVERSATION, 50, MessageCursor.NONE))
                .isInstanceOfSatisfying(DmException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("append 는 content 문서를 POST 한다")
    void appendPostsContent() throws Exception {
        // Given
        JsonNode doc = objectMapper.readTree("""
                {"type":"doc","content":[{"type":"paragraph","content":[{"type":"text","text":"hi"}]}]}
                """);
        String created = """
                {"id":8,"conversationId":"%s","authorId":"%s","content":%s,
                 "createdAt":"2024-05-01T10:00:02Z","updatedAt":null}
                """.formatted(CONVERSATION, UUID.randomUUID(), doc);
        server.expect(requestTo("http://dm.test/api/conversations/" + CONVERSATION + "/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.content.type").value("doc"))
                .andExpect(jsonPath("$.content.content[0].content[0].text").value("hi"))
                .andRespond(withStatus(HttpStatus.CREATED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(created));

        // When
        MessageDto saved = client.append(CONVERSATION, doc);

        // Then
        server.verify();
        assertThat(saved.id()).isEqualTo(8L);
        assertThat(saved.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:00:02Z"));
    }
}
