package com.realtime.dm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST 위의 {@link MessageLogClient}. 오류 본문 {@code {kind, message}} 를 {@link DmException} 으로 바꾸고,
 * I/O 실패와 타임아웃은 {@code Transient} 로 올린다.
 */
@Slf4j
public class RestMessageLogClient implements MessageLogClient {

    private final RestClient rest;
    private final ObjectMapper objectMapper;

    public RestMessageLogClient(RestClient rest, ObjectMapper objectMapper) {
        this.rest = rest;
        this.objectMapper = objectMapper;
    }

    public static RestMessageLogClient create(String baseUrl, Supplier<String> accessToken,
                                              Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);

        RestClient rest = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .requestInterceptor((request, body, execution) -> {
                    request.getHeaders().setBearerAuth(accessToken.get());
                    return execution.execute(request, body);
                })
                .build();
        return new RestMessageLogClient(rest, JsonMapper.builder().findAndAddModules().build());
    }

    @Override
    public MessagePageDto page(UUID conversationId, int limit, MessageCursor cursor) {
        MessageCursor c = cursor == null ? MessageCursor.NONE : cursor;
        try {
            return rest.get()
                    .uri(b -> b.path("/api/conversations/{id}/messages")
                            .queryParam("limit", limit)
                            .queryParamIfPresent("before", Optional.ofNullable(c.before()).map(Instant::toString))
                            .queryParamIfPresent("beforeId", Optional.ofNullable(c.beforeId()))
                            .build(conversationId))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw toError(res);
                    })
                    .body(MessagePageDto.class);
        } catch (ResourceAccessException e) {
            throw transientError(e);
        }
    }

    @Override
    public MessageDto append(UUID conversationId, JsonNode content) {
        try {
            return rest.post()
                    .uri("/api/conversations/{id}/messages", conversationId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("content", content))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw toError(res);
                    })
                    .body(MessageDto.class);
        } catch (ResourceAccessException e) {
            throw transientError(e);
        }
    }

    DmException toError(ClientHttpResponse res) throws IOException {
        int status = res.getStatusCode().value();
        String kind = null;
        String message = null;
        String resourceId = null;
        try (InputStream body = res.getBody()) {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isObject()) {
                kind = node.path("kind").asText(null);
                message = node.path("message").asText(null);
                resourceId = node.path("resourceId").asText(null);
            }
        } catch (IOException e) {
            // 본문이 JSON 이 아니면 상태 코드로만 분류
            log.debug("error body unreadable: status={} cause={}", status, e.toString());
        }
        ErrorKind errorKind = ErrorKind.fromWire(kind, status);
        return new DmException(errorKind, message != null ? message : "HTTP " + status, resourceId);
    }

    private static DmException transientError(ResourceAccessException e) {
        return new DmException(ErrorKind.TRANSIENT, "서버에 연결하지 못했습니다. 잠시 후 다시 시도해 주세요.", null, e);
    }
}
