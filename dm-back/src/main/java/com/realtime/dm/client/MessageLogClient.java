package com.realtime.dm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;

import java.util.UUID;

/**
 * 메시지 로그 요청/응답 호출. 실패는 {@link com.realtime.dm.common.DmException} 으로 올라온다.
 */
public interface MessageLogClient {

    MessagePageDto page(UUID conversationId, int limit, MessageCursor cursor);

    MessageDto append(UUID conversationId, JsonNode content);
}
