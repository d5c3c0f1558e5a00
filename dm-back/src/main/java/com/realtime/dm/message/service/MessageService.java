package com.realtime.dm.message.service;

import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.config.DmProps;
import com.realtime.dm.conversation.service.ConversationService;
import com.realtime.dm.live.MessageEvent;
import com.realtime.dm.message.dto.MessageCursor;
import com.realtime.dm.message.dto.MessageDto;
import com.realtime.dm.message.dto.MessagePageDto;
import com.realtime.dm.message.entity.ChatMessage;
import com.realtime.dm.message.repository.ChatMessageRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MessageService {

    private final ChatMessageRepository messageRepo;
    private final ConversationService conversationService;
    private final MessageContentValidator contentValidator;
    private final MessageMapper mapper;
    private final DmProps props;
    private final ApplicationEventPublisher events;

    /**
     * 단일 행 INSERT. created_at 은 INSERT 시점(µs)으로 찍히고,
     * 라이브 이벤트는 커밋 이후에만 나간다.
     */
    @Transactional
    public MessageDto append(UUID conversationId, UUID authorId, JsonNode content) {
        conversationService.requireParticipant(conversationId, authorId);
        MessageContentValidator.ValidatedContent valid = contentValidator.validate(content);

        ChatMessage saved = messageRepo.saveAndFlush(ChatMessage.builder()
                .conversationId(conversationId)
                .authorId(authorId)
                .content(valid.json())
                .build());

        MessageDto dto = mapper.toDto(saved);
        events.publishEvent(MessageEvent.insert(dto));
        log.debug("message appended: conversation={} id={} author={}", conversationId, saved.getId(), authorId);
        return dto;
    }

    /**
     * (created_at, id) 내림차순. limit+1 개를 읽어 hasMore 를 판단한다.
     */
    @Transactional(readOnly = true)
    public MessagePageDto page(UUID conversationId, UUID callerId, Integer limit, MessageCursor cursor) {
        conversationService.requireParticipant(conversationId, callerId);

        int capped = clampLimit(limit);
        PageRequest fetch = PageRequest.of(0, capped + 1);
        MessageCursor c = cursor == null ? MessageCursor.NONE : cursor;

        List<ChatMessage> rows;
        if (c.isEmpty()) {
            rows = messageRepo.findLatest(conversationId, fetch);
        } else if (c.isComposite() && c.wholeMillisecond()) {
            rows = messageRepo.findBeforeMillisCursor(
                    conversationId, c.before(), c.boundaryEnd(), c.beforeId(), fetch);
        } else if (c.isComposite()) {
            rows = messageRepo.findBeforeCursor(conversationId, c.before(), c.beforeId(), fetch);
        } else {
            rows = messageRepo.findBefore(conversationId, c.before(), fetch);
        }

        boolean hasMore = rows.size() > capped;
        List<ChatMessage> page = hasMore ? rows.subList(0, capped) : rows;
        List<MessageDto> messages = page.stream().map(mapper::toDto).toList();

        if (!hasMore) {
            return new MessagePageDto(messages, false, null, null);
        }
        MessageDto oldest = messages.get(messages.size() - 1);
        return new MessagePageDto(messages, true, oldest.createdAt(), oldest.id());
    }

    @Transactional(readOnly = true)
    public MessageDto get(Long messageId, UUID callerId) {
        ChatMessage m = requireMessage(messageId);
        conversationService.requireParticipant(m.getConversationId(), callerId);
        return mapper.toDto(m);
    }

    /** 작성자만. created_at 은 그대로라 타임라인 위치가 바뀌지 않는다 */
    @Transactional
    public MessageDto edit(Long messageId, UUID actorId, JsonNode newContent) {
        ChatMessage m = requireMessage(messageId);
        requireAuthor(m, actorId);
        MessageContentValidator.ValidatedContent valid = contentValidator.validate(newContent);

        m.edit(valid.json());
        messageRepo.flush();

        MessageDto dto = mapper.toDto(m);
        events.publishEvent(MessageEvent.update(dto));
        return dto;
    }

    /** 하드 삭제. 구독자는 DELETE 이벤트로 삭제를 구분한다 */
    @Transactional
    public void delete(Long messageId, UUID actorId) {
        ChatMessage m = requireMessage(messageId);
        requireAuthor(m, actorId);

        messageRepo.delete(m);
        messageRepo.flush();
        events.publishEvent(MessageEvent.delete(m.getConversationId(), m.getId()));
        log.debug("message deleted: conversation={} id={}", m.getConversationId(), m.getId());
    }

    int clampLimit(Integer limit) {
        int requested = (limit == null) ? props.getPageDefaultLimit() : limit;
        return Math.min(props.getPageMaxLimit(), Math.max(1, requested));
    }

    private ChatMessage requireMessage(Long messageId) {
        return messageRepo.findById(messageId)
                .orElseThrow(() -> new DmException(ErrorKind.NOT_FOUND,
                        "메시지를 찾을 수 없습니다.", String.valueOf(messageId)));
    }

    private void requireAuthor(ChatMessage m, UUID actorId) {
        if (!m.getAuthorId().equals(actorId)) {
            throw DmException.forbidden("본인이 작성한 메시지만 수정/삭제할 수 있습니다.");
        }
    }
}
