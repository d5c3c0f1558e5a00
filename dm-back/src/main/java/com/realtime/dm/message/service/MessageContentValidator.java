package com.realtime.dm.message.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.config.DmProps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * 구조화 문서 검증 + 정제.
 * <ul>
 *   <li>루트는 {@code {type:"doc", content:[...]}}</li>
 *   <li>노드 타입/마크는 허용 목록만, 그 밖의 속성은 버린다</li>
 *   <li>추출한 텍스트 1..maxTextLength 자, 직렬화 결과 maxDocumentLength 자 이하</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class MessageContentValidator {

    static final Set<String> NODE_TYPES =
            Set.of("doc", "paragraph", "text", "heading", "bold", "italic", "code", "hardBreak");
    static final Set<String> MARK_TYPES = Set.of("bold", "italic", "code");

    private static final Pattern DANGEROUS =
            Pattern.compile("<script>|</script>|<iframe>|</iframe>|javascript:", Pattern.CASE_INSENSITIVE);
    private static final int MAX_DEPTH = 16;

    private final ObjectMapper objectMapper;
    private final DmProps props;

    public record ValidatedContent(ObjectNode document, String json, String plainText) {}

    public ValidatedContent validate(JsonNode content) {
        if (content == null || !content.isObject()) {
            throw invalid("content는 JSON 객체여야 합니다.");
        }
        if (!"doc".equals(content.path("type").asText(null))) {
            throw invalid("content.type은 \"doc\" 이어야 합니다.");
        }
        if (!content.path("content").isArray()) {
            throw invalid("content.content는 배열이어야 합니다.");
        }

        ObjectNode sanitized = sanitizeNode(content, 0);
        String text = plainText(sanitized);
        if (text.isBlank()) {
            throw invalid("빈 메시지는 보낼 수 없습니다.");
        }
        if (text.length() > props.getMaxTextLength()) {
            throw invalid("메시지가 너무 깁니다. (최대 " + props.getMaxTextLength() + "자)");
        }

        String json = write(sanitized);
        if (json.length() > props.getMaxDocumentLength()) {
            throw invalid("문서가 너무 큽니다. (최대 " + props.getMaxDocumentLength() + "자)");
        }
        return new ValidatedContent(sanitized, json, text);
    }

    /** 텍스트 노드 이어붙이기. hardBreak 는 줄바꿈 */
    public String plainText(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        collectText(node, sb);
        return sb.toString();
    }

    private void collectText(JsonNode node, StringBuilder sb) {
        if (node == null || !node.isObject()) return;
        String type = node.path("type").asText("");
        if ("text".equals(type)) {
            sb.append(node.path("text").asText(""));
        } else if ("hardBreak".equals(type)) {
            sb.append('\n');
        }
        JsonNode children = node.path("content");
        if (children.isArray()) {
            children.forEach(child -> collectText(child, sb));
        }
    }

    private ObjectNode sanitizeNode(JsonNode node, int depth) {
        if (depth > MAX_DEPTH) throw invalid("문서 중첩이 너무 깊습니다.");
        if (!node.isObject()) throw invalid("문서 노드는 JSON 객체여야 합니다.");

        String type = node.path("type").asText(null);
        if (type == null || !NODE_TYPES.contains(type)) {
            throw invalid("허용되지 않는 노드 타입입니다: " + type);
        }

        ObjectNode out = objectMapper.createObjectNode();
        out.put("type", type);

        JsonNode text = node.get("text");
        if (text != null && text.isTextual()) {
            out.put("text", stripDangerous(text.asText()));
        }

        if ("heading".equals(type)) {
            int level = node.path("attrs").path("level").asInt(1);
            out.putObject("attrs").put("level", Math.min(6, Math.max(1, level)));
        }

        JsonNode marks = node.get("marks");
        if (marks != null && marks.isArray()) {
            ArrayNode kept = objectMapper.createArrayNode();
            for (JsonNode mark : marks) {
                String markType = mark.path("type").asText(null);
                if (markType != null && MARK_TYPES.contains(markType)) {
                    kept.addObject().put("type", markType);
                }
            }
            if (!kept.isEmpty()) out.set("marks", kept);
        }

        JsonNode children = node.get("content");
        if (children != null) {
            if (!children.isArray()) throw invalid("content는 배열이어야 합니다.");
            ArrayNode kids = out.putArray("content");
            for (JsonNode child : children) {
                kids.add(sanitizeNode(child, depth + 1));
            }
        }
        return out;
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DmException(ErrorKind.INVALID_CONTENT, "문서를 직렬화할 수 없습니다.", null, e);
        }
    }

    // 한 번 지우면 남은 조각이 다시 토큰이 될 수 있어 변화가 없을 때까지 반복
    static String stripDangerous(String text) {
        String current = text;
        String stripped = DANGEROUS.matcher(current).replaceAll("");
        while (!stripped.equals(current)) {
            current = stripped;
            stripped = DANGEROUS.matcher(current).replaceAll("");
        }
        return stripped;
    }

    private static DmException invalid(String message) {
        return new DmException(ErrorKind.INVALID_CONTENT, message);
    }
}
