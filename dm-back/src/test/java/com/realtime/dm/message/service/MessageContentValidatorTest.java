package com.realtime.dm.message.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.dm.common.DmException;
import com.realtime.dm.common.ErrorKind;
import com.realtime.dm.config.DmProps;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageContentValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MessageContentValidator validator;

    @BeforeEach
    void setUp() {
        validator = new MessageContentValidator(objectMapper, new DmProps());
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    private static String paragraph(String text) {
        return """
               {"type":"doc","content":[{"type":"paragraph","content":[{"type":"text","text":"%s"}]}]}
               """.formatted(text);
    }

    private static void assertInvalid(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(DmException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_CONTENT));
    }

    @Test
    @DisplayName("정상 문서는 텍스트를 추출한다")
    void validDocument() throws Exception {
        MessageContentValidator.ValidatedContent result = validator.validate(json(paragraph("hi")));

        assertThat(result.plainText()).isEqualTo("hi");
        assertThat(result.document().path("type").asText()).isEqualTo("doc");
    }

    @Test
    @DisplayName("루트 타입이 doc 가 아니면 거부")
    void rootMustBeDoc() throws Exception {
        JsonNode content = json("""
                {"type":"paragraph","content":[{"type":"text","text":"hi"}]}
                """);
        assertInvalid(() -> validator.validate(content));
    }

    @Test
    @DisplayName("허용 목록 밖의 노드 타입은 거부")
    void unknownNodeRejected() throws Exception {
        JsonNode content = json("""
                {"type":"doc","content":[{"type":"image","attrs":{"src":"x"}}]}
                """);
        assertInvalid(() -> validator.validate(content));
    }

    @Test
    @DisplayName("빈 텍스트는 거부")
    void blankRejected() throws Exception {
        assertInvalid(() -> validator.validate(json(paragraph("   "))));
        assertInvalid(() -> validator.validate(json("{\"type\":\"doc\",\"content\":[]}")));
    }

    @Test
    @DisplayName("2000자를 넘으면 거부, 2000자는 허용")
    void textLengthBound() throws Exception {
        assertThat(validator.validate(json(paragraph("a".repeat(2000)))).plainText()).hasSize(2000);
        JsonNode tooLong = json(paragraph("a".repeat(2001)));
        assertInvalid(() -> validator.validate(tooLong));
    }

    @Test
    @DisplayName("script, iframe, javascript: 는 텍스트에서 제거")
    void sanitizesText() throws Exception {
        String raw = "<script>alert(1)</script> go JavaScript:void(0)";
        MessageContentValidator.ValidatedContent result = validator.validate(json(paragraph(raw)));

        assertThat(result.plainText()).isEqualTo("alert(1) go void(0)");
        assertThat(result.json()).doesNotContain("<script>").doesNotContainIgnoringCase("javascript:");
    }

    @Test
    @DisplayName("제거 후 다시 조립되는 중첩 토큰도 남지 않는다")
    void sanitizesNestedTokens() throws Exception {
        String raw = "<scr<script>ipt>alert(1)</scr</script>ipt> <ifr<iframe>ame>javajavascript:script:x";
        MessageContentValidator.ValidatedContent result = validator.validate(json(paragraph(raw)));

        assertThat(result.plainText()).isEqualTo("alert(1) x");
        assertThat(result.json())
                .doesNotContainIgnoringCase("<script>")
                .doesNotContainIgnoringCase("</script>")
                .doesNotContainIgnoringCase("<iframe>")
                .doesNotContainIgnoringCase("javascript:");
    }

    @Test
    @DisplayName("허용되지 않는 마크와 속성은 버린다")
    void dropsUnknownMarksAndAttrs() throws Exception {
        JsonNode content = json("""
                {"type":"doc","content":[{"type":"paragraph","attrs":{"style":"color:red"},
                  "content":[{"type":"text","text":"x","marks":[{"type":"bold"},{"type":"link","attrs":{"href":"h"}}]}]}]}
                """);

        JsonNode doc = validator.validate(content).document();
        JsonNode paragraph = doc.path("content").get(0);
        JsonNode text = paragraph.path("content").get(0);

        assertThat(paragraph.has("attrs")).isFalse();
        assertThat(text.path("marks")).hasSize(1);
        assertThat(text.path("marks").get(0).path("type").asText()).isEqualTo("bold");
    }

    @Test
    @DisplayName("heading level 은 1..6 으로 제한")
    void clampsHeadingLevel() throws Exception {
        JsonNode content = json("""
                {"type":"doc","content":[{"type":"heading","attrs":{"level":9},"content":[{"type":"text","text":"t"}]}]}
                """);

        JsonNode heading = validator.validate(content).document().path("content").get(0);
        assertThat(heading.path("attrs").path("level").asInt()).isEqualTo(6);
    }

    @Test
    @DisplayName("hardBreak 는 줄바꿈으로 추출")
    void hardBreakIsNewline() throws Exception {
        JsonNode content = json("""
                {"type":"doc","content":[{"type":"paragraph","content":[
                  {"type":"text","text":"a"},{"type":"hardBreak"},{"type":"text","text":"b"}]}]}
                """);

        assertThat(validator.validate(content).plainText()).isEqualTo("a\nb");
    }
}
