package com.realtime.dm.live;

import lombok.*;

/**
 * 새 메시지 알림 (대화방 밖에 있는 참여자용 미리보기).
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatNotify {
    /** MESSAGE */
    private String type;

    private String conversationId;

    private Long messageId;

    /** 발신자 UUID 문자열 */
    private String senderUserId;

    /** 화면에 표시할 라벨(표시명, 없으면 username) */
    private String username;

    /** 본문 텍스트 요약 */
    private String preview;

    /** epoch millis */
    private Long createdAt;
}
