package com.realtime.dm.notify;

import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 사용자 알림. 수신자({@code to})마다 한 건씩 만들어 /topic/notify/{to} 로 보낸다.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class NotifyEvent {
    private NotifyType type;
    private UUID from;   // 행위자
    private UUID to;     // 수신자
    private Instant at;
    private Map<String, Object> payload;

    public static NotifyEvent of(NotifyType type, UUID from, UUID to, Map<String, Object> payload) {
        return NotifyEvent.builder()
                .type(type)
                .from(from)
                .to(to)
                .at(Instant.now())
                .payload(payload)
                .build();
    }
}
