package com.realtime.dm.client;

import com.realtime.dm.message.dto.MessageDto;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 표시용 묶음. 같은 작성자의 연속 메시지가 직전 메시지로부터 quiet 간격 미만이면 묶고,
 * 묶인 메시지는 작성자/시각 표시를 생략한다.
 */
public final class MessageGrouping {

    public static final Duration DEFAULT_QUIET_INTERVAL = Duration.ofMinutes(5);

    public record GroupedMessage(MessageDto message, boolean grouped) {
        public boolean showHeader() {
            return !grouped;
        }
    }

    private MessageGrouping() {}

    /** @param ascending (createdAt, id) 오름차순 */
    public static List<GroupedMessage> group(List<MessageDto> ascending, Duration quietInterval) {
        List<GroupedMessage> out = new ArrayList<>(ascending.size());
        MessageDto prev = null;
        for (MessageDto m : ascending) {
            out.add(new GroupedMessage(m, continues(prev, m, quietInterval)));
            prev = m;
        }
        return out;
    }

    static boolean continues(MessageDto prev, MessageDto cur, Duration quietInterval) {
        if (prev == null || !prev.authorId().equals(cur.authorId())) return false;
        return Duration.between(prev.createdAt(), cur.createdAt()).compareTo(quietInterval) < 0;
    }
}
