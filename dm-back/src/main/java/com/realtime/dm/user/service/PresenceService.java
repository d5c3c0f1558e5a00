package com.realtime.dm.user.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * 접속 여부. STOMP 세션 수를 Redis 카운터로 관리한다 (탭 여러 개 허용).
 * Redis 미사용 환경에서는 항상 offline.
 */
@Service
@Slf4j
public class PresenceService {

    private final ObjectProvider<StringRedisTemplate> redisProvider;

    public PresenceService(ObjectProvider<StringRedisTemplate> redisProvider) {
        this.redisProvider = redisProvider;
    }

    public boolean isOnline(UUID userId) {
        StringRedisTemplate redis = redisProvider.getIfAvailable();
        if (redis == null) return false;
        try {
            String v = redis.opsForValue().get(key(userId));
            return v != null && Long.parseLong(v) > 0;
        } catch (RuntimeException e) {
            log.debug("presence lookup failed for {}: {}", userId, e.getMessage());
            return false;
        }
    }

    public void markOnline(UUID userId) {
        StringRedisTemplate redis = redisProvider.getIfAvailable();
        if (redis == null) return;
        try {
            redis.opsForValue().increment(key(userId));
        } catch (RuntimeException e) {
            log.warn("presence online update failed for {}: {}", userId, e.getMessage());
        }
    }

    public void markOffline(UUID userId) {
        StringRedisTemplate redis = redisProvider.getIfAvailable();
        if (redis == null) return;
        try {
            Long left = redis.opsForValue().decrement(key(userId));
            if (left != null && left <= 0) redis.delete(key(userId));
        } catch (RuntimeException e) {
            log.warn("presence offline update failed for {}: {}", userId, e.getMessage());
        }
    }

    public static String key(UUID userId) {
        return "presence:online:" + userId;
    }
}
