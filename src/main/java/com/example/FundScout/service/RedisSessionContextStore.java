package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.SessionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Keeps one {@link SessionContext} per conversation in Redis as JSON.
 * The TTL is refreshed on every save (rolling); temporary sessions expire sooner.
 */
@Service
@RequiredArgsConstructor
public class RedisSessionContextStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionContextStore.class);

    static final String KEY_PREFIX = "funding:session:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FundingProperties properties;

    /** Stored context, or {@link SessionContext#empty()} when absent or unreadable. */
    public SessionContext load(String sessionId) {
        String raw = redisTemplate.opsForValue().get(buildKey(sessionId));
        if (raw == null || raw.isBlank()) {
            return SessionContext.empty();
        }
        try {
            return objectMapper.readValue(raw, SessionContext.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable session context for {}: {}", sessionId, e.getMessage());
            return SessionContext.empty();
        }
    }

    public void save(String sessionId, SessionContext context, boolean temporary) {
        Duration ttl = temporary ? properties.getSession().getTemporaryTtl() : properties.getSession().getTtl();
        try {
            redisTemplate.opsForValue().set(buildKey(sessionId), objectMapper.writeValueAsString(context), ttl);
        } catch (JsonProcessingException e) {
            // the turn already has its answer; the next one simply starts fresh
            log.warn("Failed to serialize session context for {}", sessionId, e);
        }
    }

    public boolean clear(String sessionId) {
        return Boolean.TRUE.equals(redisTemplate.delete(buildKey(sessionId)));
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
