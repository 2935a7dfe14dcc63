package com.spring.fateweaver.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis 캐시 유틸리티 서비스
 *
 * [설계 원칙]
 * - StringRedisTemplate 기반 + ObjectMapper JSON 직렬화
 * - 키 네이밍: {domain}:{identifier} (예: campaign_owner:abc, knowledge:outworlder:BRAIN)
 * - 캐시 실패는 로그만 남기고 원본 조회로 진행 (Cache-Aside)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedisCacheService {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  키 프리픽스 상수
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /** CampaignGuard 소유권: campaign_owner:{campaignId} → userId */
    public static final String CAMPAIGN_OWNER_PREFIX = "campaign_owner:";

    /** 참고 자료 스니펫: knowledge:{worldId}:{target} → String[] JSON */
    public static final String KNOWLEDGE_PREFIX = "knowledge:";

    /** 턴 잠금: turn_lock:{campaignId} → 토큰 */
    public static final String TURN_LOCK_PREFIX = "turn_lock:";

    /** 값이 일치할 때만 삭제 (잠금 해제) */
    private static final DefaultRedisScript<Long> DELETE_IF_EQUALS = new DefaultRedisScript<>(
        "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
        Long.class
    );

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  공통 캐시 연산
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    public <T> void put(String key, T value, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, json, ttl);
        } catch (JsonProcessingException e) {
            log.warn("Redis cache put failed (serialization): key={}", key, e);
        }
    }

    /**
     * @return 캐시 미스 또는 역직렬화 실패 시 Optional.empty()
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) return Optional.empty();
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            log.warn("Redis cache get failed: key={}", key, e);
            return Optional.empty();
        }
    }

    public void putString(String key, String value) {
        redisTemplate.opsForValue().set(key, value);
    }

    public Optional<String> getString(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    public void evict(String key) {
        redisTemplate.delete(key);
    }

    /**
     * SET NX + TTL
     * @return true 면 새로 기록됨
     */
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    /**
     * 현재 값이 expected 일 때만 삭제 (Lua, 원자적)
     */
    public boolean deleteIfEquals(String key, String expected) {
        Long deleted = redisTemplate.execute(DELETE_IF_EQUALS, List.of(key), expected);
        return deleted != null && deleted > 0;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  도메인별 편의 메서드
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    // ── CampaignGuard: 캠페인 소유자 (영구) ──

    public void cacheCampaignOwner(String campaignId, Long userId) {
        putString(CAMPAIGN_OWNER_PREFIX + campaignId, String.valueOf(userId));
    }

    public Optional<Long> getCampaignOwner(String campaignId) {
        return getString(CAMPAIGN_OWNER_PREFIX + campaignId).map(Long::valueOf);
    }

    // ── Knowledge ──

    public void cacheKnowledge(String worldId, String target, List<String> snippets, Duration ttl) {
        put(KNOWLEDGE_PREFIX + worldId + ":" + target, snippets.toArray(String[]::new), ttl);
    }

    public Optional<List<String>> getKnowledge(String worldId, String target) {
        return get(KNOWLEDGE_PREFIX + worldId + ":" + target, String[].class).map(List::of);
    }

    public void evictKnowledge(String worldId, String target) {
        evict(KNOWLEDGE_PREFIX + worldId + ":" + target);
    }
}
