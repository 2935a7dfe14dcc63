package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.service.cache.RedisCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis SET NX 기반 턴 잠금
 * - TTL 로 비정상 종료된 턴의 잠금도 결국 풀린다.
 * - 해제는 토큰이 일치할 때만 (TTL 만료 후 다른 턴이 잡은 잠금을 지우지 않도록)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RedisTurnLock implements TurnLock {

    private final RedisCacheService cacheService;
    private final GameProperties gameProperties;

    @Override
    public Optional<TurnLockHandle> tryAcquire(String campaignId) {
        String token = UUID.randomUUID().toString();
        Duration ttl = Duration.ofSeconds(gameProperties.turnLock().ttlSeconds());
        if (cacheService.setIfAbsent(RedisCacheService.TURN_LOCK_PREFIX + campaignId, token, ttl)) {
            log.debug("🔒 [LOCK] Acquired campaign={}", campaignId);
            return Optional.of(new TurnLockHandle(campaignId, token));
        }
        log.warn("🔒 [LOCK] Busy campaign={}", campaignId);
        return Optional.empty();
    }

    @Override
    public void release(TurnLockHandle handle) {
        boolean released = cacheService.deleteIfEquals(
            RedisCacheService.TURN_LOCK_PREFIX + handle.campaignId(), handle.token());
        if (!released) {
            log.warn("🔒 [LOCK] Lock for campaign={} expired before release", handle.campaignId());
        }
    }
}
