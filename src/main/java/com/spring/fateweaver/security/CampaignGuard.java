package com.spring.fateweaver.security;

import com.spring.fateweaver.service.cache.RedisCacheService;
import com.spring.fateweaver.service.turn.CampaignSnapshot;
import com.spring.fateweaver.service.turn.CampaignStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 캠페인 소유권 검증 가드
 *
 * - Redis 에 campaignId → userId 매핑을 캐싱 (소유자는 바뀌지 않으므로 TTL 없음)
 * - Cache Miss 시에만 저장소를 조회한다 (Cache-Aside)
 * - 아직 저장되지 않은 캠페인은 첫 턴에서 요청자 소유로 생성되므로 통과
 */
@Component("campaignGuard")
@Slf4j
@RequiredArgsConstructor
public class CampaignGuard {

    private final CampaignStore campaignStore;
    private final RedisCacheService cacheService;

    /**
     * @param subject JWT subject (사용자 id 문자열)
     */
    public boolean isOwner(String campaignId, String subject) {
        Long userId = parseUserId(subject);
        if (userId == null) {
            return false;
        }

        Optional<Long> cachedOwner = cacheService.getCampaignOwner(campaignId);
        if (cachedOwner.isPresent()) {
            return cachedOwner.get().equals(userId);
        }

        Optional<CampaignSnapshot> campaign = campaignStore.load(campaignId);
        if (campaign.isEmpty()) {
            return true;
        }

        Long owner = campaign.get().userId();
        cacheService.cacheCampaignOwner(campaignId, owner);
        log.debug("🔑 [CACHE] Campaign ownership cached: campaignId={} → owner={}", campaignId, owner);
        return owner.equals(userId);
    }

    public static Long parseUserId(String subject) {
        if (subject == null) return null;
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            log.warn("🔑 [AUTH] Non-numeric JWT subject rejected: {}", subject);
            return null;
        }
    }
}
