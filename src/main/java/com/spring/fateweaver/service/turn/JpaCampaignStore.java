package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.domain.campaign.Campaign;
import com.spring.fateweaver.domain.campaign.CampaignRepository;
import com.spring.fateweaver.domain.campaign.PendingCharge;
import com.spring.fateweaver.domain.campaign.PendingChargeRepository;
import com.spring.fateweaver.domain.campaign.TranscriptEntry;
import com.spring.fateweaver.domain.campaign.TranscriptEntryRepository;
import com.spring.fateweaver.domain.user.User;
import com.spring.fateweaver.domain.user.UserRepository;
import com.spring.fateweaver.exception.NotFoundException;
import com.spring.fateweaver.exception.PersistenceFailureException;
import com.spring.fateweaver.exception.StaleCampaignException;
import com.spring.fateweaver.service.economy.ChargeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.Optional;

/**
 * JPA 캠페인 저장소
 *
 * [저장 트랜잭션]
 * 캠페인 upsert → 플레이어/나레이터 기록 → PendingCharge(PENDING)
 * 하나라도 실패하면 전체 롤백되고 PersistenceFailureException 으로 변환된다.
 * 읽은 뒤 다른 턴이 먼저 저장했으면 StaleCampaignException (과금 전)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaCampaignStore implements CampaignStore {

    private final CampaignRepository campaignRepository;
    private final TranscriptEntryRepository transcriptRepository;
    private final PendingChargeRepository pendingChargeRepository;
    private final UserRepository userRepository;
    private final TransactionTemplate txTemplate;

    @Override
    public Optional<CampaignSnapshot> load(String campaignId) {
        return txTemplate.execute(status -> campaignRepository.findWithUserById(campaignId)
            .map(c -> new CampaignSnapshot(c.getId(), c.getUser().getId(), c.getWorldId(), c.getState(), c.getVersion())));
    }

    @Override
    public SavedTurn saveTurn(TurnRecord record) {
        long start = System.currentTimeMillis();
        try {
            SavedTurn saved = txTemplate.execute(status -> {
                Campaign campaign = campaignRepository.findById(record.campaignId())
                    .map(existing -> requireVersion(existing, record))
                    .orElseGet(() -> campaignRepository.save(Campaign.start(
                        record.campaignId(), findUser(record.userId()), record.worldId(), Map.of())));

                campaign.applyTurn(record.state());
                transcriptRepository.save(TranscriptEntry.user(campaign, record.userInput()));
                transcriptRepository.save(TranscriptEntry.narrator(
                    campaign, record.narrative(), record.voiceModelId(), record.cost()));

                PendingCharge charge = pendingChargeRepository.save(PendingCharge.of(
                    record.campaignId(), record.userId(), record.cost(),
                    ChargeRequest.usageDocument(record.usage())));

                // flush 실패(버전 충돌 등)도 이 블록 안에서 드러나도록
                campaignRepository.flush();
                return new SavedTurn(charge.getId());
            });
            log.info("💾 [PERSIST] campaign={} saved, pendingCharge={} ({}ms)",
                record.campaignId(), saved.pendingChargeId(), System.currentTimeMillis() - start);
            return saved;
        } catch (StaleCampaignException e) {
            log.warn("💾 [PERSIST] Stale turn rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("💾 [PERSIST] Failed to save campaign={}: {}", record.campaignId(), e.getMessage(), e);
            throw new PersistenceFailureException(e);
        }
    }

    @Override
    public void saveState(String campaignId, Map<String, Object> state) {
        txTemplate.executeWithoutResult(status -> {
            Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new NotFoundException("Campaign not found: " + campaignId));
            campaign.replaceState(state);
        });
    }

    /**
     * 턴 시작 시 읽은 버전과 다르면 그 사이 다른 턴이 저장한 것이다 (잠금 TTL 만료 등).
     * 덮어쓰지 않고 거절한다. 읽을 때 없던 캠페인이 그 사이 생긴 경우도 마찬가지
     */
    private Campaign requireVersion(Campaign campaign, TurnRecord record) {
        if (record.expectedVersion() == null || record.expectedVersion() != campaign.getVersion()) {
            throw new StaleCampaignException(record.campaignId(), record.expectedVersion(), campaign.getVersion());
        }
        return campaign;
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }
}
