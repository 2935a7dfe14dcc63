package com.spring.fateweaver.service.scheduler;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.campaign.PendingCharge;
import com.spring.fateweaver.domain.campaign.PendingChargeRepository;
import com.spring.fateweaver.domain.enums.ChargeStatus;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import com.spring.fateweaver.service.economy.ChargeRequest;
import com.spring.fateweaver.service.economy.EconomyLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 저장됐지만 과금되지 않은 턴(PendingCharge=PENDING) 재과금 스케줄러
 * - 진행 중인 턴과 겹치지 않도록 min-age 보다 오래된 건만 처리
 * - 과금은 PendingCharge 잠금 + 상태 확인으로 멱등
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChargeRecoveryScheduler {

    private final PendingChargeRepository pendingChargeRepository;
    private final EconomyLedger economyLedger;
    private final GameProperties gameProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${game.charge-recovery.interval-ms:60000}")
    public void recover() {
        LocalDateTime before = LocalDateTime.now(clock).minusSeconds(gameProperties.chargeRecovery().minAgeSeconds());
        List<PendingCharge> pending = pendingChargeRepository
            .findTop50ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ChargeStatus.PENDING, before);
        if (pending.isEmpty()) {
            return;
        }

        log.info("💰 [RECOVERY] Retrying {} pending charge(s)", pending.size());
        for (PendingCharge charge : pending) {
            try {
                economyLedger.charge(new ChargeRequest(charge.getUserId(), charge.getId(), charge.getCost(),
                    ChargeRequest.usageFromDocument(charge.getUsage())));
            } catch (InsufficientBalanceException e) {
                log.warn("💰 [RECOVERY] Charge {} rejected: balance {} < cost {}",
                    charge.getId(), e.getAvailable(), e.getRequired());
            } catch (RuntimeException e) {
                log.error("💰 [RECOVERY] Charge {} still failing: {}", charge.getId(), e.getMessage());
            }
        }
    }
}
