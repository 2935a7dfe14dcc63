package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.domain.campaign.PendingCharge;
import com.spring.fateweaver.domain.campaign.PendingChargeRepository;
import com.spring.fateweaver.domain.usage.ModelUsage;
import com.spring.fateweaver.domain.usage.ModelUsageRepository;
import com.spring.fateweaver.domain.user.User;
import com.spring.fateweaver.domain.user.UserRepository;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import com.spring.fateweaver.exception.NotFoundException;
import com.spring.fateweaver.external.llm.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JPA 턴 원장
 *
 * [과금 트랜잭션]
 * 1. 사용자 행 PESSIMISTIC_WRITE 잠금
 * 2. PendingCharge 잠금 (이미 정산/거절된 건이면 아무것도 하지 않음 → 재시도 멱등)
 * 3. 잔액 ≥ 비용 확인 후 차감, 턴/토큰 누계 증가
 * 4. PendingCharge SETTLED
 *
 * 잔액 부족은 REJECTED 를 커밋한 뒤 예외를 던진다 (noRollbackFor).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaEconomyLedger implements EconomyLedger {

    private final UserRepository userRepository;
    private final PendingChargeRepository pendingChargeRepository;
    private final ModelUsageRepository modelUsageRepository;

    @Override
    @Transactional(readOnly = true)
    public AccountView account(Long userId) {
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        return new AccountView(user.getId(), user.getTier(), user.getTurnBalance(),
            user.getBrainModel(), user.getVoiceModel());
    }

    @Override
    @Transactional(noRollbackFor = InsufficientBalanceException.class)
    public ChargeReceipt charge(ChargeRequest request) {
        User user = userRepository.findByIdForUpdate(request.userId())
            .orElseThrow(() -> new NotFoundException("User not found: " + request.userId()));

        PendingCharge pending = null;
        if (request.pendingChargeId() != null) {
            pending = pendingChargeRepository.findByIdForUpdate(request.pendingChargeId())
                .orElseThrow(() -> new NotFoundException("Pending charge not found: " + request.pendingChargeId()));
            if (!pending.isPending()) {
                log.info("💰 [LEDGER] Charge {} already {}, skipping", pending.getId(), pending.getStatus());
                return new ChargeReceipt(0, user.getTurnBalance());
            }
        }

        try {
            user.debitTurns(request.cost());
        } catch (InsufficientBalanceException e) {
            if (pending != null) pending.reject();
            log.warn("💰 [LEDGER] Charge rejected: userId={} cost={} balance={}",
                user.getId(), request.cost(), user.getTurnBalance());
            throw e;
        }

        TokenUsage total = request.totalUsage();
        user.addTokenUsage(total.promptTokens(), total.completionTokens());
        request.usageByModel().forEach((modelKey, usage) -> {
            ModelUsage row = modelUsageRepository.findByUserIdAndModelKey(user.getId(), modelKey)
                .orElseGet(() -> modelUsageRepository.save(ModelUsage.start(user.getId(), modelKey)));
            row.add(usage.promptTokens(), usage.completionTokens());
        });

        Optional.ofNullable(pending).ifPresent(PendingCharge::settle);

        log.info("💰 [LEDGER] Charged userId={} cost={} remaining={} tokens={}",
            user.getId(), request.cost(), user.getTurnBalance(), total.totalTokens());
        return new ChargeReceipt(request.cost(), user.getTurnBalance());
    }
}
