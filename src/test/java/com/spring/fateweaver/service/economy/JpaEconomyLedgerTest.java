package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.domain.campaign.PendingCharge;
import com.spring.fateweaver.domain.campaign.PendingChargeRepository;
import com.spring.fateweaver.domain.enums.ChargeStatus;
import com.spring.fateweaver.domain.enums.UserTier;
import com.spring.fateweaver.domain.usage.ModelUsage;
import com.spring.fateweaver.domain.usage.ModelUsageRepository;
import com.spring.fateweaver.domain.user.User;
import com.spring.fateweaver.domain.user.UserRepository;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import com.spring.fateweaver.external.llm.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaEconomyLedger.class)
class JpaEconomyLedgerTest {

    private static final Map<String, TokenUsage> USAGE = Map.of(
        "gpt-4o-mini", new TokenUsage(1200, 300),
        "claude-3-5-sonnet-20241022", new TokenUsage(900, 450));

    @Autowired
    private JpaEconomyLedger ledger;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private PendingChargeRepository pendingChargeRepository;
    @Autowired
    private ModelUsageRepository modelUsageRepository;

    private User user;

    @BeforeEach
    void setUp() {
        user = userRepository.save(User.of("aria", UserTier.HERO, 25));
    }

    private PendingCharge pending(int cost) {
        return pendingChargeRepository.save(
            PendingCharge.of("campaign-1", user.getId(), cost, ChargeRequest.usageDocument(USAGE)));
    }

    @Test
    void charge_debits_balance_and_records_usage_per_model() {
        PendingCharge row = pending(10);

        ChargeReceipt receipt = ledger.charge(new ChargeRequest(user.getId(), row.getId(), 10, USAGE));

        assertThat(receipt.charged()).isEqualTo(10);
        assertThat(receipt.remainingBalance()).isEqualTo(15);

        User reloaded = userRepository.findById(user.getId()).orElseThrow();
        assertThat(reloaded.getTurnsUsed()).isEqualTo(1);
        assertThat(reloaded.getTotalTokens()).isEqualTo(2850);
        assertThat(modelUsageRepository.findAllByUserId(user.getId()))
            .extracting(ModelUsage::getModelKey)
            .containsExactlyInAnyOrder("gpt-4o-mini", "claude-3-5-sonnet-20241022");
        assertThat(pendingChargeRepository.findById(row.getId()).orElseThrow().getStatus())
            .isEqualTo(ChargeStatus.SETTLED);
    }

    @Test
    void settled_charge_is_not_applied_twice() {
        PendingCharge row = pending(10);
        ChargeRequest request = new ChargeRequest(user.getId(), row.getId(), 10, USAGE);

        ledger.charge(request);
        ChargeReceipt retry = ledger.charge(request);

        assertThat(retry.charged()).isZero();
        assertThat(retry.remainingBalance()).isEqualTo(15);
        assertThat(userRepository.findById(user.getId()).orElseThrow().getTurnsUsed()).isEqualTo(1);
    }

    @Test
    void insufficient_balance_rejects_the_row_and_keeps_the_balance() {
        PendingCharge row = pending(40);

        assertThatThrownBy(() -> ledger.charge(new ChargeRequest(user.getId(), row.getId(), 40, USAGE)))
            .isInstanceOf(InsufficientBalanceException.class);

        assertThat(userRepository.findById(user.getId()).orElseThrow().getTurnBalance()).isEqualTo(25);
        assertThat(pendingChargeRepository.findById(row.getId()).orElseThrow().getStatus())
            .isEqualTo(ChargeStatus.REJECTED);
        assertThat(modelUsageRepository.findAllByUserId(user.getId())).isEmpty();
    }

    @Test
    void account_view_exposes_tier_and_balance() {
        AccountView account = ledger.account(user.getId());

        assertThat(account.tier()).isEqualTo(UserTier.HERO);
        assertThat(account.balance()).isEqualTo(25);
    }
}
