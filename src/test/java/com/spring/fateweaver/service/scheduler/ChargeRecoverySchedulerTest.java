package com.spring.fateweaver.service.scheduler;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.campaign.PendingCharge;
import com.spring.fateweaver.domain.campaign.PendingChargeRepository;
import com.spring.fateweaver.domain.enums.ChargeStatus;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import com.spring.fateweaver.service.economy.ChargeReceipt;
import com.spring.fateweaver.service.economy.ChargeRequest;
import com.spring.fateweaver.service.economy.EconomyLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChargeRecoverySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private PendingChargeRepository repository;
    private EconomyLedger ledger;
    private ChargeRecoveryScheduler scheduler;

    @BeforeEach
    void setUp() {
        repository = mock(PendingChargeRepository.class);
        ledger = mock(EconomyLedger.class);
        GameProperties game = new GameProperties(
            new GameProperties.Economy(10, Map.of(), List.of()),
            new GameProperties.Narrator(150, 250, true, 4096, false),
            new GameProperties.Reviewer(true, 1),
            new GameProperties.History(10, 6),
            new GameProperties.Knowledge(2, 3, 300),
            new GameProperties.TurnLock(300),
            new GameProperties.ChargeRecovery(60000, 300)
        );
        scheduler = new ChargeRecoveryScheduler(repository, ledger, game, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void only_charges_older_than_the_minimum_age_are_fetched() {
        when(repository.findTop50ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(any(), any())).thenReturn(List.of());

        scheduler.recover();

        verify(repository).findTop50ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            ChargeStatus.PENDING, LocalDateTime.of(2026, 3, 1, 11, 55, 0));
        verify(ledger, never()).charge(any());
    }

    @Test
    void one_rejected_charge_does_not_stop_the_rest() {
        PendingCharge poor = PendingCharge.of("c1", 7L, 10,
            Map.of("gpt-4o-mini", Map.of("prompt", 100, "completion", 50)));
        PendingCharge rich = PendingCharge.of("c2", 8L, 10, Map.of());
        when(repository.findTop50ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(eq(ChargeStatus.PENDING), any()))
            .thenReturn(List.of(poor, rich));
        when(ledger.charge(any()))
            .thenThrow(new InsufficientBalanceException(10, 3))
            .thenReturn(new ChargeReceipt(10, 90));

        scheduler.recover();

        ArgumentCaptor<ChargeRequest> captor = ArgumentCaptor.forClass(ChargeRequest.class);
        verify(ledger, times(2)).charge(captor.capture());
        assertThat(captor.getAllValues()).extracting(ChargeRequest::userId).containsExactly(7L, 8L);
        assertThat(captor.getAllValues().get(0).totalUsage().promptTokens()).isEqualTo(100);
    }
}
