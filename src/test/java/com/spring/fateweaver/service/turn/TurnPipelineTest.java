package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.dto.brain.BrainResult;
import com.spring.fateweaver.dto.brain.NarrativeCue;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.dto.turn.TurnRequest;
import com.spring.fateweaver.dto.turn.TurnResponse;
import com.spring.fateweaver.engine.fate.DirectorMode;
import com.spring.fateweaver.engine.fate.FateEngineState;
import com.spring.fateweaver.engine.fate.FateResolver;
import com.spring.fateweaver.engine.fate.SequenceDiceRoller;
import com.spring.fateweaver.engine.state.StateMerger;
import com.spring.fateweaver.exception.ErrorCode;
import com.spring.fateweaver.exception.PersistenceFailureException;
import com.spring.fateweaver.exception.ProviderFailureException;
import com.spring.fateweaver.external.llm.ModelRouter;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.external.llm.TokenUsage;
import com.spring.fateweaver.service.brain.BrainTurn;
import com.spring.fateweaver.service.brain.RulesInterpreter;
import com.spring.fateweaver.service.economy.TurnCostResolver;
import com.spring.fateweaver.service.prompt.WorldProfile;
import com.spring.fateweaver.service.prompt.WorldRulesCatalog;
import com.spring.fateweaver.service.review.ConsistencyReviewer;
import com.spring.fateweaver.service.review.ReviewOutcome;
import com.spring.fateweaver.service.voice.Narration;
import com.spring.fateweaver.service.voice.NarratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnPipelineTest {

    private static final Long USER_ID = 7L;
    private static final String CAMPAIGN = "campaign-1";
    private static final String WORLD = "classic-fantasy";

    private InMemoryCampaignStore store;
    private InMemoryEconomyLedger ledger;
    private InMemoryTurnLock lock;
    private RulesInterpreter rulesInterpreter;
    private NarratorService narratorService;
    private ConsistencyReviewer reviewer;
    private TurnPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryCampaignStore();
        ledger = new InMemoryEconomyLedger(100);
        lock = new InMemoryTurnLock();
        rulesInterpreter = mock(RulesInterpreter.class);
        narratorService = mock(NarratorService.class);
        reviewer = mock(ConsistencyReviewer.class);

        WorldRulesCatalog catalog = mock(WorldRulesCatalog.class);
        when(catalog.resolve(anyString()))
            .thenReturn(new WorldProfile(WORLD, "Classic Fantasy", WorldEngine.CLASSIC, "rules", "style"));

        GameProperties game = new GameProperties(
            new GameProperties.Economy(10, Map.of(), List.of("legendary")),
            new GameProperties.Narrator(150, 250, true, 4096, false),
            new GameProperties.Reviewer(true, 1),
            new GameProperties.History(10, 6),
            new GameProperties.Knowledge(2, 3, 300),
            new GameProperties.TurnLock(120),
            new GameProperties.ChargeRecovery(60000, 300)
        );
        LlmProperties llm = new LlmProperties(
            new LlmProperties.ProviderSettings("server-openai-key", "http://localhost/v1", null),
            null, null,
            "gpt-4o-mini", "gpt-4o-mini", "gpt-4o-mini", "gpt-4o-mini", Map.of()
        );

        FateResolver fateResolver = new FateResolver(new SequenceDiceRoller(15));
        KnowledgeFetcher knowledgeFetcher = new KnowledgeFetcher(
            (worldId, role, limit) -> List.of("### Goblins\nGoblins are cowardly."), game, Runnable::run);

        pipeline = new TurnPipeline(
            store, ledger, lock, knowledgeFetcher, catalog, new ModelRouter(llm), new TurnCostResolver(game),
            rulesInterpreter, new PendingRollResolver(fateResolver, new SequenceDiceRoller(4)),
            new StateMerger(), new DirectorMode(), narratorService, reviewer, llm
        );

        when(narratorService.narrate(any()))
            .thenReturn(new Narration("Steel flashes in the torchlight.", new TokenUsage(80, 120), "gpt-4o-mini", false));
    }

    @Test
    void attack_with_server_dice_records_a_d20_roll_whose_total_is_result_plus_modifier() {
        brainReturns(brain(Map.of("gold", 12), goblinAttackRoll()));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", false, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.diceRolls()).hasSize(1);
        DiceRoll roll = response.diceRolls().get(0);
        assertThat(roll.type()).isEqualTo("d20");
        assertThat(roll.result()).isEqualTo(15);
        assertThat(roll.modifier()).isEqualTo(3);
        assertThat(roll.total()).isEqualTo(roll.result() + roll.modifier());
        assertThat(roll.success()).isTrue();

        assertThat(response.turnCost()).isEqualTo(10);
        assertThat(response.remainingBalance()).isEqualTo(90);
        assertThat(response.stateDelta()).containsEntry("gold", 12);
        assertThat(response.requiresUserInput()).isFalse();
        assertThat(store.savedTurns).hasSize(1);
        assertThat(ledger.charges).hasSize(1);
        assertThat(lock.held).isEmpty();
    }

    @Test
    void balance_below_cost_is_rejected_before_any_model_call() {
        ledger.balance = 5;
        store.put(CAMPAIGN, USER_ID, WORLD, Map.of("gold", 3));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", false, null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.errorCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(ledger.balance).isEqualTo(5);
        assertThat(store.stateOf(CAMPAIGN)).isEqualTo(Map.of("gold", 3));
        assertThat(store.savedTurns).isEmpty();
        verify(rulesInterpreter, never()).interpret(any(), any(), any());
    }

    @Test
    void failed_save_never_charges() {
        brainReturns(brain(Map.of("gold", 12), null));
        store.failOnSave = true;

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I search the chest", false, null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.errorCode()).isEqualTo(ErrorCode.PERSISTENCE_FAILURE);
        assertThat(response.errorMessage()).isEqualTo(PersistenceFailureException.NOT_CHARGED_MESSAGE);
        assertThat(ledger.charges).isEmpty();
        assertThat(ledger.balance).isEqualTo(100);
    }

    @Test
    void interactive_roll_request_returns_pending_roll_without_cost_or_save() {
        brainReturns(new BrainResult(Map.of("gold", 99), List.of(NarrativeCue.description("The goblin snarls.")),
            List.of(), List.of(), "The goblin snarls.", true, null, goblinAttackRoll()));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", true, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.requiresUserInput()).isTrue();
        assertThat(response.pendingRoll()).isNotNull();
        assertThat(response.pendingRoll().type()).isEqualTo("d20");
        assertThat(response.turnCost()).isZero();
        assertThat(response.diceRolls()).isEmpty();
        assertThat(store.savedTurns).isEmpty();
        assertThat(ledger.charges).isEmpty();
        verify(narratorService, never()).narrate(any());
    }

    @Test
    void supplied_natural_twenty_is_a_critical_and_resets_the_crit_counter() {
        store.put(CAMPAIGN, USER_ID, WORLD,
            Map.of("fateEngine", new FateEngineState(2, 17, false).toDocument()));
        brainReturns(brain(Map.of(), null));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", true, goblinAttackRoll(), 20));

        assertThat(response.success()).isTrue();
        DiceRoll roll = response.diceRolls().get(0);
        assertThat(roll.rawRolls()).containsExactly(20);
        assertThat(roll.flags().critical()).isTrue();
        assertThat(response.turnCost()).isEqualTo(10);

        FateEngineState saved = FateEngineState.fromDocument(store.stateOf(CAMPAIGN).get("fateEngine"));
        assertThat(saved.turnsSinceCrit()).isZero();
        assertThat(saved.momentum()).isZero();
    }

    @Test
    void second_submission_for_a_busy_campaign_is_rejected() {
        lock.held.add(CAMPAIGN);

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", false, null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.errorCode()).isEqualTo(ErrorCode.TURN_IN_PROGRESS);
        assertThat(lock.releases).isZero();
        verify(rulesInterpreter, never()).interpret(any(), any(), any());
    }

    @Test
    void turn_whose_campaign_was_saved_by_another_turn_meanwhile_is_rejected_without_charge() {
        store.put(CAMPAIGN, USER_ID, WORLD, Map.of("gold", 3));
        brainReturns(brain(Map.of("gold", 12), null));
        when(narratorService.narrate(any())).thenAnswer(invocation -> {
            // 잠금 TTL 이 지난 뒤 다른 턴이 먼저 저장한 상황
            store.saveState(CAMPAIGN, Map.of("gold", 50));
            return new Narration("The goblin flees.", new TokenUsage(80, 120), "gpt-4o-mini", false);
        });

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I loot the goblin", false, null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.errorCode()).isEqualTo(ErrorCode.TURN_IN_PROGRESS);
        assertThat(store.stateOf(CAMPAIGN)).isEqualTo(Map.of("gold", 50));
        assertThat(store.savedTurns).isEmpty();
        assertThat(ledger.charges).isEmpty();
        assertThat(ledger.balance).isEqualTo(100);
        assertThat(lock.held).isEmpty();
    }

    @Test
    void essences_from_plain_array_deltas_accumulate_across_turns() {
        brainReturns(brain(Map.of("character", Map.of("essences", List.of("Fire"))), null));
        pipeline.resolveTurn(USER_ID, new TurnRequest(CAMPAIGN, "I absorb the fire essence", WORLD,
            Map.of("character", Map.of("name", "Aria")), List.of(), null, null, false, false, null, null));

        brainReturns(brain(Map.of("character", Map.of("essences", List.of("Water"))), null));
        pipeline.resolveTurn(USER_ID, request("I absorb the water essence", false, null, null));

        @SuppressWarnings("unchecked")
        Map<String, Object> character = (Map<String, Object>) store.stateOf(CAMPAIGN).get("character");
        assertThat(character).containsEntry("name", "Aria");
        assertThat(character.get("essences")).isEqualTo(List.of("Fire", "Water"));
    }

    @Test
    void model_cannot_write_engine_managed_fields() {
        brainReturns(brain(Map.of("fateEngine", Map.of("momentum_counter", 10), "gold", 5), null));

        pipeline.resolveTurn(USER_ID, request("I pray for luck", false, null, null));

        FateEngineState saved = FateEngineState.fromDocument(store.stateOf(CAMPAIGN).get("fateEngine"));
        assertThat(saved.momentum()).isZero();
        assertThat(store.stateOf(CAMPAIGN)).containsEntry("gold", 5);
    }

    @Test
    void brain_failure_aborts_without_side_effects() {
        when(rulesInterpreter.interpret(any(), any(), any()))
            .thenThrow(new ProviderFailureException("OpenAI returned an empty response"));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I attack the goblin", false, null, null));

        assertThat(response.errorCode()).isEqualTo(ErrorCode.PROVIDER_FAILURE);
        assertThat(store.savedTurns).isEmpty();
        assertThat(ledger.charges).isEmpty();
        assertThat(lock.held).isEmpty();
    }

    @Test
    void narrator_fallback_skips_review_but_still_completes_the_turn() {
        brainReturns(brain(Map.of(), null));
        when(narratorService.narrate(any()))
            .thenReturn(new Narration("The goblin flees.", TokenUsage.ZERO, "gpt-4o-mini", true));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I shout", false, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.narrativeText()).isEqualTo("The goblin flees.");
        verify(reviewer, never()).review(anyString(), any(), anyInt(), any());
    }

    @Test
    void reviewer_corrections_are_persisted() {
        brainReturns(brain(Map.of("gold", 10), null));
        when(reviewer.review(anyString(), any(), anyInt(), any())).thenReturn(Optional.of(new ReviewOutcome(
            Map.of("gold", 4), Map.of("gold", 4), List.of(), "Paid the ferryman", new TokenUsage(50, 10),
            new ResolvedModel("gpt-4.1-mini", "gpt-4.1-mini", ProviderType.OPENAI, "key", false, false))));

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I pay the ferryman", false, null, null));

        assertThat(response.reviewerApplied()).isTrue();
        assertThat(store.stateOf(CAMPAIGN)).containsEntry("gold", 4);
        assertThat(ledger.charges.get(0).usageByModel())
            .containsEntry("gpt-4_1-mini", new TokenUsage(50, 10))
            .doesNotContainKey("gpt-4.1-mini");
    }

    @Test
    void balance_spent_elsewhere_after_save_returns_narrative_without_charge() {
        brainReturns(brain(Map.of(), null));
        ledger.drainBeforeCharge = true;

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I rest", false, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.turnCost()).isZero();
        assertThat(response.systemMessages()).contains(TurnPipeline.CHARGE_REJECTED_MESSAGE);
        assertThat(store.savedTurns).hasSize(1);
    }

    @Test
    void ledger_outage_after_save_leaves_the_charge_pending() {
        brainReturns(brain(Map.of(), null));
        ledger.failOnCharge = true;

        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I rest", false, null, null));

        assertThat(response.success()).isTrue();
        assertThat(response.chargePending()).isTrue();
        assertThat(response.remainingBalance()).isNull();
        assertThat(store.savedTurns).hasSize(1);
    }

    @Test
    void roll_result_without_pending_roll_is_a_validation_error() {
        TurnResponse response = pipeline.resolveTurn(USER_ID, request("I roll", true, null, 12));

        assertThat(response.errorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  fixtures
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private void brainReturns(BrainResult result) {
        when(rulesInterpreter.interpret(any(), any(), any()))
            .thenReturn(new BrainTurn(result, new TokenUsage(100, 50), "gpt-4o-mini"));
    }

    private static BrainResult brain(Map<String, Object> stateUpdates, PendingRoll pendingRoll) {
        return new BrainResult(stateUpdates, List.of(NarrativeCue.description("Something happens.")),
            List.of(), List.of(), "Something happens.", false, null, pendingRoll);
    }

    private static PendingRoll goblinAttackRoll() {
        return new PendingRoll(null, "Attack Roll vs Goblin", 3, null, 12, null, null, null, null);
    }

    private static TurnRequest request(String input, boolean interactive, PendingRoll pendingRoll, Integer rollResult) {
        return new TurnRequest(CAMPAIGN, input, WORLD, null, List.of(), null, null,
            interactive, false, pendingRoll, rollResult);
    }
}
