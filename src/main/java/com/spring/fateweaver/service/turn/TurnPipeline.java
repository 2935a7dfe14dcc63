package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.config.LlmProperties;
import com.spring.fateweaver.dto.brain.BrainResult;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.dto.turn.TurnRequest;
import com.spring.fateweaver.dto.turn.TurnResponse;
import com.spring.fateweaver.engine.fate.DirectorMode;
import com.spring.fateweaver.engine.fate.FateEngineState;
import com.spring.fateweaver.engine.state.DeltaSource;
import com.spring.fateweaver.engine.state.MergeResult;
import com.spring.fateweaver.engine.state.StateDocuments;
import com.spring.fateweaver.engine.state.StateMerger;
import com.spring.fateweaver.exception.BusinessException;
import com.spring.fateweaver.exception.ErrorCode;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import com.spring.fateweaver.exception.NotFoundException;
import com.spring.fateweaver.exception.TurnInProgressException;
import com.spring.fateweaver.exception.ValidationException;
import com.spring.fateweaver.external.llm.ModelRouter;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.external.llm.TokenUsage;
import com.spring.fateweaver.service.brain.BrainTurn;
import com.spring.fateweaver.service.brain.RulesInterpreter;
import com.spring.fateweaver.service.economy.AccountView;
import com.spring.fateweaver.service.economy.ChargeReceipt;
import com.spring.fateweaver.service.economy.ChargeRequest;
import com.spring.fateweaver.service.economy.EconomyLedger;
import com.spring.fateweaver.service.economy.TurnCostResolver;
import com.spring.fateweaver.service.prompt.BrainPromptContext;
import com.spring.fateweaver.service.prompt.WorldProfile;
import com.spring.fateweaver.service.prompt.WorldRulesCatalog;
import com.spring.fateweaver.service.review.ConsistencyReviewer;
import com.spring.fateweaver.service.review.ReviewOutcome;
import com.spring.fateweaver.service.voice.Narration;
import com.spring.fateweaver.service.voice.NarrationRequest;
import com.spring.fateweaver.service.voice.NarratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.spring.fateweaver.engine.state.StateDocuments.asMap;
import static com.spring.fateweaver.engine.state.StateDocuments.deepCopy;

/**
 * 턴 파이프라인
 *
 * VALIDATING → RESOLVING(월드/모델/비용/참고자료) → INTERPRETING(Brain)
 *   → [인터랙티브 굴림 요청이면 AWAITING_ROLL 로 종료, 과금 없음]
 *   → ROLLING(Fate) → MERGING → NARRATING(Voice) → REVIEWING → PERSISTING → CHARGING → DONE
 *
 * [원칙]
 * 1. PERSISTING 이전의 실패는 상태/잔액에 아무 영향이 없다.
 * 2. 과금은 저장이 성공한 뒤에만. 저장 트랜잭션이 PendingCharge 를 남기므로
 *    과금 단계가 인프라 오류로 실패해도 "저장됨, 미과금" 상태가 복구 가능하게 남는다.
 * 3. 같은 캠페인의 턴은 동시에 하나만 (TurnLock)
 * 4. LLM 호출은 트랜잭션 밖에서만 일어난다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TurnPipeline {

    static final String AUTO_ROLL_FAILED_MESSAGE = "The dice slipped from the table. The action resolves without a roll.";
    static final String CHARGE_REJECTED_MESSAGE =
        "Your progress was saved, but this turn could not be charged because your turn balance ran out.";

    private final CampaignStore campaignStore;
    private final EconomyLedger economyLedger;
    private final TurnLock turnLock;
    private final KnowledgeFetcher knowledgeFetcher;
    private final WorldRulesCatalog worldRulesCatalog;
    private final ModelRouter modelRouter;
    private final TurnCostResolver costResolver;
    private final RulesInterpreter rulesInterpreter;
    private final PendingRollResolver rollResolver;
    private final StateMerger stateMerger;
    private final DirectorMode directorMode;
    private final NarratorService narratorService;
    private final ConsistencyReviewer consistencyReviewer;
    private final LlmProperties llmProperties;

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  단계 간 데이터 전달용 내부 DTO
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private record Resolved(
        Map<String, Object> state,
        String worldId,
        WorldProfile world,
        AccountView account,
        ResolvedModel brainModel,
        ResolvedModel voiceModel,
        int cost,
        KnowledgeBundle knowledge,
        Long loadedVersion
    ) {}

    /** 단계 추적 + 모델별 토큰 사용량 누계 */
    private static final class TurnTrace {
        private final String campaignId;
        private final Map<String, TokenUsage> usage = new LinkedHashMap<>();
        private TurnStage stage = TurnStage.VALIDATING;
        private long stageStart = System.currentTimeMillis();

        private TurnTrace(String campaignId) {
            this.campaignId = campaignId;
        }

        void enter(TurnStage next) {
            log.debug("⏱️ [PERF] campaign={} {} done: {}ms", campaignId, stage, System.currentTimeMillis() - stageStart);
            stage = next;
            stageStart = System.currentTimeMillis();
        }

        void record(String modelKey, TokenUsage tokens) {
            if (tokens == null || tokens.totalTokens() == 0) return;
            usage.merge(modelKey, tokens, TokenUsage::plus);
        }
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  턴 해석
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 플레이어 행동 한 번을 처리한다. 실패는 예외 대신 success=false 응답으로 돌려준다.
     *
     * @param userId 인증된 사용자 (JWT subject)
     */
    public TurnResponse resolveTurn(Long userId, TurnRequest request) {
        long totalStart = System.currentTimeMillis();
        TurnTrace trace = new TurnTrace(request == null ? null : request.campaignId());
        TurnLockHandle lock = null;

        try {
            validate(userId, request);
            log.info("⏱️ [PERF] ====== resolveTurn START ====== campaign={} user={}", request.campaignId(), userId);

            lock = turnLock.tryAcquire(request.campaignId())
                .orElseThrow(() -> new TurnInProgressException(request.campaignId()));

            TurnResponse response = runTurn(userId, request, trace);
            trace.enter(TurnStage.DONE);
            log.info("⏱️ [PERF] ====== resolveTurn DONE: {}ms ====== cost={} awaitingInput={}",
                System.currentTimeMillis() - totalStart, response.turnCost(), response.requiresUserInput());
            return response;

        } catch (BusinessException e) {
            log.warn("❌ [TURN] Failed at {}: {} - {}", trace.stage, e.getErrorCode(), e.getMessage());
            return TurnResponse.failure(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ [TURN] Unexpected failure at {}: {}", trace.stage, e.getMessage(), e);
            return TurnResponse.failure(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred while resolving the turn.");
        } finally {
            if (lock != null) {
                turnLock.release(lock);
            }
        }
    }

    private TurnResponse runTurn(Long userId, TurnRequest request, TurnTrace trace) {
        // ━━ RESOLVING ━━
        trace.enter(TurnStage.RESOLVING);
        Resolved ctx = resolve(userId, request);

        // ━━ INTERPRETING ━━
        trace.enter(TurnStage.INTERPRETING);
        BrainTurn brain = rulesInterpreter.interpret(new BrainPromptContext(
            ctx.world(),
            ctx.state(),
            ctx.knowledge().brain(),
            request.history().size(),
            request.interactiveDice(),
            request.showSuggestedChoices(),
            request.pendingRoll(),
            request.resolvesPendingRoll() ? request.rollResult() : null,
            request.userInput()
        ), request.history(), ctx.brainModel());
        BrainResult result = brain.result();

        // ━━ AWAITING_ROLL: 플레이어가 굴릴 차례 → 저장/과금 없이 종료 ━━
        if (request.interactiveDice() && !request.resolvesPendingRoll() && result.pendingRoll() != null) {
            trace.enter(TurnStage.AWAITING_ROLL);
            return awaitingRoll(result, ctx);
        }
        trace.record(ctx.brainModel().usageKey(), brain.usage());

        // ━━ ROLLING ━━
        trace.enter(TurnStage.ROLLING);
        List<String> systemMessages = new ArrayList<>(result.systemMessages() == null ? List.of() : result.systemMessages());
        List<DiceRoll> diceRolls = new ArrayList<>(result.diceRolls() == null ? List.of() : result.diceRolls());
        FateEngineState fateState = PendingRollResolver.fateStateOf(ctx.state());
        PendingRoll followUpRoll = null;

        if (request.resolvesPendingRoll()) {
            PendingRollResolver.RolledDice rolled = rollResolver.resolve(
                request.pendingRoll(), withFate(ctx.state(), fateState), ctx.world().engine(), request.rollResult());
            diceRolls.add(0, rolled.roll());
            fateState = rolled.nextState();
        }
        if (result.pendingRoll() != null) {
            if (request.interactiveDice()) {
                // 굴림 해결 턴에 Brain 이 요청한 다른 후속 굴림: 다음 턴으로 넘긴다
                followUpRoll = result.pendingRoll().withDefaultType();
            } else {
                Optional<PendingRollResolver.RolledDice> rolled =
                    autoRoll(result.pendingRoll(), withFate(ctx.state(), fateState), ctx);
                if (rolled.isPresent()) {
                    diceRolls.add(rolled.get().roll());
                    fateState = rolled.get().nextState();
                } else {
                    systemMessages.add(AUTO_ROLL_FAILED_MESSAGE);
                }
            }
        }

        // ━━ MERGING ━━
        trace.enter(TurnStage.MERGING);
        MergeResult merged = stateMerger.merge(ctx.state(), result.stateUpdates(), DeltaSource.MODEL);
        Map<String, Object> state = merged.state();

        Optional<DirectorMode.Activation> director = directorMode.check(asMap(state.get("character")), fateState);
        if (director.isPresent()) {
            fateState = director.get().nextState();
            systemMessages.add(director.get().systemMessage());
        }
        state = stateMerger.merge(state, Map.of(PendingRollResolver.FATE_ENGINE_KEY, fateState.toDocument()),
            DeltaSource.ENGINE).state();

        // ━━ NARRATING ━━
        trace.enter(TurnStage.NARRATING);
        Narration narration = narratorService.narrate(new NarrationRequest(
            ctx.world(),
            ctx.knowledge().voice(),
            result.narrativeCues(),
            diceRolls,
            StateDocuments.diff(ctx.state(), state),
            request.history(),
            ctx.voiceModel(),
            result.narrativeCue()
        ));
        trace.record(ctx.voiceModel().usageKey(), narration.usage());

        // ━━ REVIEWING (best-effort) ━━
        trace.enter(TurnStage.REVIEWING);
        boolean reviewerApplied = false;
        if (!narration.fallback()) {
            int turnNumber = request.history().size() / 2 + 1;
            Optional<ReviewOutcome> review = consistencyReviewer.review(narration.text(), state, turnNumber, request.keys());
            if (review.isPresent()) {
                trace.record(review.get().usageKey(), review.get().usage());
                reviewerApplied = !review.get().corrections().isEmpty();
                state = review.get().state();
            }
        }

        // ━━ PERSISTING ━━
        trace.enter(TurnStage.PERSISTING);
        SavedTurn saved = campaignStore.saveTurn(new TurnRecord(
            request.campaignId(),
            userId,
            ctx.worldId(),
            state,
            request.userInput(),
            narration.text(),
            narration.modelId(),
            ctx.cost(),
            Map.copyOf(trace.usage),
            ctx.loadedVersion()
        ));

        // ━━ CHARGING (저장 성공 후에만) ━━
        trace.enter(TurnStage.CHARGING);
        int charged = ctx.cost();
        Integer remaining;
        boolean chargePending = false;
        try {
            ChargeReceipt receipt = economyLedger.charge(
                new ChargeRequest(userId, saved.pendingChargeId(), ctx.cost(), Map.copyOf(trace.usage)));
            remaining = receipt.remainingBalance();
        } catch (InsufficientBalanceException e) {
            // 사전 확인 이후 다른 턴이 잔액을 소진한 경우: 진행은 저장됐고 과금은 거절됨
            charged = 0;
            remaining = e.getAvailable();
            systemMessages.add(CHARGE_REJECTED_MESSAGE);
        } catch (RuntimeException e) {
            log.error("💰 [LEDGER] Charge failed after save, left pending for recovery: campaign={} pendingCharge={}",
                request.campaignId(), saved.pendingChargeId(), e);
            chargePending = true;
            remaining = null;
        }

        boolean choiceRequested = result.requiresUserInput() && result.pendingChoice() != null;
        return TurnResponse.builder()
            .success(true)
            .narrativeText(narration.text())
            .stateDelta(StateDocuments.diff(ctx.state(), state))
            .diceRolls(diceRolls)
            .systemMessages(systemMessages)
            .requiresUserInput(choiceRequested || followUpRoll != null)
            .pendingChoice(result.pendingChoice())
            .pendingRoll(followUpRoll)
            .remainingBalance(remaining)
            .turnCost(charged)
            .voiceModelId(narration.modelId())
            .reviewerApplied(reviewerApplied)
            .chargePending(chargePending)
            .build();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  단계별 헬퍼
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private void validate(Long userId, TurnRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required.");
        }
        if (userId == null) {
            throw new ValidationException("Authenticated user is required.");
        }
        requireText(request.campaignId(), "campaignId");
        requireText(request.userInput(), "userInput");
        requireText(request.worldId(), "worldId");
        if (request.rollResult() != null) {
            if (request.pendingRoll() == null) {
                throw new ValidationException("rollResult requires the pendingRoll it answers.");
            }
            if (request.rollResult() < 1 || request.rollResult() > 20) {
                throw new ValidationException("rollResult must be between 1 and 20.");
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
    }

    /**
     * 저장된 상태가 권위를 가진다. 요청의 stateSnapshot 은 캠페인이 아직 없을 때만 초기 상태로 쓴다.
     * 등급도 요청 값이 아니라 계정에 저장된 값을 따른다.
     */
    private Resolved resolve(Long userId, TurnRequest request) {
        Optional<CampaignSnapshot> stored = campaignStore.load(request.campaignId());
        if (stored.isPresent() && !stored.get().userId().equals(userId)) {
            throw new NotFoundException("Campaign not found: " + request.campaignId());
        }

        String worldId = stored.map(CampaignSnapshot::worldId).orElse(request.worldId());
        if (!worldId.equals(request.worldId())) {
            log.warn("⚠️ [TURN] campaign={} is bound to world {}, ignoring requested world {}",
                request.campaignId(), worldId, request.worldId());
        }
        Map<String, Object> state = stored.map(CampaignSnapshot::state)
            .or(() -> Optional.ofNullable(request.stateSnapshot()))
            .map(StateDocuments::deepCopy)
            .orElseGet(LinkedHashMap::new);

        AccountView account = economyLedger.account(userId);
        if (request.userTier() != null && request.userTier() != account.tier()) {
            log.debug("User tier in request ({}) differs from stored tier ({}), using stored", request.userTier(), account.tier());
        }

        WorldProfile world = worldRulesCatalog.resolve(worldId);
        ResolvedModel brainModel = modelRouter.resolve(
            preferred(account.brainModel(), llmProperties.brainModel()), request.keys(), "brain");
        ResolvedModel voiceModel = modelRouter.resolve(
            preferred(account.voiceModel(), llmProperties.voiceModel()), request.keys(), "voice");

        // 사전 잔액 확인 (실제 차감 전 최종 확인은 과금 트랜잭션에서)
        int cost = costResolver.cost(voiceModel, account.tier());
        if (account.balance() < cost) {
            throw new InsufficientBalanceException(cost, account.balance());
        }

        KnowledgeBundle knowledge = knowledgeFetcher.fetch(worldId);
        log.info("🎯 [TURN] campaign={} world={} brain={} voice={} cost={}",
            request.campaignId(), worldId, brainModel.modelId(), voiceModel.modelId(), cost);

        return new Resolved(state, worldId, world, account, brainModel, voiceModel, cost, knowledge,
            stored.map(CampaignSnapshot::version).orElse(null));
    }

    private TurnResponse awaitingRoll(BrainResult result, Resolved ctx) {
        PendingRoll pending = result.pendingRoll().withDefaultType();
        log.info("🎲 [TURN] Awaiting player roll: {} ({})", pending.purpose(), pending.notation());
        return TurnResponse.builder()
            .success(true)
            .narrativeText(result.narrativeCue())
            .stateDelta(Map.of())
            .diceRolls(List.of())
            .systemMessages(result.systemMessages() == null ? List.of() : result.systemMessages())
            .requiresUserInput(true)
            .pendingRoll(pending)
            .remainingBalance(ctx.account().balance())
            .turnCost(0)
            .build();
    }

    /** 서버 판정 모드의 굴림. 굴림 실패가 턴을 깨뜨리지 않도록 empty 로 대체 */
    private Optional<PendingRollResolver.RolledDice> autoRoll(PendingRoll pending, Map<String, Object> state, Resolved ctx) {
        try {
            return Optional.of(rollResolver.resolve(pending, state, ctx.world().engine(), null));
        } catch (IllegalArgumentException e) {
            log.warn("🎲 [FATE] Could not resolve requested roll {}: {}", pending, e.getMessage());
            return Optional.empty();
        }
    }

    private static Map<String, Object> withFate(Map<String, Object> state, FateEngineState fate) {
        Map<String, Object> copy = deepCopy(state);
        copy.put(PendingRollResolver.FATE_ENGINE_KEY, fate.toDocument());
        return copy;
    }

    private static String preferred(String stored, String fallback) {
        return stored == null || stored.isBlank() ? fallback : stored;
    }
}
