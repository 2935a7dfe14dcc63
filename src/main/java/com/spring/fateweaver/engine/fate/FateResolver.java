package com.spring.fateweaver.engine.fate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * d20 운명 판정기
 *
 * [규칙]
 * 1. 유리/불리 상쇄 → 굴림 개수 결정 (max/min 선택)
 * 2. 크리티컬: 자연 20은 항상, 자연 19는 마지막 크리 이후 40턴 초과 시 "pity crit"
 * 3. 자연 1: momentum > 4 이면 한 번 재굴림 (재굴림 결과의 1/20은 그대로 적용)
 * 4. 모멘텀: adjusted = min(20, die + momentum). 자연값 < 8 → +2 (최대 10), 자연값 > 12 → 0
 * 5. 최종 총합 = adjusted + (능력치 보정 + 숙련 + 아이템 + 상황)
 *
 * 크리티컬/펌블은 언제나 자연값 기준이다. 모멘텀 보정으로 20에 도달해도 크리티컬이 아니다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FateResolver {

    public static final int D20 = 20;

    /** pity crit 발동 조건: 마지막 크리 이후 경과 굴림 수 */
    static final int PITY_CRIT_GAP = 40;

    /** 펌블 보호 발동 조건: momentum 이 값을 초과 */
    static final int FUMBLE_PROTECTION_MOMENTUM = 4;

    static final int MOMENTUM_LOW_ROLL = 8;
    static final int MOMENTUM_HIGH_ROLL = 12;
    static final int MOMENTUM_STEP = 2;

    private final DiceRoller diceRoller;

    public FateResolution resolve(FateRollRequest request, FateEngineState state) {
        if (request == null || state == null) {
            throw new IllegalArgumentException("roll request and fate state are required");
        }
        Integer supplied = request.suppliedNaturalRoll();
        if (supplied != null && (supplied < 1 || supplied > D20)) {
            throw new IllegalArgumentException("supplied roll must be between 1 and 20: " + supplied);
        }
        if (request.difficulty() != null && request.difficulty() < 0) {
            throw new IllegalArgumentException("difficulty must not be negative: " + request.difficulty());
        }

        // ── 1~2. 유리/불리 ──
        AdvantageState advantage = AdvantageState.resolve(
            request.advantageSources(), request.disadvantageSources());

        List<Integer> rawRolls = new ArrayList<>();
        for (int i = 0; i < advantage.diceCount(); i++) {
            rawRolls.add(i == 0 && supplied != null ? supplied : diceRoller.roll(D20));
        }
        int natural = switch (advantage) {
            case ADVANTAGE -> Math.max(rawRolls.get(0), rawRolls.get(1));
            case DISADVANTAGE -> Math.min(rawRolls.get(0), rawRolls.get(1));
            case STRAIGHT -> rawRolls.get(0);
        };

        // ── 3. 크리티컬 / 펌블 ──
        int momentum = state.momentum();
        int die = natural;
        boolean critical = false;
        boolean pityCrit = false;
        boolean fumble = false;
        boolean rerolled = false;

        if (natural == 20) {
            critical = true;
        } else if (natural == 19 && state.turnsSinceCrit() > PITY_CRIT_GAP) {
            critical = true;
            pityCrit = true;
        } else if (natural == 1) {
            if (momentum > FUMBLE_PROTECTION_MOMENTUM) {
                die = diceRoller.roll(D20);
                rawRolls.add(die);
                rerolled = true;
                critical = die == 20;
                fumble = die == 1;
                log.debug("🎲 [FATE] Fumble protection reroll: 1 -> {} (momentum={})", die, momentum);
            } else {
                fumble = true;
            }
        }

        // ── 4. 모멘텀 ──
        int adjusted = Math.min(D20, die + momentum);
        int nextMomentum = momentum;
        if (natural < MOMENTUM_LOW_ROLL) {
            nextMomentum = Math.min(FateEngineState.MAX_MOMENTUM, momentum + MOMENTUM_STEP);
        } else if (natural > MOMENTUM_HIGH_ROLL) {
            nextMomentum = 0;
        }

        // ── 5. 보정치 스택 ──
        ModifierBreakdown math = new ModifierBreakdown(
            statModifier(request.statValue()),
            request.proficient() ? request.proficiencyBonus() : 0,
            request.itemBonus(),
            request.situationalModifier(),
            adjusted - die
        );

        int total = adjusted + math.total();
        RollOutcome outcome = request.difficulty() == null ? null : RollOutcome.evaluate(total, request.difficulty());

        RollFlags flags = new RollFlags(
            advantage == AdvantageState.ADVANTAGE,
            advantage == AdvantageState.DISADVANTAGE,
            critical,
            fumble,
            momentum > 0,
            rerolled,
            pityCrit
        );

        String rollType = request.rollType() == null || request.rollType().isBlank() ? "ability" : request.rollType();
        FateRoll roll = new FateRoll(rollType + " roll", List.copyOf(rawRolls), natural, adjusted, math, flags, outcome);

        FateEngineState next = new FateEngineState(
            nextMomentum,
            critical ? 0 : state.turnsSinceCrit() + 1,
            state.directorModeCooldown()
        );

        log.info("🎲 [FATE] {} | raw={} natural={} result={} mod={} total={} crit={} fumble={} momentum {}->{}",
            roll.purpose(), rawRolls, natural, adjusted, math.total(), total, critical, fumble, momentum, nextMomentum);

        return new FateResolution(roll, next);
    }

    public static int statModifier(int statValue) {
        return Math.floorDiv(statValue - 10, 2);
    }
}
