package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.engine.fate.CharacterStats;
import com.spring.fateweaver.engine.fate.DiceNotation;
import com.spring.fateweaver.engine.fate.DiceRoller;
import com.spring.fateweaver.engine.fate.FateEngineState;
import com.spring.fateweaver.engine.fate.FateResolution;
import com.spring.fateweaver.engine.fate.FateResolver;
import com.spring.fateweaver.engine.fate.FateRollRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.spring.fateweaver.engine.state.StateDocuments.asMap;

/**
 * Brain 의 굴림 요청(PendingRoll)을 엔진 판정으로 바꾼다.
 *
 * [d20]
 * - stat 이 있으면 캐릭터 시트에서 능력치/숙련/아이템 보정을 계산하고 모델이 보낸 modifier 는 쓰지 않는다.
 * - stat 이 없으면 modifier 를 상황 보정으로, 능력치는 10 으로 본다.
 * - 운명 엔진 상태(fateEngine)를 읽어 갱신된 상태를 돌려준다.
 *
 * [그 외 표기 (2d6+3 등)]
 * - 단순 합산. 운명 엔진 상태는 바뀌지 않는다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingRollResolver {

    public static final String FATE_ENGINE_KEY = "fateEngine";

    private final FateResolver fateResolver;
    private final DiceRoller diceRoller;

    public record RolledDice(DiceRoll roll, FateEngineState nextState) {}

    /**
     * @param suppliedNaturalRoll 플레이어가 굴린 자연값 (서버 판정이면 null)
     */
    public RolledDice resolve(PendingRoll pending, Map<String, Object> state, WorldEngine engine,
                              Integer suppliedNaturalRoll) {
        PendingRoll roll = pending.withDefaultType();
        FateEngineState fateState = fateStateOf(state);

        DiceNotation notation = parseOrD20(roll.notation());
        if (!notation.isD20()) {
            return new RolledDice(rollPlain(notation, roll, suppliedNaturalRoll), fateState);
        }

        Map<String, Object> character = asMap(state.get("character"));
        boolean hasStat = roll.stat() != null && !roll.stat().isBlank();

        FateRollRequest request = FateRollRequest.builder()
            .rollType(hasStat ? roll.stat() : "ability")
            .advantageSources(roll.advantageSources() == null ? List.of() : roll.advantageSources())
            .disadvantageSources(roll.disadvantageSources() == null ? List.of() : roll.disadvantageSources())
            .statValue(hasStat ? CharacterStats.statValue(character, roll.stat(), engine) : CharacterStats.DEFAULT_STAT)
            .proficient(hasStat && Boolean.TRUE.equals(roll.proficient()))
            .proficiencyBonus(CharacterStats.proficiencyBonus(character))
            .itemBonus(hasStat && roll.itemBonus() != null ? roll.itemBonus() : 0)
            .situationalModifier(!hasStat && roll.modifier() != null ? roll.modifier() : 0)
            .difficulty(roll.difficulty())
            .suppliedNaturalRoll(suppliedNaturalRoll)
            .build();

        FateResolution resolution = fateResolver.resolve(request, fateState);
        return new RolledDice(DiceRoll.fromFate(resolution.roll(), roll.purpose()), resolution.nextState());
    }

    /** 저장된 fateEngine 문서. 없거나 손상됐으면 초기 상태 */
    public static FateEngineState fateStateOf(Map<String, Object> state) {
        Object raw = state == null ? null : state.get(FATE_ENGINE_KEY);
        if (raw == null) {
            return FateEngineState.initial();
        }
        try {
            return FateEngineState.fromDocument(raw);
        } catch (IllegalArgumentException e) {
            log.warn("🎲 [FATE] Corrupt fateEngine state, starting fresh: {}", e.getMessage());
            return FateEngineState.initial();
        }
    }

    private DiceRoll rollPlain(DiceNotation notation, PendingRoll roll, Integer supplied) {
        List<Integer> dice = notation.count() == 1 && supplied != null && supplied <= notation.sides()
            ? List.of(supplied)
            : notation.roll(diceRoller);
        int sum = dice.stream().mapToInt(Integer::intValue).sum();
        int modifier = notation.bonus() + (roll.modifier() == null ? 0 : roll.modifier());
        log.info("🎲 [FATE] {} | {} -> {} (+{})", roll.purpose(), notation, dice, modifier);
        return DiceRoll.simple(notation.toString(), sum, modifier, roll.purpose(), roll.difficulty());
    }

    private DiceNotation parseOrD20(String notation) {
        try {
            return DiceNotation.parse(notation);
        } catch (IllegalArgumentException e) {
            log.warn("🎲 [FATE] Unreadable dice notation '{}', rolling d20", notation);
            return DiceNotation.parse(PendingRoll.DEFAULT_TYPE);
        }
    }
}
