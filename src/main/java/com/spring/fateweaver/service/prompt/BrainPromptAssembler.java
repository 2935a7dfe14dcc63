package com.spring.fateweaver.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.dto.turn.PendingRoll;
import com.spring.fateweaver.engine.state.QuestLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.spring.fateweaver.engine.state.StateDocuments.asList;
import static com.spring.fateweaver.engine.state.StateDocuments.asMap;

/**
 * Brain(규칙 해석기)용 시스템 프롬프트 조립기
 *
 * [구성 순서]
 * 1. (인터랙티브 주사위 모드) 최상단 경고 헤더
 * 2. 월드 능력치 안내 + 월드 규칙
 * 3. 참고 자료 / 에센스 고정 섹션
 * 4. 주사위 규칙, 선택지 규칙, 굴림 결과 규칙
 * 5. 활성 퀘스트 + 캠페인 장부 + 원본 상태 JSON
 * 6. 응답 스키마
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrainPromptAssembler {

    /** 대화 기록이 이보다 짧으면 도입부로 간주 (능력 추가 금지) */
    private static final int INTRO_PHASE_MESSAGES = 10;

    private final CampaignLedgerAssembler ledgerAssembler;
    private final QuestLog questLog;
    private final ObjectMapper objectMapper;

    public BrainPrompt assemble(BrainPromptContext ctx) {
        StringBuilder prompt = new StringBuilder();

        if (ctx.interactiveDice() && !ctx.resolvingRoll()) {
            prompt.append(CRITICAL_DICE_HEADER);
        }
        prompt.append(statContext(ctx.world().engine()));
        prompt.append(ctx.world().rulesText()).append('\n');

        prompt.append(knowledgeSection(ctx.knowledge()));
        prompt.append(essenceSection(ctx.state(), ctx.historySize()));

        prompt.append("""

            CRITICAL INSTRUCTIONS:
            1. You are ONLY the logic engine. You process game mechanics, not story.
            2. You MUST respond with valid JSON. Include a "stateUpdates" object with any changed game state fields.
            3. %s
            4. Update only the state fields that changed in the stateUpdates object.
               Array fields (inventory, abilities, partyMembers) MUST use {"added": [...], "removed": [...]}.
            5. Provide narrative cues for the storyteller, not full prose.
            6. Include any system messages (level ups, achievements, warnings).
            7. If reference materials are provided, use them for world-consistent responses.
            8. %s
            %s
            """.formatted(diceRules(ctx), choicesRule(ctx.showSuggestedChoices()), rollResultRule(ctx)));

        prompt.append(questContext(ctx.state()));
        prompt.append(ledgerAssembler.assemble(ctx.state(), ctx.world().engine()));
        prompt.append("\nCURRENT GAME STATE (RAW):\n").append(rawState(ctx.state())).append('\n');
        prompt.append(RESPONSE_SCHEMA);

        return new BrainPrompt(prompt.toString(), "PLAYER ACTION: " + ctx.userInput());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  주사위 / 선택지 규칙
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private static final String CRITICAL_DICE_HEADER = """
        🚨🚨🚨 CRITICAL MANDATORY RULE - READ THIS FIRST 🚨🚨🚨

        INTERACTIVE DICE MODE IS ACTIVE

        When ANY action requires a dice roll, you MUST:
        1. SET "pendingRoll" object with: type, purpose, modifier, stat, difficulty
        2. SET "requiresUserInput": true
        3. LEAVE "diceRolls": [] (empty array)
        4. DO NOT describe the roll outcome - STOP before resolution

        VIOLATING THIS RULE IS A SYSTEM ERROR.

        🚨🚨🚨 END CRITICAL RULE 🚨🚨🚨

        """;

    private String diceRules(BrainPromptContext ctx) {
        if (!ctx.interactiveDice()) {
            // 서버 판정 모드: 굴림이 필요하면 pendingRoll 로 요청만 하고 엔진이 굴린다
            return """
                When an action needs a dice roll, DO NOT roll it yourself. Describe the roll in "pendingRoll"
                (type, purpose, stat, difficulty, proficient, advantageSources, disadvantageSources) and the game
                engine will resolve it before narration. Keep "requiresUserInput": false and "diceRolls": [].""";
        }
        if (ctx.resolvingRoll()) {
            PendingRoll roll = ctx.pendingRoll();
            int modifier = roll == null || roll.modifier() == null ? 0 : roll.modifier();
            return """
                ⚠️ INTERACTIVE ROLL RESOLUTION ⚠️
                You are processing the User's manual dice roll result (%d).
                1. The game engine records this roll. Leave "diceRolls" as [].
                2. DO NOT set "requiresUserInput": true (unless a *different* follow-up action needs a roll).
                3. DO NOT set "pendingRoll" for this same action again.
                4. Continue the narrative based on this result (%d + %d).""".formatted(
                ctx.rollResult(), ctx.rollResult(), modifier);
        }
        return """
            ⚠️ CRITICAL - INTERACTIVE DICE MODE IS ACTIVE ⚠️
            When ANY situation requires a dice roll, you MUST set "requiresUserInput": true, set "pendingRoll",
            leave "diceRolls" as [] and describe ONLY the setup in "narrativeCues", NOT the outcome.

            REQUIRED pendingRoll JSON structure:
            { "type": "d20", "purpose": "Attack Roll vs Goblin", "modifier": 5, "stat": "Strength", "difficulty": 15 }

            TRIGGERS: combat attacks, skill checks the player ACTIVELY ATTEMPTS, saving throws, ability checks,
            damage rolls (only after a hit is confirmed). ONLY when a meaningful DC can be assigned (5-20).
            AUTO-SUCCESS: routine use of known abilities in safe places, status checks, help queries.""";
    }

    private String choicesRule(boolean showChoices) {
        if (!showChoices) {
            return "USER PREFERENCE: showSuggestedChoices = false. Do NOT include options in pendingChoice. Set it to null.";
        }
        return """
            USER PREFERENCE: showSuggestedChoices = true.
            ALWAYS include a "pendingChoice" object with 2-4 "options" representing suggested next actions.
            - Every option is written from the player's perspective ("I ask about...", "I examine...").
            - Options are THINGS THE PLAYER DOES, never NPC reactions or outcomes.
            - Set "requiresUserInput": true so they are displayed.""";
    }

    private String rollResultRule(BrainPromptContext ctx) {
        if (!ctx.resolvingRoll()) return "";
        PendingRoll roll = ctx.pendingRoll();
        String purpose = roll == null || roll.purpose() == null ? "unknown purpose" : roll.purpose();
        int modifier = roll == null || roll.modifier() == null ? 0 : roll.modifier();
        String dc = roll == null || roll.difficulty() == null ? "N/A" : String.valueOf(roll.difficulty());
        return """

            🎲 DICE ROLL RESULT RECEIVED: %d
            CONTEXT: The user rolled for "%s". Target DC: %s, Modifier: %d

            ⚠️ CRITICAL ROLL INTEGRITY RULES ⚠️
            1. NO MODIFIER INVENTION: do not add modifiers beyond %d.
            2. HONEST CALCULATION: Success/Failure = (%d + %d) vs DC %s.
            3. ALLOW FAILURES: if the roll fails, it fails. Implement consequences.
            4. NO RE-ROLLS: do not request another roll for the same action.""".formatted(
            ctx.rollResult(), purpose, dc, modifier, modifier, ctx.rollResult(), modifier, dc);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  상태 기반 섹션
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private String statContext(WorldEngine engine) {
        return switch (engine) {
            case CLASSIC -> "\n📊 STATS: Use D&D 5E stats: STR, DEX, CON, INT, WIS, CHA\n";
            case OUTWORLDER -> "\n📊 STATS: Use Outworlder stats ONLY: power, speed, spirit, recovery. NEVER use D&D stat names (STR/DEX/WIS/etc).\n";
            case TACTICAL -> "\n📊 STATS: Use Tactical stats ONLY: strength, agility, vitality, intelligence, perception. NEVER use D&D stat names (STR/DEX/WIS/etc).\n";
        };
    }

    private String knowledgeSection(List<String> knowledge) {
        if (knowledge == null || knowledge.isEmpty()) return "";
        return "\nREFERENCE MATERIALS (Use for world context and lore):\n---\n"
            + String.join("\n\n---\n\n", knowledge)
            + "\n---\n";
    }

    /**
     * 에센스가 이미 정해진 캐릭터: 각성/선택 장면 반복 금지, 도입부에서는 능력 추가 금지
     */
    private String essenceSection(Map<String, Object> state, int historySize) {
        Map<String, Object> character = asMap(state.get("character"));
        if (character == null) return "";
        List<Object> essences = asList(character.get("essences"));
        if (essences == null || essences.isEmpty()) return "";

        String essenceList = joinNames(essences);
        List<Object> abilities = asList(character.get("abilities"));
        boolean hasAbilities = abilities != null && !abilities.isEmpty();

        StringBuilder sb = new StringBuilder("""

            🚨 CRITICAL OVERRIDE - ALL ESSENCES AND ABILITIES ARE ACTIVE 🚨
            - Selected Essences: %s
            - Rank: %s
            - Existing Abilities: %s
            Every essence listed above is FULLY ACTIVE. Do not run awakening or selection sequences.
            """.formatted(essenceList, Objects.requireNonNullElse(character.get("rank"), "Iron"),
            hasAbilities ? joinNames(abilities) : "None yet"));

        if (hasAbilities && historySize < INTRO_PHASE_MESSAGES) {
            sb.append("""
                🔒 LOCKED ABILITY SET: you are FORBIDDEN from adding entries to 'abilities' during the intro.
                Reference ONLY the abilities listed above.
                """);
        } else if (hasAbilities) {
            sb.append("You MAY grant new abilities ONLY for a specific item use or an earned quest reward.\n");
        } else {
            sb.append("The character has essences but NO abilities yet. Grant their intrinsic abilities as they awaken.\n");
        }
        return sb.toString();
    }

    private String questContext(Map<String, Object> state) {
        return questLog.activeQuest(state).map(quest -> {
            List<Object> objectives = asList(quest.get("objectives"));
            String lines = objectives == null ? "" : objectives.stream()
                .map(o -> asMap(o))
                .filter(Objects::nonNull)
                .map(o -> "  " + (Boolean.TRUE.equals(o.get("isCompleted")) ? "[✓] " : "[ ] ") + o.get("text"))
                .collect(Collectors.joining("\n"));
            return """

                ACTIVE QUEST:
                Title: %s
                Description: %s
                Objectives:
                %s

                IMPORTANT: Keep this quest objective in mind.
                """.formatted(quest.get("title"), quest.get("description"), lines);
        }).orElse("");
    }

    private String rawState(Map<String, Object> state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            log.warn("🧠 [BRAIN] State serialization for prompt failed: {}", e.getMessage());
            return String.valueOf(state);
        }
    }

    private static String joinNames(List<Object> elements) {
        return elements.stream()
            .map(e -> {
                Map<String, Object> m = asMap(e);
                return m == null ? String.valueOf(e) : String.valueOf(m.getOrDefault("name", "Unknown"));
            })
            .collect(Collectors.joining(", "));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  응답 스키마
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private static final String RESPONSE_SCHEMA = """

        [Output Format Rule]
        Respond with JSON only. No markdown, no explanation.
        {
          "stateUpdates": { "character": { "hp": { "current": 12 } }, "inventory": { "added": [], "removed": [] } },
          "narrativeCues": [
            { "type": "action|dialogue|description|combat|discovery", "content": "...", "emotion": "neutral|tense|triumphant|mysterious|danger" }
          ],
          "narrativeCue": "One-line summary of what happened",
          "diceRolls": [],
          "systemMessages": [],
          "requiresUserInput": false,
          "pendingChoice": { "prompt": "What do you do?", "options": ["I ...", "I ..."], "choiceType": "action" },
          "pendingRoll": null
        }
        """;
}
