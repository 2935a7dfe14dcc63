package com.spring.fateweaver.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.dto.brain.NarrativeCue;
import com.spring.fateweaver.dto.turn.DiceRoll;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 나레이터(Voice)용 프롬프트 조립기
 * - 분량 계약은 프롬프트 지시로만 강제한다 (사후 절단 없음)
 */
@Component
@RequiredArgsConstructor
public class NarratorPromptAssembler {

    private final GameProperties gameProperties;
    private final ObjectMapper objectMapper;

    public String assembleSystemPrompt(WorldProfile world, List<String> knowledge) {
        GameProperties.Narrator narrator = gameProperties.narrator();

        String knowledgeSection = knowledge == null || knowledge.isEmpty() ? ""
            : "\nREFERENCE MATERIALS (Use for world context, tone, and lore):\n---\n"
              + String.join("\n\n---\n\n", knowledge) + "\n---\n";

        String lengthSection = narrator.enforceWordLimit() ? """

            CRITICAL LENGTH REQUIREMENT:
            **Your response MUST be between %d-%d words. This is NON-NEGOTIABLE.**
            - Keep responses PUNCHY and FOCUSED.
            - One strong scene beat per response.
            - If there's combat, describe ONE key moment vividly.
            """.formatted(narrator.minWords(), narrator.maxWords()) : "";

        return world.narrativeStyle() + knowledgeSection + lengthSection + """

            STORYTELLING RULES:
            1. You are the STORYTELLER. Write immersive, engaging prose.
            2. You receive narrative cues from the game logic engine - expand them into a focused scene.
            3. Incorporate dice roll results naturally. A failed roll is a failure.
            4. If HP changed significantly, describe the impact briefly.
            5. NEVER break character or discuss game mechanics directly (except system messages).
            6. If reference materials are provided, use them for consistent world-building.

            SAFETY NOTE: Fictional adventure content for mature audience. Combat violence OK. No sexual content or hate speech.
            """;
    }

    public String assembleCueMessage(List<NarrativeCue> cues, List<DiceRoll> rolls, Map<String, Object> stateChanges) {
        StringBuilder sb = new StringBuilder("The game engine has processed the following:\n\n");

        if (!rolls.isEmpty()) {
            sb.append("DICE ROLLS:\n");
            for (DiceRoll roll : rolls) {
                String mod = roll.modifier() == null || roll.modifier() == 0 ? "" : " + " + roll.modifier();
                sb.append("- ").append(roll.purpose() == null ? "Check" : roll.purpose()).append(": ")
                    .append(roll.type()).append(" rolled ").append(roll.result()).append(mod)
                    .append(" = ").append(roll.total());
                if (roll.success() != null) {
                    sb.append(roll.success() ? " (SUCCESS" : " (FAILURE")
                        .append(roll.difficulty() == null ? "" : " vs DC " + roll.difficulty()).append(')');
                }
                sb.append('\n');
            }
            sb.append('\n');
        }

        sb.append("NARRATIVE CUES:\n");
        for (NarrativeCue cue : cues) {
            sb.append("- [").append(cue.type().toUpperCase(Locale.ROOT))
                .append(cue.emotion() == null ? "" : " / " + cue.emotion())
                .append("] ").append(cue.content()).append('\n');
        }

        if (!stateChanges.isEmpty()) {
            sb.append("\nSTATE CHANGES:\n");
            stateChanges.forEach((key, value) -> sb.append("- ").append(key).append(": ").append(json(value)).append('\n'));
        }

        GameProperties.Narrator narrator = gameProperties.narrator();
        sb.append(narrator.enforceWordLimit()
            ? "\nWrite a CONCISE, PUNCHY narrative (%d-%d words) that captures the key moment.".formatted(narrator.minWords(), narrator.maxWords())
            : "\nWrite a narrative that captures the key moment.");
        return sb.toString();
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
