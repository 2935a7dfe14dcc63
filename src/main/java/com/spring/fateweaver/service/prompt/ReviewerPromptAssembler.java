package com.spring.fateweaver.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 상태 일관성 검토용 프롬프트
 */
@Component
@RequiredArgsConstructor
public class ReviewerPromptAssembler {

    private final ObjectMapper objectMapper;

    public String assembleSystemPrompt(Map<String, Object> state, String narrative) {
        return """
            You are a STATE CONSISTENCY REVIEWER for an RPG game.

            Your job is to review the narrative output and extract any state changes that should be tracked.

            LOOK FOR CHANGES TO:
            - Inventory (items picked up, used, or lost)
            - HP/Health changes (damage taken, healing received)
            - Mana/Energy/Nanites changes (spells cast, abilities used)
            - Powers/Abilities (new abilities gained)
            - Party members (NPCs joining or leaving)
            - Currency (gold, credits, etc.)

            CURRENT GAME STATE:
            %s

            NARRATIVE TO REVIEW:
            %s

            Return a JSON object with only the fields that changed:
            {
              "corrections": {
                "inventory": { "added": [], "removed": [] },
                "hp": { "current": 0, "max": 0 },
                "mana": { "current": 0, "max": 0 },
                "nanites": { "current": 0, "max": 0 },
                "fatigue": 0,
                "powers": { "added": [] },
                "partyMembers": { "joined": [], "left": [] },
                "gold": 0,
                "experience": 0
              },
              "reasoning": "Brief explanation of what changed"
            }
            Omit every field that did not change. Respond with JSON only.
            """.formatted(json(state), narrative);
    }

    public String assembleUserMessage(String narrative) {
        return "Review this narrative and extract any state changes. Respond with JSON only:\n\n" + narrative;
    }

    private String json(Map<String, Object> state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            return String.valueOf(state);
        }
    }
}
