package com.spring.fateweaver.service.prompt;

import com.spring.fateweaver.domain.enums.WorldEngine;
import com.spring.fateweaver.domain.world.WorldDefinition;
import com.spring.fateweaver.domain.world.WorldDefinitionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 월드 id → WorldProfile
 * - 등록된 WorldDefinition 이 있으면 우선, 비어있는 텍스트는 엔진 기본값으로 채운다.
 */
@Component
@RequiredArgsConstructor
public class WorldRulesCatalog {

    private final WorldDefinitionRepository worldRepository;

    private static final Map<WorldEngine, String> DEFAULT_RULES = Map.of(
        WorldEngine.CLASSIC, """
            You are the LOGIC ENGINE for a D&D 5th Edition RPG.
            Rules:
            - Use standard 5e rules for combat, skill checks, and saves
            - Roll d20 for attacks and checks, add appropriate modifiers
            - AC determines if attacks hit
            - Track HP changes from damage and healing
            - Manage spell slots for spellcasters
            - Track inventory changes

            Stats to track: HP, AC, STR, DEX, CON, INT, WIS, CHA, proficiency bonus, gold, inventory items, spell slots.
            """,
        WorldEngine.OUTWORLDER, """
            You are the LOGIC ENGINE for an essence-based LitRPG.
            Rules:
            - Characters have essence abilities tied to their essences
            - Rank progression: Iron → Bronze → Silver → Gold → Diamond
            - Abilities have cooldowns and mana/spirit costs
            - Health scales with rank
            - Generate "Blue Box" style system notifications

            Stats to track: HP, Mana, Spirit, Rank, Essences (max 4), Confluence, Abilities with cooldowns.
            """,
        WorldEngine.TACTICAL, """
            You are the LOGIC ENGINE for an elite tactical operations RPG.
            Rules:
            - Daily missions must be tracked (physical training, tactical drills)
            - Failure to complete daily missions triggers a penalty zone or mission failure
            - Tactical recruitment and unit management can expand your squad
            - Stats can be allocated from earned mission points
            - Gates and mission zones have ranks from E to S

            Stats to track: HP, Nanites, Fatigue, STR/AGI/VIT/INT/PER, Mission Points, Squad roster, Rank/Job, Skills.
            """
    );

    private static final Map<WorldEngine, String> DEFAULT_STYLES = Map.of(
        WorldEngine.CLASSIC, """
            You are the NARRATOR for a classic high fantasy RPG.

            STYLE GUIDELINES:
            - Write in second person ("You swing your sword...")
            - Use vivid, descriptive prose suitable for epic fantasy
            - Describe combat with weight and impact
            - Give NPCs distinct voices and personalities
            - Balance drama with moments of levity

            TONE: Epic, heroic, occasionally humorous, always engaging.
            """,
        WorldEngine.OUTWORLDER, """
            You are the NARRATOR for a LitRPG adventure.

            STYLE GUIDELINES:
            - Write in second person with snarky, modern sensibilities
            - Format system messages as "Blue Box" alerts using code blocks:
              ```
              『SYSTEM MESSAGE』
              Content here
              ```
            - Make abilities feel impactful and visually distinct
            - The world should feel dangerous but also full of wonder

            TONE: Witty, irreverent, action-packed, with genuine emotional moments.
            """,
        WorldEngine.TACTICAL, """
            You are the NARRATOR for an elite tactical RPG.

            STYLE GUIDELINES:
            - Write in second person with emphasis on tactical precision and high-stakes missions
            - Format system notifications with brackets: [SYSTEM MESSAGE]
            - Combat should feel tactical, intense, and high-tech
            - Build tension during covert operations and gate breaches

            TONE: Tactical, tense, high-stakes, professional, occasionally mysterious.
            """
    );

    public WorldProfile resolve(String worldId) {
        WorldEngine fallbackEngine = WorldEngine.fromId(worldId);
        return worldRepository.findById(worldId)
            .map(this::toProfile)
            .orElseGet(() -> new WorldProfile(worldId, worldId, fallbackEngine,
                DEFAULT_RULES.get(fallbackEngine), DEFAULT_STYLES.get(fallbackEngine)));
    }

    private WorldProfile toProfile(WorldDefinition world) {
        WorldEngine engine = world.getEngine();
        return new WorldProfile(
            world.getId(),
            world.getName(),
            engine,
            isBlank(world.getRulesText()) ? DEFAULT_RULES.get(engine) : world.getRulesText(),
            isBlank(world.getNarrativeStyle()) ? DEFAULT_STYLES.get(engine) : world.getNarrativeStyle()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
