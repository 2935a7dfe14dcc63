package com.spring.fateweaver.service.prompt;

import com.spring.fateweaver.domain.enums.WorldEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.spring.fateweaver.engine.state.StateDocuments.asList;
import static com.spring.fateweaver.engine.state.StateDocuments.asMap;

/**
 * 캠페인 장부 (모델이 참조하는 상태 요약)
 *
 * Brain / Reviewer 가 같은 요약을 본다.
 * 목록에 없는 능력/아이템/NPC 는 "존재하지 않는다"고 명시해 모델의 창작을 막는다.
 */
@Component
public class CampaignLedgerAssembler {

    private static final List<String> OUTWORLDER_RANKS = List.of("Iron", "Bronze", "Silver", "Gold", "Diamond");

    public String assemble(Map<String, Object> state, WorldEngine engine) {
        Map<String, Object> character = asMap(state.get("character"));
        if (character == null) character = Map.of();
        String difficulty = text(state.get("difficulty"), "adventurer");

        Object inventory = character.containsKey("inventory") ? character.get("inventory") : state.get("inventory");
        Object npcs = state.containsKey("keyNpcs") ? state.get("keyNpcs") : state.get("npcs");

        return """

            📜 CAMPAIGN LEDGER (MANDATORY REFERENCE)
            ═══════════════════════════════════════

            CHARACTER:
            • Name: %s
            • %s: %s
            %s
            PROGRESSION:
            %s

            ABILITIES (⚠️ ONLY REFERENCE THESE - DO NOT INVENT):
            %s

            INVENTORY:
            %s

            RESOURCES:
            %s

            KEY NPCs MET:
            %s

            CURRENT LOCATION: %s

            ACTIVE QUESTS:
            %s

            DIFFICULTY: %s
            %s

            ═══════════════════════════════════════
            ⚠️ CRITICAL: Use ONLY the abilities, inventory, and NPCs listed above.
            Do NOT invent new ones. If something isn't listed, it doesn't exist yet.

            🎲 GAME MASTER PRINCIPLES:
            • Be FAIR, not punishing - challenge appropriately for %s
            • Dice results are sacred - honor the roll
            • NPCs have their own agendas
            • The world feels real - actions have consequences
            """.formatted(
            text(character.get("name"), "Unknown"),
            engine == WorldEngine.OUTWORLDER ? "Rank" : "Level",
            character.get("rank") != null ? character.get("rank") : text(character.get("level"), "1"),
            identityLines(character),
            progression(character, engine, state),
            names(character.get("abilities"), "• None yet", true),
            names(inventory, "• Empty", false),
            resources(character, engine),
            npcLines(npcs),
            text(state.get("currentLocation"), "Unknown"),
            questLines(state.get("questLog")),
            difficulty.toUpperCase(Locale.ROOT),
            difficultyInstructions(difficulty),
            difficulty
        );
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  섹션별 포맷
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private String identityLines(Map<String, Object> character) {
        StringBuilder sb = new StringBuilder();
        List<Object> essences = asList(character.get("essences"));
        if (essences != null && !essences.isEmpty()) {
            sb.append("• Essences: ").append(essences.stream().map(this::nameOf).collect(Collectors.joining(", "))).append('\n');
        }
        for (String key : List.of("class", "race", "job")) {
            if (character.get(key) != null) {
                sb.append("• ").append(Character.toUpperCase(key.charAt(0))).append(key.substring(1))
                    .append(": ").append(character.get(key)).append('\n');
            }
        }
        return sb.toString();
    }

    private String progression(Map<String, Object> character, WorldEngine engine, Map<String, Object> state) {
        int level = character.get("level") instanceof Number n ? n.intValue() : 1;
        Object experience = Objects.requireNonNullElse(character.get("experience"), 0);
        return switch (engine) {
            case OUTWORLDER -> {
                String rank = text(character.get("rank"), "Iron");
                int index = OUTWORLDER_RANKS.indexOf(rank);
                String next = index < 0 || index == OUTWORLDER_RANKS.size() - 1 ? rank : OUTWORLDER_RANKS.get(index + 1);
                yield "• Rank: " + rank + " → Next: " + next
                    + "\n• Rank Progress: " + Objects.requireNonNullElse(character.get("rankProgress"), 0) + "%";
            }
            case CLASSIC -> "• Level: " + level
                + "\n• XP: " + experience + " / " + (level + 1) * 1000
                + "\n• Proficiency Bonus: +" + Objects.requireNonNullElse(character.get("proficiencyBonus"), 2);
            case TACTICAL -> "• Level: " + level
                + "\n• XP: " + experience + " / " + (level + 1) * 1000
                + "\n• Stat Points Available: " + Objects.requireNonNullElse(character.get("statPoints"), 0)
                + "\n• Job: " + text(character.get("job"), "None")
                + "\n• Gate Rank: " + text(state.get("gateRank") != null ? state.get("gateRank") : character.get("gateRank"), "E");
        };
    }

    private String names(Object raw, String empty, boolean withType) {
        List<Object> list = asList(raw);
        if (list == null || list.isEmpty()) return empty;
        return list.stream().map(element -> {
            Map<String, Object> item = asMap(element);
            if (item == null) return "• " + element;
            StringBuilder sb = new StringBuilder("• ").append(nameOf(item));
            if (withType && item.get("type") != null) sb.append(" [").append(item.get("type")).append(']');
            if (item.get("quantity") != null) sb.append(" x").append(item.get("quantity"));
            if (Boolean.TRUE.equals(item.get("equipped"))) sb.append(" [EQUIPPED]");
            if (withType && item.get("description") instanceof String desc && !desc.isBlank()) {
                sb.append(" - ").append(desc.length() > 60 ? desc.substring(0, 60) + "..." : desc);
            }
            return sb.toString();
        }).collect(Collectors.joining("\n"));
    }

    private String resources(Map<String, Object> character, WorldEngine engine) {
        List<String> pools = engine == WorldEngine.TACTICAL
            ? List.of("hp", "nanites", "stamina")
            : List.of("hp", "mana", "stamina");
        String lines = pools.stream()
            .filter(pool -> asMap(character.get(pool)) != null)
            .map(pool -> {
                Map<String, Object> p = asMap(character.get(pool));
                String label = pool.equals("hp") ? "HP" : Character.toUpperCase(pool.charAt(0)) + pool.substring(1);
                return "• " + label + ": " + p.get("current") + "/" + p.get("max");
            })
            .collect(Collectors.joining("\n"));
        return lines.isEmpty() ? "• None tracked" : lines;
    }

    private String npcLines(Object raw) {
        Map<String, Object> npcs = asMap(raw);
        if (npcs == null || npcs.isEmpty()) return "• None yet";
        return npcs.entrySet().stream().map(e -> {
            Map<String, Object> npc = asMap(e.getValue());
            Object info = npc == null ? null : (npc.get("info") != null ? npc.get("info") : npc.get("role"));
            return "• " + e.getKey() + (info == null ? "" : " - " + info);
        }).collect(Collectors.joining("\n"));
    }

    private String questLines(Object raw) {
        List<Object> quests = asList(raw);
        if (quests == null) return "• None active";
        String lines = quests.stream()
            .map(q -> asMap(q))
            .filter(q -> q != null && "active".equals(q.get("status")))
            .map(q -> {
                List<Object> objectives = asList(q.get("objectives"));
                long remaining = objectives == null ? 0 : objectives.stream()
                    .map(o -> asMap(o))
                    .filter(o -> o != null && !Boolean.TRUE.equals(o.get("isCompleted")))
                    .count();
                return "• " + text(q.get("title"), text(q.get("name"), "Untitled")) + " (" + remaining + " objectives remaining)";
            })
            .collect(Collectors.joining("\n"));
        return lines.isEmpty() ? "• None active" : lines;
    }

    private String difficultyInstructions(String difficulty) {
        return switch (difficulty.toLowerCase(Locale.ROOT)) {
            case "story" -> "🎭 STORY MODE: Focus on narrative enjoyment. Be generous with success, soften failures into \"almost\" moments.";
            case "novice" -> "📚 NOVICE: Provide helpful hints. Be forgiving but educational. Failures should teach, not punish.";
            case "hero" -> "🏆 HERO: No safety nets. Dice results are absolute. Failures hurt. Victory is hard-won.";
            case "legendary" -> "💀 LEGENDARY: Unforgiving. Death is permanent. Every decision could be your last.";
            default -> "⚔️ ADVENTURER: Balanced and fair. Success feels earned, failure has consequences but isn't devastating.";
        };
    }

    private String nameOf(Object element) {
        Map<String, Object> m = asMap(element);
        if (m == null) return String.valueOf(element);
        return text(m.get("name"), "Unknown");
    }

    private static String text(Object value, String fallback) {
        return value == null || String.valueOf(value).isBlank() ? fallback : String.valueOf(value);
    }
}
