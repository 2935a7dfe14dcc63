package com.spring.fateweaver.engine.state;

import com.spring.fateweaver.domain.enums.QuestStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestLogTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final QuestLog questLog = new QuestLog(Clock.fixed(NOW, ZoneOffset.UTC));

    private static Map<String, Object> stateWithSuggestion() {
        return Map.of(QuestLog.SUGGESTED, List.of(Map.of(
            "id", "q1",
            "title", "Rats in the Cellar",
            "objectives", List.of(Map.of("text", "Find the nest", "isCompleted", false)))));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> quest(Map<String, Object> state, int index) {
        return (Map<String, Object>) ((List<Object>) state.get(QuestLog.LOG)).get(index);
    }

    @Test
    void accept_moves_the_suggestion_into_the_log_and_tracks_it() {
        Map<String, Object> state = questLog.accept(stateWithSuggestion(), "q1");

        assertThat((List<?>) state.get(QuestLog.SUGGESTED)).isEmpty();
        assertThat(quest(state, 0))
            .containsEntry("status", "active")
            .containsEntry("startedAt", NOW.toEpochMilli());
        assertThat(state).containsEntry(QuestLog.ACTIVE_ID, "q1");
    }

    @Test
    void accept_keeps_an_already_tracked_quest() {
        Map<String, Object> state = questLog.addQuest(Map.of(), Map.of("id", "main", "title", "Main"));

        state = questLog.accept(merge(state, stateWithSuggestion()), "q1");

        assertThat(state).containsEntry(QuestLog.ACTIVE_ID, "main");
    }

    @Test
    void decline_removes_the_suggestion_only() {
        Map<String, Object> state = questLog.decline(stateWithSuggestion(), "q1");

        assertThat((List<?>) state.get(QuestLog.SUGGESTED)).isEmpty();
        assertThat(state.get(QuestLog.LOG)).isNull();
    }

    @Test
    void unknown_suggestion_is_rejected() {
        assertThatThrownBy(() -> questLog.accept(stateWithSuggestion(), "nope"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void objective_completion_is_recorded() {
        Map<String, Object> state = questLog.accept(stateWithSuggestion(), "q1");

        state = questLog.updateObjective(state, "q1", 0, true);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> objectives = (List<Map<String, Object>>) quest(state, 0).get("objectives");
        assertThat(objectives.get(0)).containsEntry("isCompleted", true);
        assertThatThrownBy(() -> questLog.updateObjective(Map.copyOf(stateWithSuggestion()), "q1", 3, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void plain_string_objectives_from_the_model_can_be_completed() {
        MergeResult merged = new StateMerger().merge(Map.of(), Map.of(QuestLog.SUGGESTED, List.of(Map.of(
            "id", "q1",
            "objectives", List.of("Find the key", "Kill the rats")))), DeltaSource.MODEL);
        Map<String, Object> state = questLog.accept(merged.state(), "q1");

        state = questLog.updateObjective(state, "q1", 0, true);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> objectives = (List<Map<String, Object>>) quest(state, 0).get("objectives");
        assertThat(objectives).hasSize(2);
        assertThat(objectives.get(0))
            .containsEntry("text", "Find the key")
            .containsEntry("isCompleted", true);
        assertThat(objectives.get(1))
            .containsEntry("text", "Kill the rats")
            .containsEntry("isCompleted", false);
    }

    @Test
    void string_objective_already_in_the_log_is_promoted_on_update() {
        Map<String, Object> state = Map.of(QuestLog.LOG, List.of(Map.of(
            "id", "q1", "status", "active", "objectives", List.of("Find the key", 42))));

        Map<String, Object> updated = questLog.updateObjective(state, "q1", 0, true);

        @SuppressWarnings("unchecked")
        List<Object> objectives = (List<Object>) quest(updated, 0).get("objectives");
        assertThat(objectives.get(0)).isEqualTo(Map.of("text", "Find the key", "isCompleted", true));
        assertThatThrownBy(() -> questLog.updateObjective(state, "q1", 1, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void completing_the_tracked_quest_clears_the_active_id() {
        Map<String, Object> state = questLog.accept(stateWithSuggestion(), "q1");

        state = questLog.setStatus(state, "q1", QuestStatus.COMPLETED);

        assertThat(quest(state, 0))
            .containsEntry("status", "completed")
            .containsEntry("completedAt", NOW.toEpochMilli());
        assertThat(state).doesNotContainKey(QuestLog.ACTIVE_ID);
        assertThat(questLog.activeQuest(state)).isEmpty();
    }

    @Test
    void only_active_quests_can_be_tracked() {
        Map<String, Object> state = questLog.accept(stateWithSuggestion(), "q1");
        Map<String, Object> failed = questLog.setStatus(state, "q1", QuestStatus.FAILED);

        assertThat(questLog.activeQuest(state)).isPresent();
        assertThatThrownBy(() -> questLog.setActive(failed, "q1")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Map<String, Object> merge(Map<String, Object> a, Map<String, Object> b) {
        Map<String, Object> merged = StateDocuments.deepCopy(a);
        merged.putAll(StateDocuments.deepCopy(b));
        return merged;
    }
}
