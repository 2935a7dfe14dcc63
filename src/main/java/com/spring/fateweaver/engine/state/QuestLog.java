package com.spring.fateweaver.engine.state;

import com.spring.fateweaver.domain.enums.QuestStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.spring.fateweaver.engine.state.StateDocuments.asList;
import static com.spring.fateweaver.engine.state.StateDocuments.asMap;
import static com.spring.fateweaver.engine.state.StateDocuments.deepCopy;

/**
 * 퀘스트 로그 연산
 *
 * GameState 구조
 * - suggestedQuests: 수락 대기 중인 퀘스트 (모델이 제안)
 * - questLog: 수락된 퀘스트 목록 (id, title, description, status, objectives[], startedAt, completedAt, failedAt)
 * - activeQuestId: 현재 추적 중인 퀘스트
 *
 * 모든 연산은 입력 상태를 변경하지 않고 새 문서를 반환한다.
 * 제안 → 로그 이동은 accept/decline 으로만 일어난다.
 */
@Component
public class QuestLog {

    public static final String SUGGESTED = "suggestedQuests";
    public static final String LOG = "questLog";
    public static final String ACTIVE_ID = "activeQuestId";

    private final Clock clock;

    public QuestLog(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Object> accept(Map<String, Object> state, String questId) {
        Map<String, Object> next = deepCopy(state);
        List<Object> suggested = listOf(next, SUGGESTED);

        Map<String, Object> quest = suggested.stream()
            .map(StateDocuments::asMap)
            .filter(q -> q != null && Objects.equals(String.valueOf(q.get("id")), questId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No suggested quest with id " + questId));

        suggested.remove(quest);
        next.put(SUGGESTED, suggested);
        return addQuest(next, quest);
    }

    public Map<String, Object> decline(Map<String, Object> state, String questId) {
        Map<String, Object> next = deepCopy(state);
        List<Object> suggested = listOf(next, SUGGESTED);
        boolean removed = suggested.removeIf(q -> {
            Map<String, Object> m = asMap(q);
            return m != null && Objects.equals(String.valueOf(m.get("id")), questId);
        });
        if (!removed) {
            throw new IllegalArgumentException("No suggested quest with id " + questId);
        }
        next.put(SUGGESTED, suggested);
        return next;
    }

    /**
     * 로그에 퀘스트 추가. 같은 id가 있으면 무시, 추적 중인 퀘스트가 없으면 활성화
     */
    public Map<String, Object> addQuest(Map<String, Object> state, Map<String, Object> quest) {
        Map<String, Object> next = deepCopy(state);
        List<Object> log = listOf(next, LOG);
        String id = String.valueOf(quest.get("id"));

        boolean exists = log.stream()
            .map(StateDocuments::asMap)
            .anyMatch(q -> q != null && Objects.equals(String.valueOf(q.get("id")), id));
        if (exists) {
            return next;
        }

        Map<String, Object> entry = new LinkedHashMap<>(deepCopy(quest));
        entry.put("status", QuestStatus.ACTIVE.value());
        entry.put("objectives", objectivesOf(entry.get("objectives")));
        entry.put("startedAt", clock.millis());
        log.add(entry);
        next.put(LOG, log);

        if (next.get(ACTIVE_ID) == null) {
            next.put(ACTIVE_ID, id);
        }
        return next;
    }

    public Map<String, Object> updateObjective(Map<String, Object> state, String questId,
                                               int objectiveIndex, boolean completed) {
        Map<String, Object> next = deepCopy(state);
        Map<String, Object> quest = findInLog(next, questId);

        List<Object> objectives = asList(quest.get("objectives"));
        if (objectives == null || objectiveIndex < 0 || objectiveIndex >= objectives.size()) {
            throw new IllegalArgumentException("Quest " + questId + " has no objective #" + objectiveIndex);
        }
        Map<String, Object> objective = toObjective(objectives.get(objectiveIndex));
        objective.put("isCompleted", completed);
        objectives.set(objectiveIndex, objective);
        quest.put("objectives", objectives);
        return next;
    }

    /**
     * 모델이 목표를 문자열 배열로 주는 경우가 있어 {text, isCompleted} 로 맞춘다
     */
    private static List<Object> objectivesOf(Object raw) {
        List<Object> objectives = new ArrayList<>();
        List<Object> list = asList(raw);
        if (list != null) {
            list.forEach(o -> objectives.add(toObjective(o)));
        }
        return objectives;
    }

    private static Map<String, Object> toObjective(Object raw) {
        if (raw instanceof String text) {
            Map<String, Object> objective = new LinkedHashMap<>();
            objective.put("text", text);
            objective.put("isCompleted", false);
            return objective;
        }
        Map<String, Object> map = asMap(raw);
        if (map == null) {
            throw new IllegalArgumentException("Unsupported quest objective: " + raw);
        }
        return new LinkedHashMap<>(map);
    }

    /**
     * 상태 변경. 완료/실패 시 타임스탬프를 남기고, 추적 중이던 퀘스트면 activeQuestId를 비운다.
     */
    public Map<String, Object> setStatus(Map<String, Object> state, String questId, QuestStatus status) {
        Map<String, Object> next = deepCopy(state);
        Map<String, Object> quest = findInLog(next, questId);

        quest.put("status", status.value());
        switch (status) {
            case COMPLETED -> quest.put("completedAt", clock.millis());
            case FAILED -> quest.put("failedAt", clock.millis());
            case ACTIVE -> { }
        }

        if (status != QuestStatus.ACTIVE && Objects.equals(next.get(ACTIVE_ID), questId)) {
            next.remove(ACTIVE_ID);
        }
        return next;
    }

    public Optional<Map<String, Object>> activeQuest(Map<String, Object> state) {
        Object activeId = state.get(ACTIVE_ID);
        if (activeId == null) return Optional.empty();
        List<Object> log = asList(state.get(LOG));
        if (log == null) return Optional.empty();
        return log.stream()
            .map(StateDocuments::asMap)
            .filter(q -> q != null && Objects.equals(String.valueOf(q.get("id")), String.valueOf(activeId)))
            .findFirst();
    }

    public Map<String, Object> setActive(Map<String, Object> state, String questId) {
        Map<String, Object> next = deepCopy(state);
        Map<String, Object> quest = findInLog(next, questId);
        if (!QuestStatus.ACTIVE.value().equals(quest.get("status"))) {
            throw new IllegalArgumentException("Quest " + questId + " is not active");
        }
        next.put(ACTIVE_ID, questId);
        return next;
    }

    private Map<String, Object> findInLog(Map<String, Object> state, String questId) {
        List<Object> log = listOf(state, LOG);
        state.put(LOG, log);
        return log.stream()
            .map(StateDocuments::asMap)
            .filter(q -> q != null && Objects.equals(String.valueOf(q.get("id")), questId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No quest with id " + questId));
    }

    private List<Object> listOf(Map<String, Object> state, String key) {
        List<Object> list = asList(state.get(key));
        return list == null ? new ArrayList<>() : list;
    }
}
