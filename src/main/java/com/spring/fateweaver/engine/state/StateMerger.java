package com.spring.fateweaver.engine.state;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.spring.fateweaver.engine.state.StateDocuments.asList;
import static com.spring.fateweaver.engine.state.StateDocuments.asMap;
import static com.spring.fateweaver.engine.state.StateDocuments.deepCopy;
import static com.spring.fateweaver.engine.state.StateDocuments.identityOf;
import static com.spring.fateweaver.engine.state.StateDocuments.isBlank;
import static com.spring.fateweaver.engine.state.StateDocuments.isSetOperation;

/**
 * State Merger
 *
 * 신뢰할 수 없는 출처(LLM)의 델타를 권위 있는 GameState에 병합한다.
 * - 필드 정책은 {@link FieldPolicyTable}에서 조회 (테이블에 없으면 값 형태로 추론)
 * - 입력 상태는 변경하지 않고 새 문서를 반환
 * - 형식 불일치로 예외를 던지지 않는다. 경고를 남기고 정책이 허용하는 가장 가까운 동작으로 처리
 */
@Component
@Slf4j
public class StateMerger {

    private final FieldPolicyTable table;

    public StateMerger() {
        this(FieldPolicyTable.defaults());
    }

    public StateMerger(FieldPolicyTable table) {
        this.table = table;
    }

    public MergeResult merge(Map<String, Object> current, Map<String, Object> delta, DeltaSource source) {
        Map<String, Object> base = current == null ? new LinkedHashMap<>() : deepCopy(current);
        List<String> warnings = new ArrayList<>();

        if (delta == null || delta.isEmpty()) {
            return new MergeResult(base, warnings);
        }

        Map<String, Object> merged = mergeObject(base, delta, table, source, "", warnings);
        warnings.forEach(w -> log.warn("⚠️ [MERGE] {}", w));
        return new MergeResult(merged, List.copyOf(warnings));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  객체 단위 병합 (최상위 / character 하위)
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private Map<String, Object> mergeObject(Map<String, Object> target, Map<String, Object> delta,
                                            FieldPolicyTable policies, DeltaSource source,
                                            String path, List<String> warnings) {
        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            String fieldPath = path + key;

            if (value == null) {
                log.debug("[MERGE] null value skipped: {}", fieldPath);
                continue;
            }

            Object existing = target.get(key);
            FieldPolicy policy = policies.policyOf(key).orElseGet(() -> inferPolicy(existing, value));

            switch (policy) {
                case SYSTEM_MANAGED -> {
                    if (source == DeltaSource.ENGINE) {
                        target.put(key, deepCopy(value));
                    } else {
                        warnings.add(fieldPath + " is engine-managed; model delta ignored");
                    }
                }
                case IMMUTABLE_ADDITIVE -> target.put(key, applyImmutable(existing, value, fieldPath, warnings));
                case PROTECTED_ADDITIVE -> target.put(key, applyProtected(existing, value, fieldPath, warnings));
                case IDENTITY_PROTECTED -> target.put(key, applyIdentity(existing, value, fieldPath, warnings));
                case PROTECTED_ENTRIES -> target.put(key, applyEntries(existing, value, fieldPath, warnings));
                case SHALLOW_MERGE -> target.put(key, applyShallow(existing, value,
                    policies.nestedTable(key).orElse(null), source, fieldPath, warnings));
                case REPLACE -> target.put(key, deepCopy(value));
            }
        }
        return target;
    }

    /**
     * 테이블에 없는 필드: {added, removed} → 보호 집합 연산, 객체 ↔ 객체 → 얕은 병합, 그 외 교체
     */
    private FieldPolicy inferPolicy(Object existing, Object value) {
        if (isSetOperation(value)) return FieldPolicy.PROTECTED_ADDITIVE;
        if (asMap(existing) != null && asMap(value) != null) return FieldPolicy.SHALLOW_MERGE;
        return FieldPolicy.REPLACE;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  정책별 적용
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private List<Object> applyImmutable(Object existing, Object value, String path, List<String> warnings) {
        List<Object> current = existingList(existing, path, warnings);
        List<Object> additions;

        if (isSetOperation(value)) {
            Map<String, Object> op = asMap(value);
            additions = elements(op.get("added"), path, warnings);
            if (!isBlank(op.get("removed"))) {
                warnings.add(path + " is add-only; removal of " + op.get("removed") + " ignored");
            }
        } else {
            additions = elements(value, path, warnings);
        }
        return union(current, additions);
    }

    private List<Object> applyProtected(Object existing, Object value, String path, List<String> warnings) {
        List<Object> current = existingList(existing, path, warnings);

        if (isSetOperation(value)) {
            Map<String, Object> op = asMap(value);
            List<Object> added = elements(op.get("added"), path, warnings);
            List<Object> removed = elements(op.get("removed"), path, warnings);
            return difference(union(current, added), removed);
        }

        if (asList(value) != null) {
            warnings.add(path + " received a plain array; treated as add-only, not a replacement");
        }
        return union(current, elements(value, path, warnings));
    }

    private Object applyIdentity(Object existing, Object value, String path, List<String> warnings) {
        if (isBlank(existing)) {
            return deepCopy(value);
        }
        if (!Objects.equals(existing, value)) {
            warnings.add(path + " is identity-protected; kept '" + existing + "' over '" + value + "'");
        }
        return existing;
    }

    /**
     * keyNpcs: 이름 → 레코드. 새 항목 추가 / 기존 항목 얕은 갱신 (name, role 유지). 삭제 불가
     */
    private Map<String, Object> applyEntries(Object existing, Object value, String path, List<String> warnings) {
        Map<String, Object> current = asMap(existing) == null ? new LinkedHashMap<>() : asMap(existing);
        if (existing != null && asMap(existing) == null) {
            warnings.add(path + " held a non-object value; rebuilt as an entry map");
        }

        Map<String, Object> incoming = new LinkedHashMap<>();
        if (asMap(value) != null && !isSetOperation(value)) {
            incoming.putAll(asMap(value));
        } else {
            // 배열 또는 {added} 로 들어온 경우 name 기준으로 항목화
            Object source = isSetOperation(value) ? asMap(value).get("added") : value;
            if (isSetOperation(value) && !isBlank(asMap(value).get("removed"))) {
                warnings.add(path + " entries cannot be deleted; removal ignored");
            }
            for (Object element : elements(source, path, warnings)) {
                Map<String, Object> npc = asMap(element);
                if (npc != null && npc.get("name") != null) {
                    incoming.put(String.valueOf(npc.get("name")), npc);
                } else {
                    warnings.add(path + " entry without a name ignored: " + element);
                }
            }
        }

        incoming.forEach((name, record) -> {
            if (record == null) {
                warnings.add(path + "." + name + " cannot be deleted");
                return;
            }
            Map<String, Object> prior = asMap(current.get(name));
            Map<String, Object> update = asMap(record);
            if (prior == null || update == null) {
                if (prior != null) {
                    warnings.add(path + "." + name + " update is not an object; ignored");
                } else {
                    current.put(name, deepCopy(record));
                }
                return;
            }
            Map<String, Object> mergedNpc = new LinkedHashMap<>(prior);
            update.forEach((k, v) -> {
                if (("name".equals(k) || "role".equals(k)) && !isBlank(prior.get(k))) {
                    if (!Objects.equals(prior.get(k), v)) {
                        warnings.add(path + "." + name + "." + k + " is identity-protected");
                    }
                    return;
                }
                if (v != null) mergedNpc.put(k, deepCopy(v));
            });
            current.put(name, mergedNpc);
        });
        return current;
    }

    private Object applyShallow(Object existing, Object value, FieldPolicyTable nested, DeltaSource source,
                                String path, List<String> warnings) {
        Map<String, Object> update = asMap(value);
        if (update == null) {
            warnings.add(path + " expected an object but got " + value + "; assigned directly");
            return deepCopy(value);
        }

        Map<String, Object> current = asMap(existing);
        if (current == null) {
            if (existing != null) {
                warnings.add(path + " held a non-object value; replaced by object");
            }
            current = new LinkedHashMap<>();
        }

        if (nested != null) {
            return mergeObject(current, update, nested, source, path + ".", warnings);
        }

        // 한 단계 하위 객체까지만 병합
        for (Map.Entry<String, Object> e : update.entrySet()) {
            if (e.getValue() == null) continue;
            Map<String, Object> priorChild = asMap(current.get(e.getKey()));
            Map<String, Object> childUpdate = asMap(e.getValue());
            if (priorChild != null && childUpdate != null) {
                Map<String, Object> child = new LinkedHashMap<>(priorChild);
                childUpdate.forEach((k, v) -> child.put(k, deepCopy(v)));
                current.put(e.getKey(), child);
            } else {
                current.put(e.getKey(), deepCopy(e.getValue()));
            }
        }
        return current;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  집합 연산 헬퍼
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private List<Object> existingList(Object existing, String path, List<String> warnings) {
        if (existing == null) return new ArrayList<>();
        List<Object> list = asList(existing);
        if (list != null) return list;
        warnings.add(path + " held a non-array value " + existing + "; kept as a single entry");
        List<Object> single = new ArrayList<>();
        single.add(existing);
        return single;
    }

    /** 배열이면 원소들, 스칼라/객체면 단일 원소 */
    private List<Object> elements(Object value, String path, List<String> warnings) {
        if (value == null) return List.of();
        List<Object> list = asList(value);
        if (list != null) return list;
        warnings.add(path + " expected an array but got " + value + "; treated as a single entry");
        return List.of(value);
    }

    private List<Object> union(List<Object> current, List<Object> additions) {
        List<Object> result = new ArrayList<>(current);
        Set<String> seen = new LinkedHashSet<>();
        current.forEach(e -> seen.add(identityOf(e)));
        for (Object element : additions) {
            if (element != null && seen.add(identityOf(element))) {
                result.add(deepCopy(element));
            }
        }
        return result;
    }

    private List<Object> difference(List<Object> current, List<Object> removals) {
        if (removals.isEmpty()) return current;
        Set<String> removeIds = new LinkedHashSet<>();
        removals.forEach(e -> removeIds.add(identityOf(e)));
        List<Object> result = new ArrayList<>();
        for (Object element : current) {
            if (!removeIds.contains(identityOf(element))) {
                result.add(element);
            }
        }
        return result;
    }
}
