package com.spring.fateweaver.engine.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GameState 문서(Map/List/스칼라 트리) 조작 유틸
 */
public final class StateDocuments {

    private StateDocuments() {}

    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return (T) copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return null;
    }

    /** {added: [...]} 또는 {removed: [...]} 형태인지 */
    public static boolean isSetOperation(Object value) {
        Map<String, Object> map = asMap(value);
        return map != null && (map.containsKey("added") || map.containsKey("removed"));
    }

    /**
     * 집합 연산용 원소 식별자
     * - id 가 있는 객체 → id
     * - name 이 있는 객체 → name (인벤토리 아이템, NPC, 파티원)
     * - 그 외 → 값 자체의 문자열
     */
    public static String identityOf(Object element) {
        Map<String, Object> map = asMap(element);
        if (map != null) {
            if (map.get("id") != null) return String.valueOf(map.get("id"));
            if (map.get("name") != null) return String.valueOf(map.get("name"));
        }
        return String.valueOf(element);
    }

    public static boolean isBlank(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof List<?> list) return list.isEmpty();
        if (value instanceof Map<?, ?> map) return map.isEmpty();
        return false;
    }

    /**
     * 최상위 키 기준 변경분 (after 값). 삭제된 키는 null로 표시
     */
    public static Map<String, Object> diff(Map<String, Object> before, Map<String, Object> after) {
        Map<String, Object> delta = new LinkedHashMap<>();
        after.forEach((key, value) -> {
            if (!Objects.equals(before.get(key), value)) {
                delta.put(key, deepCopy(value));
            }
        });
        before.keySet().stream()
            .filter(key -> !after.containsKey(key))
            .forEach(key -> delta.put(key, null));
        return delta;
    }
}
