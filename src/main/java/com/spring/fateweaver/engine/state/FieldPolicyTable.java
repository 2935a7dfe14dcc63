package com.spring.fateweaver.engine.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 필드명 → 병합 정책 선언 테이블
 * - 보호 필드 추가는 이 테이블에 한 줄을 더하는 데이터 변경으로 끝난다.
 * - 하위 테이블(nested)은 character 같은 객체 필드의 키별 정책
 */
public final class FieldPolicyTable {

    private final Map<String, FieldPolicy> policies;
    private final Map<String, FieldPolicyTable> nested;

    private FieldPolicyTable(Map<String, FieldPolicy> policies, Map<String, FieldPolicyTable> nested) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
        this.nested = Collections.unmodifiableMap(new LinkedHashMap<>(nested));
    }

    public Optional<FieldPolicy> policyOf(String field) {
        return Optional.ofNullable(policies.get(field));
    }

    public Optional<FieldPolicyTable> nestedTable(String field) {
        return Optional.ofNullable(nested.get(field));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 기본 정책 테이블
     */
    public static FieldPolicyTable defaults() {
        FieldPolicyTable character = builder()
            .field("name", FieldPolicy.IDENTITY_PROTECTED)
            .field("rank", FieldPolicy.IDENTITY_PROTECTED)
            .field("class", FieldPolicy.IDENTITY_PROTECTED)
            .field("essences", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("abilities", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("spells", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("inventory", FieldPolicy.PROTECTED_ADDITIVE)
            .build();

        return builder()
            .field("abilities", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("spells", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("essences", FieldPolicy.IMMUTABLE_ADDITIVE)
            .field("inventory", FieldPolicy.PROTECTED_ADDITIVE)
            .field("partyMembers", FieldPolicy.PROTECTED_ADDITIVE)
            .field("suggestedQuests", FieldPolicy.PROTECTED_ADDITIVE)
            .field("keyNpcs", FieldPolicy.PROTECTED_ENTRIES)
            .field("fateEngine", FieldPolicy.SYSTEM_MANAGED)
            .field("questLog", FieldPolicy.SYSTEM_MANAGED)
            .field("activeQuestId", FieldPolicy.SYSTEM_MANAGED)
            .field("gold", FieldPolicy.REPLACE)
            .field("experience", FieldPolicy.REPLACE)
            .field("currentLocation", FieldPolicy.REPLACE)
            .nested("character", FieldPolicy.SHALLOW_MERGE, character)
            .build();
    }

    public static final class Builder {
        private final Map<String, FieldPolicy> policies = new LinkedHashMap<>();
        private final Map<String, FieldPolicyTable> nested = new LinkedHashMap<>();

        public Builder field(String name, FieldPolicy policy) {
            policies.put(name, policy);
            return this;
        }

        public Builder nested(String name, FieldPolicy policy, FieldPolicyTable table) {
            policies.put(name, policy);
            nested.put(name, table);
            return this;
        }

        public FieldPolicyTable build() {
            return new FieldPolicyTable(policies, nested);
        }
    }
}
