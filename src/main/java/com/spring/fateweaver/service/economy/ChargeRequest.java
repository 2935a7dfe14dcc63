package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.external.llm.TokenUsage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param pendingChargeId 저장 단계에서 만든 PendingCharge (없으면 null)
 * @param usageByModel    모델 키 → 토큰 사용량
 */
public record ChargeRequest(
    Long userId,
    Long pendingChargeId,
    int cost,
    Map<String, TokenUsage> usageByModel
) {
    static final String PROMPT = "prompt";
    static final String COMPLETION = "completion";

    public TokenUsage totalUsage() {
        return usageByModel.values().stream().reduce(TokenUsage.ZERO, TokenUsage::plus);
    }

    /** PendingCharge.usage 문서 형식 */
    public static Map<String, Object> usageDocument(Map<String, TokenUsage> usageByModel) {
        Map<String, Object> doc = new LinkedHashMap<>();
        usageByModel.forEach((model, usage) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(PROMPT, usage.promptTokens());
            entry.put(COMPLETION, usage.completionTokens());
            doc.put(model, entry);
        });
        return doc;
    }

    public static Map<String, TokenUsage> usageFromDocument(Map<String, Object> doc) {
        Map<String, TokenUsage> usage = new LinkedHashMap<>();
        doc.forEach((model, raw) -> {
            if (raw instanceof Map<?, ?> entry) {
                usage.put(model, new TokenUsage(intValue(entry.get(PROMPT)), intValue(entry.get(COMPLETION))));
            }
        });
        return usage;
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
