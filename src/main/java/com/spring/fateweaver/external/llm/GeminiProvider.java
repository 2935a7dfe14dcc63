package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.gemini.GeminiRequest;
import com.spring.fateweaver.dto.gemini.GeminiResponse;
import com.spring.fateweaver.dto.turn.ChatMessage;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Gemini generateContent
 * - 대화 기록은 user/model role 로 변환
 * - Gemini 는 대화가 user 로 시작해야 하므로 앞쪽 model 메시지는 버린다
 */
public class GeminiProvider extends AbstractRestLlmProvider {

    public GeminiProvider(RestClient restClient, String model, RetryPolicy retryPolicy) {
        super(restClient, model, retryPolicy);
    }

    @Override
    public ProviderType type() {
        return ProviderType.GOOGLE;
    }

    @Override
    protected LlmCompletion call(LlmRequest request) {
        List<GeminiRequest.Content> contents = new ArrayList<>();
        for (ChatMessage m : request.safeHistory()) {
            if (contents.isEmpty() && !m.isUser()) continue;
            contents.add(GeminiRequest.Content.of(m.isUser() ? "user" : "model", m.content()));
        }
        contents.add(GeminiRequest.Content.of("user", request.userMessage()));

        GeminiRequest body = new GeminiRequest(
            GeminiRequest.Content.of(null, request.systemPrompt()),
            contents,
            new GeminiRequest.GenerationConfig(
                request.temperature(),
                request.maxTokens(),
                request.jsonMode() ? "application/json" : null)
        );

        GeminiResponse response = restClient.post()
            .uri("/models/{model}:generateContent", model)
            .body(body)
            .retrieve()
            .body(GeminiResponse.class);

        if (response == null) return null;
        TokenUsage usage = response.usageMetadata() == null ? TokenUsage.ZERO
            : new TokenUsage(response.usageMetadata().promptTokenCount(), response.usageMetadata().candidatesTokenCount());
        return new LlmCompletion(response.text(), usage, model);
    }
}
