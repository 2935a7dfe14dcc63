package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.anthropic.AnthropicRequest;
import com.spring.fateweaver.dto.anthropic.AnthropicResponse;
import com.spring.fateweaver.dto.turn.ChatMessage;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages API
 * - system 프롬프트는 별도 필드, JSON 모드 없음 (프롬프트 지시로 대체)
 */
public class AnthropicMessagesProvider extends AbstractRestLlmProvider {

    static final int DEFAULT_MAX_TOKENS = 3000;

    public AnthropicMessagesProvider(RestClient restClient, String model, RetryPolicy retryPolicy) {
        super(restClient, model, retryPolicy);
    }

    @Override
    public ProviderType type() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    protected LlmCompletion call(LlmRequest request) {
        List<AnthropicRequest.Message> messages = new ArrayList<>();
        for (ChatMessage m : request.safeHistory()) {
            messages.add(new AnthropicRequest.Message(m.isUser() ? "user" : "assistant", m.content()));
        }
        messages.add(new AnthropicRequest.Message("user", request.userMessage()));

        int maxTokens = request.maxTokens() == null ? DEFAULT_MAX_TOKENS : request.maxTokens();
        AnthropicResponse response = restClient.post()
            .uri("/messages")
            .body(new AnthropicRequest(model, maxTokens, request.systemPrompt(), messages, request.temperature()))
            .retrieve()
            .body(AnthropicResponse.class);

        if (response == null) return null;
        TokenUsage usage = response.usage() == null ? TokenUsage.ZERO
            : new TokenUsage(response.usage().inputTokens(), response.usage().outputTokens());
        return new LlmCompletion(response.text(), usage, model);
    }
}
