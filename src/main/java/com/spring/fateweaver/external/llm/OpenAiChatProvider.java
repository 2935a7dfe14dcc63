package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.domain.enums.ProviderType;
import com.spring.fateweaver.dto.openai.OpenAiChatRequest;
import com.spring.fateweaver.dto.openai.OpenAiChatResponse;
import com.spring.fateweaver.dto.openai.OpenAiMessage;
import com.spring.fateweaver.dto.turn.ChatMessage;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Chat Completions
 */
public class OpenAiChatProvider extends AbstractRestLlmProvider {

    public OpenAiChatProvider(RestClient restClient, String model, RetryPolicy retryPolicy) {
        super(restClient, model, retryPolicy);
    }

    @Override
    public ProviderType type() {
        return ProviderType.OPENAI;
    }

    @Override
    protected LlmCompletion call(LlmRequest request) {
        List<OpenAiMessage> messages = new ArrayList<>();
        messages.add(OpenAiMessage.system(request.systemPrompt()));
        for (ChatMessage m : request.safeHistory()) {
            messages.add(m.isUser() ? OpenAiMessage.user(m.content()) : OpenAiMessage.assistant(m.content()));
        }
        messages.add(OpenAiMessage.user(request.userMessage()));

        OpenAiChatResponse response = restClient.post()
            .uri("/chat/completions")
            .body(OpenAiChatRequest.of(model, messages, request.temperature(), request.maxTokens(), request.jsonMode()))
            .retrieve()
            .body(OpenAiChatResponse.class);

        if (response == null) return null;
        TokenUsage usage = response.usage() == null ? TokenUsage.ZERO
            : new TokenUsage(response.usage().promptTokens(), response.usage().completionTokens());
        return new LlmCompletion(response.firstContent(), usage, model);
    }
}
