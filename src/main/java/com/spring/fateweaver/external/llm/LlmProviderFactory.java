package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.config.LlmProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * 라우팅된 모델 → 프로바이더 구현 생성
 * - 파이프라인은 LlmProvider 인터페이스만 사용한다.
 */
@Component
@RequiredArgsConstructor
public class LlmProviderFactory {

    static final String DEFAULT_ANTHROPIC_VERSION = "2023-06-01";

    private final RestClient.Builder restClientBuilder;
    private final ModelRouter modelRouter;

    public LlmProvider create(ResolvedModel resolved) {
        LlmProperties.ProviderSettings settings = modelRouter.settingsFor(resolved.provider());
        String baseUrl = settings == null ? null : settings.baseUrl();

        RestClient.Builder builder = restClientBuilder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        return switch (resolved.provider()) {
            case OPENAI -> new OpenAiChatProvider(
                builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + resolved.apiKey()).build(),
                resolved.modelId(), RetryPolicy.DEFAULT);
            case ANTHROPIC -> new AnthropicMessagesProvider(
                builder.defaultHeader("x-api-key", resolved.apiKey())
                    .defaultHeader("anthropic-version",
                        settings != null && settings.apiVersion() != null ? settings.apiVersion() : DEFAULT_ANTHROPIC_VERSION)
                    .build(),
                resolved.modelId(), RetryPolicy.DEFAULT);
            case GOOGLE -> new GeminiProvider(
                builder.defaultHeader("x-goog-api-key", resolved.apiKey()).build(),
                resolved.modelId(), RetryPolicy.DEFAULT);
        };
    }
}
