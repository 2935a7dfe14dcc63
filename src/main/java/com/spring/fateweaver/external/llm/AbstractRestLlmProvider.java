package com.spring.fateweaver.external.llm;

import com.spring.fateweaver.exception.ProviderFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * RestClient 기반 프로바이더 공통 골격
 *
 * - 지수 백오프 재시도: 일시적 오류(429, 5xx, 타임아웃) 자동 복구
 * - 재시도 불가 상태(400, 401 등)는 즉시 실패
 * - 응답 본문이 비어있으면 재시도 없이 실패
 */
@Slf4j
public abstract class AbstractRestLlmProvider implements LlmProvider {

    protected final RestClient restClient;
    protected final String model;
    private final RetryPolicy retryPolicy;

    protected AbstractRestLlmProvider(RestClient restClient, String model, RetryPolicy retryPolicy) {
        this.restClient = restClient;
        this.model = model;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String model() {
        return model;
    }

    /** 단일 HTTP 호출. 내용이 없으면 null 텍스트를 담아 반환 */
    protected abstract LlmCompletion call(LlmRequest request);

    @Override
    public LlmCompletion complete(LlmRequest request) {
        RuntimeException lastException = null;
        int maxRetries = retryPolicy.maxRetries();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    long backoff = retryPolicy.backoffFor(attempt);
                    log.warn("🔄 [RETRY] {} attempt {}/{} after {}ms | model={}",
                        type(), attempt, maxRetries, backoff, model);
                    Thread.sleep(backoff);
                }

                LlmCompletion completion = call(request);

                if (completion == null || completion.text() == null || completion.text().isBlank()) {
                    throw new ProviderFailureException(type() + " returned no content. model=" + model);
                }

                if (attempt > 0) {
                    log.info("✅ [RETRY] {} succeeded on attempt {}", type(), attempt + 1);
                }
                return completion;

            } catch (RestClientResponseException e) {
                lastException = e;
                int statusCode = e.getStatusCode().value();

                if (!retryPolicy.isRetryable(statusCode)) {
                    log.error("❌ [RETRY] {} non-retryable error {}. body={}",
                        type(), statusCode, abbreviate(e.getResponseBodyAsString()));
                    throw new ProviderFailureException(type() + " call failed (" + statusCode + ")", e);
                }

                log.warn("⚠️ [RETRY] {} retryable error {} on attempt {}/{} | body={}",
                    type(), statusCode, attempt + 1, maxRetries + 1, abbreviate(e.getResponseBodyAsString()));

            } catch (ResourceAccessException e) {
                lastException = e;
                log.warn("⚠️ [RETRY] {} I/O error on attempt {}/{}: {}",
                    type(), attempt + 1, maxRetries + 1, e.getMessage());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderFailureException(type() + " retry interrupted", e);
            }
        }

        log.error("❌ [RETRY] All {} attempts exhausted for {} model={}", maxRetries + 1, type(), model);
        throw new ProviderFailureException(
            type() + " call failed after " + (maxRetries + 1) + " attempts", lastException);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.substring(0, Math.min(200, body.length()));
    }
}
