package com.spring.fateweaver.config;

import com.spring.fateweaver.external.llm.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * 외부 LLM 호출/게임 엔진 공통 Bean 설정
 * - RestClient 는 요청마다 키가 달라질 수 있어(BYOK) LlmProviderFactory 에서 생성한다.
 * - 연결/읽기 타임아웃은 여기서 공통 Builder 에 건다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({LlmProperties.class, GameProperties.class})
public class RestClientConfig {

    /** 한 턴 안에서 순차 호출되는 LLM 단계 수 (Brain, Narrator, Reviewer) */
    static final int LLM_STAGES_PER_TURN = 3;

    /** 엔티티 타임스탬프(LocalDateTime.now())와 같은 시간대를 써야 PendingCharge 경과 시간 비교가 맞는다 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestClientCustomizer llmTimeoutCustomizer(
            @Value("${llm.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${llm.read-timeout-ms:20000}") long readTimeoutMs,
            GameProperties gameProperties) {

        Duration connect = Duration.ofMillis(connectTimeoutMs);
        Duration read = Duration.ofMillis(readTimeoutMs);
        requireWithinTurnLock(connect, read, gameProperties.turnLock().ttlSeconds());

        log.info("🌐 [LLM] HTTP timeouts: connect={}ms, read={}ms", connectTimeoutMs, readTimeoutMs);
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(connect);
            factory.setReadTimeout(read);
            builder.requestFactory(factory);
        };
    }

    /**
     * 재시도까지 포함한 최악의 턴 소요 시간이 턴 잠금 TTL 을 넘으면 기동하지 않는다.
     * TTL 이 먼저 만료되면 같은 캠페인의 다른 턴이 잠금을 얻을 수 있다.
     */
    static long requireWithinTurnLock(Duration connect, Duration read, long ttlSeconds) {
        long perAttempt = connect.plus(read).toMillis();
        long worstCaseMs = LLM_STAGES_PER_TURN * RetryPolicy.DEFAULT.worstCaseMillis(perAttempt);
        if (worstCaseMs >= ttlSeconds * 1000) {
            throw new IllegalStateException("Worst-case turn duration " + worstCaseMs
                + "ms reaches game.turn-lock.ttl-seconds=" + ttlSeconds
                + ". Lower llm.read-timeout-ms / llm.connect-timeout-ms or raise the lock TTL.");
        }
        return worstCaseMs;
    }
}
