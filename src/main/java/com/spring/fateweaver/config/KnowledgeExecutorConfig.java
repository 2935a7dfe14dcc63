package com.spring.fateweaver.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 참고 자료 병렬 조회용 스레드 풀
 * - 스레드 이름 knowledge-N
 * - 큐가 가득 차면 호출 스레드에서 실행 (조회가 버려지지 않도록)
 */
@Configuration
public class KnowledgeExecutorConfig {

    @Value("${game.knowledge.pool-size:4}")
    private int poolSize;

    @Value("${game.knowledge.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "knowledgeExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor knowledgeExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "knowledge-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity), tf, new ThreadPoolExecutor.CallerRunsPolicy());
    }
}
