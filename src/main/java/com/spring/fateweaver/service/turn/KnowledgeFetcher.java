package com.spring.fateweaver.service.turn;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.KnowledgeTarget;
import com.spring.fateweaver.service.knowledge.KnowledgeSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Brain/Voice 참고 자료를 병렬 조회한다. 조회 실패는 빈 목록으로 대체
 */
@Component
@Slf4j
public class KnowledgeFetcher {

    private final KnowledgeSource knowledgeSource;
    private final GameProperties gameProperties;
    private final Executor executor;

    public KnowledgeFetcher(KnowledgeSource knowledgeSource,
                            GameProperties gameProperties,
                            @Qualifier("knowledgeExecutor") Executor executor) {
        this.knowledgeSource = knowledgeSource;
        this.gameProperties = gameProperties;
        this.executor = executor;
    }

    public KnowledgeBundle fetch(String worldId) {
        long start = System.currentTimeMillis();
        GameProperties.Knowledge limits = gameProperties.knowledge();

        CompletableFuture<List<String>> brain = lookup(worldId, KnowledgeTarget.BRAIN, limits.brainLimit());
        CompletableFuture<List<String>> voice = lookup(worldId, KnowledgeTarget.VOICE, limits.voiceLimit());

        KnowledgeBundle bundle = new KnowledgeBundle(brain.join(), voice.join());
        log.info("⏱️ [PERF] Knowledge fetch: {}ms (brain={}, voice={})",
            System.currentTimeMillis() - start, bundle.brain().size(), bundle.voice().size());
        return bundle;
    }

    private CompletableFuture<List<String>> lookup(String worldId, KnowledgeTarget target, int limit) {
        return CompletableFuture
            .supplyAsync(() -> knowledgeSource.snippets(worldId, target, limit), executor)
            .exceptionally(e -> {
                log.warn("⚠️ [KNOWLEDGE] {} lookup failed for world={}: {}", target, worldId, e.getMessage());
                return List.of();
            });
    }
}
