package com.spring.fateweaver.service.knowledge;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.KnowledgeTarget;
import com.spring.fateweaver.domain.world.KnowledgeDocument;
import com.spring.fateweaver.domain.world.KnowledgeDocumentRepository;
import com.spring.fateweaver.service.cache.RedisCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 월드 + global 참고 자료 조회 (Redis Cache-Aside)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeService implements KnowledgeSource {

    private final KnowledgeDocumentRepository knowledgeRepository;
    private final RedisCacheService cacheService;
    private final GameProperties gameProperties;

    @Override
    @Transactional(readOnly = true)
    public List<String> snippets(String worldId, KnowledgeTarget role, int limit) {
        if (limit <= 0) return List.of();

        Optional<List<String>> cached = cacheService.getKnowledge(worldId, role.name());
        if (cached.isPresent()) {
            return cached.get().stream().limit(limit).collect(Collectors.toList());
        }

        List<String> snippets = knowledgeRepository
            .findByWorldIdInAndEnabledTrueOrderByIdAsc(List.of(worldId, KnowledgeDocument.GLOBAL))
            .stream()
            .filter(doc -> doc.getTargetModel().appliesTo(role))
            .map(doc -> "### " + doc.getTitle() + "\n" + doc.getContent())
            .collect(Collectors.toList());

        cacheService.cacheKnowledge(worldId, role.name(), snippets,
            Duration.ofSeconds(gameProperties.knowledge().cacheTtlSeconds()));
        log.debug("📚 [KNOWLEDGE] Loaded {} {} snippets for world={}", snippets.size(), role, worldId);

        return snippets.stream().limit(limit).collect(Collectors.toList());
    }
}
