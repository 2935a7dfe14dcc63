package com.spring.fateweaver.domain.world;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, Long> {

    List<KnowledgeDocument> findByWorldIdInAndEnabledTrueOrderByIdAsc(Collection<String> worldIds);
}
