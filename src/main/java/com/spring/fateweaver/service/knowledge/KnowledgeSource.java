package com.spring.fateweaver.service.knowledge;

import com.spring.fateweaver.domain.enums.KnowledgeTarget;

import java.util.List;

/**
 * 프롬프트에 주입할 참고 자료 조회 포트
 */
public interface KnowledgeSource {

    /**
     * @param role  BRAIN 또는 VOICE
     * @param limit 최대 문서 수
     */
    List<String> snippets(String worldId, KnowledgeTarget role, int limit);
}
