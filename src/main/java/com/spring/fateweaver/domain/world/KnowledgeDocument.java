package com.spring.fateweaver.domain.world;

import com.spring.fateweaver.domain.enums.KnowledgeTarget;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "knowledge_documents", indexes = {
    @Index(name = "idx_knowledge_world", columnList = "world_id, enabled")
})
/**
 * 프롬프트에 주입되는 참고 자료
 * - worldId = "global" 이면 모든 월드에 적용
 */
public class KnowledgeDocument {

    public static final String GLOBAL = "global";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "world_id", nullable = false, length = 60)
    private String worldId;

    @Column(nullable = false, length = 120)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_model", nullable = false, length = 10)
    private KnowledgeTarget targetModel = KnowledgeTarget.BOTH;

    @Column(nullable = false)
    private boolean enabled = true;

    public static KnowledgeDocument of(String worldId, String title, String content, KnowledgeTarget target) {
        KnowledgeDocument d = new KnowledgeDocument();
        d.worldId = worldId;
        d.title = title;
        d.content = content;
        d.targetModel = target;
        return d;
    }
}
