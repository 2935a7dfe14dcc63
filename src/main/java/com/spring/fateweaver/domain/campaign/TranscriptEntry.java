package com.spring.fateweaver.domain.campaign;

import com.spring.fateweaver.domain.enums.ChatRole;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "transcript_entries", indexes = {
    @Index(name = "idx_transcript_campaign_created", columnList = "campaign_id, created_at")
})
/**
 * 캠페인 대화 기록 (플레이어 행동 / 나레이션)
 */
public class TranscriptEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChatRole role;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    /** 나레이션을 생성한 Voice 모델 */
    @Column(name = "model_id", length = 80)
    private String modelId;

    @Column(name = "turn_cost")
    private Integer turnCost;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        this.createdAt = LocalDateTime.now();
    }

    private TranscriptEntry(Campaign campaign, ChatRole role, String content, String modelId, Integer turnCost) {
        this.campaign = campaign;
        this.role = role;
        this.content = content;
        this.modelId = modelId;
        this.turnCost = turnCost;
    }

    public static TranscriptEntry user(Campaign campaign, String content) {
        return new TranscriptEntry(campaign, ChatRole.USER, content, null, null);
    }

    public static TranscriptEntry narrator(Campaign campaign, String content, String modelId, int turnCost) {
        return new TranscriptEntry(campaign, ChatRole.NARRATOR, content, modelId, turnCost);
    }
}
