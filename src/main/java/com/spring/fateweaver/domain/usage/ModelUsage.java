package com.spring.fateweaver.domain.usage;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "model_usage", uniqueConstraints = {
    @UniqueConstraint(name = "uk_usage_user_model", columnNames = {"user_id", "model_key"})
})
/**
 * 사용자 × 모델별 토큰 누계
 */
public class ModelUsage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** 모델 id (점은 밑줄로 치환) */
    @Column(name = "model_key", nullable = false, length = 80)
    private String modelKey;

    @Column(name = "prompt_tokens", nullable = false)
    private long promptTokens;

    @Column(name = "completion_tokens", nullable = false)
    private long completionTokens;

    @Column(name = "total_tokens", nullable = false)
    private long totalTokens;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ModelUsage start(Long userId, String modelKey) {
        ModelUsage usage = new ModelUsage();
        usage.userId = userId;
        usage.modelKey = modelKey;
        usage.updatedAt = LocalDateTime.now();
        return usage;
    }

    public void add(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
        this.totalTokens += prompt + completion;
        this.updatedAt = LocalDateTime.now();
    }
}
