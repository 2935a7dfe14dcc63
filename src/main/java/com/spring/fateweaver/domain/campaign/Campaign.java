package com.spring.fateweaver.domain.campaign;

import com.spring.fateweaver.domain.user.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "campaigns", indexes = {
    @Index(name = "idx_campaign_user", columnList = "user_id, updated_at")
})
/**
 * 캠페인 = 한 사용자의 한 플레이 세션
 * - state: GameState 문서 (State Merger 결과만 기록)
 */
public class Campaign {

    @Id
    @Column(length = 64)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "world_id", nullable = false, length = 60)
    private String worldId;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> state = new LinkedHashMap<>();

    @Column(name = "turn_count", nullable = false)
    private int turnCount;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public static Campaign start(String id, User user, String worldId, Map<String, Object> initialState) {
        Campaign c = new Campaign();
        c.id = id;
        c.user = user;
        c.worldId = worldId;
        c.state = initialState == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialState);
        return c;
    }

    /** 턴 결과 반영 */
    public void applyTurn(Map<String, Object> mergedState) {
        this.state = new LinkedHashMap<>(mergedState);
        this.turnCount++;
    }

    /** 퀘스트 수락/거절 등 턴 외 연산 결과 반영 */
    public void replaceState(Map<String, Object> nextState) {
        this.state = new LinkedHashMap<>(nextState);
    }
}
