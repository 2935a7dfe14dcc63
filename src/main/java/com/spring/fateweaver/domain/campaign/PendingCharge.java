package com.spring.fateweaver.domain.campaign;

import com.spring.fateweaver.domain.enums.ChargeStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "pending_charges", indexes = {
    @Index(name = "idx_pending_charge_status", columnList = "status, created_at")
})
/**
 * "저장됨, 아직 과금 안 됨" 기록
 * - 턴 저장 트랜잭션에서 PENDING 으로 생성
 * - 과금 트랜잭션에서 SETTLED, 잔액 부족이면 REJECTED
 * - PENDING 으로 남은 건은 스케줄러가 재시도
 */
public class PendingCharge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false, length = 64)
    private String campaignId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private int cost;

    /** 모델 키 → {prompt, completion} */
    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "usage_json", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> usage = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChargeStatus status = ChargeStatus.PENDING;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @PrePersist
    void prePersist() {
        this.createdAt = LocalDateTime.now();
    }

    public static PendingCharge of(String campaignId, Long userId, int cost, Map<String, Object> usage) {
        PendingCharge p = new PendingCharge();
        p.campaignId = campaignId;
        p.userId = userId;
        p.cost = cost;
        p.usage = usage == null ? new LinkedHashMap<>() : new LinkedHashMap<>(usage);
        return p;
    }

    public boolean isPending() {
        return status == ChargeStatus.PENDING;
    }

    public void settle() {
        this.status = ChargeStatus.SETTLED;
        this.attempts++;
        this.resolvedAt = LocalDateTime.now();
    }

    public void reject() {
        this.status = ChargeStatus.REJECTED;
        this.attempts++;
        this.resolvedAt = LocalDateTime.now();
    }
}
