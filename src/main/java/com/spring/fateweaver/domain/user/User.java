package com.spring.fateweaver.domain.user;

import com.spring.fateweaver.domain.enums.UserTier;
import com.spring.fateweaver.exception.InsufficientBalanceException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_username", columnList = "username", unique = true)
})
/**
 * 사용자 계정 + 턴 원장
 * - turnBalance: 남은 턴 (행동력)
 * - turnsUsed / token 카운터: 저장에 성공한 턴마다 정확히 한 번 증가
 * - 계정 발급(가입/로그인)은 외부 인증 서비스 담당. 여기서는 JWT subject = id
 */
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50, unique = true)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserTier tier = UserTier.SCOUT;

    @Column(name = "turn_balance", nullable = false)
    private int turnBalance;

    @Column(name = "turns_used", nullable = false)
    private long turnsUsed;

    @Column(name = "prompt_tokens", nullable = false)
    private long promptTokens;

    @Column(name = "completion_tokens", nullable = false)
    private long completionTokens;

    @Column(name = "total_tokens", nullable = false)
    private long totalTokens;

    /** 사용자가 고른 Brain/Voice 모델 (UI id). null 이면 서버 기본값 */
    @Column(name = "brain_model", length = 60)
    private String brainModel;

    @Column(name = "voice_model", length = 60)
    private String voiceModel;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_turn_at")
    private LocalDateTime lastTurnAt;

    @PrePersist
    void prePersist() {
        this.createdAt = LocalDateTime.now();
    }

    public static User of(String username, UserTier tier, int turnBalance) {
        User u = new User();
        u.username = username;
        u.tier = tier;
        u.turnBalance = turnBalance;
        return u;
    }

    /**
     * 턴 비용 차감. 잔액이 부족하면 InsufficientBalanceException
     */
    public void debitTurns(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        if (this.turnBalance < amount) {
            throw new InsufficientBalanceException(amount, this.turnBalance);
        }
        this.turnBalance -= amount;
        this.turnsUsed++;
        this.lastTurnAt = LocalDateTime.now();
    }

    public void addTokenUsage(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
        this.totalTokens += prompt + completion;
    }

    public void grantTurns(int amount) {
        this.turnBalance += amount;
    }

    public void updateModels(String brainModel, String voiceModel) {
        this.brainModel = brainModel;
        this.voiceModel = voiceModel;
    }
}
