package com.spring.fateweaver.domain.world;

import com.spring.fateweaver.domain.enums.WorldEngine;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "worlds")
/**
 * 월드 모듈 정의 (관리자 대시보드에서 등록)
 * - rulesText/narrativeStyle 이 비어있으면 엔진 기본 텍스트 사용
 */
public class WorldDefinition {

    @Id
    @Column(length = 60)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WorldEngine engine;

    @Column(name = "rules_text", columnDefinition = "TEXT")
    private String rulesText;

    @Column(name = "narrative_style", columnDefinition = "TEXT")
    private String narrativeStyle;

    public static WorldDefinition of(String id, String name, WorldEngine engine, String rulesText, String narrativeStyle) {
        WorldDefinition w = new WorldDefinition();
        w.id = id;
        w.name = name;
        w.engine = engine;
        w.rulesText = rulesText;
        w.narrativeStyle = narrativeStyle;
        return w;
    }
}
