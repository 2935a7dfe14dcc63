package com.spring.fateweaver.domain.enums;

/** 참고 자료를 주입할 대상 모델 */
public enum KnowledgeTarget {
    BRAIN,
    VOICE,
    BOTH;

    public boolean appliesTo(KnowledgeTarget role) {
        return this == BOTH || this == role;
    }
}
