package com.spring.fateweaver.engine.state;

/** 델타 출처. SYSTEM_MANAGED 필드는 ENGINE 출처만 기록할 수 있다. */
public enum DeltaSource {
    MODEL,
    ENGINE
}
