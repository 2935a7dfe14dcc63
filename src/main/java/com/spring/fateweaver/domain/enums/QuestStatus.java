package com.spring.fateweaver.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestStatus {
    ACTIVE,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QuestStatus from(String value) {
        return QuestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
