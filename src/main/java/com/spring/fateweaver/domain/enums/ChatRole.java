package com.spring.fateweaver.domain.enums;

public enum ChatRole {
    USER,
    NARRATOR,
    SYSTEM
}
