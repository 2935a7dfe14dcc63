package com.spring.fateweaver.exception;

/** 필요한 역할(Brain/Voice)에 사용할 수 있는 프로바이더 자격증명이 없음 */
public class ConfigurationException extends BusinessException {
    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
