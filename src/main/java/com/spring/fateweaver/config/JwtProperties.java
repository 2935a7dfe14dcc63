package com.spring.fateweaver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JWT 검증 설정. 토큰은 계정 서비스가 발급하고 이 서버는 검증만 한다.
 *
 * @param secret Base64 인코딩된 HS256 키
 */
@ConfigurationProperties(prefix = "auth.jwt")
public record JwtProperties(
    String issuer,
    String secret
) {}
