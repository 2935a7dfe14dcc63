package com.spring.fateweaver.dto.campaign;

import com.spring.fateweaver.domain.enums.ChatRole;

import java.time.LocalDateTime;

public record TranscriptEntryResponse(
    Long id,
    ChatRole role,
    String content,
    String modelId,
    Integer turnCost,
    LocalDateTime createdAt
) {}
