package com.spring.fateweaver.service.brain;

import com.spring.fateweaver.dto.brain.BrainResult;
import com.spring.fateweaver.external.llm.TokenUsage;

public record BrainTurn(BrainResult result, TokenUsage usage, String modelId) {}
