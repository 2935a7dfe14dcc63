package com.spring.fateweaver.dto.quest;

import jakarta.validation.constraints.NotNull;

public record ObjectiveUpdateRequest(@NotNull Boolean completed) {}
