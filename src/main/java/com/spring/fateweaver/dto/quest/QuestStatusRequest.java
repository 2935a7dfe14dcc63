package com.spring.fateweaver.dto.quest;

import com.spring.fateweaver.domain.enums.QuestStatus;
import jakarta.validation.constraints.NotNull;

public record QuestStatusRequest(@NotNull QuestStatus status) {}
