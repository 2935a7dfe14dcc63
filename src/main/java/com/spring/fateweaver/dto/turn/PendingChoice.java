package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingChoice(
    @NotBlank String prompt,
    @NotEmpty List<String> options,
    String choiceType
) {}
