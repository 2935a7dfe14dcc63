package com.spring.fateweaver.dto.brain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeCue(
    @NotBlank @Pattern(regexp = "action|dialogue|description|combat|discovery") String type,
    @NotBlank String content,
    @Pattern(regexp = "neutral|tense|triumphant|mysterious|danger") String emotion
) {
    public static NarrativeCue description(String content) {
        return new NarrativeCue("description", content, null);
    }
}
