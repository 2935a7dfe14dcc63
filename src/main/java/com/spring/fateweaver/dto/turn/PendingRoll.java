package com.spring.fateweaver.dto.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Brain이 요청한 플레이어 굴림. 호출자는 이 객체를 그대로 다음 요청에 돌려준다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingRoll(
    String type,
    String purpose,
    Integer modifier,
    String stat,
    Integer difficulty,
    Boolean proficient,
    Integer itemBonus,
    List<String> advantageSources,
    List<String> disadvantageSources
) {
    public static final String DEFAULT_TYPE = "d20";

    public PendingRoll withDefaultType() {
        if (type != null && !type.isBlank()) return this;
        return new PendingRoll(DEFAULT_TYPE, purpose, modifier, stat, difficulty, proficient, itemBonus,
            advantageSources, disadvantageSources);
    }

    public String notation() {
        return type == null || type.isBlank() ? DEFAULT_TYPE : type;
    }
}
