package com.spring.fateweaver.service.voice;

import com.spring.fateweaver.dto.brain.NarrativeCue;
import com.spring.fateweaver.dto.turn.ChatMessage;
import com.spring.fateweaver.dto.turn.DiceRoll;
import com.spring.fateweaver.external.llm.ResolvedModel;
import com.spring.fateweaver.service.prompt.WorldProfile;

import java.util.List;
import java.util.Map;

/**
 * @param fallbackCue Voice 실패 시 그대로 돌려줄 Brain 요약
 */
public record NarrationRequest(
    WorldProfile world,
    List<String> knowledge,
    List<NarrativeCue> cues,
    List<DiceRoll> diceRolls,
    Map<String, Object> stateChanges,
    List<ChatMessage> history,
    ResolvedModel model,
    String fallbackCue
) {}
