package com.spring.fateweaver.service.economy;

import com.spring.fateweaver.config.GameProperties;
import com.spring.fateweaver.domain.enums.UserTier;
import com.spring.fateweaver.external.llm.ResolvedModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 턴 비용 = Voice 모델 비용 (UI id → 실제 id → 기본값). 무료 등급은 0
 */
@Component
@RequiredArgsConstructor
public class TurnCostResolver {

    private final GameProperties gameProperties;

    public int cost(ResolvedModel voiceModel, UserTier tier) {
        GameProperties.Economy economy = gameProperties.economy();
        if (tier != null && economy.tiersWithoutCharge().stream().anyMatch(t -> t.equalsIgnoreCase(tier.name()))) {
            return 0;
        }
        Integer byUiId = economy.costs().get(voiceModel.requestedId());
        if (byUiId != null) return byUiId;
        Integer byModelId = economy.costs().get(voiceModel.modelId());
        if (byModelId != null) return byModelId;
        return economy.defaultTurnCost();
    }
}
