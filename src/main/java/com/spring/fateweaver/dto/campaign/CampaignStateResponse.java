package com.spring.fateweaver.dto.campaign;

import java.util.Map;

public record CampaignStateResponse(
    String campaignId,
    String worldId,
    Map<String, Object> state
) {}
