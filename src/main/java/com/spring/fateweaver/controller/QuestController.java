package com.spring.fateweaver.controller;

import com.spring.fateweaver.dto.campaign.CampaignStateResponse;
import com.spring.fateweaver.dto.quest.ObjectiveUpdateRequest;
import com.spring.fateweaver.dto.quest.QuestStatusRequest;
import com.spring.fateweaver.service.quest.QuestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * 퀘스트 로그 API
 *
 * POST  /{questId}/accept | /decline | /track
 * PATCH /{questId}/objectives/{index}
 * PATCH /{questId}/status
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/campaigns/{campaignId}/quests")
public class QuestController {

    private final QuestService questService;

    @PostMapping("/{questId}/accept")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse accept(@PathVariable String campaignId, @PathVariable String questId) {
        return questService.accept(campaignId, questId);
    }

    @PostMapping("/{questId}/decline")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse decline(@PathVariable String campaignId, @PathVariable String questId) {
        return questService.decline(campaignId, questId);
    }

    @PostMapping("/{questId}/track")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse track(@PathVariable String campaignId, @PathVariable String questId) {
        return questService.track(campaignId, questId);
    }

    @PatchMapping("/{questId}/objectives/{index}")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse updateObjective(
        @PathVariable String campaignId,
        @PathVariable String questId,
        @PathVariable int index,
        @RequestBody @Valid ObjectiveUpdateRequest request
    ) {
        return questService.updateObjective(campaignId, questId, index, request.completed());
    }

    @PatchMapping("/{questId}/status")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse setStatus(
        @PathVariable String campaignId,
        @PathVariable String questId,
        @RequestBody @Valid QuestStatusRequest request
    ) {
        return questService.setStatus(campaignId, questId, request.status());
    }
}
