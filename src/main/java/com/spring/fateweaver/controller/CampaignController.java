package com.spring.fateweaver.controller;

import com.spring.fateweaver.domain.campaign.TranscriptEntry;
import com.spring.fateweaver.domain.campaign.TranscriptEntryRepository;
import com.spring.fateweaver.dto.campaign.CampaignStateResponse;
import com.spring.fateweaver.dto.campaign.TranscriptEntryResponse;
import com.spring.fateweaver.service.quest.QuestService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * 캠페인 조회 API
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/campaigns")
public class CampaignController {

    private final QuestService questService;
    private final TranscriptEntryRepository transcriptRepository;

    @GetMapping("/{campaignId}/state")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public CampaignStateResponse getState(@PathVariable String campaignId) {
        return questService.getState(campaignId);
    }

    /**
     * 대화 기록 조회 (페이지네이션, 최신순)
     */
    @GetMapping("/{campaignId}/transcript")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public Page<TranscriptEntryResponse> getTranscript(
        @PathVariable String campaignId,
        @RequestParam(defaultValue = "0") int page,
        @RequestParam(defaultValue = "50") int size
    ) {
        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return transcriptRepository.findByCampaign_Id(campaignId, pageable)
            .map(this::toDto);
    }

    private TranscriptEntryResponse toDto(TranscriptEntry entry) {
        return new TranscriptEntryResponse(
            entry.getId(),
            entry.getRole(),
            entry.getContent(),
            entry.getModelId(),
            entry.getTurnCost(),
            entry.getCreatedAt()
        );
    }
}
