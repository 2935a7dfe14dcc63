package com.spring.fateweaver.controller;

import com.spring.fateweaver.dto.turn.TurnRequest;
import com.spring.fateweaver.dto.turn.TurnResponse;
import com.spring.fateweaver.exception.ValidationException;
import com.spring.fateweaver.security.CampaignGuard;
import com.spring.fateweaver.service.turn.TurnPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

/**
 * 턴 해석 API
 *
 * POST /api/v1/campaigns/{campaignId}/turns
 * - 실패도 TurnResponse(success=false) 본문으로 내려가며, HTTP 상태는 에러 코드를 따른다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/campaigns")
public class TurnController {

    private final TurnPipeline turnPipeline;

    @PostMapping("/{campaignId}/turns")
    @PreAuthorize("@campaignGuard.isOwner(#campaignId, principal.subject)")
    public ResponseEntity<TurnResponse> resolveTurn(
        @PathVariable String campaignId,
        @RequestBody @Valid TurnRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        if (!campaignId.equals(request.campaignId())) {
            throw new ValidationException("campaignId in path and body do not match.");
        }
        TurnResponse response = turnPipeline.resolveTurn(CampaignGuard.parseUserId(jwt.getSubject()), request);
        int status = response.success() ? 200 : response.errorCode().httpStatus();
        return ResponseEntity.status(status).body(response);
    }
}
