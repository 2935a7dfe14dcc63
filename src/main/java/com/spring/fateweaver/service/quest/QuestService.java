package com.spring.fateweaver.service.quest;

import com.spring.fateweaver.domain.enums.QuestStatus;
import com.spring.fateweaver.dto.campaign.CampaignStateResponse;
import com.spring.fateweaver.engine.state.QuestLog;
import com.spring.fateweaver.exception.NotFoundException;
import com.spring.fateweaver.exception.TurnInProgressException;
import com.spring.fateweaver.exception.ValidationException;
import com.spring.fateweaver.service.turn.CampaignSnapshot;
import com.spring.fateweaver.service.turn.CampaignStore;
import com.spring.fateweaver.service.turn.TurnLock;
import com.spring.fateweaver.service.turn.TurnLockHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 퀘스트 로그 조작 (수락/거절/목표/상태)
 * - 턴과 같은 잠금 아래에서 실행되어 진행 중인 턴의 병합 결과를 덮어쓰지 않는다.
 * - 제안 → 로그 이동은 여기서만 일어난다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuestService {

    private final CampaignStore campaignStore;
    private final TurnLock turnLock;
    private final QuestLog questLog;

    public CampaignStateResponse getState(String campaignId) {
        CampaignSnapshot snapshot = load(campaignId);
        return new CampaignStateResponse(snapshot.campaignId(), snapshot.worldId(), snapshot.state());
    }

    public CampaignStateResponse accept(String campaignId, String questId) {
        return update(campaignId, "accept " + questId, state -> questLog.accept(state, questId));
    }

    public CampaignStateResponse decline(String campaignId, String questId) {
        return update(campaignId, "decline " + questId, state -> questLog.decline(state, questId));
    }

    public CampaignStateResponse updateObjective(String campaignId, String questId, int index, boolean completed) {
        return update(campaignId, "objective " + questId + "#" + index,
            state -> questLog.updateObjective(state, questId, index, completed));
    }

    public CampaignStateResponse setStatus(String campaignId, String questId, QuestStatus status) {
        return update(campaignId, "status " + questId + " -> " + status.value(),
            state -> questLog.setStatus(state, questId, status));
    }

    public CampaignStateResponse track(String campaignId, String questId) {
        return update(campaignId, "track " + questId, state -> questLog.setActive(state, questId));
    }

    private CampaignStateResponse update(String campaignId, String operation,
                                         UnaryOperator<Map<String, Object>> change) {
        TurnLockHandle lock = turnLock.tryAcquire(campaignId)
            .orElseThrow(() -> new TurnInProgressException(campaignId));
        try {
            CampaignSnapshot snapshot = load(campaignId);
            Map<String, Object> next;
            try {
                next = change.apply(snapshot.state());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
            campaignStore.saveState(campaignId, next);
            log.info("📜 [QUEST] campaign={} {}", campaignId, operation);
            return new CampaignStateResponse(campaignId, snapshot.worldId(), next);
        } finally {
            turnLock.release(lock);
        }
    }

    private CampaignSnapshot load(String campaignId) {
        return campaignStore.load(campaignId)
            .orElseThrow(() -> new NotFoundException("Campaign not found: " + campaignId));
    }
}
