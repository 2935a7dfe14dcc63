package com.spring.fateweaver.service.turn;

import java.util.Map;
import java.util.Optional;

/**
 * 캠페인 저장소 포트
 */
public interface CampaignStore {

    Optional<CampaignSnapshot> load(String campaignId);

    /**
     * 상태, 대화 기록, PendingCharge 를 하나의 트랜잭션으로 저장한다.
     * 캠페인이 없으면 이 시점에 생성된다.
     *
     * @throws com.spring.fateweaver.exception.PersistenceFailureException 저장 실패 (과금하지 않음)
     */
    SavedTurn saveTurn(TurnRecord record);

    /** 턴 외 연산(퀘스트 수락 등)의 결과 상태 저장 */
    void saveState(String campaignId, Map<String, Object> state);
}
