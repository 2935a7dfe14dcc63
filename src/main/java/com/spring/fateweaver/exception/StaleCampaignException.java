package com.spring.fateweaver.exception;

/**
 * 턴을 해석하는 동안 다른 턴이 같은 캠페인을 먼저 저장한 경우
 * - 저장 트랜잭션 안에서 감지되므로 과금되지 않는다.
 */
public class StaleCampaignException extends BusinessException {
    public StaleCampaignException(String campaignId, Long expectedVersion, long actualVersion) {
        super(ErrorCode.TURN_IN_PROGRESS,
            "The campaign changed while this action was being resolved. Your turn was NOT charged. Please try again. "
                + "campaignId=" + campaignId + " expectedVersion=" + expectedVersion + " actualVersion=" + actualVersion);
    }
}
