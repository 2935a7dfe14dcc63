package com.spring.fateweaver.exception;

public class TurnInProgressException extends BusinessException {
    public TurnInProgressException(String campaignId) {
        super(ErrorCode.TURN_IN_PROGRESS,
            "Another action is still being resolved for this campaign. campaignId=" + campaignId);
    }
}
