package com.spring.fateweaver.service.turn;

import java.util.Optional;

/**
 * 캠페인 단위 턴 잠금. 같은 캠페인의 턴은 동시에 하나만 진행된다.
 */
public interface TurnLock {

    /** 이미 다른 턴이 진행 중이면 empty */
    Optional<TurnLockHandle> tryAcquire(String campaignId);

    void release(TurnLockHandle handle);
}
