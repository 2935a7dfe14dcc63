package com.spring.fateweaver.engine.fate;

/**
 * 주사위 난수원. 테스트에서는 고정 시퀀스로 대체한다.
 */
public interface DiceRoller {

    /** 1..sides 범위의 정수 하나 */
    int roll(int sides);
}
