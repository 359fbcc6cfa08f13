package com.bluxguard.core.trip;

/**
 * 规则状态机：IDLE → EVALUATING → (MATCHED | NOT_MATCHED)，每个事件重新进入
 */
public enum RuleState {
    IDLE,
    EVALUATING,
    MATCHED,
    NOT_MATCHED
}
