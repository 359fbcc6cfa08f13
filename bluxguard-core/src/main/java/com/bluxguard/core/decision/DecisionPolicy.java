package com.bluxguard.core.decision;

import com.bluxguard.api.decision.Decision;
import lombok.Builder;
import lombok.Value;

/**
 * 决策策略开关
 */
@Value
@Builder
public class DecisionPolicy {

    /**
     * 没有 discernment 报告时的默认决策
     */
    @Builder.Default
    Decision defaultWithoutDiscernment = Decision.ALLOW;

    /**
     * 低风险但不确定度为 high 时升级为 WARN
     */
    @Builder.Default
    boolean escalateOnHighUncertainty = false;

    public static DecisionPolicy defaults() {
        return DecisionPolicy.builder().build();
    }
}
