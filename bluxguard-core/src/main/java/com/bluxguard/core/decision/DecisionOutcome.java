package com.bluxguard.core.decision;

import com.bluxguard.api.decision.Decision;
import lombok.Value;

import java.util.List;

@Value
public class DecisionOutcome {
    Decision decision;
    /**
     * 按阶段顺序累积的全部原因码（非仅决定性的那条）
     */
    List<String> reasonCodes;
}
