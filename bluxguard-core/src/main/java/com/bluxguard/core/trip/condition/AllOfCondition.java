package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;
import lombok.Value;

import java.util.List;

/**
 * and：短路求值，后续子句（及其窗口）在前一子句失败时不再计算
 */
@Value
public class AllOfCondition implements Condition {

    public static final String TYPE = "and";

    List<Condition> clauses;

    @Override
    public boolean evaluate(RuleContext context) {
        for (Condition clause : clauses) {
            if (!clause.evaluate(context)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
