package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;
import lombok.Value;

import java.util.List;

/**
 * or：短路求值
 */
@Value
public class AnyOfCondition implements Condition {

    public static final String TYPE = "or";

    List<Condition> clauses;

    @Override
    public boolean evaluate(RuleContext context) {
        for (Condition clause : clauses) {
            if (clause.evaluate(context)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
