package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;
import lombok.Value;

/**
 * 非法规则的占位条件，永不命中
 */
@Value
public class InvalidCondition implements Condition {

    public static final String TYPE = "invalid";

    String error;

    @Override
    public boolean evaluate(RuleContext context) {
        return false;
    }

    @Override
    public String type() {
        return TYPE;
    }
}
