package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class MatchCondition implements Condition {

    public static final String TYPE = "match";

    String field;
    JsonNode expected;

    @Override
    public boolean evaluate(RuleContext context) {
        return EventFields.valueEquals(EventFields.lookup(context.getEvent(), field), expected);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
