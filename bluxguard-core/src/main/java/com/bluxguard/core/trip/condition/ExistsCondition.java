package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class ExistsCondition implements Condition {

    public static final String TYPE = "exists";

    String field;

    @Override
    public boolean evaluate(RuleContext context) {
        JsonNode value = EventFields.lookup(context.getEvent(), field);
        return value != null && !value.isNull();
    }

    @Override
    public String type() {
        return TYPE;
    }
}
