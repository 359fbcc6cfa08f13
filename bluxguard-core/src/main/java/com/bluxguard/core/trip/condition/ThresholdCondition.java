package com.bluxguard.core.trip.condition;

import com.bluxguard.api.trip.ThresholdOperator;
import com.bluxguard.core.trip.RuleContext;
import lombok.Value;

/**
 * 阈值条件：窗口内含该字段（真值）的事件数与阈值比较
 * <p>
 * 窗口按 (规则, 主体, 字段) 隔离。同一事件对同一窗口最多记录一次。
 * </p>
 */
@Value
public class ThresholdCondition implements Condition {

    public static final String TYPE = "threshold";

    String field;
    ThresholdOperator operator;
    double value;
    int windowSeconds;

    @Override
    public boolean evaluate(RuleContext context) {
        boolean qualifies = EventFields.isTruthy(EventFields.lookup(context.getEvent(), field));
        int count = context.record(field, qualifies, windowSeconds);
        return operator.test(count, value);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
