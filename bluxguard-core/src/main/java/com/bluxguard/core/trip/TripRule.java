package com.bluxguard.core.trip;

import com.bluxguard.core.trip.condition.Condition;
import com.bluxguard.core.trip.condition.InvalidCondition;
import lombok.Builder;
import lombok.Value;

/**
 * 触发规则
 */
@Value
@Builder
public class TripRule {
    String id;
    String name;
    /**
     * 主体字段路径，为空时使用引擎默认值（uid）
     */
    String subjectField;
    /**
     * 命中时建议的响应动作，原样写入事故 meta.response
     */
    String response;
    Condition condition;

    public boolean isValid() {
        return !(condition instanceof InvalidCondition);
    }
}
