package com.bluxguard.core.trip;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 单个事件的处理结果
 */
@Value
public class TripResult {

    public static final String NO_TRIP = "OK";

    /**
     * 每条命中规则一条紧凑告警
     */
    List<String> alerts;
    List<JsonNode> incidents;
    /**
     * 规则 ID → 终态
     */
    Map<String, RuleState> states;

    public boolean isTripped() {
        return !alerts.isEmpty();
    }

    /**
     * stdin 协议的输出行：告警，或无命中时的 OK
     */
    public List<String> outputLines() {
        return alerts.isEmpty() ? List.of(NO_TRIP) : alerts;
    }
}
