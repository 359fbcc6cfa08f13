package com.bluxguard.core.trip;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * 单条规则对单个事件的求值上下文
 */
@Value
public class RuleContext {
    String ruleId;
    String subject;
    JsonNode event;
    /**
     * 事件到达时间（Unix 秒）
     */
    double now;
    SlidingWindowStore windows;

    /**
     * 在 (规则, 主体, 字段) 窗口中记录本事件，返回窗口内计数
     */
    public int record(String field, boolean qualifying, int windowSeconds) {
        return windows.record(ruleId, subject, field, now, qualifying, windowSeconds);
    }
}
