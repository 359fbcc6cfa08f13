package com.bluxguard.core.trip.condition;

import com.bluxguard.core.trip.RuleContext;

/**
 * 规则条件树节点
 */
public interface Condition {

    boolean evaluate(RuleContext context);

    /**
     * 条件类型，对应规则文件中的 type 字段
     */
    String type();
}
