package com.bluxguard.core.trip;

import lombok.Value;

import java.util.List;

/**
 * 启动时加载一次的规则集合，之后只读
 */
@Value
public class RuleSet {
    List<TripRule> rules;
    String source;

    public static RuleSet empty() {
        return new RuleSet(List.of(), "<none>");
    }

    public long invalidCount() {
        return rules.stream().filter(r -> !r.isValid()).count();
    }
}
