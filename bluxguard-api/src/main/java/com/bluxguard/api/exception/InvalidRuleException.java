package com.bluxguard.api.exception;

/**
 * 规则定义非法
 */
public class InvalidRuleException extends GuardException {

    private final String ruleId;

    public InvalidRuleException(String ruleId, String message) {
        super("Invalid rule [" + ruleId + "]: " + message);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
