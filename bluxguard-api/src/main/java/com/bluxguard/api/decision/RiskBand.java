package com.bluxguard.api.decision;

import java.util.Locale;

/**
 * 风险等级（来自外部 discernment 报告）
 */
public enum RiskBand {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * 宽松解析：大小写不敏感，未知值返回 null
     */
    public static RiskBand fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RiskBand.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
