package com.bluxguard.api.decision;

import java.util.Locale;

/**
 * 风险评估的不确定度
 */
public enum Uncertainty {
    LOW,
    MEDIUM,
    HIGH;

    public static Uncertainty fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Uncertainty.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
