package com.bluxguard.api.decision;

import java.util.Locale;

/**
 * 能力令牌的汇总状态，写入收据的 token_status 字段
 */
public enum TokenStatus {
    VALID,
    INVALID,
    MISSING;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
