package com.bluxguard.core.audit;

import java.util.Locale;

/**
 * 审计链校验结论
 */
public enum ChainStatus {
    /**
     * 日志文件不存在
     */
    MISSING,
    EMPTY,
    CLEAN,
    /**
     * 存在无法解析的行
     */
    CORRUPT,
    /**
     * 重算摘要与记录的锚点不一致
     */
    TAMPERED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHealthy() {
        return this == CLEAN || this == EMPTY;
    }
}
