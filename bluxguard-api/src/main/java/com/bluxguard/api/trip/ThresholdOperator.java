package com.bluxguard.api.trip;

import java.util.Locale;

/**
 * 阈值规则的比较运算符，比较对象为窗口内事件数
 */
public enum ThresholdOperator {
    GT,
    GTE,
    EQ,
    LT,
    LTE;

    public boolean test(long count, double threshold) {
        switch (this) {
            case GT:
                return count > threshold;
            case GTE:
                return count >= threshold;
            case EQ:
                return count == threshold;
            case LT:
                return count < threshold;
            case LTE:
                return count <= threshold;
            default:
                return false;
        }
    }

    /**
     * 解析运算符，未知值返回 null（规则将被视为非法）
     */
    public static ThresholdOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ThresholdOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
