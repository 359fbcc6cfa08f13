package com.bluxguard.api.decision;

/**
 * 授权决策枚举
 * <p>
 * 严重级别：ALLOW(0) &lt; WARN(1) &lt; REQUIRE_CONFIRM(2) &lt; BLOCK(3)
 * </p>
 * <p>
 * 多个阶段给出不同结论时，取严重级别最高者。
 * </p>
 */
public enum Decision {
    /**
     * 放行
     */
    ALLOW(0),

    /**
     * 放行但提示风险
     */
    WARN(1),

    /**
     * 需要人工确认
     */
    REQUIRE_CONFIRM(2),

    /**
     * 拒绝
     */
    BLOCK(3);

    private final int severity;

    Decision(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * 获取两个决策中更严格的那个
     *
     * @param other 另一个决策，可为 null
     * @return 严重级别较高的决策
     */
    public Decision max(Decision other) {
        if (other == null) {
            return this;
        }
        return this.severity >= other.severity ? this : other;
    }

    public boolean isAtLeast(Decision other) {
        return this.severity >= other.severity;
    }
}
