package com.bluxguard.api.decision;

import com.bluxguard.api.trip.ThresholdOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("决策词汇表 单元测试")
class DecisionTest {

    @Nested
    @DisplayName("严重级别")
    class SeverityTests {

        @Test
        @DisplayName("max() 应返回更严格的决策")
        void maxShouldPickStricterDecision() {
            assertEquals(Decision.BLOCK, Decision.ALLOW.max(Decision.BLOCK));
            assertEquals(Decision.REQUIRE_CONFIRM, Decision.REQUIRE_CONFIRM.max(Decision.WARN));
            assertEquals(Decision.WARN, Decision.WARN.max(null));
        }

        @Test
        @DisplayName("BLOCK 至少与所有决策同级")
        void blockIsAtLeastEverything() {
            for (Decision d : Decision.values()) {
                assertTrue(Decision.BLOCK.isAtLeast(d));
            }
        }
    }

    @Nested
    @DisplayName("宽松解析")
    class ParsingTests {

        @Test
        @DisplayName("风险等级大小写不敏感")
        void riskBandIsCaseInsensitive() {
            assertEquals(RiskBand.CRITICAL, RiskBand.fromValue("Critical"));
            assertNull(RiskBand.fromValue("extreme"));
            assertNull(RiskBand.fromValue(null));
        }

        @Test
        @DisplayName("阈值运算符比较窗口计数")
        void thresholdOperatorComparesCounts() {
            assertTrue(ThresholdOperator.fromValue("gt").test(6, 5));
            assertFalse(ThresholdOperator.GT.test(5, 5));
            assertTrue(ThresholdOperator.LTE.test(5, 5));
            assertNull(ThresholdOperator.fromValue("between"));
        }
    }
}
