package com.bluxguard.core.decision;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.api.decision.RiskBand;
import com.bluxguard.api.decision.TokenStatus;
import com.bluxguard.api.decision.Uncertainty;
import com.bluxguard.core.token.TokenReasons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 决策映射引擎
 * <p>
 * 两个阶段：令牌阶段与风险阶段。阶段内首个命中的规则生效，阶段间取严重级别最高者。
 * 无状态、线程安全。
 * </p>
 * <ol>
 *     <li>令牌无效或缺失 → BLOCK（token.invalid / token.missing）</li>
 *     <li>critical → BLOCK（risk.critical）</li>
 *     <li>high → REQUIRE_CONFIRM（risk.high）</li>
 *     <li>medium 且 posture ∈ {low, degraded} → REQUIRE_CONFIRM（posture.low）</li>
 *     <li>medium → WARN（risk.medium）</li>
 *     <li>requires_confirmation → REQUIRE_CONFIRM（discernment.confirmation）</li>
 *     <li>其余 → ALLOW（risk.low）</li>
 * </ol>
 */
public class DecisionMappingEngine {

    public static final String RISK_CRITICAL = "risk.critical";
    public static final String RISK_HIGH = "risk.high";
    public static final String RISK_MEDIUM = "risk.medium";
    public static final String RISK_LOW = "risk.low";
    public static final String POSTURE_LOW = "posture.low";
    public static final String CONFIRMATION = "discernment.confirmation";
    public static final String NO_DISCERNMENT = "discernment.none";
    public static final String UNCERTAINTY_HIGH = "uncertainty.high";

    private static final Set<String> WEAK_POSTURES = Set.of("low", "degraded");

    private final DecisionPolicy policy;

    public DecisionMappingEngine(DecisionPolicy policy) {
        this.policy = policy;
    }

    public DecisionOutcome map(DecisionInput input) {
        List<String> reasons = new ArrayList<>(input.getTokenReasonCodes());

        Decision tokenStage = null;
        if (input.getTokenStatus() == TokenStatus.MISSING) {
            tokenStage = Decision.BLOCK;
            addOnce(reasons, TokenReasons.MISSING);
        } else if (input.getTokenStatus() != TokenStatus.VALID) {
            tokenStage = Decision.BLOCK;
            addOnce(reasons, TokenReasons.INVALID);
        }

        Decision riskStage = riskStage(input, reasons);
        return new DecisionOutcome(riskStage.max(tokenStage), List.copyOf(reasons));
    }

    private Decision riskStage(DecisionInput input, List<String> reasons) {
        if (!input.isDiscernmentPresent()) {
            Decision fallback = policy.getDefaultWithoutDiscernment();
            // 默认放行等同于低风险结论，再追加缺少评估的标记
            if (fallback == Decision.ALLOW) {
                reasons.add(RISK_LOW);
            }
            reasons.add(NO_DISCERNMENT);
            return fallback;
        }
        RiskBand band = input.getRiskBand();
        if (band == RiskBand.CRITICAL) {
            reasons.add(RISK_CRITICAL);
            return Decision.BLOCK;
        }
        if (band == RiskBand.HIGH) {
            reasons.add(RISK_HIGH);
            return Decision.REQUIRE_CONFIRM;
        }
        if (band == RiskBand.MEDIUM && isWeakPosture(input.getPosture())) {
            reasons.add(POSTURE_LOW);
            return Decision.REQUIRE_CONFIRM;
        }
        if (band == RiskBand.MEDIUM) {
            reasons.add(RISK_MEDIUM);
            return Decision.WARN;
        }
        if (input.isRequiresConfirmation()) {
            reasons.add(CONFIRMATION);
            return Decision.REQUIRE_CONFIRM;
        }
        reasons.add(RISK_LOW);
        if (policy.isEscalateOnHighUncertainty() && input.getUncertainty() == Uncertainty.HIGH) {
            reasons.add(UNCERTAINTY_HIGH);
            return Decision.WARN;
        }
        return Decision.ALLOW;
    }

    private static boolean isWeakPosture(String posture) {
        return posture != null && WEAK_POSTURES.contains(posture.trim().toLowerCase(Locale.ROOT));
    }

    private static void addOnce(List<String> reasons, String code) {
        if (!reasons.contains(code)) {
            reasons.add(code);
        }
    }
}
