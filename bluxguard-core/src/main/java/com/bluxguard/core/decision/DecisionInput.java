package com.bluxguard.core.decision;

import com.bluxguard.api.decision.RiskBand;
import com.bluxguard.api.decision.TokenStatus;
import com.bluxguard.api.decision.Uncertainty;
import com.bluxguard.core.model.DiscernmentReport;
import com.bluxguard.core.token.TokenCheck;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 决策映射的全部输入，决策是它的纯函数
 */
@Value
@Builder
public class DecisionInput {
    TokenStatus tokenStatus;
    @Singular
    List<String> tokenReasonCodes;
    boolean discernmentPresent;
    RiskBand riskBand;
    Uncertainty uncertainty;
    String posture;
    boolean requiresConfirmation;

    public static DecisionInput of(TokenCheck tokens, DiscernmentReport discernment) {
        DecisionInputBuilder builder = DecisionInput.builder()
                .tokenStatus(tokens.getStatus())
                .tokenReasonCodes(tokens.getReasonCodes())
                .discernmentPresent(discernment != null);
        if (discernment != null) {
            builder.riskBand(discernment.riskBand())
                    .uncertainty(discernment.uncertaintyLevel())
                    .posture(discernment.getPosture())
                    .requiresConfirmation(discernment.confirmationRequested());
        }
        return builder.build();
    }
}
