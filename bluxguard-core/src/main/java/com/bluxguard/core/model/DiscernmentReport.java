package com.bluxguard.core.model;

import com.bluxguard.api.decision.RiskBand;
import com.bluxguard.api.decision.Uncertainty;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 外部风险评估报告（只读输入，不在收据之外持久化）
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscernmentReport {

    @JsonProperty("band")
    String band;

    @JsonProperty("risk_level")
    String riskLevel;

    @JsonProperty("uncertainty")
    String uncertainty;

    /**
     * 系统健康信号，例如 nominal、low、degraded
     */
    @JsonProperty("posture")
    String posture;

    @JsonProperty("requires_confirmation")
    Boolean requiresConfirmation;

    @JsonProperty("summary")
    String summary;

    /**
     * risk_level 优先于 band
     */
    public RiskBand riskBand() {
        return RiskBand.fromValue(riskLevel != null ? riskLevel : band);
    }

    public Uncertainty uncertaintyLevel() {
        return Uncertainty.fromValue(uncertainty);
    }

    public boolean confirmationRequested() {
        return Boolean.TRUE.equals(requiresConfirmation);
    }
}
