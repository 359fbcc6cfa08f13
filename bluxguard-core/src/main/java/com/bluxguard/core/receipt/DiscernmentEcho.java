package com.bluxguard.core.receipt;

import com.bluxguard.core.model.DiscernmentReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 收据中回显的风险评估摘要，未提供评估时为空对象
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscernmentEcho {

    @JsonProperty("band")
    String band;

    @JsonProperty("risk_level")
    String riskLevel;

    @JsonProperty("uncertainty")
    String uncertainty;

    @JsonProperty("summary")
    String summary;

    public static DiscernmentEcho of(DiscernmentReport report) {
        if (report == null) {
            return DiscernmentEcho.builder().build();
        }
        return DiscernmentEcho.builder()
                .band(report.getBand())
                .riskLevel(report.getRiskLevel())
                .uncertainty(report.getUncertainty())
                .summary(report.getSummary())
                .build();
    }
}
