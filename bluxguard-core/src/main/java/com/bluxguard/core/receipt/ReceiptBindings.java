package com.bluxguard.core.receipt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 收据与请求的绑定关系
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReceiptBindings {

    @JsonProperty("trace_id")
    String traceId;

    @JsonProperty("envelope_hash")
    String envelopeHash;

    /**
     * 已去重并排序
     */
    @JsonProperty("capability_refs")
    List<String> capabilityRefs;
}
