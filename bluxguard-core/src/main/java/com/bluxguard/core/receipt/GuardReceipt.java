package com.bluxguard.core.receipt;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.core.constraint.SandboxConstraints;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 守卫收据：单次授权决策的签名记录
 * <p>
 * 签名覆盖除 signature 之外的全部字段。签名后不可变。
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"$schema", "receipt_id", "issued_at", "decision", "trace_id", "capability_token_ref",
        "token_status", "reason_codes", "constraints", "discernment", "signature", "bindings"})
public class GuardReceipt {

    @JsonProperty("$schema")
    String schema;

    @JsonProperty("receipt_id")
    String receiptId;

    /**
     * Unix 秒（含毫秒小数）
     */
    @JsonProperty("issued_at")
    double issuedAt;

    @JsonProperty("decision")
    Decision decision;

    @JsonProperty("trace_id")
    String traceId;

    @JsonProperty("capability_token_ref")
    String capabilityTokenRef;

    @JsonProperty("token_status")
    String tokenStatus;

    @JsonProperty("reason_codes")
    List<String> reasonCodes;

    @JsonProperty("constraints")
    SandboxConstraints constraints;

    @JsonProperty("discernment")
    DiscernmentEcho discernment;

    @JsonProperty("signature")
    ReceiptSignature signature;

    @JsonProperty("bindings")
    ReceiptBindings bindings;
}
