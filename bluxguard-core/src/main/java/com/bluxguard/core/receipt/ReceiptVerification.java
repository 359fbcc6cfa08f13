package com.bluxguard.core.receipt;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * 收据校验结果，对应 CLI 输出的 {ok, reason}
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ReceiptVerification {

    public static final String OK = "ok";
    public static final String MISSING_FIELDS = "missing_fields";
    public static final String INVALID_SIGNATURE_METADATA = "invalid_signature_metadata";
    public static final String SIGNATURE_MISMATCH = "signature_mismatch";

    boolean ok;
    String reason;
    List<String> violations;

    public static ReceiptVerification success() {
        return new ReceiptVerification(true, OK, List.of());
    }

    public static ReceiptVerification failure(String reason) {
        return new ReceiptVerification(false, reason, List.of());
    }

    public static ReceiptVerification failure(String reason, List<String> violations) {
        return new ReceiptVerification(false, reason, List.copyOf(violations));
    }
}
