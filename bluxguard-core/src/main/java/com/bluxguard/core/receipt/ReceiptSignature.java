package com.bluxguard.core.receipt;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ReceiptSignature {

    @JsonProperty("alg")
    String alg;

    /**
     * 十六进制 MAC
     */
    @JsonProperty("value")
    String value;
}
