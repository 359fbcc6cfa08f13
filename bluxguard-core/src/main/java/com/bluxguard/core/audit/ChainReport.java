package com.bluxguard.core.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "digest", "line_count", "message", "corrupt_line"})
public class ChainReport {

    @JsonIgnore
    ChainStatus chainStatus;

    String digest;

    @JsonProperty("line_count")
    int lineCount;

    String message;

    /**
     * 第一条无法解析的行号（从 1 开始）
     */
    @JsonProperty("corrupt_line")
    Integer corruptLine;

    @JsonProperty("status")
    public String getStatus() {
        return chainStatus.wireValue();
    }
}
