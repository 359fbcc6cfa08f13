package com.bluxguard.core.constraint;

import com.bluxguard.core.model.EnvironmentPolicy;
import com.bluxguard.core.model.NetworkPolicy;
import com.bluxguard.core.model.ResourceLimits;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 可执行约束集合
 * 未解析或为空的字段直接省略，不输出 null。
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"receipt_required", "allowlist_execution", "working_dir", "sandbox_profile", "timeout_s",
        "resource_limits", "allowed_commands", "allowed_paths", "network", "environment", "confirmation_required"})
public class SandboxConstraints {

    @JsonProperty("receipt_required")
    Boolean receiptRequired;

    @JsonProperty("allowlist_execution")
    Boolean allowlistExecution;

    @JsonProperty("working_dir")
    String workingDir;

    @JsonProperty("sandbox_profile")
    String sandboxProfile;

    @JsonProperty("timeout_s")
    Integer timeoutS;

    @JsonProperty("resource_limits")
    ResourceLimits resourceLimits;

    @JsonProperty("allowed_commands")
    List<String> allowedCommands;

    @JsonProperty("allowed_paths")
    List<String> allowedPaths;

    @JsonProperty("network")
    NetworkPolicy network;

    @JsonProperty("environment")
    EnvironmentPolicy environment;

    @JsonProperty("confirmation_required")
    Boolean confirmationRequired;
}
