package com.bluxguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 请求信封：待评估的动作
 * <p>
 * 构造后不可变，由单次评估独占。结构已由 request_envelope 契约校验。
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestEnvelope {

    @JsonProperty("trace_id")
    String traceId;

    @JsonProperty("working_dir")
    String workingDir;

    @JsonProperty("command")
    String command;

    @JsonProperty("allowed_commands")
    List<String> allowedCommands;

    @JsonProperty("allowed_paths")
    List<String> allowedPaths;

    @JsonProperty("sandbox_profile")
    String sandboxProfile;

    @JsonProperty("timeout_s")
    Integer timeoutS;

    @JsonProperty("resource_limits")
    ResourceLimits resourceLimits;

    @JsonProperty("network")
    NetworkPolicy network;

    @JsonProperty("environment")
    EnvironmentPolicy environment;

    // 兼容旧字段
    @JsonProperty("env_allowlist")
    List<String> envAllowlist;

    @JsonProperty("env_denylist")
    List<String> envDenylist;

    @JsonProperty("capability_token_ref")
    String capabilityTokenRef;

    @JsonProperty("capability_refs")
    List<String> capabilityRefs;

    @JsonProperty("capability_token")
    String capabilityToken;

    @JsonProperty("capability_tokens")
    List<String> capabilityTokens;

    @JsonProperty("envelope_hash")
    String envelopeHash;

    /**
     * 信封内携带的令牌：capability_tokens 优先，其次 capability_token
     */
    public List<String> embeddedTokens() {
        if (capabilityTokens != null && !capabilityTokens.isEmpty()) {
            return capabilityTokens;
        }
        if (capabilityToken != null && !capabilityToken.isBlank()) {
            return List.of(capabilityToken);
        }
        return List.of();
    }
}
