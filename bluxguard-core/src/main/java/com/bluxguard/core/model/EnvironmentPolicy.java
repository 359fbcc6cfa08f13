package com.bluxguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 环境变量允许/拒绝名单
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnvironmentPolicy {

    @JsonProperty("allowlist")
    List<String> allowlist;

    @JsonProperty("denylist")
    List<String> denylist;
}
