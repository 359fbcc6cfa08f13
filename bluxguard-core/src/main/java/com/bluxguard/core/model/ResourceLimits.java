package com.bluxguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 资源上限，均为正整数
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceLimits {

    @JsonProperty("cpu_seconds")
    Integer cpuSeconds;

    @JsonProperty("memory_mb")
    Integer memoryMb;

    @JsonProperty("processes")
    Integer processes;

    /**
     * 逐字段以默认值补齐
     */
    public ResourceLimits withDefaults(ResourceLimits defaults) {
        return ResourceLimits.builder()
                .cpuSeconds(cpuSeconds != null ? cpuSeconds : defaults.getCpuSeconds())
                .memoryMb(memoryMb != null ? memoryMb : defaults.getMemoryMb())
                .processes(processes != null ? processes : defaults.getProcesses())
                .build();
    }
}
