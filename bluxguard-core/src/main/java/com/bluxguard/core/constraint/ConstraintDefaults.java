package com.bluxguard.core.constraint;

import com.bluxguard.core.model.ResourceLimits;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 约束默认值，来自 GuardConfig 的 constraints 段
 */
@Value
@Builder
public class ConstraintDefaults {

    public static final List<String> DEFAULT_ENV_ALLOWLIST = List.of("PATH", "LANG", "LC_ALL", "LC_CTYPE", "HOME");

    public static final List<String> DEFAULT_ENV_DENYLIST = List.of(
            "AWS_ACCESS_KEY_ID", "AWS_SECRET_ACCESS_KEY", "AWS_SESSION_TOKEN",
            "GITHUB_TOKEN", "GH_TOKEN", "GITLAB_TOKEN", "NPM_TOKEN");

    /**
     * 相对工作目录的解析基准，也是未指定 working_dir 时的默认值
     */
    @Builder.Default
    String baseDir = System.getProperty("user.dir");

    @Builder.Default
    String sandboxProfile = "userland";

    @Builder.Default
    int timeoutS = 300;

    @Builder.Default
    ResourceLimits resourceLimits = ResourceLimits.builder().cpuSeconds(120).memoryMb(512).processes(64).build();

    @Builder.Default
    String egress = "restricted";

    @Builder.Default
    List<String> envAllowlist = DEFAULT_ENV_ALLOWLIST;

    @Builder.Default
    List<String> envDenylist = DEFAULT_ENV_DENYLIST;

    public static ConstraintDefaults defaults() {
        return ConstraintDefaults.builder().build();
    }
}
