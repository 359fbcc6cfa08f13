package com.bluxguard.core.constraint;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.core.model.EnvironmentPolicy;
import com.bluxguard.core.model.NetworkPolicy;
import com.bluxguard.core.model.RequestEnvelope;
import com.bluxguard.core.model.ResourceLimits;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 约束解析器
 * <p>
 * 将信封与决策转换为执行方可强制的约束。纯函数、线程安全。
 * 信封既未指定命令也未指定路径且决策为 ALLOW 时，只开放工作目录本身。
 * </p>
 */
public class ConstraintResolver {

    private final ConstraintDefaults defaults;

    public ConstraintResolver(ConstraintDefaults defaults) {
        this.defaults = defaults;
    }

    public SandboxConstraints resolve(RequestEnvelope envelope, Decision decision) {
        String workingDir = resolveWorkingDir(envelope.getWorkingDir());

        List<String> commands = allowedCommands(envelope);
        List<String> paths = nonEmpty(envelope.getAllowedPaths());
        if (commands == null && paths == null && decision == Decision.ALLOW) {
            paths = List.of(workingDir);
        }

        return SandboxConstraints.builder()
                .receiptRequired(true)
                .allowlistExecution(true)
                .workingDir(workingDir)
                .sandboxProfile(envelope.getSandboxProfile() != null
                        ? envelope.getSandboxProfile() : defaults.getSandboxProfile())
                .timeoutS(envelope.getTimeoutS() != null ? envelope.getTimeoutS() : defaults.getTimeoutS())
                .resourceLimits(envelope.getResourceLimits() != null
                        ? envelope.getResourceLimits().withDefaults(defaults.getResourceLimits())
                        : defaults.getResourceLimits())
                .allowedCommands(commands)
                .allowedPaths(paths)
                .network(network(envelope.getNetwork()))
                .environment(environment(envelope))
                .confirmationRequired(decision == Decision.REQUIRE_CONFIRM)
                .build();
    }

    private String resolveWorkingDir(String requested) {
        Path base = Paths.get(defaults.getBaseDir());
        Path resolved = requested == null || requested.isBlank() ? base : base.resolve(requested);
        return resolved.toAbsolutePath().normalize().toString();
    }

    private static List<String> allowedCommands(RequestEnvelope envelope) {
        if (envelope.getAllowedCommands() != null) {
            return nonEmpty(envelope.getAllowedCommands());
        }
        if (envelope.getCommand() != null && !envelope.getCommand().isBlank()) {
            return List.of(envelope.getCommand());
        }
        return null;
    }

    private NetworkPolicy network(NetworkPolicy requested) {
        if (requested == null) {
            return NetworkPolicy.builder().egress(defaults.getEgress()).build();
        }
        if (requested.getEgress() == null) {
            return requested.toBuilder().egress(defaults.getEgress()).build();
        }
        return requested;
    }

    /**
     * 拒绝名单总是包含默认凭据变量；允许名单中出现在拒绝名单里的变量被剔除
     */
    private EnvironmentPolicy environment(RequestEnvelope envelope) {
        EnvironmentPolicy requested = envelope.getEnvironment();
        List<String> allow = requested != null && requested.getAllowlist() != null
                ? requested.getAllowlist() : envelope.getEnvAllowlist();
        List<String> deny = requested != null && requested.getDenylist() != null
                ? requested.getDenylist() : envelope.getEnvDenylist();

        Set<String> denySet = new LinkedHashSet<>(defaults.getEnvDenylist());
        if (deny != null) {
            denySet.addAll(deny);
        }
        Set<String> allowSet = new LinkedHashSet<>(allow != null ? allow : defaults.getEnvAllowlist());
        allowSet.removeAll(denySet);

        return EnvironmentPolicy.builder()
                .allowlist(new ArrayList<>(allowSet))
                .denylist(new ArrayList<>(denySet))
                .build();
    }

    private static List<String> nonEmpty(List<String> values) {
        return values == null || values.isEmpty() ? null : List.copyOf(values);
    }
}
