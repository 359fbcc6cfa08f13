package com.bluxguard.core.constraint;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.core.model.EnvironmentPolicy;
import com.bluxguard.core.model.NetworkPolicy;
import com.bluxguard.core.model.RequestEnvelope;
import com.bluxguard.core.model.ResourceLimits;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConstraintResolver 单元测试")
class ConstraintResolverTest {

    @TempDir
    Path baseDir;

    private ConstraintResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ConstraintResolver(ConstraintDefaults.builder().baseDir(baseDir.toString()).build());
    }

    private static RequestEnvelope.RequestEnvelopeBuilder envelope() {
        return RequestEnvelope.builder().traceId("t-1");
    }

    @Nested
    @DisplayName("命令与路径")
    class SurfaceTests {

        @Test
        @DisplayName("ALLOW 且未指定命令和路径时只开放工作目录")
        void narrowestSurfaceOnAllow() {
            SandboxConstraints c = resolver.resolve(envelope().build(), Decision.ALLOW);

            assertEquals(baseDir.toAbsolutePath().normalize().toString(), c.getWorkingDir());
            assertEquals(List.of(c.getWorkingDir()), c.getAllowedPaths());
            assertNull(c.getAllowedCommands());
        }

        @Test
        @DisplayName("非 ALLOW 决策不补默认路径")
        void noDefaultPathWhenNotAllowed() {
            SandboxConstraints c = resolver.resolve(envelope().build(), Decision.BLOCK);

            assertNull(c.getAllowedPaths());
            assertNull(c.getAllowedCommands());
        }

        @Test
        @DisplayName("单条 command 转为 allowed_commands")
        void commandBecomesAllowlist() {
            SandboxConstraints c = resolver.resolve(envelope().command("ls -la").build(), Decision.ALLOW);

            assertEquals(List.of("ls -la"), c.getAllowedCommands());
            assertNull(c.getAllowedPaths());
        }

        @Test
        @DisplayName("allowed_commands 优先于 command")
        void explicitCommandsWin() {
            SandboxConstraints c = resolver.resolve(envelope()
                    .command("rm -rf /")
                    .allowedCommands(List.of("git status"))
                    .build(), Decision.WARN);

            assertEquals(List.of("git status"), c.getAllowedCommands());
        }

        @Test
        @DisplayName("相对工作目录按基准目录解析并规范化")
        void relativeWorkingDir() {
            SandboxConstraints c = resolver.resolve(envelope().workingDir("sub/../work").build(), Decision.ALLOW);

            assertEquals(baseDir.resolve("work").toAbsolutePath().normalize().toString(), c.getWorkingDir());
        }
    }

    @Nested
    @DisplayName("默认值")
    class DefaultTests {

        @Test
        @DisplayName("沙箱、超时、资源与网络使用默认值")
        void appliesDefaults() {
            SandboxConstraints c = resolver.resolve(envelope().build(), Decision.ALLOW);

            assertEquals("userland", c.getSandboxProfile());
            assertEquals(300, c.getTimeoutS());
            assertEquals(120, c.getResourceLimits().getCpuSeconds());
            assertEquals(512, c.getResourceLimits().getMemoryMb());
            assertEquals(64, c.getResourceLimits().getProcesses());
            assertEquals("restricted", c.getNetwork().getEgress());
            assertTrue(c.getReceiptRequired());
            assertTrue(c.getAllowlistExecution());
        }

        @Test
        @DisplayName("部分资源上限逐字段补齐")
        void mergesResourceLimits() {
            SandboxConstraints c = resolver.resolve(envelope()
                    .resourceLimits(ResourceLimits.builder().memoryMb(128).build())
                    .timeoutS(30)
                    .network(NetworkPolicy.builder().egress("none").build())
                    .build(), Decision.ALLOW);

            assertEquals(128, c.getResourceLimits().getMemoryMb());
            assertEquals(120, c.getResourceLimits().getCpuSeconds());
            assertEquals(30, c.getTimeoutS());
            assertEquals("none", c.getNetwork().getEgress());
        }

        @Test
        @DisplayName("confirmation_required 镜像决策")
        void mirrorsConfirmation() {
            assertTrue(resolver.resolve(envelope().build(), Decision.REQUIRE_CONFIRM).getConfirmationRequired());
            assertFalse(resolver.resolve(envelope().build(), Decision.WARN).getConfirmationRequired());
        }
    }

    @Nested
    @DisplayName("环境变量")
    class EnvironmentTests {

        @Test
        @DisplayName("默认允许与拒绝名单")
        void defaultLists() {
            EnvironmentPolicy env = resolver.resolve(envelope().build(), Decision.ALLOW).getEnvironment();

            assertEquals(ConstraintDefaults.DEFAULT_ENV_ALLOWLIST, env.getAllowlist());
            assertTrue(env.getDenylist().containsAll(List.of("AWS_SECRET_ACCESS_KEY", "GITHUB_TOKEN")));
        }

        @Test
        @DisplayName("凭据变量不会因调用方允许而泄露")
        void denylistWinsOverAllowlist() {
            EnvironmentPolicy env = resolver.resolve(envelope()
                    .environment(EnvironmentPolicy.builder()
                            .allowlist(List.of("PATH", "AWS_SECRET_ACCESS_KEY", "MY_VAR"))
                            .denylist(List.of("MY_VAR"))
                            .build())
                    .build(), Decision.ALLOW).getEnvironment();

            assertEquals(List.of("PATH"), env.getAllowlist());
            assertTrue(env.getDenylist().contains("MY_VAR"));
            assertTrue(env.getDenylist().contains("AWS_SECRET_ACCESS_KEY"));
        }

        @Test
        @DisplayName("兼容 env_allowlist 字段")
        void legacyFields() {
            EnvironmentPolicy env = resolver.resolve(envelope()
                    .envAllowlist(List.of("HOME", "TERM"))
                    .build(), Decision.ALLOW).getEnvironment();

            assertEquals(List.of("HOME", "TERM"), env.getAllowlist());
        }
    }

    @Test
    @DisplayName("序列化时省略空字段")
    void omitsUnresolvedFields() {
        JsonNode json = JsonSupport.mapper().valueToTree(resolver.resolve(envelope().build(), Decision.BLOCK));

        assertFalse(json.has("allowed_paths"));
        assertFalse(json.has("allowed_commands"));
        assertTrue(json.has("working_dir"));
        assertTrue(json.get("confirmation_required").isBoolean());
    }

    @Test
    @DisplayName("相同输入得到相同约束")
    void deterministic() {
        RequestEnvelope request = envelope().command("make").build();

        assertEquals(resolver.resolve(request, Decision.ALLOW), resolver.resolve(request, Decision.ALLOW));
    }
}
