package com.bluxguard.core.config;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.core.constraint.ConstraintDefaults;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GuardConfigLoader 单元测试")
class GuardConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String... lines) throws IOException {
        return Files.writeString(tempDir.resolve(name), String.join("\n", lines) + "\n");
    }

    @Nested
    @DisplayName("查找顺序")
    class LookupTests {

        @Test
        @DisplayName("无配置文件时使用默认值")
        void defaults() {
            GuardConfig config = new GuardConfigLoader(Map.of()).load(null);

            assertEquals(GuardConfig.defaults(), config);
            assertTrue(config.isFsync());
            assertEquals("uid", config.getTrip().getSubjectField());
        }

        @Test
        @DisplayName("BLUX_GUARD_CONFIG 指向的文件")
        void fromEnvironment() throws IOException {
            Path file = write("guard.yaml", "fsync: false");

            GuardConfig config = new GuardConfigLoader(Map.of(GuardConfigLoader.CONFIG_ENV, file.toString())).load(null);

            assertFalse(config.isFsync());
        }

        @Test
        @DisplayName("显式路径优先于环境变量")
        void explicitWins() throws IOException {
            Path explicit = write("explicit.yaml", "auditLogFile: explicit.jsonl");
            Path fromEnv = write("env.yaml", "auditLogFile: env.jsonl");

            GuardConfig config = new GuardConfigLoader(Map.of(GuardConfigLoader.CONFIG_ENV, fromEnv.toString()))
                    .load(explicit);

            assertEquals("explicit.jsonl", config.getAuditLogFile());
        }

        @Test
        @DisplayName("环境变量覆盖日志目录与规则文件")
        void environmentOverrides() throws IOException {
            Path file = write("guard.yaml", "logDir: /from/file");

            GuardConfig config = new GuardConfigLoader(Map.of(
                    GuardConfigLoader.LOG_DIR_ENV, tempDir.toString(),
                    GuardConfigLoader.RULES_ENV, "/etc/rules.yaml")).load(file);

            assertEquals(tempDir.resolve("audit.jsonl"), config.auditLogPath());
            assertEquals(tempDir.resolve("incidents.jsonl"), config.incidentLogPath());
            assertEquals("/etc/rules.yaml", config.getTrip().getRulesFile());
        }
    }

    @Nested
    @DisplayName("绑定")
    class BindingTests {

        @Test
        @DisplayName("绑定全部配置段")
        void bindsSections() throws IOException {
            Path file = write("guard.yaml",
                    "logDir: " + tempDir,
                    "tokenAuthority:",
                    "  command: [blux-reg, check]",
                    "  timeoutMs: 250",
                    "  trustedTokens:",
                    "    tok-1: cap-1",
                    "decision:",
                    "  defaultWithoutDiscernment: warn",
                    "  escalateOnHighUncertainty: true",
                    "constraints:",
                    "  baseDir: /srv/work",
                    "  timeoutS: 90",
                    "  egress: none",
                    "  envDenylist: [SECRET_TOKEN]",
                    "trip:",
                    "  defaultWindowSeconds: 30",
                    "  queueCapacity: 16");

            GuardConfig config = new GuardConfigLoader(Map.of()).load(file);

            assertEquals(List.of("blux-reg", "check"), config.getTokenAuthority().getCommand());
            assertEquals(Duration.ofMillis(250), config.getTokenAuthority().timeout());
            assertEquals("cap-1", config.getTokenAuthority().getTrustedTokens().get("tok-1"));
            assertEquals(Decision.WARN, config.getDecision().toPolicy().getDefaultWithoutDiscernment());
            assertTrue(config.getDecision().toPolicy().isEscalateOnHighUncertainty());
            assertEquals(30, config.getTrip().getDefaultWindowSeconds());
            assertEquals(16, config.getTrip().getQueueCapacity());

            ConstraintDefaults defaults = config.getConstraints().toDefaults();
            assertEquals("/srv/work", defaults.getBaseDir());
            assertEquals(90, defaults.getTimeoutS());
            assertEquals("none", defaults.getEgress());
            assertEquals(List.of("SECRET_TOKEN"), defaults.getEnvDenylist());
        }

        @Test
        @DisplayName("空文件使用默认值")
        void emptyFile() throws IOException {
            Path file = write("empty.yaml", "");

            assertEquals(GuardConfig.defaults(), new GuardConfigLoader(Map.of()).load(file));
        }

        @Test
        @DisplayName("未知键报错")
        void unknownKey() throws IOException {
            Path file = write("typo.yaml", "fsynk: true");

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> new GuardConfigLoader(Map.of()).load(file));
            assertTrue(e.getMessage().contains("fsynk"), e.getMessage());
        }

        @Test
        @DisplayName("指定的文件不存在时报错")
        void missingFile() {
            assertThrows(ConfigurationException.class,
                    () -> new GuardConfigLoader(Map.of()).load(tempDir.resolve("absent.yaml")));
        }

        @Test
        @DisplayName("YAML 语法错误报错")
        void malformedYaml() throws IOException {
            Path file = write("bad.yaml", "trip: [unclosed");

            assertThrows(ConfigurationException.class, () -> new GuardConfigLoader(Map.of()).load(file));
        }
    }

    @Test
    @DisplayName("开发预设：工作目录下的 .blux-guard，关闭 fsync")
    void developmentPreset() {
        GuardConfig config = GuardConfig.development();

        assertFalse(config.isFsync());
        assertEquals(Paths.get(".blux-guard", "logs", "audit.jsonl"), config.auditLogPath());
        assertEquals(30000, config.getTokenAuthority().getTimeoutMs());
    }
}
