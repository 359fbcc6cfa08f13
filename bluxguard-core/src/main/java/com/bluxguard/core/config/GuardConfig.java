package com.bluxguard.core.config;

import com.bluxguard.api.decision.Decision;
import com.bluxguard.core.constraint.ConstraintDefaults;
import com.bluxguard.core.decision.DecisionPolicy;
import com.bluxguard.core.model.ResourceLimits;
import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BLUX Guard 运行配置
 * <p>
 * 由 {@link GuardConfigLoader} 从 YAML 绑定，字段初始值即默认值。
 * 密钥不在此处配置，见 {@code EnvironmentSecretProvider} 与 {@code KeyFileSecretProvider}。
 * </p>
 */
@Data
public class GuardConfig {

    static final String HOME_DIR = Paths.get(System.getProperty("user.home"), ".config", "blux-guard").toString();

    // ==================== 日志 ====================

    /**
     * 审计与事故日志目录
     */
    private String logDir = Paths.get(HOME_DIR, "logs").toString();

    private String auditLogFile = "audit.jsonl";

    private String incidentLogFile = "incidents.jsonl";

    /**
     * 每次追加后 fsync
     */
    private boolean fsync = true;

    // ==================== 分节 ====================

    private TokenAuthoritySection tokenAuthority = new TokenAuthoritySection();

    private DecisionSection decision = new DecisionSection();

    private ConstraintsSection constraints = new ConstraintsSection();

    private TripSection trip = new TripSection();

    public Path auditLogPath() {
        return Paths.get(logDir).resolve(auditLogFile);
    }

    public Path incidentLogPath() {
        return Paths.get(logDir).resolve(incidentLogFile);
    }

    @Data
    public static class TokenAuthoritySection {
        /**
         * 外部验证命令，令牌追加为最后一个参数
         */
        private List<String> command = new ArrayList<>(Arrays.asList("blux-reg", "verify", "--token"));

        private long timeoutMs = 5000;

        /**
         * 令牌 → token_ref。非空时使用静态权威，不再调用外部命令
         */
        private Map<String, String> trustedTokens = new LinkedHashMap<>();

        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    @Data
    public static class DecisionSection {
        private Decision defaultWithoutDiscernment = Decision.ALLOW;

        private boolean escalateOnHighUncertainty = false;

        public DecisionPolicy toPolicy() {
            return DecisionPolicy.builder()
                    .defaultWithoutDiscernment(defaultWithoutDiscernment)
                    .escalateOnHighUncertainty(escalateOnHighUncertainty)
                    .build();
        }
    }

    @Data
    public static class ConstraintsSection {
        /**
         * 相对 working_dir 的解析基准，为空时取进程当前目录
         */
        private String baseDir;

        private String sandboxProfile = "userland";

        private int timeoutS = 300;

        private int cpuSeconds = 120;

        private int memoryMb = 512;

        private int processes = 64;

        private String egress = "restricted";

        private List<String> envAllowlist = new ArrayList<>(ConstraintDefaults.DEFAULT_ENV_ALLOWLIST);

        private List<String> envDenylist = new ArrayList<>(ConstraintDefaults.DEFAULT_ENV_DENYLIST);

        public ConstraintDefaults toDefaults() {
            return ConstraintDefaults.builder()
                    .baseDir(baseDir != null ? baseDir : System.getProperty("user.dir"))
                    .sandboxProfile(sandboxProfile)
                    .timeoutS(timeoutS)
                    .resourceLimits(ResourceLimits.builder()
                            .cpuSeconds(cpuSeconds)
                            .memoryMb(memoryMb)
                            .processes(processes)
                            .build())
                    .egress(egress)
                    .envAllowlist(List.copyOf(envAllowlist))
                    .envDenylist(List.copyOf(envDenylist))
                    .build();
        }
    }

    @Data
    public static class TripSection {
        private String rulesFile = Paths.get(HOME_DIR, "rules", "rules.json").toString();

        /**
         * 规则未声明 subject 时的主体字段
         */
        private String subjectField = "uid";

        private int defaultWindowSeconds = 60;

        private int queueCapacity = 1024;

        /**
         * 告警签名密钥文件（未设置 BLUX_GUARD_TRIP_KEY 时使用）
         */
        private String keyFile = Paths.get(HOME_DIR, "key").toString();
    }

    // ==================== 工厂方法 ====================

    public static GuardConfig defaults() {
        return new GuardConfig();
    }

    /**
     * 开发模式：工作目录下的 .blux-guard，关闭 fsync，放宽权威超时
     */
    public static GuardConfig development() {
        GuardConfig config = new GuardConfig();
        config.setLogDir(Paths.get(".blux-guard", "logs").toString());
        config.setFsync(false);
        config.getTokenAuthority().setTimeoutMs(30000);
        config.getTrip().setRulesFile(Paths.get(".blux-guard", "rules.json").toString());
        config.getTrip().setKeyFile(Paths.get(".blux-guard", "key").toString());
        return config;
    }
}
