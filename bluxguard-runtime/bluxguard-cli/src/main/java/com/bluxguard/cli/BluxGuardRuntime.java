package com.bluxguard.cli;

import com.bluxguard.core.audit.AuditLog;
import com.bluxguard.core.config.GuardConfig;
import com.bluxguard.core.constraint.ConstraintResolver;
import com.bluxguard.core.decision.DecisionMappingEngine;
import com.bluxguard.core.event.EventBus;
import com.bluxguard.core.receipt.GuardReceiptEngine;
import com.bluxguard.core.receipt.ReceiptSigner;
import com.bluxguard.core.schema.SchemaValidator;
import com.bluxguard.core.secret.EnvironmentSecretProvider;
import com.bluxguard.core.secret.KeyFileSecretProvider;
import com.bluxguard.core.spi.SecretProvider;
import com.bluxguard.core.spi.TokenAuthority;
import com.bluxguard.core.token.CapabilityTokenVerifier;
import com.bluxguard.core.token.ProcessTokenAuthority;
import com.bluxguard.core.token.StaticTokenAuthority;
import com.bluxguard.core.trip.RuleSet;
import com.bluxguard.core.trip.RuleSetLoader;
import com.bluxguard.core.trip.SlidingWindowStore;
import com.bluxguard.core.trip.TripEngine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

/**
 * BLUX Guard 运行时：按配置组装信任核心组件
 * <p>
 * 收据引擎在启动时组装；触发引擎在首次使用时组装（避免仅做评估时生成告警密钥文件）。
 * </p>
 */
@Slf4j
public class BluxGuardRuntime implements AutoCloseable {

    public static final String TRIP_KEY_ENV = "BLUX_GUARD_TRIP_KEY";

    @Getter
    private final GuardConfig config;
    @Getter
    private final EventBus eventBus;
    @Getter
    private final AuditLog auditLog;
    @Getter
    private final GuardReceiptEngine receiptEngine;

    private final CapabilityTokenVerifier tokenVerifier;
    private final Map<String, String> env;
    private final Clock clock;
    private TripEngine tripEngine;

    private BluxGuardRuntime(GuardConfig config, Map<String, String> env, Clock clock) {
        this.config = config;
        this.env = env;
        this.clock = clock;
        this.eventBus = new EventBus();
        this.auditLog = AuditLog.open(config.auditLogPath(), config.isFsync(), clock);
        this.tokenVerifier = new CapabilityTokenVerifier(tokenAuthority(config), config.getTokenAuthority().timeout());
        this.receiptEngine = new GuardReceiptEngine(
                SchemaValidator.loadBuiltin(),
                tokenVerifier,
                new DecisionMappingEngine(config.getDecision().toPolicy()),
                new ConstraintResolver(config.getConstraints().toDefaults()),
                new ReceiptSigner(new EnvironmentSecretProvider(env)),
                auditLog,
                eventBus,
                clock);
    }

    /**
     * 启动运行时
     */
    public static BluxGuardRuntime start(GuardConfig config, Map<String, String> env, Clock clock) {
        long start = System.currentTimeMillis();
        BluxGuardRuntime runtime = new BluxGuardRuntime(config, env, clock);
        log.info("[Runtime] BLUX Guard started in {} ms (audit log: {})",
                System.currentTimeMillis() - start, config.auditLogPath());
        return runtime;
    }

    public synchronized TripEngine tripEngine() {
        if (tripEngine == null) {
            GuardConfig.TripSection trip = config.getTrip();
            RuleSet rules = new RuleSetLoader(trip.getDefaultWindowSeconds()).load(Paths.get(trip.getRulesFile()));
            tripEngine = new TripEngine(
                    rules,
                    new SlidingWindowStore(),
                    tripKey(trip),
                    AuditLog.open(config.incidentLogPath(), config.isFsync(), clock),
                    eventBus,
                    clock,
                    trip.getSubjectField());
        }
        return tripEngine;
    }

    private SecretProvider tripKey(GuardConfig.TripSection trip) {
        String key = env.get(TRIP_KEY_ENV);
        if (key != null && !key.isEmpty()) {
            byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
            return bytes::clone;
        }
        return new KeyFileSecretProvider(Paths.get(trip.getKeyFile()));
    }

    private static TokenAuthority tokenAuthority(GuardConfig config) {
        GuardConfig.TokenAuthoritySection section = config.getTokenAuthority();
        if (!section.getTrustedTokens().isEmpty()) {
            log.info("[Runtime] Using static token authority ({} trusted tokens)", section.getTrustedTokens().size());
            return new StaticTokenAuthority(section.getTrustedTokens());
        }
        return new ProcessTokenAuthority(section.getCommand(), section.timeout());
    }

    @Override
    public void close() {
        tokenVerifier.close();
        log.debug("[Runtime] BLUX Guard stopped");
    }
}
