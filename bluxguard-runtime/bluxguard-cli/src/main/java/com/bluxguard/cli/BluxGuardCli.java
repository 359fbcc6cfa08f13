package com.bluxguard.cli;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.api.exception.GuardException;
import com.bluxguard.api.exception.SchemaViolationException;
import com.bluxguard.core.audit.AuditChainVerifier;
import com.bluxguard.core.audit.ChainReport;
import com.bluxguard.core.config.GuardConfig;
import com.bluxguard.core.config.GuardConfigLoader;
import com.bluxguard.core.receipt.GuardReceipt;
import com.bluxguard.core.receipt.ReceiptVerification;
import com.bluxguard.core.trip.TripEngine;
import com.bluxguard.core.trip.TripEventPipeline;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BLUX Guard 命令行
 * <pre>
 *   evaluate --request-envelope &lt;path&gt; [--token &lt;tok&gt;]... [--discernment &lt;path&gt;] [--revocations &lt;path&gt;]
 *   verify-receipt --receipt &lt;path&gt;
 *   trip [--rules &lt;path&gt;]
 *   audit-verify [--log &lt;path&gt;] [--anchor &lt;hex&gt;]
 * </pre>
 * 所有命令都接受 --config。stdout 只输出结果 JSON / 告警 / OK，日志走 stderr。
 * <p>
 * 退出码：0 成功；1 输入或配置错误；2 校验失败。
 * </p>
 */
@Slf4j
public class BluxGuardCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT_ERROR = 1;
    public static final int EXIT_VERIFICATION_FAILED = 2;

    private static final Map<String, Set<String>> COMMANDS = new LinkedHashMap<>();

    static {
        COMMANDS.put("evaluate", Set.of("request-envelope", "token", "discernment", "revocations", "config"));
        COMMANDS.put("verify-receipt", Set.of("receipt", "config"));
        COMMANDS.put("trip", Set.of("rules", "config"));
        COMMANDS.put("audit-verify", Set.of("log", "anchor", "config"));
    }

    private final Map<String, String> env;
    private final Clock clock;

    public BluxGuardCli(Map<String, String> env, Clock clock) {
        this.env = env;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int code = new BluxGuardCli(System.getenv(), Clock.systemUTC()).run(args, System.in, System.out, System.err);
        System.exit(code);
    }

    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        try {
            CliArguments arguments = CliArguments.parse(args, COMMANDS);
            GuardConfig config = new GuardConfigLoader(env).load(arguments.path("config"));
            switch (arguments.command()) {
                case "evaluate":
                    return evaluate(arguments, config, out);
                case "verify-receipt":
                    return verifyReceipt(arguments, config, out);
                case "trip":
                    return trip(arguments, config, in, out);
                case "audit-verify":
                    return auditVerify(arguments, config, out);
                default:
                    throw new UsageException("Unknown command: " + arguments.command());
            }
        } catch (UsageException e) {
            printError(out, "usage_error", e.getMessage(), List.of());
            err.println(usage());
            return EXIT_INPUT_ERROR;
        } catch (SchemaViolationException e) {
            printError(out, "schema_violation", e.getMessage(), e.getViolations());
            return EXIT_INPUT_ERROR;
        } catch (ConfigurationException e) {
            printError(out, "configuration_error", e.getMessage(), List.of());
            return EXIT_INPUT_ERROR;
        } catch (GuardException e) {
            log.error("[CLI] Command failed", e);
            printError(out, "guard_error", e.getMessage(), List.of());
            return EXIT_INPUT_ERROR;
        }
    }

    private int evaluate(CliArguments arguments, GuardConfig config, PrintStream out) {
        try (BluxGuardRuntime runtime = BluxGuardRuntime.start(config, env, clock)) {
            GuardReceipt receipt = runtime.getReceiptEngine().evaluateFromFiles(
                    arguments.requirePath("request-envelope"),
                    arguments.path("discernment"),
                    arguments.values("token"),
                    arguments.path("revocations"));
            out.println(JsonSupport.toPrettyJson(receipt));
            return EXIT_OK;
        }
    }

    private int verifyReceipt(CliArguments arguments, GuardConfig config, PrintStream out) {
        JsonNode receipt = JsonSupport.readTree(arguments.requirePath("receipt"));
        try (BluxGuardRuntime runtime = BluxGuardRuntime.start(config, env, clock)) {
            ReceiptVerification result = runtime.getReceiptEngine().verify(receipt);
            out.println(JsonSupport.toPrettyJson(result));
            return result.isOk() ? EXIT_OK : EXIT_VERIFICATION_FAILED;
        }
    }

    private int trip(CliArguments arguments, GuardConfig config, InputStream in, PrintStream out) {
        Path rules = arguments.path("rules");
        if (rules != null) {
            config.getTrip().setRulesFile(rules.toString());
        }
        try (BluxGuardRuntime runtime = BluxGuardRuntime.start(config, env, clock)) {
            TripEngine engine = runtime.tripEngine();
            log.info("[Trip] Ready, {} rules loaded; feed one JSON event per line on stdin",
                    engine.getRuleSet().getRules().size());
            TripEventPipeline pipeline = new TripEventPipeline(engine, config.getTrip().getQueueCapacity(), result -> {
                for (String line : result.outputLines()) {
                    out.println(line);
                }
                out.flush();
            }).start();
            try {
                feed(in, pipeline);
            } finally {
                pipeline.close();
            }
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GuardException("Interrupted while processing trip events", e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read events from stdin", e);
        }
    }

    private static void feed(InputStream in, TripEventPipeline pipeline) throws IOException, InterruptedException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            JsonNode event;
            try {
                event = JsonSupport.mapper().readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.warn("[Trip] Invalid JSON on line {} (skipping): {}", lineNo, e.getOriginalMessage());
                continue;
            }
            if (!event.isObject()) {
                log.warn("[Trip] Line {} is not a JSON object (skipping)", lineNo);
                continue;
            }
            pipeline.submit(event);
        }
    }

    private int auditVerify(CliArguments arguments, GuardConfig config, PrintStream out) {
        Path logFile = arguments.path("log") != null ? arguments.path("log") : config.auditLogPath();
        ChainReport report = AuditChainVerifier.verify(logFile, arguments.value("anchor"));
        out.println(JsonSupport.toPrettyJson(report));
        return report.getChainStatus().isHealthy() ? EXIT_OK : EXIT_VERIFICATION_FAILED;
    }

    private static void printError(PrintStream out, String kind, String message, List<String> violations) {
        ObjectNode error = JsonSupport.mapper().createObjectNode();
        error.put("error", kind);
        error.put("message", message);
        violations.forEach(error.putArray("violations")::add);
        out.println(JsonSupport.toPrettyJson(error));
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: blux-guard <command> [options]",
                "  evaluate --request-envelope <path> [--token <tok>]... [--discernment <path>] [--revocations <path>]",
                "  verify-receipt --receipt <path>",
                "  trip [--rules <path>]",
                "  audit-verify [--log <path>] [--anchor <hex>]",
                "All commands accept --config <path>.");
    }
}
