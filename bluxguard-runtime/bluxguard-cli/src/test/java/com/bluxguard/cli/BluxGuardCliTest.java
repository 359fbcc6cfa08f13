package com.bluxguard.cli;

import com.bluxguard.core.crypto.HmacSigner;
import com.bluxguard.core.secret.EnvironmentSecretProvider;
import com.bluxguard.core.trip.CompactAlert;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BluxGuardCli 集成测试")
class BluxGuardCliTest {

    private static final String TRIP_KEY = "cli-trip-key";

    @TempDir
    Path tempDir;

    private Path configFile;
    private BluxGuardCli cli;

    @BeforeEach
    void setUp() throws IOException {
        configFile = Files.writeString(tempDir.resolve("guard.yaml"), String.join("\n",
                "logDir: " + tempDir.resolve("logs"),
                "fsync: false",
                "tokenAuthority:",
                "  trustedTokens:",
                "    tok-1: cap-1",
                "constraints:",
                "  baseDir: " + tempDir,
                "trip:",
                "  rulesFile: " + tempDir.resolve("rules.json"),
                "  keyFile: " + tempDir.resolve("trip.key"),
                ""));
        Map<String, String> env = Map.of(
                EnvironmentSecretProvider.SECRET_ENV, "cli-secret",
                BluxGuardRuntime.TRIP_KEY_ENV, TRIP_KEY);
        cli = new BluxGuardCli(env, Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));
    }

    private Result runWithStdin(String stdin, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = cli.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private Result run(String... args) {
        return runWithStdin("", args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private Path issueReceipt(String... extra) throws IOException {
        Path envelope = write("envelope.json", "{\"trace_id\":\"cli-1\",\"command\":\"make\"}");
        String[] base = {"evaluate", "--config", configFile.toString(), "--request-envelope", envelope.toString()};
        String[] args = Arrays.copyOf(base, base.length + extra.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        Result result = run(args);
        assertEquals(BluxGuardCli.EXIT_OK, result.code, result.err);
        return write("receipt.json", result.out);
    }

    @Nested
    @DisplayName("evaluate / verify-receipt")
    class ReceiptCommandTests {

        @Test
        @DisplayName("签发后校验通过")
        void evaluateThenVerify() throws IOException {
            Path receipt = issueReceipt("--token", "tok-1");

            JsonNode issued = JsonSupport.readTree(receipt);
            assertEquals("ALLOW", issued.get("decision").asText());
            assertEquals("cap-1", issued.get("capability_token_ref").asText());

            Result verified = run("verify-receipt", "--config", configFile.toString(), "--receipt", receipt.toString());
            assertEquals(BluxGuardCli.EXIT_OK, verified.code);
            assertTrue(verified.json().get("ok").asBoolean());
        }

        @Test
        @DisplayName("无令牌时仍签发 BLOCK 收据")
        void evaluateWithoutToken() throws IOException {
            JsonNode issued = JsonSupport.readTree(issueReceipt());

            assertEquals("BLOCK", issued.get("decision").asText());
            assertEquals("missing", issued.get("token_status").asText());
        }

        @Test
        @DisplayName("篡改收据后校验失败，退出码 2")
        void tamperedReceipt() throws IOException {
            Path receipt = issueReceipt("--token=tok-1");
            ObjectNode node = (ObjectNode) JsonSupport.readTree(receipt);
            node.put("decision", "BLOCK");
            Files.writeString(receipt, JsonSupport.toPrettyJson(node));

            Result verified = run("verify-receipt", "--config", configFile.toString(), "--receipt", receipt.toString());

            assertEquals(BluxGuardCli.EXIT_VERIFICATION_FAILED, verified.code);
            assertEquals("signature_mismatch", verified.json().get("reason").asText());
        }

        @Test
        @DisplayName("信封不满足契约时输出全部违规项")
        void schemaViolation() throws IOException {
            Path envelope = write("bad.json", "{\"timeout_s\":-1,\"unknown\":true}");

            Result result = run("evaluate", "--config", configFile.toString(), "--request-envelope", envelope.toString());

            assertEquals(BluxGuardCli.EXIT_INPUT_ERROR, result.code);
            assertEquals("schema_violation", result.json().get("error").asText());
            assertTrue(result.json().get("violations").size() >= 2);
        }

        @Test
        @DisplayName("超大整数超时输出结构化违规而非堆栈")
        void oversizedTimeoutIsStructured() throws IOException {
            Path envelope = write("huge.json", "{\"working_dir\":\"/tmp\",\"timeout_s\":10000000000}");

            Result result = run("evaluate", "--config", configFile.toString(), "--request-envelope", envelope.toString());

            assertEquals(BluxGuardCli.EXIT_INPUT_ERROR, result.code);
            assertEquals("schema_violation", result.json().get("error").asText());
            assertEquals(1, result.json().get("violations").size());
        }
    }

    @Nested
    @DisplayName("参数与配置错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少子命令时输出用法")
        void noCommand() {
            Result result = run();

            assertEquals(BluxGuardCli.EXIT_INPUT_ERROR, result.code);
            assertEquals("usage_error", result.json().get("error").asText());
            assertTrue(result.err.contains("Usage: blux-guard"));
        }

        @Test
        @DisplayName("缺少必填选项")
        void missingRequiredOption() {
            Result result = run("evaluate", "--config", configFile.toString());

            assertEquals(BluxGuardCli.EXIT_INPUT_ERROR, result.code);
            assertTrue(result.json().get("message").asText().contains("--request-envelope"));
        }

        @Test
        @DisplayName("未知选项")
        void unknownOption() {
            Result result = run("verify-receipt", "--receipts", "x.json");

            assertEquals("usage_error", result.json().get("error").asText());
        }

        @Test
        @DisplayName("配置文件不存在")
        void missingConfig() {
            Result result = run("audit-verify", "--config", tempDir.resolve("absent.yaml").toString());

            assertEquals(BluxGuardCli.EXIT_INPUT_ERROR, result.code);
            assertEquals("configuration_error", result.json().get("error").asText());
        }
    }

    @Nested
    @DisplayName("trip")
    class TripCommandTests {

        @Test
        @DisplayName("逐行输出 OK 或告警，跳过非法行")
        void processesStdin() throws IOException {
            write("rules.json", "{\"rules\":[{\"id\":\"sudo\",\"condition\":"
                    + "{\"type\":\"match\",\"field\":\"cmd\",\"value\":\"sudo\"}}]}");
            String stdin = String.join("\n",
                    "{\"uid\":\"a\",\"cmd\":\"ls\"}",
                    "not json",
                    "[1,2]",
                    "",
                    "{\"uid\":\"a\",\"cmd\":\"sudo\"}",
                    "");

            Result result = runWithStdin(stdin, "trip", "--config", configFile.toString());

            assertEquals(BluxGuardCli.EXIT_OK, result.code, result.err);
            List<String> lines = result.lines();
            assertEquals(2, lines.size(), result.out);
            assertEquals("OK", lines.get(0));
            JsonNode incident = CompactAlert.decode(lines.get(1),
                    new HmacSigner(TRIP_KEY.getBytes(StandardCharsets.UTF_8))).orElseThrow();
            assertEquals("sudo", incident.get("rule_id").asText());
            assertTrue(Files.exists(tempDir.resolve("logs").resolve("incidents.jsonl")));
        }

        @Test
        @DisplayName("--rules 覆盖配置中的规则文件；规则文件缺失时全部输出 OK")
        void rulesOverride() {
            Result result = runWithStdin("{\"uid\":\"a\"}\n", "trip", "--config", configFile.toString(),
                    "--rules", tempDir.resolve("none.json").toString());

            assertEquals(List.of("OK"), result.lines());
        }
    }

    @Nested
    @DisplayName("audit-verify")
    class AuditCommandTests {

        @Test
        @DisplayName("签发后的审计链完整")
        void cleanChain() throws IOException {
            issueReceipt("--token", "tok-1");
            issueReceipt();

            Result result = run("audit-verify", "--config", configFile.toString());

            assertEquals(BluxGuardCli.EXIT_OK, result.code);
            assertEquals("clean", result.json().get("status").asText());
            assertEquals(2, result.json().get("line_count").asInt());
        }

        @Test
        @DisplayName("锚点不符时退出码 2")
        void anchorMismatch() throws IOException {
            issueReceipt();

            Result result = run("audit-verify", "--config", configFile.toString(), "--anchor", "00ff");

            assertEquals(BluxGuardCli.EXIT_VERIFICATION_FAILED, result.code);
            assertEquals("tampered", result.json().get("status").asText());
        }

        @Test
        @DisplayName("篡改日志行后与原锚点不符，退出码 2")
        void tamperedLog() throws IOException {
            issueReceipt();
            issueReceipt();
            Path log = tempDir.resolve("logs").resolve("audit.jsonl");
            String anchor = run("audit-verify", "--log", log.toString()).json().get("digest").asText();
            List<String> lines = Files.readAllLines(log);
            Files.write(log, List.of(lines.get(0).replace("BLOCK", "ALLOW"), lines.get(1)));

            Result result = run("audit-verify", "--log", log.toString(), "--anchor", anchor);

            assertEquals(BluxGuardCli.EXIT_VERIFICATION_FAILED, result.code);
            assertEquals("tampered", result.json().get("status").asText());
        }
    }

    private static final class Result {
        final int code;
        final String out;
        final String err;

        Result(int code, String out, String err) {
            this.code = code;
            this.out = out;
            this.err = err;
        }

        JsonNode json() {
            try {
                return JsonSupport.mapper().readTree(out);
            } catch (IOException e) {
                throw new AssertionError("stdout is not JSON: " + out, e);
            }
        }

        List<String> lines() {
            return out.lines().filter(line -> !line.isBlank()).collect(Collectors.toList());
        }
    }
}
