package com.bluxguard.core.token;

import com.bluxguard.api.exception.TokenUnavailableException;
import com.bluxguard.core.spi.TokenAuthority;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 子进程令牌权威
 * <p>
 * 执行配置的命令（默认 {@code blux-reg verify --token}），令牌追加为最后一个参数，
 * 标准输出应为一个 JSON 对象。
 * </p>
 * <p>
 * 调用线程只在 {@link Process#waitFor(long, TimeUnit)} 上阻塞，输出由独立线程读取；
 * 超时、中断或 {@link #close()} 时强制结束子进程及其后代。
 * </p>
 */
@Slf4j
public class ProcessTokenAuthority implements TokenAuthority {

    private final List<String> command;
    private final Duration timeout;
    private final Set<Process> live = ConcurrentHashMap.newKeySet();

    public ProcessTokenAuthority(List<String> command) {
        this(command, null);
    }

    /**
     * @param timeout 单次调用等待上限，{@code null} 表示由调用方通过中断控制
     */
    public ProcessTokenAuthority(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Token authority command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public JsonNode verify(String token, Set<String> revocations) {
        List<String> argv = new ArrayList<>(command);
        argv.add(token);

        Process process;
        try {
            process = new ProcessBuilder(argv).start();
        } catch (IOException e) {
            throw new TokenUnavailableException("cli_missing", "Token authority could not be started: " + command.get(0), e);
        }
        live.add(process);

        try {
            CompletableFuture<String> stdout = read(process.getInputStream());
            CompletableFuture<String> stderr = read(process.getErrorStream());
            if (!awaitExit(process)) {
                log.warn("[Token] Authority pid={} exceeded {} ms, killing", process.pid(), timeout.toMillis());
                kill(process);
                throw new TokenUnavailableException("timeout", "Token authority did not answer within " + timeout.toMillis() + " ms");
            }
            int code = process.exitValue();
            String out = output(stdout).trim();

            if (code != 0) {
                log.warn("[Token] Authority exited with code {}", code);
                ObjectNode failed = JsonSupport.mapper().createObjectNode();
                failed.put("valid", false);
                failed.put("status", "failed");
                failed.put("code", String.valueOf(code));
                failed.put("stderr", output(stderr).trim());
                failed.putArray("reason_codes").add(TokenReasons.VERIFY_FAILED);
                return failed;
            }
            try {
                return JsonSupport.mapper().readTree(out.isEmpty() ? "{}" : out);
            } catch (IOException e) {
                ObjectNode unknown = JsonSupport.mapper().createObjectNode();
                unknown.put("status", "unknown");
                unknown.put("message", out);
                return unknown;
            }
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new TokenUnavailableException("interrupted", "Token authority call interrupted", e);
        } finally {
            live.remove(process);
        }
    }

    /**
     * 当前仍在运行的子进程数
     */
    public int liveProcesses() {
        return (int) live.stream().filter(Process::isAlive).count();
    }

    /**
     * 强制结束全部在途子进程
     */
    @Override
    public void close() {
        for (Process process : live) {
            kill(process);
        }
        live.clear();
    }

    private boolean awaitExit(Process process) throws InterruptedException {
        if (timeout == null) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static CompletableFuture<String> read(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream is = in) {
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private static String output(CompletableFuture<String> future) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            throw new TokenUnavailableException("io_error", "Failed to read token authority output", e);
        }
    }
}
