package com.bluxguard.core.token;

import com.bluxguard.api.decision.TokenStatus;
import com.bluxguard.api.exception.TokenUnavailableException;
import com.bluxguard.core.spi.TokenAuthority;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 能力令牌验证器
 * <p>
 * 先查吊销集合，再委托外部权威。权威不可达、超时或异常一律视为
 * {@code token.verifier_unavailable}（失败即关闭，绝不放行）。
 * </p>
 */
@Slf4j
public class CapabilityTokenVerifier implements AutoCloseable {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final TokenAuthority authority;
    private final Duration timeout;
    private final ExecutorService executor;

    public CapabilityTokenVerifier(TokenAuthority authority, Duration timeout) {
        this.authority = authority;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "bluxguard-token-verifier-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 验证全部令牌并汇总
     */
    public TokenCheck check(List<String> tokens, Collection<String> revocations) {
        if (tokens == null || tokens.isEmpty()) {
            TokenVerification missing = TokenVerification.rejected(null, TokenReasons.MISSING, "missing");
            return new TokenCheck(TokenStatus.MISSING, null, List.of(TokenReasons.MISSING), List.of(missing));
        }
        Set<String> revoked = revocations == null ? Set.of() : Set.copyOf(revocations);

        List<TokenVerification> results = new ArrayList<>(tokens.size());
        List<String> reasons = new ArrayList<>();
        boolean allValid = true;
        for (String token : tokens) {
            TokenVerification result = verify(token, revoked);
            results.add(result);
            reasons.addAll(result.getReasonCodes());
            allValid &= result.isValid();
        }
        String tokenRef = results.get(0).getTokenRef();
        return new TokenCheck(allValid ? TokenStatus.VALID : TokenStatus.INVALID, tokenRef, reasons, results);
    }

    public TokenVerification verify(String token, Set<String> revocations) {
        if (revocations.contains(token)) {
            log.info("[Token] Token is revoked");
            return TokenVerification.rejected(token, TokenReasons.REVOKED, "revoked");
        }

        Future<JsonNode> future = executor.submit(() -> authority.verify(token, revocations));
        try {
            JsonNode payload = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            TokenVerification result = parse(payload, token);
            log.debug("[Token] Authority answered valid={} ref={}", result.isValid(), result.getTokenRef());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Token] Authority timed out after {} ms, failing closed", timeout.toMillis());
            return unavailable(token, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TokenUnavailableException) {
                log.warn("[Token] Authority unavailable ({}), failing closed", ((TokenUnavailableException) cause).getReason());
                return unavailable(token, ((TokenUnavailableException) cause).getReason());
            }
            log.error("[Token] Authority failed unexpectedly, failing closed", cause);
            return unavailable(token, "error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[Token] Interrupted while waiting for authority, failing closed");
            return unavailable(token, "interrupted");
        }
    }

    /**
     * 解析权威应答。兼容 valid / status=valid / state=active 三种有效性写法。
     */
    static TokenVerification parse(JsonNode payload, String token) {
        if (payload == null || !payload.isObject()) {
            return TokenVerification.rejected(token, TokenReasons.INVALID, "unknown");
        }
        boolean valid = payload.path("valid").asBoolean(false)
                || "valid".equals(payload.path("status").asText(null))
                || "active".equals(payload.path("state").asText(null));

        String tokenRef = firstText(payload, "token_ref", "id", "ref");
        if (tokenRef == null) {
            tokenRef = token;
        }

        List<String> reasons = new ArrayList<>();
        JsonNode reasonNode = payload.get("reason_codes");
        if (reasonNode != null && reasonNode.isTextual()) {
            reasons.add(reasonNode.asText());
        } else if (reasonNode != null && reasonNode.isArray()) {
            for (JsonNode item : reasonNode) {
                reasons.add(item.asText());
            }
        }
        if (reasons.isEmpty()) {
            reasons.add(valid ? TokenReasons.VALID : TokenReasons.INVALID);
        }

        TokenVerification.TokenVerificationBuilder builder = TokenVerification.builder()
                .token(token)
                .valid(valid)
                .tokenRef(tokenRef)
                .reasonCodes(reasons);
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("reason_codes".equals(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            builder.meta(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return builder.build();
    }

    private static TokenVerification unavailable(String token, String reason) {
        return TokenVerification.builder()
                .token(token)
                .valid(false)
                .tokenRef(token)
                .reasonCode(TokenReasons.VERIFIER_UNAVAILABLE)
                .meta("status", "unavailable")
                .meta("reason", reason == null ? "unknown" : reason)
                .build();
    }

    private static String firstText(JsonNode payload, String... names) {
        for (String name : names) {
            JsonNode node = payload.get(name);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        authority.close();
    }
}
