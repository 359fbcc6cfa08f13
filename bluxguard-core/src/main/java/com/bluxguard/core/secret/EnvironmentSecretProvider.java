package com.bluxguard.core.secret;

import com.bluxguard.core.spi.SecretProvider;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从环境变量读取收据签名密钥
 * <p>
 * BLUX_GUARD_RECEIPT_SECRET 为当前密钥；BLUX_GUARD_RECEIPT_SECRET_PREVIOUS 仅用于校验轮换前签发的收据。
 * 未配置时退回开发密钥并告警。
 * </p>
 */
@Slf4j
public class EnvironmentSecretProvider implements SecretProvider {

    public static final String SECRET_ENV = "BLUX_GUARD_RECEIPT_SECRET";
    public static final String PREVIOUS_SECRET_ENV = "BLUX_GUARD_RECEIPT_SECRET_PREVIOUS";

    static final String DEV_SECRET = "blux-guard-dev-secret";

    private final byte[] current;
    private final byte[] previous;

    public EnvironmentSecretProvider() {
        this(System.getenv());
    }

    public EnvironmentSecretProvider(Map<String, String> env) {
        String secret = env.get(SECRET_ENV);
        if (secret == null || secret.isEmpty()) {
            log.warn("[Secret] {} not set, falling back to development secret", SECRET_ENV);
            secret = DEV_SECRET;
        }
        this.current = secret.getBytes(StandardCharsets.UTF_8);
        String prev = env.get(PREVIOUS_SECRET_ENV);
        this.previous = prev == null || prev.isEmpty() ? null : prev.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] signingSecret() {
        return current.clone();
    }

    @Override
    public List<byte[]> verificationSecrets() {
        List<byte[]> secrets = new ArrayList<>(2);
        secrets.add(current.clone());
        if (previous != null) {
            secrets.add(previous.clone());
        }
        return secrets;
    }
}
