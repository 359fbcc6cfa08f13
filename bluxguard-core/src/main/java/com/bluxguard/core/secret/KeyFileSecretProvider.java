package com.bluxguard.core.secret;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.core.spi.SecretProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;

/**
 * 密钥文件提供方（触发引擎告警签名）
 * 文件不存在时生成 32 字节随机密钥，POSIX 系统上权限为 0600。
 */
@Slf4j
public class KeyFileSecretProvider implements SecretProvider {

    private static final int KEY_LENGTH = 32;

    private final byte[] key;

    public KeyFileSecretProvider(Path keyFile) {
        this.key = loadOrCreate(keyFile);
    }

    @Override
    public byte[] signingSecret() {
        return key.clone();
    }

    private static byte[] loadOrCreate(Path keyFile) {
        try {
            if (Files.exists(keyFile)) {
                byte[] existing = Files.readAllBytes(keyFile);
                if (existing.length == 0) {
                    throw new ConfigurationException("Key file is empty: " + keyFile);
                }
                return existing;
            }
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] generated = new byte[KEY_LENGTH];
            new SecureRandom().nextBytes(generated);
            Files.write(keyFile, generated);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
            }
            log.info("[Secret] Generated new trip key at {}", keyFile);
            return generated;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load key file: " + keyFile, e);
        }
    }
}
