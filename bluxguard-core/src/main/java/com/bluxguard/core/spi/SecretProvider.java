package com.bluxguard.core.spi;

import java.util.List;

/**
 * MAC 密钥提供方 SPI
 * 支持轮换：签发只使用当前密钥，校验依次尝试当前与历史密钥。
 */
public interface SecretProvider {

    byte[] signingSecret();

    default List<byte[]> verificationSecrets() {
        return List.of(signingSecret());
    }
}
