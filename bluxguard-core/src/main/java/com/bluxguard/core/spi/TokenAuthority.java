package com.bluxguard.core.spi;

import com.bluxguard.api.exception.TokenUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * 外部能力令牌权威 SPI
 * <p>
 * 可能阻塞（子进程或网络调用），调用方负责超时控制。
 * 返回权威的原始应答，由验证器解析为 valid / token_ref / reason_codes。
 * </p>
 */
public interface TokenAuthority extends AutoCloseable {

    /**
     * @param token       令牌原文
     * @param revocations 调用方提供的吊销集合
     * @return 权威应答
     * @throws TokenUnavailableException 权威不可达
     */
    JsonNode verify(String token, Set<String> revocations) throws TokenUnavailableException;

    /**
     * 释放在途调用占用的资源（如子进程），默认无操作
     */
    @Override
    default void close() {
    }
}
