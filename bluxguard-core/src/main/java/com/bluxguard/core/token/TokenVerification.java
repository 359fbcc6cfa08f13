package com.bluxguard.core.token;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 单个令牌的验证结果
 */
@Value
@Builder
public class TokenVerification {
    String token;
    boolean valid;
    /**
     * 权威解析出的规范标识
     */
    String tokenRef;
    @Singular
    List<String> reasonCodes;
    @Singular("meta")
    Map<String, String> metadata;

    static TokenVerification rejected(String token, String reasonCode, String status) {
        return TokenVerification.builder()
                .token(token)
                .valid(false)
                .tokenRef(token)
                .reasonCode(reasonCode)
                .meta("status", status)
                .build();
    }
}
