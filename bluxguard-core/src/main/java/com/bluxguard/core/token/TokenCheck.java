package com.bluxguard.core.token;

import com.bluxguard.api.decision.TokenStatus;
import lombok.Value;

import java.util.List;

/**
 * 一次评估中全部令牌的汇总结果
 * 只有全部令牌有效时状态才为 VALID；任一无效或不可验证即 INVALID。
 */
@Value
public class TokenCheck {
    TokenStatus status;
    /**
     * 第一个令牌解析出的规范标识，可为空
     */
    String tokenRef;
    List<String> reasonCodes;
    List<TokenVerification> verifications;

    public boolean isValid() {
        return status == TokenStatus.VALID;
    }
}
