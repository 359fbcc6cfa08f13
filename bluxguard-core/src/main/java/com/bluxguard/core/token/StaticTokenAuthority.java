package com.bluxguard.core.token;

import com.bluxguard.core.spi.TokenAuthority;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 静态令牌权威
 * 从配置的可信令牌表应答，适用于离线部署与测试；未登记的令牌视为无效。
 */
public class StaticTokenAuthority implements TokenAuthority {

    private final Map<String, JsonNode> responses = new ConcurrentHashMap<>();

    public StaticTokenAuthority() {
    }

    public StaticTokenAuthority(Map<String, String> trustedTokens) {
        if (trustedTokens != null) {
            trustedTokens.forEach(this::trust);
        }
    }

    /**
     * 登记一个有效令牌
     *
     * @param token    令牌原文
     * @param tokenRef 规范标识，为空时使用令牌原文
     */
    public StaticTokenAuthority trust(String token, String tokenRef) {
        ObjectNode payload = JsonSupport.mapper().createObjectNode();
        payload.put("valid", true);
        payload.put("status", "valid");
        payload.put("token_ref", tokenRef == null || tokenRef.isBlank() ? token : tokenRef);
        responses.put(token, payload);
        return this;
    }

    public StaticTokenAuthority respond(String token, JsonNode payload) {
        responses.put(token, payload);
        return this;
    }

    @Override
    public JsonNode verify(String token, Set<String> revocations) {
        JsonNode payload = responses.get(token);
        if (payload != null) {
            return payload;
        }
        ObjectNode unknown = JsonSupport.mapper().createObjectNode();
        unknown.put("valid", false);
        unknown.put("status", "unknown");
        return unknown;
    }
}
