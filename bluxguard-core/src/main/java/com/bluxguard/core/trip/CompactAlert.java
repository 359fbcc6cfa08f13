package com.bluxguard.core.trip;

import com.bluxguard.core.crypto.CanonicalJson;
import com.bluxguard.core.crypto.HmacSigner;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Base64;
import java.util.Optional;

/**
 * 紧凑告警：base64(canonical_json(incident)).base64(hmac)
 * 可由持有同一密钥的外部方独立校验。
 */
@Slf4j
public final class CompactAlert {

    private CompactAlert() {
    }

    public static String encode(JsonNode incident, HmacSigner signer) {
        byte[] payload = CanonicalJson.toBytes(incident);
        return Base64.getEncoder().encodeToString(payload) + "." + signer.signBase64(payload);
    }

    /**
     * 校验并解码告警
     *
     * @return 事故内容；格式错误或 MAC 不匹配时为空
     */
    public static Optional<JsonNode> decode(String alert, HmacSigner signer) {
        if (alert == null) {
            return Optional.empty();
        }
        int dot = alert.indexOf('.');
        if (dot <= 0 || dot != alert.lastIndexOf('.')) {
            return Optional.empty();
        }
        byte[] payload;
        byte[] mac;
        try {
            payload = Base64.getDecoder().decode(alert.substring(0, dot));
            mac = Base64.getDecoder().decode(alert.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            log.debug("[Trip] Alert is not valid base64: {}", e.getMessage());
            return Optional.empty();
        }
        if (!signer.verify(payload, mac)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonSupport.mapper().readTree(payload));
        } catch (IOException e) {
            log.debug("[Trip] Alert payload is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
