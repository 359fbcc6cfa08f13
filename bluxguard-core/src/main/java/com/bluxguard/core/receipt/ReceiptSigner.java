package com.bluxguard.core.receipt;

import com.bluxguard.core.crypto.CanonicalJson;
import com.bluxguard.core.crypto.HmacSigner;
import com.bluxguard.core.spi.SecretProvider;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 收据签名：HMAC-SHA256(secret, canonical(receipt - signature))
 */
public class ReceiptSigner {

    static final String SIGNATURE_FIELD = "signature";

    private final SecretProvider secrets;

    public ReceiptSigner(SecretProvider secrets) {
        this.secrets = secrets;
    }

    public ReceiptSignature sign(GuardReceipt receipt) {
        byte[] payload = signedBytes(JsonSupport.mapper().valueToTree(receipt));
        String value = new HmacSigner(secrets.signingSecret()).signHex(payload);
        return ReceiptSignature.builder().alg(HmacSigner.ALGORITHM).value(value).build();
    }

    /**
     * 依次使用当前与历史密钥比对，任一匹配即通过
     */
    public boolean matches(JsonNode receipt, String expectedHex) {
        byte[] payload = signedBytes(receipt);
        for (byte[] secret : secrets.verificationSecrets()) {
            if (new HmacSigner(secret).verifyHex(payload, expectedHex)) {
                return true;
            }
        }
        return false;
    }

    static byte[] signedBytes(JsonNode receipt) {
        ObjectNode copy = receipt.deepCopy();
        copy.remove(SIGNATURE_FIELD);
        return CanonicalJson.toBytes(copy);
    }
}
