package com.bluxguard.core.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * HMAC-SHA256 签名器
 * <p>
 * 实例不可变，可跨线程共享；每次签名创建独立的 {@link Mac}。
 * </p>
 */
public class HmacSigner {

    public static final String ALGORITHM = "HMAC-SHA256";

    private static final String JCA_NAME = "HmacSHA256";

    private final byte[] key;

    public HmacSigner(byte[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("HMAC key must not be empty");
        }
        this.key = Arrays.copyOf(key, key.length);
    }

    public byte[] sign(byte[] data) {
        try {
            Mac mac = Mac.getInstance(JCA_NAME);
            mac.init(new SecretKeySpec(key, JCA_NAME));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    public String signHex(byte[] data) {
        return Digests.toHex(sign(data));
    }

    public String signBase64(byte[] data) {
        return Base64.getEncoder().encodeToString(sign(data));
    }

    /**
     * 常量时间比较十六进制 MAC
     */
    public boolean verifyHex(byte[] data, String expectedHex) {
        if (!Digests.isHex(expectedHex)) {
            return false;
        }
        return MessageDigest.isEqual(sign(data), Digests.fromHex(expectedHex));
    }

    public boolean verify(byte[] data, byte[] expected) {
        return expected != null && MessageDigest.isEqual(sign(data), expected);
    }
}
