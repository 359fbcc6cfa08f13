package com.bluxguard.core.token;

/**
 * 令牌相关原因码
 */
public final class TokenReasons {

    public static final String MISSING = "token.missing";
    public static final String INVALID = "token.invalid";
    public static final String VALID = "token.valid";
    public static final String REVOKED = "token.revoked";
    public static final String VERIFIER_UNAVAILABLE = "token.verifier_unavailable";
    public static final String VERIFY_FAILED = "token.verify_failed";

    private TokenReasons() {
    }
}
