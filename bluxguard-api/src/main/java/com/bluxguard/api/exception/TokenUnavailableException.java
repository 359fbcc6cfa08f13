package com.bluxguard.api.exception;

/**
 * 令牌验证方不可用
 * <p>
 * 由外部令牌权威（进程或网络）在无法给出结论时抛出。
 * 验证器会将其转换为 {@code token.verifier_unavailable}，对应决策为 BLOCK。
 * </p>
 */
public class TokenUnavailableException extends GuardException {

    private final String reason;

    public TokenUnavailableException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenUnavailableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * 机器可读的不可用原因，例如 cli_missing、timeout
     */
    public String getReason() {
        return reason;
    }
}
