package com.bluxguard.api.exception;

/**
 * BLUX Guard 基础异常
 * <p>
 * 所有信任核心抛出的异常均继承自此类，调用方可统一捕获。
 * </p>
 */
public class GuardException extends RuntimeException {

    public GuardException(String message) {
        super(message);
    }

    public GuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
