package com.bluxguard.api.exception;

/**
 * 审计落盘失败
 * 审计 Sink 无法写入时抛出；收据引擎只记录降级事件，不阻断签发。
 */
public class LogUnavailableException extends GuardException {

    private final String sink;

    public LogUnavailableException(String sink, String message, Throwable cause) {
        super(message, cause);
        this.sink = sink;
    }

    public String getSink() {
        return sink;
    }
}
