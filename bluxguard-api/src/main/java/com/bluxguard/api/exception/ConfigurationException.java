package com.bluxguard.api.exception;

/**
 * 配置加载异常
 * 配置文件、规则文件或密钥文件无法读取或解析时抛出。
 */
public class ConfigurationException extends GuardException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
