package com.bluxguard.cli;

import com.bluxguard.api.exception.GuardException;

/**
 * 命令行用法错误
 */
public class UsageException extends GuardException {

    public UsageException(String message) {
        super(message);
    }
}
