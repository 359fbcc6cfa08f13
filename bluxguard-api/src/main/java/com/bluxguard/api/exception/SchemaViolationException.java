package com.bluxguard.api.exception;

import java.util.Collections;
import java.util.List;

/**
 * 结构校验异常
 * 输入文档不满足其版本化契约时抛出，携带全部违规项而非仅第一条。
 */
public class SchemaViolationException extends GuardException {

    private final String contract;
    private final List<String> violations;

    public SchemaViolationException(String contract, List<String> violations) {
        super("Schema validation failed for " + contract + ": " + String.join("; ", violations));
        this.contract = contract;
        this.violations = Collections.unmodifiableList(violations);
    }

    public String getContract() {
        return contract;
    }

    public List<String> getViolations() {
        return violations;
    }
}
