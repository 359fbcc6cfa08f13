package com.bluxguard.core.schema;

/**
 * 版本化结构契约
 */
public enum Contract {
    REQUEST_ENVELOPE("request_envelope.schema.json"),
    DISCERNMENT_REPORT("discernment_report.schema.json"),
    GUARD_RECEIPT("guard_receipt.schema.json");

    public static final String RECEIPT_SCHEMA_ID = "blux://contracts/guard_receipt.schema.json";

    private final String resourceName;

    Contract(String resourceName) {
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
