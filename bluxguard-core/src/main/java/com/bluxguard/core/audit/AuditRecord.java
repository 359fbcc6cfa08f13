package com.bluxguard.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * 已追加的审计记录：规范化行内容及其链摘要
 */
@Value
public class AuditRecord {
    long seq;
    JsonNode entry;
    String line;
    String digest;

    public String action() {
        JsonNode node = entry == null ? null : entry.get("action");
        return node == null ? null : node.asText();
    }

    public String correlationId() {
        JsonNode node = entry == null ? null : entry.get("correlation_id");
        return node == null || node.isNull() ? null : node.asText();
    }
}
