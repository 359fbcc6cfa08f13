package com.bluxguard.core.audit;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 审计事件（写入前的原始形态）
 */
@Value
@Builder
public class AuditEvent {

    /**
     * 动作，例如 guard.receipt.issued、trip.incident
     */
    String action;

    @Builder.Default
    String level = "info";

    @Builder.Default
    String actor = "local";

    @Builder.Default
    String stream = "audit";

    /**
     * 关联 ID，为空时由 AuditLog 生成
     */
    String correlationId;

    String component;

    Map<String, Object> payload;

    /**
     * Unix 秒，为空时由 AuditLog 按时钟填充
     */
    Double timestamp;
}
