package com.bluxguard.core.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 信任核心事件集合（供仪表盘等外部订阅方消费）
 */
public class GuardEvents {

    @Getter
    @RequiredArgsConstructor
    public static class ReceiptIssuedEvent implements GuardEvent {
        private final String receiptId;
        private final String traceId;
        private final String decision;
        private final String tokenStatus;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class IncidentRaisedEvent implements GuardEvent {
        private final String ruleId;
        private final String subject;
        private final String alert; // 紧凑告警 base64(payload).base64(mac)
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class AuditDegradedEvent implements GuardEvent {
        private final String action; // 未能落盘的审计动作
        private final String sink;
        private final String reason;
        private final long timestamp = System.currentTimeMillis();
    }
}
