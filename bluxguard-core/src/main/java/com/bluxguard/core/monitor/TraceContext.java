package com.bluxguard.core.monitor;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 链路追踪上下文
 * 使用 ThreadLocal 管理 TraceId，并同步到 SLF4J MDC（键 traceId），使日志带上当前评估的关联 ID。
 */
public class TraceContext {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    /**
     * 开启或获取当前 TraceId
     */
    public static String start() {
        String tid = TRACE_ID.get();
        if (tid == null) {
            tid = UUID.randomUUID().toString();
            set(tid);
        }
        return tid;
    }

    public static String get() {
        return TRACE_ID.get();
    }

    /**
     * 继承调用方的 TraceId；传入空值时生成新的
     */
    public static String setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            set(traceId);
            return traceId;
        }
        clear();
        return start();
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }

    private static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }
}
