package com.bluxguard.core.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TraceContext 单元测试")
class TraceContextTest {

    @AfterEach
    void tearDown() {
        TraceContext.clear();
    }

    @Test
    @DisplayName("继承调用方的 TraceId 并写入 MDC")
    void inheritsTraceId() {
        assertEquals("trace-1", TraceContext.setTraceId("trace-1"));

        assertEquals("trace-1", TraceContext.get());
        assertEquals("trace-1", MDC.get(TraceContext.MDC_KEY));
    }

    @Test
    @DisplayName("传入空值时生成新的 TraceId")
    void generatesWhenBlank() {
        TraceContext.setTraceId("old");

        String generated = TraceContext.setTraceId("  ");

        assertNotNull(generated);
        assertNotEquals("old", generated);
        assertEquals(generated, TraceContext.get());
    }

    @Test
    @DisplayName("start 复用已有 TraceId")
    void startReuses() {
        String first = TraceContext.start();

        assertEquals(first, TraceContext.start());
    }

    @Test
    @DisplayName("clear 同时清理 ThreadLocal 与 MDC")
    void clear() {
        TraceContext.setTraceId("t");
        TraceContext.clear();

        assertNull(TraceContext.get());
        assertNull(MDC.get(TraceContext.MDC_KEY));
    }

    @Test
    @DisplayName("TraceId 按线程隔离")
    void threadIsolation() throws InterruptedException {
        TraceContext.setTraceId("main");
        AtomicReference<String> seen = new AtomicReference<>("unset");

        Thread other = new Thread(() -> seen.set(TraceContext.get()));
        other.start();
        other.join();

        assertNull(seen.get());
        assertEquals("main", TraceContext.get());
    }
}
