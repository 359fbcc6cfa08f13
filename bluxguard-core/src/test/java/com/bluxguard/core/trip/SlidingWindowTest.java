package com.bluxguard.core.trip;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SlidingWindow 单元测试")
class SlidingWindowTest {

    @Test
    @DisplayName("只保留 [now - window, now] 内的时间戳")
    void prunesOutsideWindow() {
        SlidingWindow window = new SlidingWindow();
        window.record(100, true, 60);
        window.record(130, true, 60);

        assertEquals(3, window.record(160, true, 60));
        assertEquals(2, window.record(161, false, 60));
    }

    @Test
    @DisplayName("不计入的事件也会触发剪枝")
    void nonQualifyingEventPrunes() {
        SlidingWindow window = new SlidingWindow();
        window.record(0, true, 10);

        assertEquals(0, window.record(20, false, 10));
        assertEquals(0, window.size());
    }

    @Test
    @DisplayName("存储按 (规则, 主体, 字段) 区分窗口")
    void storeKeysWindows() {
        SlidingWindowStore store = new SlidingWindowStore();

        assertEquals(1, store.record("r", "u", "f", 10, true, 60));
        assertEquals(2, store.record("r", "u", "f", 11, true, 60));
        assertEquals(1, store.record("r2", "u", "f", 11, true, 60));
        assertEquals(2, store.size());
        assertEquals(2, store.count("r", "u", "f"));
        assertEquals(0, store.count("r", "other", "f"));

        store.clear();
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("不计入的事件不创建窗口，大量不同主体不会使存储增长")
    void nonQualifyingEventsDoNotCreateWindows() {
        SlidingWindowStore store = new SlidingWindowStore();

        for (int i = 0; i < 10_000; i++) {
            assertEquals(0, store.record("brute-force", "user-" + i, "failed_login", 100 + i, false, 60));
        }

        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("剪枝后为空的窗口被移除，之后计入的事件重新建窗")
    void emptiedWindowIsEvicted() {
        SlidingWindowStore store = new SlidingWindowStore();
        store.record("r", "u", "f", 0, true, 10);
        assertEquals(1, store.size());

        assertEquals(1, store.record("r", "u", "f", 5, false, 10));
        assertEquals(1, store.size());

        assertEquals(0, store.record("r", "u", "f", 20, false, 10));
        assertEquals(0, store.size());

        assertEquals(1, store.record("r", "u", "f", 21, true, 10));
        assertEquals(1, store.size());
    }
}
