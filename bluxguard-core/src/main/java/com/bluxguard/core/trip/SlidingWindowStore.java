package com.bluxguard.core.trip;

import lombok.Value;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 滑动窗口状态存储，触发引擎中唯一的共享可变状态
 * <p>
 * 每个键一把锁（窗口实例自身），不同主体之间互不阻塞。
 * 只有计入的事件才会创建窗口；剪枝后为空的窗口在同一次原子操作内移除，
 * 因此存储大小只随窗口内仍有事件的主体数增长。
 * </p>
 */
public class SlidingWindowStore {

    private final Map<WindowKey, SlidingWindow> windows = new ConcurrentHashMap<>();

    /**
     * 记录一次事件并返回剪枝后的窗口计数
     *
     * @param qualifying 本事件是否计入；不计入时只剪枝已有窗口
     */
    public int record(String ruleId, String subject, String field, double now, boolean qualifying, int windowSeconds) {
        WindowKey key = new WindowKey(ruleId, subject, field);
        int[] count = new int[1];
        if (qualifying) {
            windows.compute(key, (k, window) -> {
                SlidingWindow target = window == null ? new SlidingWindow() : window;
                count[0] = target.record(now, true, windowSeconds);
                return target;
            });
        } else {
            windows.computeIfPresent(key, (k, window) -> {
                count[0] = window.record(now, false, windowSeconds);
                return count[0] == 0 ? null : window;
            });
        }
        return count[0];
    }

    /**
     * 当前计数（不修改窗口）
     */
    public int count(String ruleId, String subject, String field) {
        SlidingWindow window = windows.get(new WindowKey(ruleId, subject, field));
        return window == null ? 0 : window.size();
    }

    public int size() {
        return windows.size();
    }

    public void clear() {
        windows.clear();
    }

    @Value
    static class WindowKey {
        String ruleId;
        String subject;
        String field;
    }
}
