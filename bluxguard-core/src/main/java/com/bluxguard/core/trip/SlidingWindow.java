package com.bluxguard.core.trip;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 单个 (规则, 主体, 字段) 的滑动时间窗口
 * <p>
 * "追加 → 剪枝 → 计数" 在实例锁内原子完成，并发写入同一主体时既不漏计也不重计。
 * 窗口只保留 [now - windowSeconds, now] 内的时间戳。
 * </p>
 */
public class SlidingWindow {

    private final Deque<Double> timestamps = new ArrayDeque<>();

    /**
     * @param now           当前时间（Unix 秒）
     * @param qualifying    本事件是否计入
     * @param windowSeconds 窗口长度
     * @return 剪枝后的窗口内事件数
     */
    public synchronized int record(double now, boolean qualifying, int windowSeconds) {
        if (qualifying) {
            timestamps.addLast(now);
        }
        double cutoff = now - windowSeconds;
        while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoff) {
            timestamps.pollFirst();
        }
        return timestamps.size();
    }

    public synchronized int size() {
        return timestamps.size();
    }
}
