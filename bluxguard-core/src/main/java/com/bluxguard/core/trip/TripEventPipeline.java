package com.bluxguard.core.trip;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 事件摄取管道
 * <p>
 * 传感器/代理作为生产者向有界队列投递事件；单个消费线程驱动 {@link TripEngine}。
 * 队列满时生产者阻塞（背压），不丢弃事件。生产者不持有任何规则状态。
 * </p>
 * <p>
 * 入队持有读锁，关闭持有写锁：被接受的事件一定排在结束标记之前，因而一定会被处理。
 * </p>
 */
@Slf4j
public class TripEventPipeline implements AutoCloseable {

    // 按引用比较的结束标记
    private static final JsonNode POISON = JsonNodeFactory.instance.objectNode();

    private final TripEngine engine;
    private final BlockingQueue<JsonNode> queue;
    private final Consumer<TripResult> resultHandler;
    private final Thread worker;
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    public TripEventPipeline(TripEngine engine, int capacity, Consumer<TripResult> resultHandler) {
        this.engine = engine;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.resultHandler = resultHandler;
        this.worker = new Thread(this::drain, "bluxguard-trip-worker");
        this.worker.setDaemon(true);
    }

    public TripEventPipeline start() {
        worker.start();
        log.info("[Trip] Event pipeline started (capacity={})", queue.remainingCapacity());
        return this;
    }

    /**
     * 投递事件，队列满时阻塞
     *
     * @throws IllegalStateException 管道已关闭
     */
    public void submit(JsonNode event) throws InterruptedException {
        closeLock.readLock().lockInterruptibly();
        try {
            ensureOpen();
            queue.put(event);
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * 限时投递
     *
     * @return 超时未能入队时为 false
     */
    public boolean offer(JsonNode event, long timeout, TimeUnit unit) throws InterruptedException {
        closeLock.readLock().lockInterruptibly();
        try {
            ensureOpen();
            return queue.offer(event, timeout, unit);
        } finally {
            closeLock.readLock().unlock();
        }
    }

    public int pending() {
        return queue.size();
    }

    /**
     * 处理完已入队的事件后停止
     */
    @Override
    public void close() throws InterruptedException {
        closeLock.writeLock().lockInterruptibly();
        try {
            if (closed) {
                return;
            }
            closed = true;
            queue.put(POISON);
        } finally {
            closeLock.writeLock().unlock();
        }
        worker.join();
        log.info("[Trip] Event pipeline stopped");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Trip pipeline is closed");
        }
    }

    private void drain() {
        while (true) {
            JsonNode event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Trip] Worker interrupted, {} events left unprocessed", queue.size());
                return;
            }
            if (event == POISON) {
                return;
            }
            try {
                resultHandler.accept(engine.process(event));
            } catch (RuntimeException e) {
                log.error("[Trip] Failed to process event, continuing", e);
            }
        }
    }
}
