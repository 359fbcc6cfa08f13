package com.bluxguard.core.audit;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.api.exception.LogUnavailableException;
import com.bluxguard.core.crypto.CanonicalJson;
import com.bluxguard.core.crypto.HashChain;
import com.bluxguard.core.spi.AuditSink;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 哈希链审计日志
 * <p>
 * 只追加。"读取上一摘要 → 计算新摘要 → 写入全部 Sink" 在全局写锁内完成，
 * 并发写入方因此排队等待（背压），而不是丢弃记录。
 * 第一个 Sink 是提交点：它写入失败时链状态不前进，并抛出 {@link LogUnavailableException}；
 * 它成功后链即前进，其余 Sink（镜像、索引）失败只记录告警，不影响已提交的序号。
 * </p>
 */
@Slf4j
public class AuditLog {

    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<AuditSink> sinks;
    private final IndexedAuditStore index;
    private final Clock clock;

    // 仅在 writeLock 内替换
    private volatile HashChain chain;

    AuditLog(List<AuditSink> sinks, IndexedAuditStore index, HashChain chain, Clock clock) {
        List<AuditSink> all = new ArrayList<>(sinks);
        all.add(index);
        this.sinks = Collections.unmodifiableList(all);
        this.index = index;
        this.chain = chain;
        this.clock = clock;
    }

    /**
     * 打开文件日志：重放已有行恢复链锚点和索引，之后续写
     *
     * @throws ConfigurationException 已有日志无法读取
     */
    public static AuditLog open(Path file, boolean fsync, Clock clock) {
        List<String> lines;
        try {
            lines = JsonLinesAuditSink.readLines(file);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to replay audit log: " + file, e);
        }
        IndexedAuditStore index = new IndexedAuditStore();
        HashChain chain = new HashChain();
        for (String line : lines) {
            long seq = chain.length();
            String digest = chain.nextHex(line);
            JsonNode entry = parseQuietly(line, seq, file);
            index.append(new AuditRecord(seq, entry, line, digest));
        }
        if (!lines.isEmpty()) {
            log.info("[Audit] Replayed {} entries from {}, anchor={}", lines.size(), file, chain.digestHex());
        }
        return new AuditLog(List.of(new JsonLinesAuditSink(file, fsync)), index, chain, clock);
    }

    /**
     * 纯内存日志（测试及无持久化部署）
     */
    public static AuditLog inMemory(Clock clock) {
        return new AuditLog(List.of(), new IndexedAuditStore(), new HashChain(), clock);
    }

    /**
     * 使用自定义 Sink 组合
     */
    public static AuditLog withSinks(List<AuditSink> sinks, Clock clock) {
        return new AuditLog(sinks, new IndexedAuditStore(), new HashChain(), clock);
    }

    public AuditRecord append(AuditEvent event) {
        writeLock.lock();
        try {
            long seq = chain.length();
            ObjectNode entry = toEntry(event, seq);
            String line = CanonicalJson.toString(entry);

            HashChain candidate = chain.copy();
            String digest = candidate.nextHex(line);
            AuditRecord record = new AuditRecord(seq, entry, line, digest);

            AuditSink primary = sinks.get(0);
            try {
                primary.append(record);
            } catch (IOException e) {
                log.warn("[Audit] Sink {} unavailable, entry seq={} action={} not persisted",
                        primary.name(), seq, event.getAction());
                throw new LogUnavailableException(primary.name(), "Audit sink write failed: " + e.getMessage(), e);
            }
            // 主 Sink 写入即提交
            chain = candidate;

            for (AuditSink sink : sinks.subList(1, sinks.size())) {
                try {
                    sink.append(record);
                } catch (IOException e) {
                    log.warn("[Audit] Secondary sink {} failed for committed entry seq={} action={}: {}",
                            sink.name(), seq, event.getAction(), e.getMessage());
                }
            }
            return record;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 当前链锚点（终端摘要），空日志为空串
     */
    public String anchor() {
        return chain.digestHex();
    }

    public long size() {
        return chain.length();
    }

    public IndexedAuditStore index() {
        return index;
    }

    private ObjectNode toEntry(AuditEvent event, long seq) {
        ObjectNode entry = JsonSupport.mapper().createObjectNode();
        double ts = event.getTimestamp() != null ? event.getTimestamp() : clock.millis() / 1000.0;
        entry.put("ts", ts);
        entry.put("seq", seq);
        entry.put("level", event.getLevel());
        entry.put("actor", event.getActor());
        entry.put("action", event.getAction());
        entry.put("stream", event.getStream());
        entry.put("correlation_id", event.getCorrelationId() != null
                ? event.getCorrelationId() : UUID.randomUUID().toString());
        if (event.getComponent() != null) {
            entry.put("component", event.getComponent());
        }
        entry.set("payload", event.getPayload() == null
                ? JsonSupport.mapper().createObjectNode()
                : JsonSupport.mapper().valueToTree(event.getPayload()));
        return entry;
    }

    private static JsonNode parseQuietly(String line, long seq, Path file) {
        try {
            return JsonSupport.mapper().readTree(line);
        } catch (IOException e) {
            log.warn("[Audit] Line {} of {} is not valid JSON; kept in chain, excluded from index", seq + 1, file);
            return null;
        }
    }
}
