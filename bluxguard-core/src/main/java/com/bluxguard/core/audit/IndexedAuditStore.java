package com.bluxguard.core.audit;

import com.bluxguard.core.spi.AuditSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 索引记录存储
 * 按序号、动作和关联 ID 建立内存索引；写入由 AuditLog 串行化，读取可并发。
 */
public class IndexedAuditStore implements AuditSink {

    private final ConcurrentSkipListMap<Long, AuditRecord> bySeq = new ConcurrentSkipListMap<>();
    private final Map<String, List<Long>> byAction = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> byCorrelation = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "index";
    }

    @Override
    public void append(AuditRecord record) {
        bySeq.put(record.getSeq(), record);
        String action = record.action();
        if (action != null) {
            byAction.computeIfAbsent(action, k -> new CopyOnWriteArrayList<>()).add(record.getSeq());
        }
        String correlationId = record.correlationId();
        if (correlationId != null) {
            byCorrelation.computeIfAbsent(correlationId, k -> new CopyOnWriteArrayList<>()).add(record.getSeq());
        }
    }

    public Optional<AuditRecord> get(long seq) {
        return Optional.ofNullable(bySeq.get(seq));
    }

    public List<AuditRecord> findByAction(String action) {
        return resolve(byAction.get(action));
    }

    public List<AuditRecord> findByCorrelationId(String correlationId) {
        return resolve(byCorrelation.get(correlationId));
    }

    public List<AuditRecord> all() {
        return new ArrayList<>(bySeq.values());
    }

    public int size() {
        return bySeq.size();
    }

    private List<AuditRecord> resolve(List<Long> seqs) {
        if (seqs == null) {
            return Collections.emptyList();
        }
        List<AuditRecord> out = new ArrayList<>(seqs.size());
        for (Long seq : seqs) {
            AuditRecord record = bySeq.get(seq);
            if (record != null) {
                out.add(record);
            }
        }
        return out;
    }
}
