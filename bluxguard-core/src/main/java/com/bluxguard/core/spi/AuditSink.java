package com.bluxguard.core.spi;

import com.bluxguard.core.audit.AuditRecord;

import java.io.IOException;

/**
 * 审计落盘 SPI
 * <p>
 * 由 {@link com.bluxguard.core.audit.AuditLog} 在全局写锁内按顺序调用，实现类无需自行加锁。
 * 只允许追加，契约中不存在更新和删除操作。
 * </p>
 */
public interface AuditSink {

    /**
     * Sink 名称，用于降级日志
     */
    String name();

    /**
     * 追加一条已计算摘要的记录
     *
     * @throws IOException 写入失败，调用方将其转换为 LogUnavailableException
     */
    void append(AuditRecord record) throws IOException;
}
