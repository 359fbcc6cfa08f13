package com.bluxguard.core.audit;

import com.bluxguard.core.spi.AuditSink;
import lombok.extern.slf4j.Slf4j;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 行式追加日志（NDJSON），每行一条可独立解析的记录
 */
@Slf4j
public class JsonLinesAuditSink implements AuditSink {

    private final Path file;
    private final boolean fsync;

    public JsonLinesAuditSink(Path file, boolean fsync) {
        this.file = file;
        this.fsync = fsync;
    }

    @Override
    public String name() {
        return "jsonl:" + file;
    }

    @Override
    public void append(AuditRecord record) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] bytes = (record.getLine() + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileOutputStream out = new FileOutputStream(file.toFile(), true)) {
            out.write(bytes);
            out.flush();
            if (fsync) {
                out.getFD().sync();
            }
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * 读取全部行；文件不存在时返回空列表
     */
    public static List<String> readLines(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }
}
