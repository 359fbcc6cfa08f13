package com.bluxguard.core.audit;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.core.crypto.HashChain;
import com.bluxguard.core.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 审计链完整性校验
 * <p>
 * 按文件顺序从头重算整条链。篡改通过与先前记录的锚点比对发现。
 * </p>
 */
@Slf4j
public final class AuditChainVerifier {

    private AuditChainVerifier() {
    }

    public static ChainReport verify(Path file) {
        return verify(file, null);
    }

    /**
     * @param expectedAnchor 先前记录的终端摘要，为空则只做重算
     */
    public static ChainReport verify(Path file, String expectedAnchor) {
        if (!Files.exists(file)) {
            return ChainReport.builder()
                    .chainStatus(ChainStatus.MISSING)
                    .digest("")
                    .lineCount(0)
                    .message("Audit log missing")
                    .build();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read audit log: " + file, e);
        }
        return verifyLines(lines, expectedAnchor);
    }

    public static ChainReport verifyLines(List<String> lines, String expectedAnchor) {
        HashChain chain = new HashChain();
        Integer corruptLine = null;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            chain.nextHex(line);
            if (corruptLine == null && !isParseable(line)) {
                corruptLine = i + 1;
            }
        }
        String digest = chain.digestHex();

        ChainStatus status;
        String message;
        if (corruptLine != null) {
            status = ChainStatus.CORRUPT;
            message = "Audit log line " + corruptLine + " is not valid JSON";
        } else if (expectedAnchor != null && !expectedAnchor.isBlank() && !expectedAnchor.equalsIgnoreCase(digest)) {
            status = ChainStatus.TAMPERED;
            message = "Audit chain digest does not match recorded anchor";
        } else if (lines.isEmpty()) {
            status = ChainStatus.EMPTY;
            message = "Audit log empty";
        } else {
            status = ChainStatus.CLEAN;
            message = "Audit chain intact";
        }
        if (!status.isHealthy()) {
            log.warn("[Audit] Chain verification: {} ({})", status.wireValue(), message);
        }
        return ChainReport.builder()
                .chainStatus(status)
                .digest(digest)
                .lineCount(lines.size())
                .message(message)
                .corruptLine(corruptLine)
                .build();
    }

    private static boolean isParseable(String line) {
        try {
            return JsonSupport.mapper().readTree(line).isObject();
        } catch (IOException e) {
            return false;
        }
    }
}
