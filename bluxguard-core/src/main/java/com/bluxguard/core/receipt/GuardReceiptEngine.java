package com.bluxguard.core.receipt;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.api.exception.LogUnavailableException;
import com.bluxguard.api.exception.SchemaViolationException;
import com.bluxguard.core.audit.AuditEvent;
import com.bluxguard.core.audit.AuditLog;
import com.bluxguard.core.constraint.ConstraintResolver;
import com.bluxguard.core.constraint.SandboxConstraints;
import com.bluxguard.core.crypto.CanonicalJson;
import com.bluxguard.core.crypto.Digests;
import com.bluxguard.core.crypto.HmacSigner;
import com.bluxguard.core.decision.DecisionInput;
import com.bluxguard.core.decision.DecisionMappingEngine;
import com.bluxguard.core.decision.DecisionOutcome;
import com.bluxguard.core.event.EventBus;
import com.bluxguard.core.event.GuardEvents;
import com.bluxguard.core.model.DiscernmentReport;
import com.bluxguard.core.model.RequestEnvelope;
import com.bluxguard.core.monitor.TraceContext;
import com.bluxguard.core.schema.Contract;
import com.bluxguard.core.schema.SchemaValidator;
import com.bluxguard.core.token.CapabilityTokenVerifier;
import com.bluxguard.core.token.TokenCheck;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * 守卫收据引擎：信任核心的对外入口
 * <p>
 * evaluate：结构校验 → 令牌验证 → 决策映射 → 约束解析 → 签名 → 自检 → 审计。
 * 审计写入失败只记录降级事件，不阻断收据签发。
 * </p>
 * <p>
 * verify：结构校验 → 签名元数据 → MAC 比对，任何一步失败都返回明确原因而不抛异常。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class GuardReceiptEngine {

    public static final String AUDIT_ACTION = "guard.receipt.issued";
    static final String UNKNOWN_TOKEN_REF = "unknown";

    private final SchemaValidator validator;
    private final CapabilityTokenVerifier tokenVerifier;
    private final DecisionMappingEngine decisionEngine;
    private final ConstraintResolver constraintResolver;
    private final ReceiptSigner signer;
    private final AuditLog auditLog;
    private final EventBus eventBus;
    private final Clock clock;

    /**
     * 评估原始 JSON 文档
     *
     * @param envelope    请求信封
     * @param discernment 风险评估，可为 null
     * @param tokens      显式令牌；为空时取信封内携带的令牌
     * @param revocations 吊销集合，可为 null
     * @throws SchemaViolationException 信封或评估报告不满足契约（列出两者的全部违规项）
     */
    public GuardReceipt evaluate(JsonNode envelope, JsonNode discernment,
                                 List<String> tokens, Collection<String> revocations) {
        List<String> violations = new ArrayList<>(validator.validate(Contract.REQUEST_ENVELOPE, envelope));
        boolean hasDiscernment = discernment != null && !discernment.isNull() && !discernment.isMissingNode();
        String failedContract = violations.isEmpty() ? null : Contract.REQUEST_ENVELOPE.getResourceName();
        if (hasDiscernment) {
            List<String> reportViolations = validator.validate(Contract.DISCERNMENT_REPORT, discernment);
            if (!reportViolations.isEmpty()) {
                violations.addAll(reportViolations);
                failedContract = failedContract == null
                        ? Contract.DISCERNMENT_REPORT.getResourceName()
                        : failedContract + "," + Contract.DISCERNMENT_REPORT.getResourceName();
            }
        }
        if (!violations.isEmpty()) {
            log.info("[Receipt] Rejected input with {} schema violation(s)", violations.size());
            throw new SchemaViolationException(failedContract, violations);
        }

        RequestEnvelope request = JsonSupport.mapper().convertValue(envelope, RequestEnvelope.class);
        DiscernmentReport report = hasDiscernment
                ? JsonSupport.mapper().convertValue(discernment, DiscernmentReport.class)
                : null;
        return evaluate(request, report, tokens, revocations);
    }

    /**
     * 评估已解析的输入
     */
    public GuardReceipt evaluate(RequestEnvelope envelope, DiscernmentReport discernment,
                                 List<String> tokens, Collection<String> revocations) {
        String previousTrace = TraceContext.get();
        String traceId = TraceContext.setTraceId(envelope.getTraceId());
        try {
            List<String> effectiveTokens = tokens != null && !tokens.isEmpty() ? tokens : envelope.embeddedTokens();
            TokenCheck tokenCheck = tokenVerifier.check(effectiveTokens, revocations);

            DecisionOutcome outcome = decisionEngine.map(DecisionInput.of(tokenCheck, discernment));
            SandboxConstraints constraints = constraintResolver.resolve(envelope, outcome.getDecision());

            GuardReceipt unsigned = GuardReceipt.builder()
                    .schema(Contract.RECEIPT_SCHEMA_ID)
                    .receiptId(UUID.randomUUID().toString())
                    .issuedAt(clock.millis() / 1000.0)
                    .decision(outcome.getDecision())
                    .traceId(traceId)
                    .capabilityTokenRef(tokenRef(tokenCheck, envelope))
                    .tokenStatus(tokenCheck.getStatus().wireValue())
                    .reasonCodes(outcome.getReasonCodes())
                    .constraints(constraints)
                    .discernment(DiscernmentEcho.of(discernment))
                    .bindings(bindings(traceId, envelope))
                    .build();
            GuardReceipt receipt = unsigned.toBuilder().signature(signer.sign(unsigned)).build();

            validator.requireValid(Contract.GUARD_RECEIPT, JsonSupport.mapper().valueToTree(receipt));

            log.info("[Receipt] Issued {} decision={} token_status={} reasons={}",
                    receipt.getReceiptId(), receipt.getDecision(), receipt.getTokenStatus(), receipt.getReasonCodes());
            recordIssued(receipt);
            eventBus.publish(new GuardEvents.ReceiptIssuedEvent(
                    receipt.getReceiptId(), traceId, receipt.getDecision().name(), receipt.getTokenStatus()));
            return receipt;
        } finally {
            if (previousTrace != null) {
                TraceContext.setTraceId(previousTrace);
            } else {
                TraceContext.clear();
            }
        }
    }

    /**
     * 从文件评估
     *
     * @param revocations JSON 数组，或 {"revoked_tokens": [...]}；可为 null
     * @throws ConfigurationException 文件不可读或格式不符
     */
    public GuardReceipt evaluateFromFiles(Path envelope, Path discernment, List<String> tokens, Path revocations) {
        JsonNode envelopeNode = JsonSupport.readTree(envelope);
        JsonNode discernmentNode = discernment == null ? null : JsonSupport.readTree(discernment);
        List<String> revoked = revocations == null ? List.of() : readRevocations(revocations);
        return evaluate(envelopeNode, discernmentNode, tokens, revoked);
    }

    public ReceiptVerification verify(GuardReceipt receipt) {
        return verify((JsonNode) JsonSupport.mapper().valueToTree(receipt));
    }

    public ReceiptVerification verify(JsonNode receipt) {
        List<String> violations = validator.validate(Contract.GUARD_RECEIPT, receipt);
        if (!violations.isEmpty()) {
            return ReceiptVerification.failure(ReceiptVerification.MISSING_FIELDS, violations);
        }
        JsonNode signature = receipt.get(ReceiptSigner.SIGNATURE_FIELD);
        String alg = signature.path("alg").asText();
        String value = signature.path("value").asText();
        if (!HmacSigner.ALGORITHM.equals(alg) || !Digests.isHex(value)) {
            return ReceiptVerification.failure(ReceiptVerification.INVALID_SIGNATURE_METADATA);
        }
        if (!signer.matches(receipt, value)) {
            log.warn("[Receipt] Signature mismatch for receipt {}", receipt.path("receipt_id").asText());
            return ReceiptVerification.failure(ReceiptVerification.SIGNATURE_MISMATCH);
        }
        return ReceiptVerification.success();
    }

    static List<String> readRevocations(Path file) {
        JsonNode node = JsonSupport.readTree(file);
        JsonNode list = node.isObject() ? node.get("revoked_tokens") : node;
        if (list == null || !list.isArray()) {
            throw new ConfigurationException("Revocations file must be an array or {\"revoked_tokens\": [...]}: " + file);
        }
        List<String> revoked = new ArrayList<>(list.size());
        for (JsonNode item : list) {
            revoked.add(item.asText());
        }
        return revoked;
    }

    private void recordIssued(GuardReceipt receipt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("receipt_id", receipt.getReceiptId());
        payload.put("decision", receipt.getDecision().name());
        payload.put("trace_id", receipt.getTraceId());
        payload.put("capability_token_ref", receipt.getCapabilityTokenRef());
        payload.put("constraints_hash", Digests.sha256Hex(CanonicalJson.toBytes(receipt.getConstraints())));
        try {
            auditLog.append(AuditEvent.builder()
                    .action(AUDIT_ACTION)
                    .component("guard")
                    .correlationId(receipt.getTraceId())
                    .payload(payload)
                    .build());
        } catch (LogUnavailableException e) {
            log.warn("[Receipt] Audit degraded, receipt {} issued without durable record: {}",
                    receipt.getReceiptId(), e.getMessage());
            eventBus.publish(new GuardEvents.AuditDegradedEvent(AUDIT_ACTION, e.getSink(), e.getMessage()));
        }
    }

    private static String tokenRef(TokenCheck tokenCheck, RequestEnvelope envelope) {
        if (tokenCheck.getTokenRef() != null) {
            return tokenCheck.getTokenRef();
        }
        if (envelope.getCapabilityTokenRef() != null && !envelope.getCapabilityTokenRef().isBlank()) {
            return envelope.getCapabilityTokenRef();
        }
        return UNKNOWN_TOKEN_REF;
    }

    private static ReceiptBindings bindings(String traceId, RequestEnvelope envelope) {
        List<String> refs = envelope.getCapabilityRefs() == null || envelope.getCapabilityRefs().isEmpty()
                ? null
                : List.copyOf(new TreeSet<>(envelope.getCapabilityRefs()));
        return ReceiptBindings.builder()
                .traceId(traceId)
                .envelopeHash(envelope.getEnvelopeHash())
                .capabilityRefs(refs)
                .build();
    }
}
