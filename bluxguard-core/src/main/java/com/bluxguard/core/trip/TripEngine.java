package com.bluxguard.core.trip;

import com.bluxguard.api.exception.LogUnavailableException;
import com.bluxguard.core.audit.AuditEvent;
import com.bluxguard.core.audit.AuditLog;
import com.bluxguard.core.crypto.CanonicalJson;
import com.bluxguard.core.crypto.HmacSigner;
import com.bluxguard.core.event.EventBus;
import com.bluxguard.core.event.GuardEvents;
import com.bluxguard.core.spi.SecretProvider;
import com.bluxguard.core.trip.condition.EventFields;
import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 触发规则引擎
 * <p>
 * 对每个事件依次求值全部规则。命中时生成事故，写入事故日志，并输出 HMAC 签名的紧凑告警。
 * 单条规则求值异常只影响该规则（视为未命中），不会中断事件处理。
 * 可被多个生产者线程并发调用。
 * </p>
 */
@Slf4j
public class TripEngine {

    public static final String INCIDENT_ACTION = "trip.incident";
    static final String UNKNOWN_SUBJECT = "<unknown>";
    static final String MAC_FIELD = "mac";
    static final String MAC_ALG_FIELD = "mac_alg";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RuleSet ruleSet;
    private final SlidingWindowStore windows;
    private final SecretProvider alertKey;
    private final AuditLog incidentLog;
    private final EventBus eventBus;
    private final Clock clock;
    private final String defaultSubjectField;

    public TripEngine(RuleSet ruleSet, SlidingWindowStore windows, SecretProvider alertKey,
                      AuditLog incidentLog, EventBus eventBus, Clock clock, String defaultSubjectField) {
        this.ruleSet = ruleSet;
        this.windows = windows;
        this.alertKey = alertKey;
        this.incidentLog = incidentLog;
        this.eventBus = eventBus;
        this.clock = clock;
        this.defaultSubjectField = defaultSubjectField;
    }

    public TripResult process(JsonNode event) {
        double now = clock.millis() / 1000.0;
        List<String> alerts = new ArrayList<>();
        List<JsonNode> incidents = new ArrayList<>();
        Map<String, RuleState> states = new LinkedHashMap<>();

        for (TripRule rule : ruleSet.getRules()) {
            states.put(rule.getId(), RuleState.EVALUATING);
            String subjectField = rule.getSubjectField() != null ? rule.getSubjectField() : defaultSubjectField;
            JsonNode subjectNode = EventFields.lookup(event, subjectField);
            String subject = subjectNode == null || subjectNode.isNull() ? UNKNOWN_SUBJECT : subjectNode.asText();

            boolean hit;
            try {
                hit = rule.getCondition().evaluate(new RuleContext(rule.getId(), subject, event, now, windows));
            } catch (RuntimeException e) {
                log.error("[Trip] Rule {} failed on event, treated as no match", rule.getId(), e);
                hit = false;
            }
            states.put(rule.getId(), hit ? RuleState.MATCHED : RuleState.NOT_MATCHED);
            if (!hit) {
                continue;
            }

            ObjectNode incident = incident(rule, event, subjectNode, now);
            HmacSigner signer = new HmacSigner(alertKey.signingSecret());
            String alert = CompactAlert.encode(incident, signer);
            log.warn("[Trip] Rule {} ({}) triggered for subject {}", rule.getId(), rule.getName(), subject);
            recordIncident(rule, subject, incident, signer);
            eventBus.publish(new GuardEvents.IncidentRaisedEvent(rule.getId(), subject, alert));
            incidents.add(incident);
            alerts.add(alert);
        }
        return new TripResult(Collections.unmodifiableList(alerts), Collections.unmodifiableList(incidents),
                Collections.unmodifiableMap(states));
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    private static ObjectNode incident(TripRule rule, JsonNode event, JsonNode subject, double now) {
        ObjectNode incident = JsonSupport.mapper().createObjectNode();
        incident.put("rule_id", rule.getId());
        incident.put("rule_name", rule.getName());
        incident.put("timestamp", (long) now);
        if (subject == null) {
            incident.putNull("uid");
        } else {
            incident.set("uid", subject.deepCopy());
        }
        incident.set("event_snapshot", event.deepCopy());
        ObjectNode meta = incident.putObject("meta");
        meta.put("note", "rule_triggered");
        if (rule.getResponse() != null) {
            meta.put("response", rule.getResponse());
        }
        return incident;
    }

    /**
     * 校验事故日志条目的 payload：去掉 mac 字段后按规范化 JSON 重新计算 HMAC
     */
    public static boolean verifyIncidentRecord(JsonNode payload, HmacSigner signer) {
        if (payload == null || !payload.isObject() || !payload.path(MAC_FIELD).isTextual()) {
            return false;
        }
        ObjectNode incident = ((ObjectNode) payload).deepCopy();
        String mac = incident.remove(MAC_FIELD).asText();
        incident.remove(MAC_ALG_FIELD);
        return signer.verifyHex(CanonicalJson.toBytes(incident), mac);
    }

    private void recordIncident(TripRule rule, String subject, ObjectNode incident, HmacSigner signer) {
        ObjectNode signed = incident.deepCopy();
        signed.put(MAC_FIELD, signer.signHex(CanonicalJson.toBytes(incident)));
        signed.put(MAC_ALG_FIELD, HmacSigner.ALGORITHM);
        try {
            incidentLog.append(AuditEvent.builder()
                    .action(INCIDENT_ACTION)
                    .level("warn")
                    .actor(subject)
                    .stream("incident")
                    .component("trip")
                    .payload(JsonSupport.mapper().convertValue(signed, MAP_TYPE))
                    .build());
        } catch (LogUnavailableException e) {
            log.warn("[Trip] Incident for rule {} not persisted: {}", rule.getId(), e.getMessage());
            eventBus.publish(new GuardEvents.AuditDegradedEvent(INCIDENT_ACTION, e.getSink(), e.getMessage()));
        }
    }
}
