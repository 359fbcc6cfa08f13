package com.bluxguard.core.trip;

import com.bluxguard.api.exception.InvalidRuleException;
import com.bluxguard.api.trip.ThresholdOperator;
import com.bluxguard.core.trip.condition.AllOfCondition;
import com.bluxguard.core.trip.condition.AnyOfCondition;
import com.bluxguard.core.trip.condition.Condition;
import com.bluxguard.core.trip.condition.ExistsCondition;
import com.bluxguard.core.trip.condition.InvalidCondition;
import com.bluxguard.core.trip.condition.MatchCondition;
import com.bluxguard.core.trip.condition.ThresholdCondition;
import com.bluxguard.core.util.YamlSupport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 规则文件加载器
 * <p>
 * 格式：{"rules": [{"id", "name", "subject"?, "response"?, "condition"}]}，JSON 或 YAML。
 * 单条规则非法时记录告警并以永不命中的占位条件载入，不影响其余规则。
 * </p>
 */
@Slf4j
public class RuleSetLoader {

    private final int defaultWindowSeconds;

    public RuleSetLoader(int defaultWindowSeconds) {
        this.defaultWindowSeconds = defaultWindowSeconds;
    }

    /**
     * 文件不存在时返回空规则集（引擎对所有事件输出 OK）
     */
    public RuleSet load(Path file) {
        if (file == null || !Files.exists(file)) {
            log.warn("[Trip] Rules not found at {}, running with an empty rule set", file);
            return RuleSet.empty();
        }
        RuleSet ruleSet = parse(YamlSupport.readJsonOrYaml(file), file.toString());
        log.info("[Trip] Loaded {} rules from {} ({} invalid)", ruleSet.getRules().size(), file, ruleSet.invalidCount());
        return ruleSet;
    }

    public RuleSet parse(JsonNode root, String source) {
        JsonNode rulesNode = root == null ? null : root.get("rules");
        if (rulesNode == null || !rulesNode.isArray()) {
            log.warn("[Trip] {} has no \"rules\" array", source);
            return new RuleSet(List.of(), source);
        }
        List<TripRule> rules = new ArrayList<>(rulesNode.size());
        int index = 0;
        for (JsonNode ruleNode : rulesNode) {
            rules.add(parseRule(ruleNode, index++));
        }
        return new RuleSet(List.copyOf(rules), source);
    }

    TripRule parseRule(JsonNode node, int index) {
        String id = text(node, "id");
        if (id == null) {
            id = "rule-" + index;
        }
        TripRule.TripRuleBuilder builder = TripRule.builder()
                .id(id)
                .name(text(node, "name") != null ? text(node, "name") : id)
                .subjectField(text(node, "subject"))
                .response(text(node, "response"));
        try {
            builder.condition(parseCondition(id, node.get("condition")));
        } catch (InvalidRuleException e) {
            log.warn("[Trip] {}; rule will never match", e.getMessage());
            builder.condition(new InvalidCondition(e.getMessage()));
        }
        return builder.build();
    }

    Condition parseCondition(String ruleId, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidRuleException(ruleId, "condition must be an object");
        }
        String type = text(node, "type");
        if (type == null) {
            throw new InvalidRuleException(ruleId, "condition type is required");
        }
        switch (type) {
            case ThresholdCondition.TYPE:
                return threshold(ruleId, node);
            case MatchCondition.TYPE:
                return new MatchCondition(requireField(ruleId, node), node.get("value"));
            case ExistsCondition.TYPE:
                return new ExistsCondition(requireField(ruleId, node));
            case AllOfCondition.TYPE:
                return new AllOfCondition(clauses(ruleId, node));
            case AnyOfCondition.TYPE:
                return new AnyOfCondition(clauses(ruleId, node));
            default:
                throw new InvalidRuleException(ruleId, "unknown condition type '" + type + "'");
        }
    }

    private ThresholdCondition threshold(String ruleId, JsonNode node) {
        String field = requireField(ruleId, node);
        JsonNode value = node.get("value");
        if (value == null || !value.isNumber()) {
            throw new InvalidRuleException(ruleId, "threshold value must be a number");
        }
        String op = text(node, "op");
        ThresholdOperator operator = op == null ? ThresholdOperator.GT : ThresholdOperator.fromValue(op);
        if (operator == null) {
            throw new InvalidRuleException(ruleId, "unknown operator '" + op + "'");
        }
        JsonNode window = node.has("window") ? node.get("window") : node.get("window_s");
        int windowSeconds = defaultWindowSeconds;
        if (window != null) {
            if (!window.canConvertToInt() || window.asInt() <= 0) {
                throw new InvalidRuleException(ruleId, "window must be a positive integer");
            }
            windowSeconds = window.asInt();
        }
        return new ThresholdCondition(field, operator, value.asDouble(), windowSeconds);
    }

    private List<Condition> clauses(String ruleId, JsonNode node) {
        JsonNode clauses = node.get("clauses");
        if (clauses == null || !clauses.isArray() || clauses.isEmpty()) {
            throw new InvalidRuleException(ruleId, "'" + text(node, "type") + "' requires a non-empty clauses array");
        }
        List<Condition> parsed = new ArrayList<>(clauses.size());
        for (JsonNode clause : clauses) {
            parsed.add(parseCondition(ruleId, clause));
        }
        return List.copyOf(parsed);
    }

    private static String requireField(String ruleId, JsonNode node) {
        String field = text(node, "field");
        if (field == null) {
            throw new InvalidRuleException(ruleId, "'" + text(node, "type") + "' requires a field");
        }
        return field;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node == null ? null : node.get(name);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
