package com.bluxguard.core.trip.condition;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 事件字段访问，支持点分路径（network.remote_ips_count）
 */
public final class EventFields {

    private EventFields() {
    }

    /**
     * @return 字段值；路径中任一段不存在时返回 null
     */
    public static JsonNode lookup(JsonNode event, String path) {
        JsonNode current = event;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject() || !current.has(part)) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    /**
     * 非空、非零、非 false、非空串/空集合
     */
    public static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0.0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isContainerNode()) {
            return value.size() > 0;
        }
        return true;
    }

    /**
     * 数值按大小比较（5 与 5.0 相等），其余按 JSON 结构比较
     */
    public static boolean valueEquals(JsonNode actual, JsonNode expected) {
        if (actual == null) {
            return expected == null || expected.isNull();
        }
        if (actual.isNumber() && expected != null && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        return actual.equals(expected);
    }
}
