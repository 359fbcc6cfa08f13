package com.bluxguard.core.crypto;

import com.bluxguard.core.util.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 规范化 JSON 序列化
 * <p>
 * 对象键按字典序排列，无多余空白，非 ASCII 字符按 UTF-8 原样输出。
 * 相同逻辑内容总是得到相同字节串，签名和哈希链都建立在此之上。
 * </p>
 */
public final class CanonicalJson {

    private CanonicalJson() {
    }

    public static byte[] toBytes(JsonNode node) {
        return toString(node).getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] toBytes(Object value) {
        return toBytes(JsonSupport.mapper().valueToTree(value));
    }

    public static String toString(JsonNode node) {
        try {
            return JsonSupport.mapper().writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical serialization failed", e);
        }
    }

    /**
     * 递归复制并排序对象键
     */
    static JsonNode sorted(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            Collections.sort(names);
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode child : node) {
                out.add(sorted(child));
            }
            return out;
        }
        return node;
    }
}
