package com.bluxguard.core.schema;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.api.exception.SchemaViolationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 结构校验器
 * <p>
 * 启动时一次性加载全部契约（draft 2020-12），之后只读，可跨线程共享。
 * 返回全部违规项，按字典序排序以保证输出稳定。
 * </p>
 */
@Slf4j
public class SchemaValidator {

    private static final String RESOURCE_ROOT = "/contracts/";

    private final Map<Contract, JsonSchema> schemas;

    private SchemaValidator(Map<Contract, JsonSchema> schemas) {
        this.schemas = schemas;
    }

    /**
     * 从 classpath 加载内置契约
     *
     * @throws ConfigurationException 契约资源缺失或无法解析
     */
    public static SchemaValidator loadBuiltin() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        Map<Contract, JsonSchema> loaded = new EnumMap<>(Contract.class);
        for (Contract contract : Contract.values()) {
            String path = RESOURCE_ROOT + contract.getResourceName();
            try (InputStream is = SchemaValidator.class.getResourceAsStream(path)) {
                if (is == null) {
                    throw new ConfigurationException("Contract resource missing: " + path);
                }
                loaded.put(contract, factory.getSchema(is));
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load contract: " + path, e);
            }
        }
        log.debug("[Schema] Loaded {} contracts", loaded.size());
        return new SchemaValidator(loaded);
    }

    /**
     * 校验文档，返回违规列表（空表示通过）
     */
    public List<String> validate(Contract contract, JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return List.of(contract.getResourceName() + ":$: document is required");
        }
        Set<ValidationMessage> messages = schemas.get(contract).validate(document);
        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(contract.getResourceName() + ":" + message.getMessage());
        }
        Collections.sort(violations);
        return violations;
    }

    /**
     * @throws SchemaViolationException 存在任一违规项
     */
    public void requireValid(Contract contract, JsonNode document) {
        List<String> violations = validate(contract, document);
        if (!violations.isEmpty()) {
            throw new SchemaViolationException(contract.getResourceName(), violations);
        }
    }
}
