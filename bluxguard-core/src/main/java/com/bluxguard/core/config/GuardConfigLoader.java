package com.bluxguard.core.config;

import com.bluxguard.api.exception.ConfigurationException;
import com.bluxguard.core.util.YamlSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 配置加载器
 * <p>
 * 查找顺序：显式路径 → BLUX_GUARD_CONFIG → 内置默认值。
 * 之后应用环境变量覆盖：BLUX_GUARD_LOG_DIR、BLUX_GUARD_RULES。
 * 未知配置键视为错误。
 * </p>
 */
@Slf4j
public class GuardConfigLoader {

    public static final String CONFIG_ENV = "BLUX_GUARD_CONFIG";
    public static final String LOG_DIR_ENV = "BLUX_GUARD_LOG_DIR";
    public static final String RULES_ENV = "BLUX_GUARD_RULES";

    private static final ObjectMapper BINDER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private final Map<String, String> env;

    public GuardConfigLoader() {
        this(System.getenv());
    }

    public GuardConfigLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * @param explicit 命令行指定的配置文件，可为 null
     * @throws ConfigurationException 指定的文件不存在、无法解析或包含未知键
     */
    public GuardConfig load(Path explicit) {
        Path source = explicit;
        if (source == null && !isBlank(env.get(CONFIG_ENV))) {
            source = Paths.get(env.get(CONFIG_ENV));
        }
        GuardConfig config = source == null ? GuardConfig.defaults() : read(source);
        applyEnvironment(config);
        return config;
    }

    GuardConfig read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: " + file);
        }
        JsonNode tree = YamlSupport.readTree(file);
        if (tree == null) {
            log.info("[Config] {} is empty, using defaults", file);
            return GuardConfig.defaults();
        }
        try {
            GuardConfig config = BINDER.convertValue(tree, GuardConfig.class);
            log.info("[Config] Loaded configuration from {}", file);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid config " + file + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironment(GuardConfig config) {
        String logDir = env.get(LOG_DIR_ENV);
        if (!isBlank(logDir)) {
            config.setLogDir(logDir);
        }
        String rules = env.get(RULES_ENV);
        if (!isBlank(rules)) {
            config.getTrip().setRulesFile(rules);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
