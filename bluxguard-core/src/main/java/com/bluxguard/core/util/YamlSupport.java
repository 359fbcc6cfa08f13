package com.bluxguard.core.util;

import com.bluxguard.api.exception.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * YAML 读取工具
 * 只使用 SafeConstructor：文档只能构造 Map / List / 标量，任何全局标签都会被拒绝。
 */
public final class YamlSupport {

    private YamlSupport() {
    }

    public static Yaml createSafeYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }

    /**
     * 读取 YAML 文件为 Jackson 树，空文档返回 null
     *
     * @throws ConfigurationException 文件不可读或不是合法 YAML
     */
    public static JsonNode readTree(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object document = createSafeYaml().load(reader);
            return document == null ? null : JsonSupport.mapper().valueToTree(document);
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to read YAML document: " + path, e);
        }
    }

    /**
     * 按扩展名选择 YAML 或 JSON 解析
     */
    public static JsonNode readJsonOrYaml(Path path) {
        return isYaml(path) ? readTree(path) : JsonSupport.readTree(path);
    }

    public static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }
}
