package com.bluxguard.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 命令行参数：子命令 + 形如 --name value 的选项，--token 可重复
 */
public class CliArguments {

    private final String command;
    private final Map<String, List<String>> options;

    private CliArguments(String command, Map<String, List<String>> options) {
        this.command = command;
        this.options = options;
    }

    /**
     * @param allowed 子命令接受的选项名（不含 --）
     * @throws UsageException 缺少子命令、未知选项或选项缺值
     */
    public static CliArguments parse(String[] args, Map<String, Set<String>> allowed) {
        if (args == null || args.length == 0) {
            throw new UsageException("A command is required: " + String.join(", ", allowed.keySet()));
        }
        String command = args[0];
        Set<String> accepted = allowed.get(command);
        if (accepted == null) {
            throw new UsageException("Unknown command: " + command);
        }
        Map<String, List<String>> options = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (!accepted.contains(name)) {
                throw new UsageException("Unknown option for " + command + ": --" + name);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new UsageException("Option --" + name + " requires a value");
                }
                value = args[++i];
            }
            options.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return new CliArguments(command, options);
    }

    public String command() {
        return command;
    }

    public String value(String name) {
        List<String> values = options.get(name);
        return values == null ? null : values.get(values.size() - 1);
    }

    public List<String> values(String name) {
        return options.getOrDefault(name, Collections.emptyList());
    }

    public Path path(String name) {
        String value = value(name);
        return value == null ? null : Paths.get(value);
    }

    public Path requirePath(String name) {
        Path path = path(name);
        if (path == null) {
            throw new UsageException(command + " requires --" + name + " <path>");
        }
        return path;
    }
}
