package com.imperium.cocounsel.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动前加载项目根目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${KEY}（OPENAI_API_KEY、MYSQL_PASSWORD、QDRANT_HOST 等）能解析到。
 * 已存在的系统属性不会被覆盖。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static final String OPENAI_BASE_URL_KEY = "OPENAI_BASE_URL";

    /** 名称包含这些片段的变量只打印 *** */
    private static final List<String> SECRET_MARKERS = List.of("KEY", "SECRET", "PASSWORD", "TOKEN");

    private DotenvLoader() {}

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    static void load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            System.err.println("[DotenvLoader] Failed to read .env: " + e.getMessage());
            return;
        }
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher matcher = ENV_LINE.matcher(trimmed);
            if (!matcher.matches()) {
                continue;
            }
            String key = matcher.group(1);
            String value = unquote(matcher.group(2).trim());

            // Spring AI 的 OpenAI client 会自动拼接 /v1，base-url 写成 .../v1 会变成 .../v1/v1/... 导致 404
            if (OPENAI_BASE_URL_KEY.equals(key)) {
                String normalized = normalizeOpenAiBaseUrl(value);
                if (!normalized.equals(value)) {
                    System.out.println("[DotenvLoader] Normalized " + key + " (removed trailing /v1): "
                            + value + " -> " + normalized);
                }
                value = normalized;
            }
            if (System.getProperty(key) != null) {
                continue;
            }
            System.setProperty(key, value);
            System.out.println("[DotenvLoader] Loaded: " + key + " = " + (isSecret(key) ? "***" : value));
        }
    }

    static boolean isSecret(String key) {
        String upper = key.toUpperCase(Locale.ROOT);
        return SECRET_MARKERS.stream().anyMatch(upper::contains);
    }

    static String normalizeOpenAiBaseUrl(String value) {
        if (value == null) {
            return "";
        }
        String v = value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
