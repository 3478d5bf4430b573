package com.p14n.eventbus.app;

import com.p14n.eventbus.data.ConfigData;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Host settings read from the environment.
 *
 * @param eventBus      Database and log store settings
 * @param eventLogFile  File for the file receiver, null when it is disabled
 * @param consoleGroups Event groups printed by the console receiver
 * @param fileGroups    Event groups written by the file receiver
 * @param otlpEndpoint  Collector endpoint for spans
 */
public record AppConfig(ConfigData eventBus, String eventLogFile, List<String> consoleGroups,
        List<String> fileGroups, String otlpEndpoint) {

    public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";
    public static final String DEFAULT_FILE_GROUPS = "n8n.workflow,n8n.core";

    public static AppConfig fromEnv(Map<String, String> env) {
        ConfigData eventBus = new ConfigData(
                value(env, "APP_DB_HOST", "localhost"),
                port(value(env, "APP_DB_PORT", "5432")),
                value(env, "APP_DB_USER", "postgres"),
                value(env, "APP_DB_PASSWORD", "postgres"),
                value(env, "APP_DB_NAME", "postgres"),
                value(env, "APP_EVENT_SCHEMA", ConfigData.DEFAULT_SCHEMA));
        return new AppConfig(eventBus,
                value(env, "APP_EVENT_LOG_FILE", null),
                list(value(env, "APP_CONSOLE_GROUPS", "")),
                list(value(env, "APP_FILE_GROUPS", DEFAULT_FILE_GROUPS)),
                value(env, "APP_OTLP_ENDPOINT", DEFAULT_OTLP_ENDPOINT));
    }

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return v == null || v.trim().isEmpty() ? defaultValue : v.trim();
    }

    private static int port(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("APP_DB_PORT out of range: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("APP_DB_PORT is not a number: " + value, e);
        }
    }

    private static List<String> list(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
