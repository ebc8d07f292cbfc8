package io.shaama.todos.config;

import lombok.experimental.UtilityClass;

import java.util.HashMap;
import java.util.Map;

// Default properties have the lowest precedence; application.properties and SPRING_* variables still win.
@UtilityClass
public class EnvironmentDefaults {

    public static final String BIND_ADDR = "BIND_ADDR";
    public static final String DATABASE_URL = "DATABASE_URL";

    static final String DEFAULT_BIND_ADDR = "127.0.0.1:3000";
    static final String DEFAULT_DATABASE_URL = "sqlite:db.sqlite";

    static final String SQLITE_TRANSACTION_MODE = "transaction_mode=IMMEDIATE";
    static final String SQLITE_BUSY_TIMEOUT = "busy_timeout=10000";

    public static Map<String, Object> fromEnvironment(Map<String, String> env) {
        BindAddress bindAddress = BindAddress.parse(valueOrDefault(env, BIND_ADDR, DEFAULT_BIND_ADDR));

        Map<String, Object> properties = new HashMap<>();
        properties.put("server.address", bindAddress.host());
        properties.put("server.port", bindAddress.port());
        properties.put("spring.datasource.url", toJdbcUrl(valueOrDefault(env, DATABASE_URL, DEFAULT_DATABASE_URL)));
        return properties;
    }

    /**
     * Accepts {@code sqlite:path}, {@code sqlite://path} and plain JDBC URLs.
     * SQLite URLs get IMMEDIATE transactions and a busy timeout unless they set
     * their own, so concurrent writers queue on the database lock instead of
     * failing with {@code SQLITE_BUSY}.
     */
    public static String toJdbcUrl(String databaseUrl) {
        String jdbcUrl;
        if (databaseUrl.startsWith("jdbc:")) {
            jdbcUrl = databaseUrl;
        } else if (databaseUrl.startsWith("sqlite://")) {
            jdbcUrl = "jdbc:sqlite:" + databaseUrl.substring("sqlite://".length());
        } else if (databaseUrl.startsWith("sqlite:")) {
            jdbcUrl = "jdbc:" + databaseUrl;
        } else {
            throw new IllegalArgumentException("Unsupported " + DATABASE_URL + ": " + databaseUrl);
        }
        return jdbcUrl.startsWith("jdbc:sqlite:") ? withSqliteLocking(jdbcUrl) : jdbcUrl;
    }

    private static String withSqliteLocking(String jdbcUrl) {
        String url = jdbcUrl;
        if (!url.contains("transaction_mode=")) {
            url = appendParameter(url, SQLITE_TRANSACTION_MODE);
        }
        if (!url.contains("busy_timeout=")) {
            url = appendParameter(url, SQLITE_BUSY_TIMEOUT);
        }
        return url;
    }

    private static String appendParameter(String url, String parameter) {
        return url + (url.contains("?") ? "&" : "?") + parameter;
    }

    private static String valueOrDefault(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
