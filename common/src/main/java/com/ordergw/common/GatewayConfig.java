package com.ordergw.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

/**
 * Central configuration loaded from gateway.yml (or classpath default).
 * All fields have sensible defaults for a local run.
 */
public final class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    // Credentials used to label logon/logout
    public String username = "testuser";
    public String password = "testpass";

    // Session window (time-of-day in zoneId)
    public LocalTime openTime  = LocalTime.of(9, 15);
    public LocalTime closeTime = LocalTime.of(15, 30);
    public String zoneId = ZoneId.systemDefault().getId();

    // Throttle
    public int maxOrdersPerSecond = 3;

    // Scheduling
    public int sessionPollMillis = 500;
    public int dispatchTickMillis = 10;

    // Metrics
    public int metricsIntervalSecs = 5;

    // Response log
    public String responseLogPath = "responses.log";

    // Simulated exchange round trip
    public int exchangeLatencyMillis = 50;

    public static GatewayConfig load(String path) {
        GatewayConfig cfg = new GatewayConfig();
        try {
            InputStream is = path != null && Files.exists(Paths.get(path))
                    ? Files.newInputStream(Paths.get(path))
                    : GatewayConfig.class.getResourceAsStream("/gateway.yml");
            if (is == null) return cfg;
            try (is) {
                Map<String, Object> map = new Yaml().load(is);
                if (map == null) return cfg;
                applyMap(cfg, map);
            }
        } catch (Exception e) {
            log.warn("Failed to load config {}, using defaults: {}", path, e.getMessage());
        }
        return cfg;
    }

    static void applyMap(GatewayConfig cfg, Map<String, Object> map) {
        if (map.containsKey("username")) cfg.username = String.valueOf(map.get("username"));
        if (map.containsKey("password")) cfg.password = String.valueOf(map.get("password"));
        if (map.containsKey("openTime")) cfg.openTime = toTime(map.get("openTime"));
        if (map.containsKey("closeTime")) cfg.closeTime = toTime(map.get("closeTime"));
        if (map.containsKey("zoneId")) cfg.zoneId = (String) map.get("zoneId");
        if (map.containsKey("maxOrdersPerSecond")) cfg.maxOrdersPerSecond = (int) map.get("maxOrdersPerSecond");
        if (map.containsKey("sessionPollMillis")) cfg.sessionPollMillis = (int) map.get("sessionPollMillis");
        if (map.containsKey("dispatchTickMillis")) cfg.dispatchTickMillis = (int) map.get("dispatchTickMillis");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
        if (map.containsKey("responseLogPath")) cfg.responseLogPath = (String) map.get("responseLogPath");
        if (map.containsKey("exchangeLatencyMillis")) cfg.exchangeLatencyMillis = (int) map.get("exchangeLatencyMillis");
    }

    /**
     * Accepts "HH:mm[:ss]" strings. SnakeYAML reads an unquoted H:mm:ss such as
     * 9:15:00 as a base-60 integer (seconds of day), so integers are accepted too.
     */
    static LocalTime toTime(Object value) {
        if (value instanceof Number n) return LocalTime.ofSecondOfDay(n.longValue());
        return LocalTime.parse(String.valueOf(value).trim());
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * Startup validation. Misconfiguration is a caller error and fails fast here
     * rather than being handled while the gateway runs.
     */
    public GatewayConfig validate() {
        if (!closeTime.isAfter(openTime)) {
            throw new IllegalStateException("closeTime " + closeTime + " must be after openTime " + openTime);
        }
        requirePositive("maxOrdersPerSecond", maxOrdersPerSecond);
        requirePositive("sessionPollMillis", sessionPollMillis);
        requirePositive("dispatchTickMillis", dispatchTickMillis);
        requirePositive("metricsIntervalSecs", metricsIntervalSecs);
        if (exchangeLatencyMillis < 0) {
            throw new IllegalStateException("exchangeLatencyMillis must not be negative: " + exchangeLatencyMillis);
        }
        try {
            zone();
        } catch (Exception e) {
            throw new IllegalStateException("invalid zoneId: " + zoneId, e);
        }
        return this;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) throw new IllegalStateException(name + " must be positive: " + value);
    }

    @Override
    public String toString() {
        return "GatewayConfig{user=" + username
                + ", window=" + openTime + "-" + closeTime + " " + zoneId
                + ", maxOrdersPerSecond=" + maxOrdersPerSecond
                + ", sessionPollMillis=" + sessionPollMillis
                + ", dispatchTickMillis=" + dispatchTickMillis
                + ", responseLogPath=" + responseLogPath + "}";
    }
}
