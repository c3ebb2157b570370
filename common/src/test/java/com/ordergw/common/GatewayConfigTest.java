package com.ordergw.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @TempDir
    Path dir;

    @Test
    void testLoadFromFile() throws Exception {
        Path file = dir.resolve("gw.yml");
        Files.writeString(file, String.join("\n",
                "username: \"alice\"",
                "openTime: \"10:00\"",
                "closeTime: \"10:30:15\"",
                "zoneId: \"Europe/London\"",
                "maxOrdersPerSecond: 7",
                "dispatchTickMillis: 25",
                "responseLogPath: \"out/resp.log\""));

        GatewayConfig cfg = GatewayConfig.load(file.toString());

        assertEquals("alice", cfg.username);
        assertEquals(LocalTime.of(10, 0), cfg.openTime);
        assertEquals(LocalTime.of(10, 30, 15), cfg.closeTime);
        assertEquals("Europe/London", cfg.zone().getId());
        assertEquals(7, cfg.maxOrdersPerSecond);
        assertEquals(25, cfg.dispatchTickMillis);
        assertEquals("out/resp.log", cfg.responseLogPath);
        // untouched keys keep defaults
        assertEquals(500, cfg.sessionPollMillis);
        assertSame(cfg, cfg.validate());
    }

    @Test
    void testUnquotedTimesReadAsBaseSixty() throws Exception {
        Path file = dir.resolve("gw.yml");
        // 9:15:00 resolves to the integer 33300; 09:15:00 stays a string
        Files.writeString(file, "openTime: 9:15:00\ncloseTime: 15:30:00\n");

        GatewayConfig cfg = GatewayConfig.load(file.toString());

        assertEquals(LocalTime.of(9, 15), cfg.openTime);
        assertEquals(LocalTime.of(15, 30), cfg.closeTime);
    }

    @Test
    void testClasspathDefault() {
        GatewayConfig cfg = GatewayConfig.load(null);

        assertEquals(3, cfg.maxOrdersPerSecond);
        assertEquals("UTC", cfg.zoneId);
        assertEquals(LocalTime.of(9, 15), cfg.openTime);
    }

    @Test
    void testMalformedFileFallsBackToDefaults() throws Exception {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "maxOrdersPerSecond: [not, an, int]\n");

        GatewayConfig cfg = GatewayConfig.load(file.toString());

        assertEquals(3, cfg.maxOrdersPerSecond);
    }

    @Test
    void testValidateRejectsInvertedWindow() {
        GatewayConfig cfg = new GatewayConfig();
        cfg.openTime  = LocalTime.of(16, 0);
        cfg.closeTime = LocalTime.of(9, 0);

        IllegalStateException e = assertThrows(IllegalStateException.class, cfg::validate);
        assertTrue(e.getMessage().contains("closeTime"));
    }

    @Test
    void testValidateRejectsEmptyWindow() {
        GatewayConfig cfg = new GatewayConfig();
        cfg.closeTime = cfg.openTime;

        assertThrows(IllegalStateException.class, cfg::validate);
    }

    @Test
    void testValidateRejectsNonPositiveCap() {
        GatewayConfig cfg = new GatewayConfig();
        cfg.maxOrdersPerSecond = 0;

        IllegalStateException e = assertThrows(IllegalStateException.class, cfg::validate);
        assertTrue(e.getMessage().contains("maxOrdersPerSecond"));
    }

    @Test
    void testValidateRejectsUnknownZone() {
        GatewayConfig cfg = new GatewayConfig();
        cfg.zoneId = "Mars/Olympus";

        assertThrows(IllegalStateException.class, cfg::validate);
    }

    @Test
    void testApplyMapIgnoresUnknownKeys() {
        GatewayConfig cfg = new GatewayConfig();
        Map<String, Object> map = new HashMap<>();
        map.put("somethingElse", 42);
        map.put("exchangeLatencyMillis", 5);

        GatewayConfig.applyMap(cfg, map);

        assertEquals(5, cfg.exchangeLatencyMillis);
    }
}
