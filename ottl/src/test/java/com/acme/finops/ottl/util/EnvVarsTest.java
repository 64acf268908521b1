package com.acme.finops.ottl.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ", "SET", " value ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
        assertEquals("value", EnvVars.getOrDefault(env, "SET", "fallback"));
    }

    @Test
    void shouldParseBooleanWithDefault() {
        Map<String, String> env = Map.of("ENABLED", "true", "DISABLED", "false");
        assertTrue(EnvVars.getBoolean(env, "ENABLED", false));
        assertFalse(EnvVars.getBoolean(env, "DISABLED", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "90000",
            "OK", "9464",
            "BAD", "abc"
        );
        assertEquals(0, EnvVars.getIntClamped(env, "LOW", 10, 0, 65_535));
        assertEquals(65_535, EnvVars.getIntClamped(env, "HIGH", 10, 0, 65_535));
        assertEquals(9464, EnvVars.getIntClamped(env, "OK", 10, 0, 65_535));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 0, 65_535));
    }

    @Test
    void shouldClampLongAndAcceptWhitespace() {
        Map<String, String> env = Map.of("INTERVAL", "  7200 ", "BAD", "soon");
        assertEquals(3_600L, EnvVars.getLongClamped(env, "INTERVAL", 60L, 0L, 3_600L));
        assertEquals(60L, EnvVars.getLongClamped(env, "BAD", 60L, 0L, 3_600L));
        assertEquals(60L, EnvVars.getLongClamped(env, "MISSING", 60L, 0L, 3_600L));
    }

    @Test
    void shouldResolvePathsOnlyWhenSet() {
        Map<String, String> env = Map.of("FILE", " /etc/ottl/filter.json ", "BLANK", "");
        assertEquals(Optional.of(Path.of("/etc/ottl/filter.json")), EnvVars.getPath(env, "FILE"));
        assertTrue(EnvVars.getPath(env, "BLANK").isEmpty());
        assertTrue(EnvVars.getPath(env, "MISSING").isEmpty());
    }
}
