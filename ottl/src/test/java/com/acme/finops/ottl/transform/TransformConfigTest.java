package com.acme.finops.ottl.transform;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.pdata.SignalKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformConfigTest {

    @TempDir
    Path dir;

    @Test
    void shouldParseGroupsWithDefaultsAndAliases() throws Exception {
        TransformConfig config = TransformConfig.parse("""
            {
              "error_mode": "ignore",
              "trace_statements": [
                { "statements": ["set(name, \\"x\\")"] },
                { "context": "scope", "statements": ["set(version, \\"1\\")"], "conditions": ["name == \\"lib\\""] },
                { "context": "spanevent", "statements": [] }
              ],
              "log_statements": [
                { "context": "log_record", "statements": ["set(body, \\"y\\")"], "error_mode": "silent" }
              ]
            }
            """);

        assertEquals(ErrorMode.IGNORE, config.errorMode());
        List<ContextStatements> traces = config.statementsFor(SignalKind.TRACES);
        assertEquals(2, traces.size());
        assertEquals("span", traces.get(0).context());
        assertEquals("instrumentation_scope", traces.get(1).context());
        assertEquals(List.of("name == \"lib\""), traces.get(1).conditions());
        ContextStatements log = config.statementsFor(SignalKind.LOGS).get(0);
        assertEquals("log", log.context());
        assertEquals(ErrorMode.SILENT, log.errorModeOr(config.errorMode()));
        assertTrue(config.statementsFor(SignalKind.PROFILES).isEmpty());
    }

    @Test
    void shouldRejectMalformedConfiguration() {
        assertThrows(ConfigException.class, () -> TransformConfig.parse("{"));
        assertThrows(ConfigException.class, () -> TransformConfig.parse("{\"span_statements\": []}"));
        assertThrows(ConfigException.class, () -> TransformConfig.parse("{\"trace_statements\": {}}"));
        assertThrows(ConfigException.class,
            () -> TransformConfig.parse("{\"log_statements\": [{\"context\": \"span\", \"statements\": [\"x\"]}]}"));
        assertThrows(ConfigException.class,
            () -> TransformConfig.parse("{\"log_statements\": [{\"statements\": \"set(body, 1)\"}]}"));
    }

    @Test
    void shouldLoadFromEnvironment() throws Exception {
        Path file = dir.resolve("transform.json");
        Files.writeString(file, "{\"log_statements\": [{\"statements\": [\"set(body, \\\"x\\\")\"]}]}", StandardCharsets.UTF_8);

        TransformConfig config = TransformConfig.load(Map.of(
            "OTTL_TRANSFORM_CONFIG_FILE", file.toString(),
            "OTTL_TRANSFORM_ERROR_MODE", "ignore"));

        assertEquals(ErrorMode.IGNORE, config.errorMode());
        assertEquals(1, config.statementsFor(SignalKind.LOGS).size());
    }

    @Test
    void shouldLoadEmptyConfigurationWhenUnset() throws Exception {
        TransformConfig config = TransformConfig.load(Map.of());

        assertEquals(ErrorMode.PROPAGATE, config.errorMode());
        for (SignalKind signal : SignalKind.values()) {
            assertTrue(config.statementsFor(signal).isEmpty());
        }
        assertThrows(ConfigException.class,
            () -> TransformConfig.load(Map.of("OTTL_TRANSFORM_ERROR_MODE", "strict")));
    }
}
