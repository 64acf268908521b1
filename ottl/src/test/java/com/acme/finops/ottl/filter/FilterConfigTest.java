package com.acme.finops.ottl.filter;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.ErrorMode;
import com.acme.finops.ottl.pdata.SignalKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterConfigTest {

    @Test
    void shouldMergeSectionsAndGroups() throws Exception {
        FilterConfig config = FilterConfig.parse("""
            {
              "error_mode": "ignore",
              "traces": {
                "span": ["attributes[\\"http.route\\"] == \\"/healthz\\""],
                "spanevent": ["name == \\"debug\\""]
              },
              "log_conditions": [
                { "conditions": ["severity_number < SEVERITY_NUMBER_WARN"], "error_mode": "silent" },
                { "context": "resource", "conditions": ["attributes[\\"env\\"] == \\"dev\\""] }
              ]
            }
            """);

        assertEquals(ErrorMode.IGNORE, config.errorMode());
        assertEquals(2, config.conditionsFor(SignalKind.TRACES).size());
        assertEquals(1, config.conditionsFor(SignalKind.TRACES, "spanevent").size());

        List<ContextConditions> logs = config.conditionsFor(SignalKind.LOGS);
        assertEquals("log", logs.get(0).context());
        assertEquals(ErrorMode.SILENT, logs.get(0).errorMode());
        assertEquals("resource", logs.get(1).context());
        assertNull(logs.get(1).errorMode());
        assertEquals(ErrorMode.IGNORE, logs.get(1).errorModeOr(config.errorMode()));
        assertTrue(config.conditionsFor(SignalKind.METRICS).isEmpty());
    }

    @Test
    void shouldDefaultToPropagate() throws Exception {
        FilterConfig config = FilterConfig.parse("{}");

        assertEquals(ErrorMode.PROPAGATE, config.errorMode());
        for (SignalKind signal : SignalKind.values()) {
            assertTrue(config.conditionsFor(signal).isEmpty());
        }
    }

    @Test
    void shouldAcceptLogRecordAlias() throws Exception {
        FilterConfig config = FilterConfig.parse("{\"logs\": {\"log_record\": [\"body == \\\"x\\\"\"]}}");

        assertEquals("log", config.conditionsFor(SignalKind.LOGS).get(0).context());
    }

    @Test
    void shouldRejectMalformedConfiguration() {
        assertThrows(ConfigException.class, () -> FilterConfig.parse("not json"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("[]"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("{\"spans\": {}}"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("{\"error_mode\": \"loud\"}"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("{\"traces\": {\"log\": [\"true\"]}}"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("{\"logs\": {\"log\": \"true\"}}"));
        assertThrows(ConfigException.class, () -> FilterConfig.parse("{\"logs\": {\"log\": [1]}}"));
        ConfigException e = assertThrows(ConfigException.class,
            () -> FilterConfig.parse("{\"metric_conditions\": [\"x\"]}"));
        assertEquals("metric_conditions[0] must be an object", e.getMessage());
    }
}
