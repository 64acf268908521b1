package com.acme.finops.ottl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ErrorModeTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(ErrorMode.IGNORE, ErrorMode.parse("ignore"));
        assertEquals(ErrorMode.PROPAGATE, ErrorMode.parse(" Propagate "));
        assertEquals(ErrorMode.SILENT, ErrorMode.parse("SILENT"));
    }

    @Test
    void shouldDefaultBlankToPropagate() {
        assertEquals(ErrorMode.PROPAGATE, ErrorMode.parse(null));
        assertEquals(ErrorMode.PROPAGATE, ErrorMode.parse("  "));
    }

    @Test
    void shouldRejectUnknownMode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ErrorMode.parse("loud"));

        assertEquals("unknown error mode loud", e.getMessage());
    }

    @Test
    void shouldRenderConfigName() {
        assertEquals("silent", ErrorMode.SILENT.configName());
    }
}
