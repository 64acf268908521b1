package com.acme.finops.ottl.expr;

import com.acme.finops.ottl.EvaluationException;
import com.acme.finops.ottl.TypeError;
import com.acme.finops.ottl.pdata.PMap;
import com.acme.finops.ottl.pdata.PSlice;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoercionsTest {

    @Test
    void shouldRejectWrongKindAndNilInStrictConversions() {
        assertThrows(TypeError.class, () -> Coercions.STRING.coerce(1L));
        assertThrows(TypeError.class, () -> Coercions.INT.coerce(1.0d));
        assertThrows(TypeError.class, () -> Coercions.MAP.coerce(null));
        assertThrows(TypeError.class, () -> Coercions.BOOL.coerce("true"));
    }

    @Test
    void shouldConvertToInt() throws Exception {
        assertEquals(3L, Coercions.INT_LIKE.coerce(3.9d));
        assertEquals(1L, Coercions.INT_LIKE.coerce(true));
        assertEquals(-42L, Coercions.INT_LIKE.coerce("-42"));
        assertNull(Coercions.INT_LIKE.coerce("4.2"));
        assertNull(Coercions.INT_LIKE.coerce(null));
        assertThrows(TypeError.class, () -> Coercions.INT_LIKE.coerce(new PMap()));
    }

    @Test
    void shouldConvertToDouble() throws Exception {
        assertEquals(2.0d, Coercions.FLOAT_LIKE.coerce(2L));
        assertEquals(1.25d, Coercions.FLOAT_LIKE.coerce("1.25"));
        assertNull(Coercions.FLOAT_LIKE.coerce("abc"));
        assertNull(Coercions.FLOAT_LIKE.coerce(" 1.0"));
        assertNull(Coercions.FLOAT_LIKE.coerce("1.0d"));
    }

    @Test
    void shouldConvertToBool() throws Exception {
        assertEquals(Boolean.TRUE, Coercions.BOOL_LIKE.coerce("T"));
        assertEquals(Boolean.FALSE, Coercions.BOOL_LIKE.coerce(0L));
        assertEquals(Boolean.TRUE, Coercions.BOOL_LIKE.coerce(0.1d));
        assertThrows(EvaluationException.class, () -> Coercions.BOOL_LIKE.coerce("yes"));
    }

    @Test
    void shouldRenderStrings() throws Exception {
        assertEquals("2", Coercions.STRING_LIKE.coerce(2.0d));
        assertEquals("1.5", Coercions.STRING_LIKE.coerce(1.5d));
        assertEquals("0aff", Coercions.STRING_LIKE.coerce(new byte[]{0x0a, (byte) 0xff}));
        assertEquals("{\"a\":[1,\"x\"]}", Coercions.STRING_LIKE.coerce(PMap.of("a", PSlice.of(1L, "x"))));
        assertNull(Coercions.STRING_LIKE.coerce(null));
    }

    @Test
    void shouldConvertToBytes() throws Exception {
        assertArrayEquals(new byte[]{'h', 'i'}, Coercions.BYTES_LIKE.coerce("hi"));
        assertArrayEquals(new byte[]{0, 0, 0, 0, 0, 0, 0, 1}, Coercions.BYTES_LIKE.coerce(1L));
        assertArrayEquals(new byte[]{1}, Coercions.BYTES_LIKE.coerce(true));
    }
}
