package com.acme.finops.ottl.pdata;

import com.acme.finops.ottl.TypeError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PMapTest {

    @Test
    void shouldNormalizeHostValuesOnPut() {
        PMap map = PMap.fromRaw(Map.of("i", 7, "f", 1.5f, "l", List.of(1, "a"), "m", Map.of("k", (short) 2)));

        assertEquals(7L, map.get("i"));
        assertEquals(1.5d, map.get("f"));
        PSlice list = assertInstanceOf(PSlice.class, map.get("l"));
        assertEquals(1L, list.get(0));
        PMap nested = assertInstanceOf(PMap.class, map.get("m"));
        assertEquals(2L, nested.get("k"));
    }

    @Test
    void shouldRejectTimesAndUnknownTypesInAttributes() {
        PMap map = new PMap();

        assertThrows(IllegalArgumentException.class, () -> map.put("t", Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> map.put("o", new Object()));
        assertThrows(TypeError.class, () -> Values.toAttributeValue(Instant.EPOCH));
    }

    @Test
    void shouldKeepInsertionOrder() {
        PMap map = PMap.of("b", 1L, "a", 2L, "c", 3L);
        map.remove("a");
        map.put("a", 4L);

        assertEquals(List.of("b", "c", "a"), map.keys());
    }

    @Test
    void shouldCopyDeeply() {
        PMap original = PMap.of("nested", PMap.of("k", "v"), "bytes", new byte[]{1});
        PMap copy = original.copy();
        ((PMap) copy.get("nested")).put("k", "changed");

        assertEquals("v", ((PMap) original.get("nested")).get("k"));
        assertNotSame(original.get("bytes"), copy.get("bytes"));
    }

    @Test
    void shouldCompareContentIgnoringOrderAndByteIdentity() {
        assertEquals(PMap.of("a", 1L, "b", new byte[]{1, 2}), PMap.of("b", new byte[]{1, 2}, "a", 1L));
        assertNotEquals(PMap.of("a", 1L), PMap.of("a", 1.0d));
    }

    @Test
    void shouldReplaceContentWithSnapshot() {
        PMap target = PMap.of("old", 1L);
        PMap source = PMap.of("new", PSlice.of("x"));

        target.replaceWith(source);
        ((PSlice) source.get("new")).add("y");

        assertEquals(List.of("new"), target.keys());
        assertEquals(1, ((PSlice) target.get("new")).size());
    }
}
