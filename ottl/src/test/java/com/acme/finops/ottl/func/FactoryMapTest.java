package com.acme.finops.ottl.func;

import com.acme.finops.ottl.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactoryMapTest {

    private static FunctionFactory<Object> factory(String name, ArgSpec... params) {
        return FunctionFactory.of(name, Signature.of(params), (fc, args) -> (ctx, tCtx) -> null);
    }

    @Test
    void shouldIndexFactoriesByNameInOrder() throws Exception {
        Map<String, Factory<Object>> catalog = FactoryMap.of(
            factory("Upper", ArgSpec.required("target", ArgType.STRING)),
            factory("Lower", ArgSpec.required("target", ArgType.STRING)));

        assertEquals(List.of("Upper", "Lower"), List.copyOf(catalog.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> catalog.remove("Upper"));
    }

    @Test
    void shouldRejectDuplicateName() {
        ConfigException e = assertThrows(ConfigException.class, () -> FactoryMap.of(
            factory("Upper"),
            factory("Upper", ArgSpec.required("target", ArgType.STRING))));

        assertTrue(e.getMessage().contains("duplicate function name Upper"));
    }

    @Test
    void shouldRejectDuplicateNameAcrossMergedCatalogs() throws Exception {
        Map<String, Factory<Object>> first = FactoryMap.of(factory("Upper"));
        Map<String, Factory<Object>> second = FactoryMap.of(factory("Upper"), factory("Lower"));

        ConfigException e = assertThrows(ConfigException.class, () -> FactoryMap.merge(first, second));

        assertTrue(e.getMessage().contains("duplicate function name Upper"));
    }

    @Test
    void shouldRejectRequiredParameterAfterOptional() {
        ConfigException e = assertThrows(ConfigException.class, () -> FactoryMap.of(factory("Pad",
            ArgSpec.optional("width", ArgType.INT),
            ArgSpec.required("target", ArgType.STRING))));

        assertTrue(e.getMessage().contains("declares required parameter target after an optional one"));
    }

    @Test
    void shouldRejectRepeatedParameterName() {
        ConfigException e = assertThrows(ConfigException.class, () -> FactoryMap.of(factory("Pad",
            ArgSpec.required("target", ArgType.STRING),
            ArgSpec.optional("target", ArgType.INT))));

        assertTrue(e.getMessage().contains("declares parameter target twice"));
    }

    @Test
    void shouldAcceptOptionalParametersAtTheEnd() throws Exception {
        Map<String, Factory<Object>> catalog = FactoryMap.of(factory("Pad",
            ArgSpec.required("target", ArgType.STRING),
            ArgSpec.optional("width", ArgType.INT),
            ArgSpec.optional("fill", ArgType.STRING)));

        assertEquals(3, catalog.get("Pad").signature().size());
    }
}
