package com.acme.finops.ottl.contexts;

import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.functions.StandardFunctions;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.Resource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceContextTest {

    @Test
    void shouldEditResourceAttributes() throws Exception {
        Parser<ResourceContext> parser = ResourceContext.newParser(StandardFunctions.all());
        Resource resource = new Resource();
        resource.attributes().put("host.name", "node-1");
        ResourceContext ctx = new ResourceContext(resource);

        parser.parseStatement("set(attributes[\"env\"], \"prod\") where attributes[\"host.name\"] == \"node-1\"")
            .execute(ExecContext.background(), ctx);
        parser.parseStatement("set(dropped_attributes_count, 3)").execute(ExecContext.background(), ctx);

        assertEquals("prod", resource.attributes().get("env"));
        assertEquals(3L, resource.droppedAttributesCount());
        assertTrue(parser.parseCondition("resource.attributes[\"env\"] == \"prod\"").eval(ExecContext.background(), ctx));
    }

    @Test
    void shouldEditScopeAndSeeItsResource() throws Exception {
        Parser<ScopeContext> parser = ScopeContext.newParser(StandardFunctions.all());
        Resource resource = new Resource();
        resource.attributes().put("service.name", "cart");
        InstrumentationScope scope = new InstrumentationScope("lib", "0.1");
        ScopeContext ctx = new ScopeContext(scope, resource);

        parser.parseStatement("set(version, \"0.2\") where resource.attributes[\"service.name\"] == \"cart\"")
            .execute(ExecContext.background(), ctx);

        assertEquals("0.2", scope.version());
        assertTrue(parser.parseCondition("name == \"lib\"").eval(ExecContext.background(), ctx));
    }
}
