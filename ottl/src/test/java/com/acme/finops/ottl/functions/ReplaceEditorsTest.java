package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.pdata.PMap;
import org.junit.jupiter.api.Test;

import static com.acme.finops.ottl.functions.FunctionTestSupport.PARSER;
import static com.acme.finops.ottl.functions.FunctionTestSupport.newLog;
import static com.acme.finops.ottl.functions.FunctionTestSupport.run;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReplaceEditorsTest {

    @Test
    void shouldReplaceValuesMatchingGlob() throws Exception {
        LogContext ctx = newLog();
        ctx.log().attributes().put("http.method", "GET");
        ctx.log().attributes().put("http.path", "/a/1/b/2");

        run(ctx, "replace_all_matches(attributes, \"/a/*/b/*\", \"/a/{x}/b/{y}\")");

        assertEquals(PMap.of("http.method", "GET", "http.path", "/a/{x}/b/{y}"), ctx.log().attributes());
    }

    @Test
    void shouldReplacePatternWithCaptureGroups() throws Exception {
        LogContext ctx = newLog();
        ctx.log().attributes().put("url", "user=ann&id=7");

        run(ctx, "replace_pattern(attributes[\"url\"], \"user=(\\\\w+)\", \"name=$1\")");

        assertEquals("name=ann&id=7", ctx.log().attributes().get("url"));
    }

    @Test
    void shouldHashReplacementThroughConverter() throws Exception {
        LogContext ctx = newLog();
        ctx.log().attributes().put("card", "card=abc");

        run(ctx, "replace_pattern(attributes[\"card\"], \"card=(.*)\", \"$1\", SHA256, \"hash:%s\")");

        assertEquals("hash:ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            ctx.log().attributes().get("card"));
    }

    @Test
    void shouldHashEveryMatchSeparately() throws Exception {
        LogContext ctx = newLog();
        ctx.log().attributes().put("pair", "a=abc b=hello");

        run(ctx, "replace_pattern(attributes[\"pair\"], \"(\\\\w{3,})\", \"$1\", SHA256)");

        assertEquals("a=ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad"
                + " b=2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
            ctx.log().attributes().get("pair"));
    }

    @Test
    void shouldReplaceKeysOrValuesOfMap() throws Exception {
        LogContext ctx = newLog();
        ctx.log().attributes().put("secret.token", "tok-1");
        ctx.log().attributes().put("count", 3L);

        run(ctx, "replace_all_patterns(attributes, \"value\", \"tok-\\\\d\", \"***\")");
        run(ctx, "replace_all_patterns(attributes, \"key\", \"^secret\\\\.\", \"redacted.\")");

        assertEquals(PMap.of("redacted.token", "***", "count", 3L), ctx.log().attributes());
    }

    @Test
    void shouldReplaceWholeMatch() throws Exception {
        LogContext ctx = newLog();
        ctx.log().setBody("GET /users/42");

        run(ctx, "replace_match(body, \"GET /users/*\", \"GET /users/{id}\")");

        assertEquals("GET /users/{id}", ctx.log().body());
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(ConfigException.class,
            () -> PARSER.parseStatement("replace_pattern(body, \"(\", \"x\")"));
        assertThrows(ConfigException.class,
            () -> PARSER.parseStatement("replace_all_patterns(attributes, \"both\", \"a\", \"b\")"));
        assertThrows(ConfigException.class,
            () -> PARSER.parseStatement("replace_match(body, \"*\", \"x\", function = Unknown)"));
    }
}
