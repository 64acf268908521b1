package com.acme.finops.ottl.lang;

import com.acme.finops.ottl.ConfigException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrammarTest {

    @Test
    void shouldParseEditorWithWhereClause() throws Exception {
        Ast.Statement st = Grammar.parseStatement(
            "set(attributes[\"env\"], \"prod\") where name == \"checkout\" and not IsMatch(name, \"^x\")");

        assertEquals("set", st.editor().name());
        assertEquals(2, st.editor().arguments().size());
        Ast.PathNode target = assertInstanceOf(Ast.PathNode.class, st.editor().arguments().get(0).value());
        assertEquals("attributes", target.fields().get(0).name());
        assertEquals("env", target.fields().get(0).keys().get(0).stringKey());

        assertEquals(1, st.whereClause().terms().size());
        Ast.Term term = st.whereClause().terms().get(0);
        assertEquals(2, term.factors().size());
        assertInstanceOf(Ast.Comparison.class, term.factors().get(0).operand());
        assertTrue(term.factors().get(1).negated());
        assertInstanceOf(Ast.BoolCall.class, term.factors().get(1).operand());
    }

    @Test
    void shouldGiveAndPrecedenceOverOr() throws Exception {
        Ast.BoolExpression expr = Grammar.parseCondition("true or false and false");

        assertEquals(2, expr.terms().size());
        assertEquals(1, expr.terms().get(0).factors().size());
        assertEquals(2, expr.terms().get(1).factors().size());
    }

    @Test
    void shouldTreatParenthesisedMathAsComparisonOperand() throws Exception {
        Ast.BoolExpression expr = Grammar.parseCondition("(1 + 2) * 3 == 9");

        Ast.Comparison cmp = assertInstanceOf(Ast.Comparison.class, expr.terms().get(0).factors().get(0).operand());
        Ast.MathNode mul = assertInstanceOf(Ast.MathNode.class, cmp.left());
        assertEquals(MathOp.MUL, mul.op());
        assertInstanceOf(Ast.MathNode.class, mul.left());
    }

    @Test
    void shouldParseGroupedBooleanExpression() throws Exception {
        Ast.BoolExpression expr = Grammar.parseCondition("not (true and false)");

        Ast.BoolFactor factor = expr.terms().get(0).factors().get(0);
        assertTrue(factor.negated());
        assertInstanceOf(Ast.Grouped.class, factor.operand());
    }

    @Test
    void shouldFoldNegativeNumericLiterals() throws Exception {
        Ast.IntLiteral i = assertInstanceOf(Ast.IntLiteral.class, Grammar.parseValue("-5"));
        Ast.FloatLiteral f = assertInstanceOf(Ast.FloatLiteral.class, Grammar.parseValue("-2.5"));

        assertEquals(-5L, i.value());
        assertEquals(Long.MIN_VALUE, assertInstanceOf(Ast.IntLiteral.class,
            Grammar.parseValue("-9223372036854775808")).value());
        assertEquals(-2.5d, f.value());
        assertInstanceOf(Ast.NegateNode.class, Grammar.parseValue("-attributes[\"n\"]"));
    }

    @Test
    void shouldParseLiteralsListsAndMaps() throws Exception {
        assertInstanceOf(Ast.NilLiteral.class, Grammar.parseValue("nil"));
        assertInstanceOf(Ast.EnumSymbol.class, Grammar.parseValue("SPAN_KIND_SERVER"));
        Ast.BytesLiteral bytes = assertInstanceOf(Ast.BytesLiteral.class, Grammar.parseValue("0x0a0B"));
        assertEquals(2, bytes.value().length);
        assertEquals(11, bytes.value()[1]);

        Ast.ListNode list = assertInstanceOf(Ast.ListNode.class, Grammar.parseValue("[1, \"a\", [true]]"));
        assertEquals(3, list.values().size());
        Ast.MapNode map = assertInstanceOf(Ast.MapNode.class, Grammar.parseValue("{\"k\": 1, \"m\": {\"n\": nil}}"));
        assertEquals(2, map.entries().size());
    }

    @Test
    void shouldParseNamedArgumentsAndConverterKeys() throws Exception {
        Ast.Call call = assertInstanceOf(Ast.Call.class,
            Grammar.parseValue("Split(target = name, delimiter = \",\")[0]"));

        assertFalse(call.isEditor());
        assertEquals("target", call.arguments().get(0).name());
        assertEquals("delimiter", call.arguments().get(1).name());
        assertEquals(0L, call.keys().get(0).intKey());
    }

    @Test
    void shouldParseDynamicKey() throws Exception {
        Ast.PathNode path = assertInstanceOf(Ast.PathNode.class, Grammar.parseValue("attributes[cache[\"k\"]]"));

        Ast.KeyNode key = path.fields().get(0).keys().get(0);
        assertNull(key.stringKey());
        assertInstanceOf(Ast.PathNode.class, key.expression());
    }

    @Test
    void shouldRejectUppercaseEditor() {
        ConfigException e = assertThrows(ConfigException.class, () -> Grammar.parseStatement("Set(name, \"x\")"));

        assertTrue(e.getMessage().contains("editor names must start with a lowercase letter"));
        assertEquals(0, e.position());
    }

    @Test
    void shouldRejectStatementWithoutEditor() {
        assertThrows(ConfigException.class, () -> Grammar.parseStatement("name == \"x\""));
    }

    @Test
    void shouldRejectPositionalAfterNamedArgument() {
        ConfigException e = assertThrows(ConfigException.class,
            () -> Grammar.parseStatement("set(target = name, \"x\")"));

        assertTrue(e.getMessage().contains("positional arguments must come before named arguments"));
    }

    @Test
    void shouldRejectIndexedEditor() {
        assertThrows(ConfigException.class, () -> Grammar.parseStatement("set(name, \"x\")[0]"));
    }

    @Test
    void shouldRejectNonNumericMathOperand() {
        ConfigException e = assertThrows(ConfigException.class, () -> Grammar.parseValue("1 + \"a\""));

        assertTrue(e.getMessage().contains("invalid operand in math expression"));
    }

    @Test
    void shouldRejectTrailingTokensAndBlankInput() {
        assertThrows(ConfigException.class, () -> Grammar.parseCondition("true true"));
        assertThrows(ConfigException.class, () -> Grammar.parseCondition("   "));
        assertThrows(ConfigException.class, () -> Grammar.parseCondition("name"));
    }

    @Test
    void shouldRenderSourceAndPositionInMessage() {
        ConfigException e = assertThrows(ConfigException.class, () -> Grammar.parseCondition("name == )"));

        assertEquals("name == )", e.source());
        assertEquals(8, e.position());
        assertTrue(e.getMessage().endsWith("(statement: name == ), position 8)"));
    }
}
