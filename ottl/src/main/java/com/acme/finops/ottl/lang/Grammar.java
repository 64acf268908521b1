package com.acme.finops.ottl.lang;

import com.acme.finops.ottl.ConfigException;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for statements, conditions and standalone value expressions.
 *
 * <pre>
 * statement   := editor ("where" boolExpr)?
 * boolExpr    := term ("or" term)*
 * term        := factor ("and" factor)*
 * factor      := "not"? (comparison | "true" | "false" | Converter | "(" boolExpr ")")
 * comparison  := value op value
 * value       := additive | string | bytes | nil | bool | ENUM | list | map
 * additive    := product (("+" | "-") product)*
 * product     := unary (("*" | "/") unary)*
 * unary       := "-" unary | primary
 * </pre>
 */
public final class Grammar {
    private final String source;
    private final List<Token> tokens;
    private int index;

    private Grammar(String source) throws ConfigException {
        this.source = source;
        this.tokens = Lexer.tokenize(source);
    }

    public static Ast.Statement parseStatement(String source) throws ConfigException {
        Grammar g = new Grammar(requireText(source, "statement"));
        Ast.ValueNode head = g.parsePrimary();
        if (!(head instanceof Ast.Call call)) {
            throw g.error("statement must start with an editor invocation", head.position());
        }
        if (!call.isEditor()) {
            throw g.error("editor names must start with a lowercase letter but got '" + call.name() + "'", call.position());
        }
        if (!call.keys().isEmpty()) {
            throw g.error("editors cannot be indexed", call.position());
        }
        Ast.BoolExpression where = null;
        if (g.peek().isKeyword("where")) {
            g.advance();
            where = g.parseBoolExpression();
        }
        g.expect(TokenType.EOF, "end of statement");
        return new Ast.Statement(call, where, source);
    }

    public static Ast.BoolExpression parseCondition(String source) throws ConfigException {
        Grammar g = new Grammar(requireText(source, "condition"));
        Ast.BoolExpression expr = g.parseBoolExpression();
        g.expect(TokenType.EOF, "end of condition");
        return expr;
    }

    public static Ast.ValueNode parseValue(String source) throws ConfigException {
        Grammar g = new Grammar(requireText(source, "value expression"));
        Ast.ValueNode value = g.parseValueNode();
        g.expect(TokenType.EOF, "end of expression");
        return value;
    }

    private static String requireText(String source, String what) throws ConfigException {
        if (source == null || source.isBlank()) {
            throw new ConfigException(what + " is blank");
        }
        return source;
    }

    // boolean expressions

    private Ast.BoolExpression parseBoolExpression() throws ConfigException {
        List<Ast.Term> terms = new ArrayList<>();
        terms.add(parseTerm());
        while (peek().isKeyword("or")) {
            advance();
            terms.add(parseTerm());
        }
        return new Ast.BoolExpression(terms);
    }

    private Ast.Term parseTerm() throws ConfigException {
        List<Ast.BoolFactor> factors = new ArrayList<>();
        factors.add(parseFactor());
        while (peek().isKeyword("and")) {
            advance();
            factors.add(parseFactor());
        }
        return new Ast.Term(factors);
    }

    private Ast.BoolFactor parseFactor() throws ConfigException {
        boolean negated = false;
        if (peek().isKeyword("not")) {
            advance();
            negated = true;
        }
        if (peek().is(TokenType.LPAREN)) {
            int mark = index;
            try {
                advance();
                Ast.BoolExpression inner = parseBoolExpression();
                expect(TokenType.RPAREN, "')'");
                if (!startsOperatorTail(peek())) {
                    return new Ast.BoolFactor(negated, new Ast.Grouped(inner));
                }
            } catch (ConfigException notBoolean) {
                // the parenthesis opens a math sub-expression; reparse as a comparison
            }
            index = mark;
        }
        Ast.ValueNode left = parseValueNode();
        Token next = peek();
        if (next.is(TokenType.COMPARISON)) {
            advance();
            Ast.ValueNode right = parseValueNode();
            return new Ast.BoolFactor(negated, new Ast.Comparison(left, CompareOp.fromSymbol(next.text()), right));
        }
        if (left instanceof Ast.BoolLiteral b) {
            return new Ast.BoolFactor(negated, new Ast.ConstBool(b.value()));
        }
        if (left instanceof Ast.Call call) {
            return new Ast.BoolFactor(negated, new Ast.BoolCall(call));
        }
        throw error("expected a comparison, boolean or converter", left.position());
    }

    private static boolean startsOperatorTail(Token t) {
        return t.is(TokenType.COMPARISON) || t.is(TokenType.PLUS) || t.is(TokenType.MINUS)
            || t.is(TokenType.STAR) || t.is(TokenType.SLASH);
    }

    // values

    private Ast.ValueNode parseValueNode() throws ConfigException {
        Ast.ValueNode value = parseAdditive();
        if (value instanceof Ast.MathNode || value instanceof Ast.NegateNode) {
            validateMathOperands(value);
        }
        return value;
    }

    private Ast.ValueNode parseAdditive() throws ConfigException {
        Ast.ValueNode left = parseProduct();
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            Token op = advance();
            Ast.ValueNode right = parseProduct();
            left = new Ast.MathNode(left, op.is(TokenType.PLUS) ? MathOp.ADD : MathOp.SUB, right, op.position());
        }
        return left;
    }

    private Ast.ValueNode parseProduct() throws ConfigException {
        Ast.ValueNode left = parseUnary();
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
            Token op = advance();
            Ast.ValueNode right = parseUnary();
            left = new Ast.MathNode(left, op.is(TokenType.STAR) ? MathOp.MUL : MathOp.DIV, right, op.position());
        }
        return left;
    }

    private Ast.ValueNode parseUnary() throws ConfigException {
        if (peek().is(TokenType.MINUS)) {
            Token minus = advance();
            if (peek().is(TokenType.INT)) {
                Token digits = advance();
                try {
                    return new Ast.IntLiteral(Long.parseLong("-" + digits.text()), minus.position());
                } catch (NumberFormatException e) {
                    throw error("invalid int literal -" + digits.text(), digits.position());
                }
            }
            Ast.ValueNode operand = parseUnary();
            if (operand instanceof Ast.IntLiteral i) {
                return new Ast.IntLiteral(-i.value(), minus.position());
            }
            if (operand instanceof Ast.FloatLiteral f) {
                return new Ast.FloatLiteral(-f.value(), minus.position());
            }
            return new Ast.NegateNode(operand, minus.position());
        }
        if (peek().is(TokenType.LPAREN)) {
            advance();
            Ast.ValueNode inner = parseAdditive();
            expect(TokenType.RPAREN, "')'");
            return inner;
        }
        return parsePrimary();
    }

    private Ast.ValueNode parsePrimary() throws ConfigException {
        Token t = peek();
        switch (t.type()) {
            case STRING -> {
                advance();
                return new Ast.StringLiteral(t.text(), t.position());
            }
            case INT -> {
                advance();
                try {
                    return new Ast.IntLiteral(Long.parseLong(t.text()), t.position());
                } catch (NumberFormatException e) {
                    throw error("invalid int literal " + t.text(), t.position());
                }
            }
            case FLOAT -> {
                advance();
                return new Ast.FloatLiteral(Double.parseDouble(t.text()), t.position());
            }
            case BYTES -> {
                advance();
                String hex = t.text().length() % 2 == 0 ? t.text() : "0" + t.text();
                return new Ast.BytesLiteral(HexFormat.of().parseHex(hex), t.position());
            }
            case LBRACKET -> {
                return parseList();
            }
            case LBRACE -> {
                return parseMap();
            }
            case IDENT -> {
                return parseIdentifier();
            }
            default -> throw error("unexpected token '" + describe(t) + "'", t.position());
        }
    }

    private Ast.ValueNode parseIdentifier() throws ConfigException {
        Token t = advance();
        String name = t.text();
        switch (name) {
            case "nil" -> {
                return new Ast.NilLiteral(t.position());
            }
            case "true" -> {
                return new Ast.BoolLiteral(true, t.position());
            }
            case "false" -> {
                return new Ast.BoolLiteral(false, t.position());
            }
            case "and", "or", "not", "where" -> throw error("unexpected keyword '" + name + "'", t.position());
            default -> {
            }
        }
        if (peek().is(TokenType.LPAREN)) {
            return parseCall(t);
        }
        if (Character.isUpperCase(name.charAt(0))) {
            return new Ast.EnumSymbol(name, t.position());
        }
        return parsePath(t);
    }

    private Ast.Call parseCall(Token nameToken) throws ConfigException {
        expect(TokenType.LPAREN, "'('");
        List<Ast.Argument> args = new ArrayList<>();
        boolean sawNamed = false;
        if (!peek().is(TokenType.RPAREN)) {
            do {
                Token argStart = peek();
                String argName = null;
                if (argStart.is(TokenType.IDENT) && peekAt(1).is(TokenType.EQUAL)) {
                    argName = argStart.text();
                    advance();
                    advance();
                    sawNamed = true;
                } else if (sawNamed) {
                    throw error("positional arguments must come before named arguments", argStart.position());
                }
                args.add(new Ast.Argument(argName, parseValueNode()));
            } while (consumeIf(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')'");
        List<Ast.KeyNode> keys = parseKeys();
        Ast.Call call = new Ast.Call(nameToken.text(), args, keys, nameToken.position());
        if (call.isEditor() && !keys.isEmpty()) {
            throw error("editors cannot be indexed", nameToken.position());
        }
        return call;
    }

    private Ast.PathNode parsePath(Token first) throws ConfigException {
        List<Ast.Field> fields = new ArrayList<>();
        fields.add(new Ast.Field(first.text(), parseKeys()));
        while (peek().is(TokenType.DOT)) {
            advance();
            Token field = expect(TokenType.IDENT, "path field name");
            fields.add(new Ast.Field(field.text(), parseKeys()));
        }
        return new Ast.PathNode(fields, first.position());
    }

    private List<Ast.KeyNode> parseKeys() throws ConfigException {
        List<Ast.KeyNode> keys = new ArrayList<>();
        while (peek().is(TokenType.LBRACKET)) {
            Token open = advance();
            Token t = peek();
            if (t.is(TokenType.STRING) && peekAt(1).is(TokenType.RBRACKET)) {
                advance();
                keys.add(new Ast.KeyNode(t.text(), null, null));
            } else if (t.is(TokenType.INT) && peekAt(1).is(TokenType.RBRACKET)) {
                advance();
                try {
                    keys.add(new Ast.KeyNode(null, Long.parseLong(t.text()), null));
                } catch (NumberFormatException e) {
                    throw error("invalid int key " + t.text(), t.position());
                }
            } else {
                Ast.ValueNode expr = parseValueNode();
                if (!(expr instanceof Ast.PathNode || expr instanceof Ast.Call || expr instanceof Ast.MathNode)) {
                    throw error("key must be a string, an int, a path or a converter", open.position());
                }
                keys.add(new Ast.KeyNode(null, null, expr));
            }
            expect(TokenType.RBRACKET, "']'");
        }
        return keys;
    }

    private Ast.ListNode parseList() throws ConfigException {
        Token open = expect(TokenType.LBRACKET, "'['");
        List<Ast.ValueNode> values = new ArrayList<>();
        if (!peek().is(TokenType.RBRACKET)) {
            do {
                values.add(parseValueNode());
            } while (consumeIf(TokenType.COMMA));
        }
        expect(TokenType.RBRACKET, "']'");
        return new Ast.ListNode(values, open.position());
    }

    private Ast.MapNode parseMap() throws ConfigException {
        Token open = expect(TokenType.LBRACE, "'{'");
        Map<String, Ast.ValueNode> entries = new LinkedHashMap<>();
        if (!peek().is(TokenType.RBRACE)) {
            do {
                Token key = expect(TokenType.STRING, "map key string");
                expect(TokenType.COLON, "':'");
                entries.put(key.text(), parseValueNode());
            } while (consumeIf(TokenType.COMMA));
        }
        expect(TokenType.RBRACE, "'}'");
        return new Ast.MapNode(entries, open.position());
    }

    private void validateMathOperands(Ast.ValueNode node) throws ConfigException {
        if (node instanceof Ast.MathNode m) {
            validateMathOperands(m.left());
            validateMathOperands(m.right());
        } else if (node instanceof Ast.NegateNode n) {
            validateMathOperands(n.operand());
        } else if (!(node instanceof Ast.IntLiteral
            || node instanceof Ast.FloatLiteral
            || node instanceof Ast.PathNode
            || node instanceof Ast.Call)) {
            throw error("invalid operand in math expression", node.position());
        }
    }

    // token helpers

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        int i = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (!t.is(TokenType.EOF)) {
            index++;
        }
        return t;
    }

    private boolean consumeIf(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) throws ConfigException {
        Token t = peek();
        if (!t.is(type)) {
            throw error("expected " + what + " but found '" + describe(t) + "'", t.position());
        }
        return advance();
    }

    private static String describe(Token t) {
        return t.is(TokenType.EOF) ? "end of input" : t.text();
    }

    private ConfigException error(String message, int position) {
        return new ConfigException(message, source, position);
    }
}
