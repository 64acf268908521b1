package com.acme.finops.ottl.lang;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of statements, conditions and values. Nodes are immutable.
 */
public final class Ast {
    private Ast() {
    }

    public record Statement(Call editor, BoolExpression whereClause, String source) {
        public Statement {
            if (!editor.isEditor()) {
                throw new IllegalArgumentException("statement must invoke an editor");
            }
        }
    }

    /** Terms joined by {@code or}. */
    public record BoolExpression(List<Term> terms) {
        public BoolExpression {
            terms = List.copyOf(terms);
        }
    }

    /** Factors joined by {@code and}. */
    public record Term(List<BoolFactor> factors) {
        public Term {
            factors = List.copyOf(factors);
        }
    }

    public record BoolFactor(boolean negated, BoolOperand operand) {}

    public sealed interface BoolOperand permits Comparison, ConstBool, BoolCall, Grouped {}

    public record Comparison(ValueNode left, CompareOp op, ValueNode right) implements BoolOperand {}

    public record ConstBool(boolean value) implements BoolOperand {}

    public record BoolCall(Call converter) implements BoolOperand {}

    public record Grouped(BoolExpression expression) implements BoolOperand {}

    public sealed interface ValueNode
        permits NilLiteral, StringLiteral, IntLiteral, FloatLiteral, BoolLiteral, BytesLiteral, EnumSymbol,
        PathNode, Call, ListNode, MapNode, MathNode, NegateNode {
        int position();
    }

    public record NilLiteral(int position) implements ValueNode {}

    public record StringLiteral(String value, int position) implements ValueNode {}

    public record IntLiteral(long value, int position) implements ValueNode {}

    public record FloatLiteral(double value, int position) implements ValueNode {}

    public record BoolLiteral(boolean value, int position) implements ValueNode {}

    public record BytesLiteral(byte[] value, int position) implements ValueNode {}

    /**
     * Uppercase identifier not followed by {@code (}. Resolves to an enum value, or to a
     * converter name where a function-typed argument is expected.
     */
    public record EnumSymbol(String name, int position) implements ValueNode {}

    public record PathNode(List<Field> fields, int position) implements ValueNode {
        public PathNode {
            fields = List.copyOf(fields);
        }
    }

    public record Field(String name, List<KeyNode> keys) {
        public Field {
            keys = List.copyOf(keys);
        }
    }

    /**
     * A bracket segment. Exactly one of the three components is set.
     */
    public record KeyNode(String stringKey, Long intKey, ValueNode expression) {}

    public record Call(String name, List<Argument> arguments, List<KeyNode> keys, int position) implements ValueNode {
        public Call {
            arguments = List.copyOf(arguments);
            keys = List.copyOf(keys);
        }

        public boolean isEditor() {
            return Character.isLowerCase(name.charAt(0));
        }
    }

    /**
     * @param name argument name for {@code name = value} syntax, otherwise {@code null}
     */
    public record Argument(String name, ValueNode value) {}

    public record ListNode(List<ValueNode> values, int position) implements ValueNode {
        public ListNode {
            values = List.copyOf(values);
        }
    }

    public record MapNode(Map<String, ValueNode> entries, int position) implements ValueNode {
        public MapNode {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    public record MathNode(ValueNode left, MathOp op, ValueNode right, int position) implements ValueNode {}

    public record NegateNode(ValueNode operand, int position) implements ValueNode {}
}
