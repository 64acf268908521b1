package com.acme.finops.ottl.func;

/**
 * Semantic parameter types a function signature may declare. The binder converts each
 * call-site argument into the Java shape noted per constant.
 */
public enum ArgType {
    /** {@code Getter<K>} */
    GETTER,
    /** {@code GetSetter<K>}; the argument must be a writable path */
    GET_SETTER,
    /** {@code TypedGetter<K, String>} strict */
    STRING,
    /** {@code TypedGetter<K, String>} coercing */
    STRING_LIKE,
    /** {@code TypedGetter<K, Long>} strict */
    INT,
    /** {@code TypedGetter<K, Long>} coercing */
    INT_LIKE,
    /** {@code TypedGetter<K, Double>} strict */
    FLOAT,
    /** {@code TypedGetter<K, Double>} coercing */
    FLOAT_LIKE,
    /** {@code TypedGetter<K, Boolean>} strict */
    BOOL,
    /** {@code TypedGetter<K, Boolean>} coercing */
    BOOL_LIKE,
    /** {@code TypedGetter<K, byte[]>} coercing */
    BYTES_LIKE,
    /** {@code TypedGetter<K, Instant>} */
    TIME,
    /** {@code TypedGetter<K, Duration>} */
    DURATION,
    /** {@code TypedGetter<K, PMap>} */
    MAP,
    /** {@code TypedGetter<K, PSlice>} */
    SLICE,
    /** {@code String}; the argument must be a string literal */
    STRING_LITERAL,
    /** {@code Long}; the argument must be an int literal */
    INT_LITERAL,
    /** {@code Double}; int or float literal */
    FLOAT_LITERAL,
    /** {@code Boolean}; the argument must be {@code true} or {@code false} */
    BOOL_LITERAL,
    /** {@code Long}; the argument must be an enum symbol */
    ENUM,
    /** {@code List<Getter<K>>} from a list literal */
    GETTER_LIST,
    /** {@code List<TypedGetter<K, String>>} strict, from a list literal */
    STRING_GETTER_LIST,
    /** {@code List<TypedGetter<K, String>>} coercing, from a list literal */
    STRING_LIKE_GETTER_LIST,
    /** {@code List<String>} from a list of string literals */
    STRING_LITERAL_LIST,
    /** {@code FunctionGetter<K>}; the argument is a bare converter name */
    FUNCTION;

    public boolean isLiteral() {
        return this == STRING_LITERAL || this == INT_LITERAL || this == FLOAT_LITERAL || this == BOOL_LITERAL
            || this == STRING_LITERAL_LIST;
    }
}
