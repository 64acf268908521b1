package com.acme.finops.ottl;

/**
 * Raised while a statement or condition is being compiled. A stage that hits one of these
 * must refuse to start.
 */
public class ConfigException extends OttlException {
    private final String source;
    private final int position;

    public ConfigException(String message) {
        this(message, null, -1, null);
    }

    public ConfigException(String message, Throwable cause) {
        this(message, null, -1, cause);
    }

    public ConfigException(String message, String source, int position) {
        this(message, source, position, null);
    }

    public ConfigException(String message, String source, int position, Throwable cause) {
        super(render(message, source, position), cause);
        this.source = source;
        this.position = position;
    }

    /**
     * Statement or condition text the failure was reported against, or {@code null}.
     */
    public String source() {
        return source;
    }

    /**
     * Zero-based character offset into {@link #source()}, or -1 when unknown.
     */
    public int position() {
        return position;
    }

    public ConfigException withSource(String statement) {
        if (this.source != null || statement == null) {
            return this;
        }
        return new ConfigException(rawMessage(), statement, position, this);
    }

    private String rawMessage() {
        String msg = getMessage();
        int idx = msg.indexOf(" (statement: ");
        return idx < 0 ? msg : msg.substring(0, idx);
    }

    private static String render(String message, String source, int position) {
        if (source == null) {
            return message;
        }
        if (position < 0) {
            return message + " (statement: " + source + ")";
        }
        return message + " (statement: " + source + ", position " + position + ")";
    }
}
