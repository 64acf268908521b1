package com.acme.finops.ottl.lang;

import com.acme.finops.ottl.ConfigException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits OTTL source into tokens. Signs are never part of numeric tokens; unary minus is
 * handled by the grammar.
 */
public final class Lexer {
    private final String source;
    private int pos;

    private Lexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) throws ConfigException {
        return new Lexer(source).run();
    }

    private List<Token> run() throws ConfigException {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                out.add(new Token(TokenType.EOF, "", pos));
                return out;
            }
            char c = source.charAt(pos);
            int start = pos;
            if (c == '"') {
                out.add(new Token(TokenType.STRING, readString(), start));
            } else if (c == '0' && pos + 1 < source.length() && (source.charAt(pos + 1) == 'x' || source.charAt(pos + 1) == 'X')) {
                out.add(readBytes());
            } else if (isDigit(c) || (c == '.' && nextIsDigit() && !previousEndsOperand(out))) {
                out.add(readNumber());
            } else if (isIdentStart(c)) {
                while (pos < source.length() && isIdentPart(source.charAt(pos))) {
                    pos++;
                }
                out.add(new Token(TokenType.IDENT, source.substring(start, pos), start));
            } else {
                out.add(readPunctuation(c));
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private String readString() throws ConfigException {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                if (pos + 1 >= source.length()) {
                    break;
                }
                char next = source.charAt(pos + 1);
                switch (next) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append('\\').append(next);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new ConfigException("unterminated string literal", source, start);
    }

    private Token readBytes() throws ConfigException {
        int start = pos;
        pos += 2;
        while (pos < source.length() && isHexDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos == start + 2) {
            throw new ConfigException("byte literal requires hex digits", source, start);
        }
        return new Token(TokenType.BYTES, source.substring(start + 2, pos), start);
    }

    private Token readNumber() throws ConfigException {
        int start = pos;
        boolean isFloat = false;
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int expStart = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= source.length() || !isDigit(source.charAt(pos))) {
                throw new ConfigException("malformed exponent in numeric literal", source, expStart);
            }
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
            isFloat = true;
        }
        if (pos < source.length() && isIdentStart(source.charAt(pos))) {
            throw new ConfigException("malformed numeric literal", source, start);
        }
        return new Token(isFloat ? TokenType.FLOAT : TokenType.INT, source.substring(start, pos), start);
    }

    private Token readPunctuation(char c) throws ConfigException {
        int start = pos;
        char next = pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
        switch (c) {
            case '=' -> {
                if (next == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, "==", start);
                }
                pos++;
                return new Token(TokenType.EQUAL, "=", start);
            }
            case '!' -> {
                if (next == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, "!=", start);
                }
                throw new ConfigException("unexpected character '!'", source, start);
            }
            case '<', '>' -> {
                if (next == '=') {
                    pos += 2;
                    return new Token(TokenType.COMPARISON, c + "=", start);
                }
                pos++;
                return new Token(TokenType.COMPARISON, String.valueOf(c), start);
            }
            default -> {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case '{' -> TokenType.LBRACE;
                    case '}' -> TokenType.RBRACE;
                    case '[' -> TokenType.LBRACKET;
                    case ']' -> TokenType.RBRACKET;
                    case ':' -> TokenType.COLON;
                    case ',' -> TokenType.COMMA;
                    case '.' -> TokenType.DOT;
                    default -> null;
                };
                if (type == null) {
                    throw new ConfigException("unexpected character '" + c + "'", source, start);
                }
                pos++;
                return new Token(type, String.valueOf(c), start);
            }
        }
    }

    private boolean nextIsDigit() {
        return pos + 1 < source.length() && isDigit(source.charAt(pos + 1));
    }

    private static boolean previousEndsOperand(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        TokenType t = tokens.get(tokens.size() - 1).type();
        return t == TokenType.IDENT || t == TokenType.RBRACKET || t == TokenType.RPAREN;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
