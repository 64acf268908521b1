package com.acme.finops.ottl.lang;

/**
 * @param text     raw text for punctuation and identifiers, the unescaped value for strings
 * @param position zero-based offset of the first character
 */
public record Token(TokenType type, String text, int position) {
    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENT && text.equals(keyword);
    }
}
