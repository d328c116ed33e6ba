package com.slowlog.analyzer.sql;

import java.util.Locale;

/**
 * A lexical unit of SQL text, keeping the exact characters it was read from.
 */
public class SqlToken {

    public enum Type {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        PLACEHOLDER,
        VARIABLE,
        PUNCTUATION,
        WHITESPACE,
        COMMENT
    }

    private final Type type;
    private final String text;

    public SqlToken(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean isLiteral() {
        return type == Type.STRING || type == Type.NUMBER;
    }

    /** Whitespace and comments do not change the meaning of a statement. */
    public boolean isSignificant() {
        return type != Type.WHITESPACE && type != Type.COMMENT;
    }

    public boolean isWord(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isPunctuation(char c) {
        return type == Type.PUNCTUATION && text.length() == 1 && text.charAt(0) == c;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
