package com.slowlog.analyzer.sql;

import java.util.ArrayList;
import java.util.List;

import com.slowlog.analyzer.sql.SqlToken.Type;

/**
 * Single pass tokenizer for MySQL flavoured SQL.
 * <p>
 * The concatenation of the returned token texts is always the input. Unterminated strings, quoted identifiers
 * and block comments extend to the end of the input.
 */
public final class SqlLexer {

    private final String s;
    private final int n;
    private final List<SqlToken> tokens = new ArrayList<>();
    private SqlToken lastSignificant;

    private SqlLexer(String sql) {
        this.s = sql;
        this.n = sql.length();
    }

    public static List<SqlToken> tokenize(String sql) {
        SqlLexer lexer = new SqlLexer(sql == null ? "" : sql);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            int end;
            if (Character.isWhitespace(c)) {
                end = i + 1;
                while (end < n && Character.isWhitespace(s.charAt(end))) {
                    end++;
                }
                emit(Type.WHITESPACE, i, end);
            } else if (c == '-' && i + 1 < n && s.charAt(i + 1) == '-' && (i + 2 == n || Character.isWhitespace(s.charAt(i + 2)))) {
                end = lineEnd(i);
                emit(Type.COMMENT, i, end);
            } else if (c == '#') {
                end = lineEnd(i);
                emit(Type.COMMENT, i, end);
            } else if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                int close = s.indexOf("*/", i + 2);
                end = close < 0 ? n : close + 2;
                emit(Type.COMMENT, i, end);
            } else if (c == '\'' || c == '"') {
                end = quotedEnd(i, c, true);
                emit(Type.STRING, i, end);
            } else if (c == '`') {
                end = quotedEnd(i, c, false);
                emit(Type.QUOTED_IDENTIFIER, i, end);
            } else if (c == '?') {
                end = i + 1;
                emit(Type.PLACEHOLDER, i, end);
            } else if (c == '@') {
                end = variableEnd(i);
                emit(Type.VARIABLE, i, end);
            } else if ((c == '-' || c == '+') && startsNumber(i + 1) && unaryContext()) {
                int numberEnd = numberEnd(i + 1);
                if (numberEnd > 0) {
                    end = numberEnd;
                    emit(Type.NUMBER, i, end);
                } else {
                    end = i + 1;
                    emit(Type.PUNCTUATION, i, end);
                }
            } else if (Character.isDigit(c) || (c == '.' && startsNumber(i) && !qualifierDot())) {
                int numberEnd = numberEnd(i);
                if (numberEnd > 0) {
                    end = numberEnd;
                    emit(Type.NUMBER, i, end);
                } else {
                    end = wordEnd(i);
                    emit(Type.WORD, i, end);
                }
            } else if (isIdentifierPart(c)) {
                end = wordEnd(i);
                emit(Type.WORD, i, end);
            } else {
                end = i + 1;
                emit(Type.PUNCTUATION, i, end);
            }
            i = end;
        }
    }

    private void emit(Type type, int start, int end) {
        SqlToken token = new SqlToken(type, s.substring(start, end));
        tokens.add(token);
        if (token.isSignificant()) {
            lastSignificant = token;
        }
    }

    /**
     * A sign is part of a number when nothing that could be a left operand precedes it.
     */
    private boolean unaryContext() {
        if (lastSignificant == null) {
            return true;
        }
        switch (lastSignificant.getType()) {
        case PUNCTUATION:
            return !lastSignificant.isPunctuation(')');
        case WORD:
            return SqlKeywords.isReserved(lastSignificant.getText());
        default:
            return false;
        }
    }

    private boolean qualifierDot() {
        if (tokens.isEmpty()) {
            return false;
        }
        Type previous = tokens.get(tokens.size() - 1).getType();
        return previous == Type.WORD || previous == Type.QUOTED_IDENTIFIER;
    }

    private boolean startsNumber(int i) {
        if (i >= n) {
            return false;
        }
        char c = s.charAt(i);
        if (Character.isDigit(c)) {
            return true;
        }
        return c == '.' && i + 1 < n && Character.isDigit(s.charAt(i + 1));
    }

    /**
     * End of the numeric literal starting at i, or -1 when the characters form an identifier such as 1abc.
     */
    private int numberEnd(int i) {
        int j = i;
        if (s.charAt(j) == '0' && j + 2 < n && (s.charAt(j + 1) == 'x' || s.charAt(j + 1) == 'X')
                && isHexDigit(s.charAt(j + 2))) {
            j += 2;
            while (j < n && isHexDigit(s.charAt(j))) {
                j++;
            }
        } else if (s.charAt(j) == '0' && j + 2 < n && (s.charAt(j + 1) == 'b' || s.charAt(j + 1) == 'B')
                && (s.charAt(j + 2) == '0' || s.charAt(j + 2) == '1')) {
            j += 2;
            while (j < n && (s.charAt(j) == '0' || s.charAt(j) == '1')) {
                j++;
            }
        } else {
            while (j < n && Character.isDigit(s.charAt(j))) {
                j++;
            }
            if (j < n && s.charAt(j) == '.') {
                j++;
                while (j < n && Character.isDigit(s.charAt(j))) {
                    j++;
                }
            }
            if (j < n && (s.charAt(j) == 'e' || s.charAt(j) == 'E')) {
                int k = j + 1;
                if (k < n && (s.charAt(k) == '+' || s.charAt(k) == '-')) {
                    k++;
                }
                if (k < n && Character.isDigit(s.charAt(k))) {
                    while (k < n && Character.isDigit(s.charAt(k))) {
                        k++;
                    }
                    j = k;
                }
            }
        }
        if (j < n && isIdentifierPart(s.charAt(j))) {
            return -1;
        }
        return j;
    }

    private int wordEnd(int i) {
        int j = i;
        while (j < n && isIdentifierPart(s.charAt(j))) {
            j++;
        }
        return Math.max(j, i + 1);
    }

    private int quotedEnd(int start, char quote, boolean backslashEscapes) {
        int j = start + 1;
        while (j < n) {
            char c = s.charAt(j);
            if (backslashEscapes && c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote) {
                if (j + 1 < n && s.charAt(j + 1) == quote) {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return n;
    }

    private int variableEnd(int start) {
        int j = start + 1;
        if (j < n && s.charAt(j) == '@') {
            j++;
        }
        if (j < n && (s.charAt(j) == '\'' || s.charAt(j) == '"' || s.charAt(j) == '`')) {
            return quotedEnd(j, s.charAt(j), s.charAt(j) != '`');
        }
        while (j < n && (isIdentifierPart(s.charAt(j)) || s.charAt(j) == '.')) {
            j++;
        }
        return j;
    }

    private int lineEnd(int i) {
        int j = i;
        while (j < n && s.charAt(j) != '\n' && s.charAt(j) != '\r') {
            j++;
        }
        return j;
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
