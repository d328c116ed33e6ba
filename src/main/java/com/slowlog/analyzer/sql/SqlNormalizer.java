package com.slowlog.analyzer.sql;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw SQL into its template so that structurally identical statements group together.
 * <p>
 * Comments are removed, whitespace is collapsed, string and numeric literals become {@code ?}, and lists made of
 * placeholders only, including multi-row VALUES groups, collapse to a single {@code (?)}. Identifier and keyword
 * case is preserved. Normalizing an already normalized text returns it unchanged.
 * <p>
 * Stateless and safe for concurrent use.
 */
public final class SqlNormalizer {

    private static final Pattern PLACEHOLDER_LIST = Pattern.compile("\\(\\s*\\?(?:\\s*,\\s*\\?)*\\s*\\)");
    private static final Pattern REPEATED_ROWS = Pattern.compile("\\(\\?\\)(?:\\s*,\\s*\\(\\?\\))+");

    private SqlNormalizer() {
    }

    public static SqlTemplate normalize(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return SqlTemplate.EMPTY;
        }
        List<SqlToken> tokens = SqlLexer.tokenize(sql);
        String text = collapseLists(render(tokens));
        while (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        if (text.isEmpty()) {
            return SqlTemplate.EMPTY;
        }
        return new SqlTemplate(text, classify(tokens), TableExtractor.extract(tokens));
    }

    /**
     * Statement type from the first keyword, skipping opening parentheses.
     */
    public static StatementType classify(List<SqlToken> tokens) {
        for (SqlToken token : tokens) {
            if (!token.isSignificant() || token.isPunctuation('(')) {
                continue;
            }
            if (token.getType() == SqlToken.Type.WORD) {
                return StatementType.findByKeyword(token.getText());
            }
            return StatementType.OTHER;
        }
        return StatementType.OTHER;
    }

    private static String render(List<SqlToken> tokens) {
        StringBuilder sb = new StringBuilder();
        boolean pendingSpace = false;
        for (SqlToken token : tokens) {
            if (!token.isSignificant()) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            String text = token.isLiteral() ? "?" : token.getText();
            // "--" followed by a space or the end would read back as a line comment
            if (pendingSpace || (text.startsWith("-") && sb.length() > 0 && sb.charAt(sb.length() - 1) == '-')) {
                sb.append(' ');
            }
            pendingSpace = false;
            sb.append(text);
        }
        return sb.toString();
    }

    private static String collapseLists(String text) {
        String previous;
        do {
            previous = text;
            text = PLACEHOLDER_LIST.matcher(text).replaceAll("(?)");
            text = REPEATED_ROWS.matcher(text).replaceAll("(?)");
        } while (!text.equals(previous));
        return text;
    }
}
