package com.catdb.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight lexical helpers over raw SQL text.
 *
 * <p>Splitting is a plain scan on {@code ;}. Semicolons inside string literals or dollar-quoted
 * bodies are not respected, so such scripts have to be run one statement at a time.
 */
public final class StatementSplitter {

    private static final Pattern COMMENT_DIRECTIVE = Pattern.compile(
            "\\A\\s*--\\s*connection\\s*:\\s*([^\\s;]+)[^\\n]*(?:\\n|\\z)",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern USE_DIRECTIVE = Pattern.compile(
            "\\A\\s*USE\\s+CONNECTION\\s+([^\\s;]+)[ \\t]*;?[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.CASE_INSENSITIVE
    );

    private StatementSplitter() {
    }

    /**
     * A connection override found at the head of a SQL text.
     *
     * @param connectionName overriding connection name, or null when the text carries no directive
     * @param sql SQL text with the directive removed
     */
    public record ConnectionDirective(String connectionName, String sql) {

        /**
         * Whether the text named a connection.
         *
         * @return true if an override is present
         */
        public boolean hasOverride() {
            return connectionName != null;
        }
    }

    /**
     * Split SQL text on {@code ;}, trimming and dropping empty segments.
     *
     * @param sqlText sql text
     * @return statements in textual order
     */
    public static List<String> split(String sqlText) {
        List<String> statements = new ArrayList<>();
        if (sqlText == null || sqlText.isBlank()) {
            return statements;
        }
        for (String part : sqlText.split(";")) {
            String s = part.trim();
            if (!s.isEmpty()) {
                statements.add(s);
            }
        }
        return statements;
    }

    /**
     * Strip one leading {@code -- connection: NAME} or {@code USE CONNECTION NAME;} line.
     *
     * @param sqlText sql text
     * @return directive and the remaining text
     */
    public static ConnectionDirective extractConnectionDirective(String sqlText) {
        if (sqlText == null) {
            return new ConnectionDirective(null, "");
        }
        Matcher comment = COMMENT_DIRECTIVE.matcher(sqlText);
        if (comment.find()) {
            return new ConnectionDirective(comment.group(1), sqlText.substring(comment.end()));
        }
        Matcher use = USE_DIRECTIVE.matcher(sqlText);
        if (use.find()) {
            return new ConnectionDirective(use.group(1), sqlText.substring(use.end()));
        }
        return new ConnectionDirective(null, sqlText);
    }

    /**
     * Find the first table named after a top-level {@code FROM} of a read statement.
     * Joins, subqueries and aliases are not resolved.
     *
     * @param selectSql select statement
     * @return table name, schema-qualified when written so, unquoted
     */
    public static Optional<String> extractPrimaryTable(String selectSql) {
        if (selectSql == null || selectSql.isBlank()) {
            return Optional.empty();
        }
        String sql = selectSql;
        int depth = 0;
        boolean firstWord = true;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                if (firstWord) {
                    return Optional.empty();
                }
                i = skipQuoted(sql, i, c);
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol == -1 ? n : eol + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end == -1 ? n : end + 2;
            } else if (c == '(') {
                depth++;
                i++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                i++;
            } else if (c == ';') {
                break;
            } else if (isWordChar(c)) {
                int start = i;
                while (i < n && isWordChar(sql.charAt(i))) {
                    i++;
                }
                String word = sql.substring(start, i).toUpperCase(Locale.ROOT);
                if (firstWord) {
                    if (!"SELECT".equals(word) && !"WITH".equals(word)) {
                        return Optional.empty();
                    }
                    firstWord = false;
                } else if (depth == 0 && "FROM".equals(word)) {
                    return readQualifiedName(sql, i);
                }
            } else {
                i++;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> readQualifiedName(String sql, int from) {
        int n = sql.length();
        int i = skipWhitespace(sql, from);
        List<String> parts = new ArrayList<>();
        while (i < n) {
            char c = sql.charAt(i);
            String part;
            if (c == '"' || c == '`' || c == '[') {
                char close = c == '[' ? ']' : c;
                int end = sql.indexOf(close, i + 1);
                if (end == -1) {
                    return Optional.empty();
                }
                part = sql.substring(i + 1, end);
                i = end + 1;
            } else if (isWordChar(c)) {
                int start = i;
                while (i < n && isWordChar(sql.charAt(i))) {
                    i++;
                }
                part = sql.substring(start, i);
            } else {
                break;
            }
            if (part.isEmpty()) {
                return Optional.empty();
            }
            parts.add(part);
            if (i < n && sql.charAt(i) == '.') {
                i++;
                continue;
            }
            break;
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(".", parts));
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static int skipWhitespace(String sql, int from) {
        int i = from;
        while (i < sql.length() && Character.isWhitespace(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
