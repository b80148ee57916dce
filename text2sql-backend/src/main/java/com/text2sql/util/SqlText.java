package com.text2sql.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical helpers over SQLite statement text.
 *
 * <p>Quoted strings and identifiers ({@code '...'}, {@code "..."}, {@code `...`}, {@code [...]})
 * and comments are skipped, so keywords and semicolons inside them are never seen.
 */
public final class SqlText {

    private static final Set<String> DML_KEYWORDS = Set.of("SELECT", "VALUES", "INSERT", "REPLACE", "UPDATE", "DELETE");

    private SqlText() {
    }

    enum TokenType {
        WORD,
        SEMICOLON,
        OPEN,
        CLOSE,
        OTHER
    }

    record Token(TokenType type, String text) {
    }

    /**
     * Uppercased first keyword of the text.
     *
     * @param sql statement text
     * @return the keyword, or an empty string when the text does not start with a word
     */
    public static String leadingKeyword(String sql) {
        List<Token> tokens = tokenize(sql);
        if (tokens.isEmpty() || tokens.get(0).type() != TokenType.WORD) {
            return "";
        }
        return tokens.get(0).text();
    }

    /**
     * Keyword of the statement body. Same as {@link #leadingKeyword} except for {@code WITH}, where
     * the common table expressions are skipped and the keyword of the statement that follows them
     * is returned.
     *
     * @param sql statement text
     * @return the keyword, or an empty string when none is found
     */
    public static String mainKeyword(String sql) {
        List<Token> tokens = tokenize(sql);
        if (tokens.isEmpty() || tokens.get(0).type() != TokenType.WORD) {
            return "";
        }
        if (!"WITH".equals(tokens.get(0).text())) {
            return tokens.get(0).text();
        }
        int depth = 0;
        for (int i = 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && t.type() == TokenType.SEMICOLON) {
                return "";
            } else if (depth == 0 && t.type() == TokenType.WORD && DML_KEYWORDS.contains(t.text())) {
                return t.text();
            }
        }
        return "";
    }

    /**
     * Whether anything other than whitespace, comments or empty statements follows the first
     * statement.
     *
     * @param sql statement text
     * @return {@code true} when the text holds more than one statement
     */
    public static boolean hasTrailingStatement(String sql) {
        List<Token> tokens = tokenize(sql);
        int terminator = firstTerminator(tokens);
        if (terminator < 0) {
            return false;
        }
        for (int i = terminator + 1; i < tokens.size(); i++) {
            if (tokens.get(i).type() != TokenType.SEMICOLON) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the semicolon ending the first statement, or -1 when it is unterminated.
     *
     * <p>Semicolons inside a trigger body ({@code BEGIN ... END}) do not end the statement.
     */
    private static int firstTerminator(List<Token> tokens) {
        boolean trigger = isCreateTrigger(tokens);
        int blockDepth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.WORD) {
                if ("CASE".equals(t.text()) || (trigger && "BEGIN".equals(t.text()))) {
                    blockDepth++;
                } else if ("END".equals(t.text()) && blockDepth > 0) {
                    blockDepth--;
                }
            } else if (t.type() == TokenType.SEMICOLON && blockDepth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isCreateTrigger(List<Token> tokens) {
        if (tokens.isEmpty() || !"CREATE".equals(tokens.get(0).text())) {
            return false;
        }
        // CREATE [TEMP | TEMPORARY] TRIGGER
        for (int i = 1; i < Math.min(3, tokens.size()); i++) {
            if ("TRIGGER".equals(tokens.get(i).text())) {
                return true;
            }
        }
        return false;
    }

    static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        if (sql == null) {
            return tokens;
        }
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '-' && next == '-') {
                int eol = sql.indexOf('\n', i + 2);
                i = eol < 0 ? n : eol + 1;
                continue;
            }
            if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                int j = i + 1;
                while (j < n) {
                    if (sql.charAt(j) == c) {
                        // doubled quote is an escaped quote
                        if (j + 1 < n && sql.charAt(j + 1) == c) {
                            j += 2;
                            continue;
                        }
                        break;
                    }
                    j++;
                }
                int end = Math.min(j + 1, n);
                tokens.add(new Token(TokenType.OTHER, sql.substring(i, end)));
                i = end;
                continue;
            }
            if (c == '[') {
                int close = sql.indexOf(']', i + 1);
                int end = close < 0 ? n : close + 1;
                tokens.add(new Token(TokenType.OTHER, sql.substring(i, end)));
                i = end;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                int j = i + 1;
                while (j < n && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_' || sql.charAt(j) == '$')) {
                    j++;
                }
                tokens.add(new Token(TokenType.WORD, sql.substring(i, j).toUpperCase(Locale.ROOT)));
                i = j;
                continue;
            }

            TokenType type = TokenType.OTHER;
            if (c == ';') {
                type = TokenType.SEMICOLON;
            } else if (c == '(') {
                type = TokenType.OPEN;
            } else if (c == ')') {
                type = TokenType.CLOSE;
            }
            tokens.add(new Token(type, String.valueOf(c)));
            i++;
        }
        return tokens;
    }
}
