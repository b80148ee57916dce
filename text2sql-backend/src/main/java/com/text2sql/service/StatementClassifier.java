package com.text2sql.service;

import com.text2sql.util.SqlText;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether a statement produces rows or changes state, from its leading keyword.
 *
 * <p>Leading comments are skipped. A statement starting with {@code WITH} is classified by the
 * statement following its common table expressions, so {@code WITH ... INSERT} is a write.
 */
@Component
public class StatementClassifier {

    public enum StatementKind {
        READ,
        WRITE
    }

    private static final Set<String> READ_KEYWORDS = Set.of("SELECT", "VALUES", "EXPLAIN", "PRAGMA");

    /**
     * Classify a statement.
     *
     * @param sql statement text
     * @return {@link StatementKind#READ} for a read keyword, otherwise {@link StatementKind#WRITE}
     */
    public StatementKind classify(String sql) {
        return READ_KEYWORDS.contains(SqlText.mainKeyword(sql)) ? StatementKind.READ : StatementKind.WRITE;
    }
}
