package com.text2sql.model;

/**
 * Result of a plan-only dry run.
 *
 * @param valid whether the engine accepted the statement
 * @param diagnostic engine error text, empty when valid
 */
public record ValidationOutcome(boolean valid, String diagnostic) {

    public static ValidationOutcome ok() {
        return new ValidationOutcome(true, "");
    }

    public static ValidationOutcome invalid(String diagnostic) {
        return new ValidationOutcome(false, diagnostic != null ? diagnostic : "");
    }
}
