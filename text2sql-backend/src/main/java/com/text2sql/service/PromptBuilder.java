package com.text2sql.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds the single instruction message sent to the completion API.
 */
@Slf4j
@Service
public class PromptBuilder {

    static final String TRUNCATION_MARKER = "... (schema truncated)\n";

    private final int maxSchemaChars;

    /**
     * Create a prompt builder.
     *
     * @param maxSchemaChars schema text cap; {@code 0} or less disables it
     */
    public PromptBuilder(@Value("${text2sql.prompt.max-schema-chars:100000}") int maxSchemaChars) {
        this.maxSchemaChars = maxSchemaChars;
    }

    /**
     * Combine schema text and the user's request into the generation prompt.
     *
     * @param schemaText serialized schema
     * @param userRequest natural-language request, embedded verbatim
     * @return prompt text
     */
    public String build(String schemaText, String userRequest) {
        String schema = capSchema(schemaText != null ? schemaText : "");
        return "\nYou are an SQL assistant. Below is the schema of the SQLite database:\n\n"
                + schema
                + "\nConvert the following natural language request into a valid SQL query that can be executed "
                + "on the above database. Do not include any Markdown formatting or code blocks in your response. "
                + "Provide only the plain SQL query.\n\n"
                + "User request: " + (userRequest != null ? userRequest : "") + "\n\n"
                + "SQL Query:\n";
    }

    /**
     * Cut the schema at the last complete table block that fits the cap.
     */
    private String capSchema(String schemaText) {
        if (maxSchemaChars <= 0 || schemaText.length() <= maxSchemaChars) {
            return schemaText;
        }
        int cut = schemaText.lastIndexOf("\n\n", maxSchemaChars - 2);
        String kept = cut >= 0 ? schemaText.substring(0, cut + 2) : "";
        log.warn("Schema text exceeds prompt cap, truncating (schema_chars={}, max_schema_chars={}, kept_chars={})",
                schemaText.length(), maxSchemaChars, kept.length());
        return kept + TRUNCATION_MARKER;
    }
}
