package com.text2sql.service;

import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Extracts candidate SQL from model output by removing Markdown code fences.
 *
 * <p>The transform is idempotent: once every {@code ```} run has been removed none can reappear,
 * so cleaning an already clean string only re-trims it.
 */
@Service
public class QuerySanitizer {

    private static final Pattern SQL_OPENING_FENCE = Pattern.compile("```sql", Pattern.CASE_INSENSITIVE);
    private static final String FENCE = "```";

    /**
     * Strip fence markers and surrounding whitespace.
     *
     * @param rawText model output, may be {@code null}
     * @return candidate SQL, never {@code null}
     */
    public String clean(String rawText) {
        if (rawText == null) {
            return "";
        }
        String s = SQL_OPENING_FENCE.matcher(rawText).replaceAll("");
        s = s.replace(FENCE, "");
        return s.strip();
    }
}
