package com.text2sql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.text2sql.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for natural-language to SQL translation.
 *
 * JSON fields (snake_case):
 * - prompt: the request as received
 * - raw_response: model output before fence stripping
 * - sql: the SQL that was validated and, if valid, executed
 * - result: rows, status or error
 * - trace_id: request correlation ID
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskResponse {
    private String prompt;
    private String rawResponse;
    private String sql;
    private ExecutionResult result;
    private String traceId;
}
