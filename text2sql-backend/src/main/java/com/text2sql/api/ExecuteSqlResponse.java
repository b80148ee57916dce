package com.text2sql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.text2sql.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecuteSqlResponse {
    private String sql;
    private ExecutionResult result;
    private String traceId;
}
