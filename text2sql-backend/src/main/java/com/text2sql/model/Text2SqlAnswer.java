package com.text2sql.model;

import lombok.Builder;
import lombok.Data;

/**
 * The two terminal outputs of one request (generated SQL and its execution result) plus the
 * intermediate values that produced them.
 */
@Data
@Builder
public class Text2SqlAnswer {
    private String request;
    private GeneratedQuery query;
    private ExecutionResult result;
}
