package com.text2sql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.text2sql.model.SchemaDescriptor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Live schema in structured form and in the text form embedded in prompts.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SchemaResponse {
    private List<SchemaDescriptor.TableDescriptor> tables;
    private String schemaText;
    private String traceId;
}
