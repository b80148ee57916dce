package com.text2sql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for natural-language to SQL translation.
 *
 * JSON fields (snake_case):
 * - prompt: natural-language description of the data or change wanted
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskRequest {

    /**
     * Example: "list all tracks longer than five minutes"
     */
    @NotBlank(message = "Natural language prompt is required")
    private String prompt;
}
