package com.text2sql.controller;

import com.text2sql.api.AskRequest;
import com.text2sql.api.AskResponse;
import com.text2sql.api.ExecuteSqlResponse;
import com.text2sql.api.SchemaResponse;
import com.text2sql.api.SqlRequest;
import com.text2sql.api.ValidateResponse;
import com.text2sql.model.ExecutionResult;
import com.text2sql.model.SchemaDescriptor;
import com.text2sql.model.Text2SqlAnswer;
import com.text2sql.model.ValidationOutcome;
import com.text2sql.service.SchemaIntrospector;
import com.text2sql.service.Text2SqlService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class Text2SqlController {

    private static final Logger log = LoggerFactory.getLogger(Text2SqlController.class);

    private final Text2SqlService text2SqlService;
    private final SchemaIntrospector schemaIntrospector;

    public Text2SqlController(Text2SqlService text2SqlService, SchemaIntrospector schemaIntrospector) {
        this.text2SqlService = text2SqlService;
        this.schemaIntrospector = schemaIntrospector;
    }

    /**
     * Translate a natural-language request into SQL and execute it.
     *
     * POST /v1/ask
     *
     * Connection and completion API failures are mapped by the global exception handler.
     *
     * @param request prompt
     * @return generated SQL and execution result
     */
    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        log.info("Ask requested: trace_id={}", MDC.get("trace_id"));
        Text2SqlAnswer answer = text2SqlService.ask(request.getPrompt());
        return ResponseEntity.ok(AskResponse.builder()
                .prompt(answer.getRequest())
                .rawResponse(answer.getQuery().getRawText())
                .sql(answer.getQuery().getSql())
                .result(answer.getResult())
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Return the live schema.
     *
     * GET /v1/schema
     */
    @GetMapping("/schema")
    public ResponseEntity<SchemaResponse> schema() {
        SchemaDescriptor schema = text2SqlService.describeSchema();
        return ResponseEntity.ok(SchemaResponse.builder()
                .tables(schema.getTables())
                .schemaText(schemaIntrospector.serialize(schema))
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Dry-run SQL without executing it.
     *
     * POST /v1/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody SqlRequest request) {
        ValidationOutcome outcome = text2SqlService.validate(request.getSql());
        return ResponseEntity.ok(ValidateResponse.builder()
                .sql(request.getSql())
                .valid(outcome.valid())
                .diagnostic(outcome.diagnostic())
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Validate and execute user-supplied SQL, e.g. an edited version of a generated query.
     *
     * POST /v1/execute_sql
     */
    @PostMapping("/execute_sql")
    public ResponseEntity<ExecuteSqlResponse> execute(@Valid @RequestBody SqlRequest request) {
        ExecutionResult result = text2SqlService.execute(request.getSql());
        return ResponseEntity.ok(ExecuteSqlResponse.builder()
                .sql(request.getSql())
                .result(result)
                .traceId(MDC.get("trace_id"))
                .build());
    }
}
