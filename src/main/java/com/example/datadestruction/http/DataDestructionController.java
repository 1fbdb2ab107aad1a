package com.example.datadestruction.http;

import com.example.datadestruction.requests.DestructionRequestValidator;
import com.example.datadestruction.requests.DestructionServiceRequest;
import com.example.datadestruction.service.DataDestructionService;
import com.example.datadestruction.service.DeletionOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for on-demand data destruction. Only protocol names known to the target
 * registry can select a table; raw dataset or table names are never accepted from callers.
 * Failures are rendered by {@link ApiExceptionHandler}.
 */
@RestController
public class DataDestructionController {

    private final DestructionRequestValidator validator;
    private final DataDestructionService destructionService;

    public DataDestructionController(DestructionRequestValidator validator,
                                     DataDestructionService destructionService) {
        this.validator = validator;
        this.destructionService = destructionService;
    }

    @PostMapping("/run_bq_data_destruction")
    public ResponseEntity<DestructionResponse> runDataDestruction(
            @RequestBody(required = false) JsonNode body
    ) {
        DestructionServiceRequest request = validator.validate(body, MDC.get(RequestIdFilter.MDC_KEY));
        DeletionOutcome outcome = destructionService.destroy(request);
        return ResponseEntity.ok(DestructionResponse.from(outcome));
    }
}
