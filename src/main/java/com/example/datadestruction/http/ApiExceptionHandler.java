package com.example.datadestruction.http;

import com.example.datadestruction.service.DataDestructionException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders every failure as {@code {"error": message}}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DataDestructionException.class)
    public ResponseEntity<Map<String, Object>> domainError(DataDestructionException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_REQUEST, PROTOCOL_NOT_SUPPORTED -> status = HttpStatus.BAD_REQUEST;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        return ResponseEntity.status(status).body(error(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        log.debug("Rejecting unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(error(DataDestructionException.malformedBody().getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        // Framework errors (unknown route, wrong method or media type) keep their own status.
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity.status(status).body(error(ex.getMessage()));
        }
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(ex.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        return Map.of("error", message != null ? message : "INTERNAL_ERROR");
    }
}
