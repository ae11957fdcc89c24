package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.error.ConflictException;
import com.delta.opportunities.pipeline.error.IllegalStateTransitionException;
import com.delta.opportunities.pipeline.error.NotFoundException;
import com.delta.opportunities.pipeline.error.TransientException;
import com.delta.opportunities.pipeline.error.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class PipelineExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "validation_failed");
        body.put("message", ex.getMessage());
        if (!ex.getViolations().isEmpty()) {
            body.put("violations", ex.getViolations());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "malformed_request", "message", "Request body could not be read"));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalTransition(IllegalStateTransitionException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of(
                "error", "illegal_state_transition",
                "message", ex.getMessage(),
                "state", ex.getCurrentState().name()
            ));
    }

    @ExceptionHandler({ConflictException.class, TransientException.class})
    public ResponseEntity<Map<String, Object>> handleBusy(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "try_again", "message", ex.getMessage()));
    }
}
