package com.braindump.orchestrator.api;

import com.braindump.orchestrator.api.dto.ErrorResponse;
import com.braindump.orchestrator.error.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link WorkflowException} kinds to HTTP statuses:
 * NOT_FOUND 404, PRECONDITION_VIOLATED 409, EXTERNAL_TOOL_FAILURE 502,
 * PRIMARY_PERSISTENCE_FAILURE 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ErrorResponse> handle(WorkflowException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND                   -> HttpStatus.NOT_FOUND;
            case PRECONDITION_VIOLATED       -> HttpStatus.CONFLICT;
            case EXTERNAL_TOOL_FAILURE       -> HttpStatus.BAD_GATEWAY;
            case PRIMARY_PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("{} ({}): {}", e.getCode(), e.getKind(), e.getMessage());
        } else {
            log.info("{} ({}): {}", e.getCode(), e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage(), e.getDetails()));
    }
}
