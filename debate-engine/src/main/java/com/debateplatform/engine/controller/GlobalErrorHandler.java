package com.debateplatform.engine.controller;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.engine.escalation.EscalationNotFoundException;
import com.debateplatform.engine.scheduler.BatchCycleInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps domain exceptions to JSON error bodies with a meaningful status. */
@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, DebateConfigurationException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(EscalationNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(EscalationNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler({IllegalStateException.class, BatchCycleInProgressException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException ex) {
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> framework(ResponseStatusException ex) {
        return respond(ex.getStatusCode(), "request_rejected", ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "unexpected server error");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatusCode status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
