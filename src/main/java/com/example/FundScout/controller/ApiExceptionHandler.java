package com.example.FundScout.controller;

import com.example.FundScout.service.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<Map<String, Object>> handleRetrieval(RetrievalException ex) {
        log.error("Retrieval failed, no shortlist produced", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "retrieval_unavailable", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details == null ? "" : details);
        return new ResponseEntity<>(body, status);
    }
}
