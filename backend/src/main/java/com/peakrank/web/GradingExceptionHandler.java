package com.peakrank.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GradingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GradingExceptionHandler.class);

    @ExceptionHandler(GradingException.class)
    public ResponseEntity<GradingErrorResponse> handle(GradingException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Grading engine failure [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new GradingErrorResponse(ex.getCode(), ex.getMessage(), ex.getField()));
    }

    public record GradingErrorResponse(
            String code,
            String message,
            String field
    ) {
    }
}
