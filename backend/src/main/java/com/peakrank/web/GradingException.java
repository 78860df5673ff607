package com.peakrank.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

@Getter
public class GradingException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final String field;

    public GradingException(HttpStatus status, String code, String message, String field) {
        super(message);
        this.status = status;
        this.code = code;
        this.field = field;
    }

    public static GradingException validation(String field, String detail) {
        return new GradingException(HttpStatus.BAD_REQUEST, "invalid_" + toSnakeCase(field), detail, field);
    }

    public static GradingException notFound(String entity, UUID id) {
        return new GradingException(
                HttpStatus.NOT_FOUND,
                toSnakeCase(entity) + "_not_found",
                entity + " not found: " + id,
                null
        );
    }

    public static GradingException conflict(String code, String detail) {
        return new GradingException(HttpStatus.CONFLICT, code, detail, null);
    }

    public static GradingException forbidden(String detail) {
        return new GradingException(HttpStatus.FORBIDDEN, "forbidden", detail, null);
    }

    public static GradingException reversalFailed(String detail) {
        return new GradingException(HttpStatus.INTERNAL_SERVER_ERROR, "progression_reversal_failed", detail, null);
    }

    private static String toSnakeCase(String value) {
        return value.replaceAll("([a-z0-9])([A-Z])", "$1_$2").replace(' ', '_').toLowerCase();
    }
}
