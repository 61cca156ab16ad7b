package com.eon.credit.config;

import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditException;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.UpstreamException;
import com.eon.credit.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CreditException.class)
    public ResponseEntity<Map<String, Object>> handleCredit(CreditException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.warn("{} {} failed upstream: {}", req.getMethod(), req.getRequestURI(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", ex.getCode().name());
        body.put("message", ex.getMessage());
        body.put("path", req.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return Map.of(
                "timestamp", Instant.now(),
                "status", 400,
                "error", "Bad Request",
                "message", message,
                "path", req.getRequestURI()
        );
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex, HttpServletRequest req) {
        return Map.of(
                "timestamp", Instant.now(),
                "status", 400,
                "error", "Bad Request",
                "message", String.valueOf(ex.getMessage()),
                "path", req.getRequestURI()
        );
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error on {}", req.getRequestURI(), ex);
        return Map.of(
                "timestamp", Instant.now(),
                "status", 500,
                "error", "Database Error",
                "message", String.valueOf(ex.getMostSpecificCause().getMessage()),
                "path", req.getRequestURI()
        );
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return Map.of(
                "timestamp", Instant.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", String.valueOf(ex.getMessage()),
                "path", req.getRequestURI()
        );
    }

    static HttpStatus statusOf(CreditException ex) {
        if (ex instanceof AuthorizationException) return HttpStatus.FORBIDDEN;
        if (ex instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof StateConflictException) return HttpStatus.CONFLICT;
        if (ex instanceof ResourceException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof UpstreamException) return HttpStatus.BAD_GATEWAY;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
