package com.poolbot.coordinator.web;

import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class PortfolioExceptionHandler {

    @ExceptionHandler(PortfolioException.class)
    public ResponseEntity<Map<String, Object>> portfolio(PortfolioException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", ex.code().name().toLowerCase());
        body.put("message", ex.getMessage());
        if (ex.botId() != null) {
            body.put("botId", ex.botId());
        }
        body.put("ts", ex.timestamp().toString());
        return ResponseEntity.status(statusFor(ex.code())).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields
        ));
    }

    static HttpStatus statusFor(PortfolioErrorCode code) {
        return switch (code) {
            case BOT_NOT_REGISTERED -> HttpStatus.NOT_FOUND;
            case BOT_ALREADY_REGISTERED, PORTFOLIO_LOCKED, INSUFFICIENT_BALANCE, INSUFFICIENT_MARGIN,
                    EXCEEDS_ALLOCATION, EXCEEDS_RISK_LIMIT -> HttpStatus.CONFLICT;
            case STATE_CORRUPTED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case INVALID_LEVERAGE, CONFIGURATION_INVALID -> HttpStatus.BAD_REQUEST;
        };
    }
}
