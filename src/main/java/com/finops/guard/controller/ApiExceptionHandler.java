package com.finops.guard.controller;

import com.finops.guard.exception.DataParseException;
import com.finops.guard.exception.ReportDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DataParseException.class)
    public ResponseEntity<ErrorResponse> handleDataParse(DataParseException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("dimension", ex.getDimension());
        details.put("day", ex.getRawValue());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "DATA_PARSE_ERROR", ex.getMessage(), details);
    }

    @ExceptionHandler(ReportDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleDelivery(ReportDeliveryException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("report", ex.getReport());
        return build(HttpStatus.BAD_GATEWAY, "DELIVERY_FAILED", ex.getMessage(), details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unhandled API error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details));
    }
}
