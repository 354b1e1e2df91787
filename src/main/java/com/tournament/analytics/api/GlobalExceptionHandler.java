package com.tournament.analytics.api;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.exception.UpstreamFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps the analytics error taxonomy onto HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("required", ex.getRequired());
        details.put("actual", ex.getActual());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(), details);
    }

    @ExceptionHandler(AnalyticsValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(AnalyticsValidationException ex) {
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = ((FieldError) error).getField();
            errors.put(field, error.getDefaultMessage());
        });
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null);
    }

    @ExceptionHandler(ReportDeliveryException.class)
    public ResponseEntity<ErrorResponse> handleReportDelivery(ReportDeliveryException ex) {
        log.error("Report delivery failed", ex);
        return build(HttpStatus.BAD_GATEWAY, "Report Delivery Failed", ex.getMessage(), null);
    }

    @ExceptionHandler({UpstreamFailureException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleUpstream(RuntimeException ex) {
        log.error("Upstream failure while serving analytics request", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Upstream Failure", ex.getMessage(), null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
