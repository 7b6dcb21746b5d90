package com.gnovoa.publeague.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({DivisionNotFoundException.class, TemplateNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(SchedulingException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> handleScheduling(SchedulingException ex) {
        log.warn("Scheduling failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach((FieldError error) ->
                errors.put(error.getField(), error.getDefaultMessage()));
        log.warn("Request validation failed: {}", errors);
        return ResponseEntity.badRequest().body(
                new ErrorResponse("VALIDATION_ERROR", "Request has invalid fields", errors, LocalDateTime.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(
                new ErrorResponse("BAD_ARGUMENT", ex.getMessage(), null, LocalDateTime.now()));
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {
        static ErrorResponse of(SchedulingException ex) {
            return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, LocalDateTime.now());
        }
    }
}
