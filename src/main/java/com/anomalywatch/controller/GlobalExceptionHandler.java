package com.anomalywatch.controller;

import com.anomalywatch.exception.InvestigationNotFoundException;
import com.anomalywatch.exception.InvestigationStorageException;
import com.anomalywatch.exception.InvestigationValidationException;
import com.anomalywatch.exception.UnknownInvestigatorTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvestigationValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvestigationValidation(InvestigationValidationException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_INVESTIGATOR")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(UnknownInvestigatorTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnknownType(UnknownInvestigatorTypeException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("UNKNOWN_INVESTIGATOR_TYPE")
                .message(ex.getMessage())
                .details(ex.getTypeCode())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message("Invalid value for parameter " + ex.getName())
                .details(String.valueOf(ex.getValue()))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvestigationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(InvestigationNotFoundException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("NOT_FOUND")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler({InvestigationStorageException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleStorage(RuntimeException ex) {
        log.error("Storage error occurred", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code("STORAGE_UNAVAILABLE")
                .message("The investigation store is currently unavailable")
                .details(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
