package com.nevis.codeindex.controller;

import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.exception.InvalidRepositoryReferenceException;
import com.nevis.codeindex.exception.TaskConflictException;
import com.nevis.codeindex.exception.WrongQueryException;
import com.nevis.codeindex.infra.SecretScrubber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TaskConflictException.class)
    public ResponseEntity<ErrorResponse> handleTaskConflict(TaskConflictException ex) {
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            "TASK_CONFLICT",
            HttpStatus.CONFLICT.value(),
            Instant.now().toEpochMilli(),
            ex.getExistingTaskId()
        );
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        return build("Duplicate entity", "DUPLICATE_ENTITY", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return build(ex.getMessage(), "NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidRepositoryReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidRepositoryReferenceException ex) {
        return build(SecretScrubber.scrub(ex.getMessage()), "INVALID_REPOSITORY_REFERENCE", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return build(message, "MISSING_PARAMETER", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return build(message, "INVALID_PARAMETER", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(field -> field.getField() + " " + field.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return build(message.isEmpty() ? "Invalid request" : message, "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build("Malformed request body", "MALFORMED_REQUEST", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({WrongQueryException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleWrongQuery(RuntimeException ex) {
        return build(SecretScrubber.scrub(ex.getMessage()), "INVALID_QUERY", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return build("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> build(String message, String errorCode, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(message, errorCode, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(error, status);
    }
}
