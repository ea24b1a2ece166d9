package com.nevis.agentrun.controller;

import com.nevis.agentrun.exception.EntityNotFoundException;
import com.nevis.agentrun.exception.PublishException;
import com.nevis.agentrun.exception.SessionNotAuthenticatedException;
import com.nevis.agentrun.exception.StorageException;
import com.nevis.agentrun.exception.ValidationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String JOB_ID_PARAMETER = "jobId";

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({
        MethodArgumentNotValidException.class,
        HandlerMethodValidationException.class,
        ConstraintViolationException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error("Invalid request", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        // a malformed job id must look exactly like an unknown one
        if (JOB_ID_PARAMETER.equals(ex.getName())) {
            return handleNotFound(new EntityNotFoundException("Job", ex.getValue()));
        }
        return error(String.format("Parameter '%s' has an invalid value", ex.getName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SessionNotAuthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleNotAuthenticated(SessionNotAuthenticatedException ex) {
        return error(ex.getMessage(), HttpStatus.UNAUTHORIZED);
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<ErrorResponse> handlePublish(PublishException ex) {
        String message = ex.getMessage() + "; it will be queued automatically, poll /result/" + ex.getJobId()
            + " and do not resubmit";
        ErrorResponse body = new ErrorResponse(message, HttpStatus.SERVICE_UNAVAILABLE.value(),
            Instant.now().toEpochMilli(), ex.getJobId());
        return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return error("Service temporarily unavailable", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, status.value(), Instant.now().toEpochMilli(), null);
        return new ResponseEntity<>(body, status);
    }
}
