package com.catdb.web;

import com.catdb.api.ErrorResponse;
import com.catdb.execution.ExecutionNotFoundException;
import com.catdb.execution.SqlExecutionException;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.ConnectionValidationException;
import com.catdb.registry.DatabaseFileNotFoundException;
import com.catdb.service.AiClientException;
import com.catdb.util.DescriptorParseException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.sql.SQLException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(DescriptorParseException.class)
    public ResponseEntity<ErrorResponse> handleDescriptorParseException(DescriptorParseException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_DESCRIPTOR", ex.getMessage(), null);
    }

    @ExceptionHandler(ConnectionValidationException.class)
    public ResponseEntity<ErrorResponse> handleConnectionValidationException(ConnectionValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(DatabaseFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseFileNotFoundException(DatabaseFileNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), ex.getPath());
    }

    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleExecutionNotFoundException(ExecutionNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), ex.getExecutionId());
    }

    @ExceptionHandler(ConnectionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleConnectionUnavailableException(ConnectionUnavailableException ex) {
        log.warn("Connection unavailable (name={}, error={})", ex.getConnectionName(), ex.getMessage());
        String cause = ex.getCause() != null ? ex.getCause().getMessage() : null;
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CONNECTION_UNAVAILABLE", ex.getMessage(), cause);
    }

    @ExceptionHandler(SqlExecutionException.class)
    public ResponseEntity<ErrorResponse> handleSqlExecutionException(SqlExecutionException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "STATEMENT_FAILED", ex.getMessage(), ex.getStatement());
    }

    @ExceptionHandler(AiClientException.class)
    public ResponseEntity<ErrorResponse> handleAiClientException(AiClientException ex) {
        return respond(HttpStatus.BAD_GATEWAY, "AI_REQUEST_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<ErrorResponse> handleSQLException(SQLException ex) {
        log.error("Database error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR",
                "A database error occurred: " + ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
