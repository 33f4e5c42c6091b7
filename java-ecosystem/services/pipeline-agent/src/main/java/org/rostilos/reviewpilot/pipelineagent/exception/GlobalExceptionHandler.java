package org.rostilos.reviewpilot.pipelineagent.exception;

import org.rostilos.reviewpilot.analysisengine.exception.ModelConfigurationException;
import org.rostilos.reviewpilot.core.exception.ReviewNotFoundException;
import org.rostilos.reviewpilot.core.exception.ReviewStateException;
import org.rostilos.reviewpilot.pipelineagent.dto.response.ErrorMessageResponse;
import org.rostilos.reviewpilot.vcsclient.VcsClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ReviewNotFoundException.class, RepositoryNotFoundException.class})
    public ResponseEntity<ErrorMessageResponse> handleNotFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({ReviewStateException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorMessageResponse> handleBadRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorMessageResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorMessageResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler({ModelConfigurationException.class, VcsClientException.class})
    public ResponseEntity<ErrorMessageResponse> handleConfiguration(RuntimeException ex) {
        log.warn("Configuration error: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorMessageResponse> handleUpstream(IOException ex) {
        log.warn("GitLab request failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorMessageResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.");
    }

    private static ResponseEntity<ErrorMessageResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorMessageResponse(message, status));
    }
}
