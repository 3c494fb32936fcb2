package org.tfregistry.webserver.exception;

import org.tfregistry.webserver.generic.dto.message.ErrorMessageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.security.GeneralSecurityException;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ScmIntegrationException.class)
    public ResponseEntity<ErrorMessageResponse> handleScmIntegration(ScmIntegrationException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("SCM integration failure [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.debug("SCM request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ErrorMessageResponse(ex.getMessage(), ex.getErrorCode(), ex.getStatus()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorMessageResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(message, "INVALID_REQUEST", HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorMessageResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse("request body is missing or malformed", "INVALID_REQUEST",
                        HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorMessageResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse("missing " + ex.getParameterName(), "INVALID_REQUEST",
                        HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorMessageResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse("invalid " + ex.getName(), "INVALID_REQUEST", HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorMessageResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getMessage(), "INVALID_REQUEST", HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(GeneralSecurityException.class)
    public ResponseEntity<ErrorMessageResponse> handleGeneralSecurityException(GeneralSecurityException ex) {
        log.error("General security exception: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorMessageResponse("A security error occurred. Please try again later.",
                        "ENCRYPTION_FAILURE", HttpStatus.INTERNAL_SERVER_ERROR));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorMessageResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorMessageResponse("An unexpected error occurred. Please try again later.",
                        "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR));
    }
}
