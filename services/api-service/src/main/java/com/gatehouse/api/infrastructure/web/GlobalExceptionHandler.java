package com.gatehouse.api.infrastructure.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatehouse.api.error.ApiError;
import com.gatehouse.api.error.ApiException;
import com.gatehouse.api.error.ErrorType;
import com.gatehouse.observability.SensitiveDataRedactor;
import com.gatehouse.security.AccessDenial;
import com.gatehouse.security.DenialReason;
import com.gatehouse.security.StorageException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to {@code {"detail": [error]}} responses.
 *
 * <p>Client faults (4xx) are logged at WARN, server faults at ERROR. Structured error inputs are
 * converted to plain JSON values and pass through {@link SensitiveDataRedactor} before they are
 * written. A request without a bearer token
 * gets the short form {@code {"detail": "Not authenticated"}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String DETAIL = "detail";

    private final SensitiveDataRedactor redactor;
    private final ObjectMapper objectMapper;

    public GlobalExceptionHandler(SensitiveDataRedactor redactor, ObjectMapper objectMapper) {
        this.redactor = redactor;
        this.objectMapper = objectMapper;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApi(ApiException ex) {
        if (ex.status().is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Request rejected: {} {}", ex.status().value(), ex.getMessage());
        }
        return respond(ex.status(), ex.headers(), ex.error());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Object> handleAccessDenied(AccessDeniedException ex) {
        AccessDenial denial = ex.denial();
        HttpHeaders headers = new HttpHeaders();
        if (denial.challenge() != null) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, denial.challenge());
        }

        if (denial.reason() == DenialReason.UNAUTHENTICATED) {
            log.warn("Access denied: {}", denial.reason().tag());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .headers(headers)
                    .body(Map.of(DETAIL, denial.message()));
        }
        if (denial.reason().serverFault()) {
            log.error("Access check failed: {}", denial.reason().tag());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .headers(headers)
                    .body(body(ApiError.of(ErrorType.DATABASE, denial.message())));
        }
        log.warn("Access denied: {}", denial.reason().tag());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .headers(headers)
                .body(body(ApiError.of(ErrorType.UNAUTHORIZED, denial.message())));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("Storage failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, HttpHeaders.EMPTY,
                ApiError.of(ErrorType.DATABASE, "storage unavailable"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Validation failed: {}", fields.keySet());
        ApiError error = new ApiError(ErrorType.INVALID_REQUEST, "invalid request",
                ex.getBindingResult().getTarget(), List.of("body"), fields);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, HttpHeaders.EMPTY, error);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleParameterValidation(HandlerMethodValidationException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Object> input = new LinkedHashMap<>();
        for (ParameterValidationResult result : ex.getAllValidationResults()) {
            String name = String.valueOf(result.getMethodParameter().getParameterName());
            input.put(name, result.getArgument());
            result.getResolvableErrors().stream()
                    .findFirst()
                    .ifPresent(violation -> fields.put(name, violation.getDefaultMessage()));
        }
        log.warn("Parameter validation failed: {}", fields.keySet());
        ApiError error = new ApiError(ErrorType.INVALID_REQUEST, "invalid query", input, List.of("query"), fields);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, HttpHeaders.EMPTY, error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        ApiError error = new ApiError(ErrorType.INVALID_REQUEST, "field required", null,
                List.of("body", ex.getParameterName()), null);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, HttpHeaders.EMPTY, error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
        ApiError error = new ApiError(ErrorType.INVALID_REQUEST, "invalid value", String.valueOf(ex.getValue()),
                List.of(ex.getName()), null);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, HttpHeaders.EMPTY, error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ApiError error = new ApiError(ErrorType.INVALID_REQUEST, "request body could not be read", null,
                List.of("body"), null);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, HttpHeaders.EMPTY, error);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoRoute(NoResourceFoundException ex) {
        log.warn("No route: {}", ex.getResourcePath());
        return respond(HttpStatus.NOT_FOUND, HttpHeaders.EMPTY,
                ApiError.of(ErrorType.NOT_FOUND, "not found", "/" + ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not allowed: {}", ex.getMethod());
        return respond(HttpStatus.METHOD_NOT_ALLOWED, HttpHeaders.EMPTY,
                ApiError.of(ErrorType.INVALID_REQUEST, "method not allowed", ex.getMethod()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, HttpHeaders.EMPTY,
                ApiError.of(null, "an unexpected error occurred"));
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, HttpHeaders headers, ApiError error) {
        return ResponseEntity.status(status).headers(headers).body(body(error));
    }

    private Map<String, Object> body(ApiError error) {
        return Map.of(DETAIL, List.of(redactInput(error)));
    }

    private ApiError redactInput(ApiError error) {
        Object input = error.input();
        if (input == null || BeanUtils.isSimpleValueType(input.getClass())) {
            return error;
        }
        return error.withInput(redactor.redactValue(toJsonValue(input)));
    }

    /** Records and beans become maps and lists so their free-form fields can be redacted too. */
    private Object toJsonValue(Object input) {
        try {
            return objectMapper.treeToValue(objectMapper.valueToTree(input), Object.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping error input of type {} that cannot be serialized", input.getClass().getName(), e);
            return null;
        }
    }
}
