package com.adaptiverisk.exception;

import com.adaptiverisk.api.dto.response.ApiErrorResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps engine exceptions and request-binding failures to {@link ApiErrorResponse}.
 *
 * <p>Trade rejections never reach this class; they are returned as decisions. What lands
 * here is bad input, unknown ids, refused risk parameter updates and genuine faults.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Bean Validation on request bodies; details are keyed by Java field name. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), String.valueOf(error.getDefaultMessage())));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Request validation failed", details, request);
    }

    /**
     * Unparseable JSON, or a value Jackson could not bind (unknown trade side, bad date).
     * When Jackson reports where it failed, the JSON path goes into {@code details.field}.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        if (ex.getCause() instanceof JsonMappingException) {
            JsonMappingException mappingException = (JsonMappingException) ex.getCause();
            if (!mappingException.getPath().isEmpty()) {
                String field = mappingException.getPath().stream()
                        .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                        .collect(Collectors.joining("."));
                return buildResponse(
                        ErrorCode.BAD_REQUEST, "Unreadable value for '" + field + "'", Map.of("field", field), request);
            }
        }
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    /** Query or path values of the wrong type, e.g. {@code ?limit=ten}. */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        details.put("value", String.valueOf(ex.getValue()));
        return buildResponse(
                ErrorCode.BAD_REQUEST, "Invalid value for request parameter '" + ex.getName() + "'", details, request);
    }

    @ExceptionHandler(InvalidParameterValueException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidParameter(
            InvalidParameterValueException ex, HttpServletRequest request) {
        log.info("Risk parameter update refused: {}", ex.getMessage());
        return buildResponse(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.NOT_FOUND, "No endpoint " + request.getRequestURI(), null, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleEngineException(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
