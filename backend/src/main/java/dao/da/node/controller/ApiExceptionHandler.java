package dao.da.node.controller;

import dao.da.node.exception.ErrorCode;
import dao.da.node.exception.NodeException;
import dao.da.node.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps node failures to HTTP statuses with a {status, error, message} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NodeException.class)
    public ResponseEntity<Map<String, Object>> handleNodeException(NodeException e) {
        Map<String, Object> body = errorBody(e.getCode().name(), e.getMessage());
        if (e instanceof NotFoundException nf) {
            body.put("reason", nf.getReason().name());
        }
        return ResponseEntity.status(statusFor(e.getCode())).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(f -> f + " is invalid")
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.VALIDATION.name(), message));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception e) {
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.VALIDATION.name(), "Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody("INTERNAL", e.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case ASSIGNMENT -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case COMMITMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE, UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
