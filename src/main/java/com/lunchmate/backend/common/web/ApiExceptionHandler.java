package com.lunchmate.backend.common.web;

import com.lunchmate.backend.common.error.DomainException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.DateTimeException;
import java.util.Map;

/**
 * Error body is always {code, message, requestId}.
 * <ul>
 *   <li>DomainException: status from its ErrorCode</li>
 *   <li>malformed input (dates, enums, missing params, bean validation): 400 INVALID_ARGUMENT</li>
 *   <li>ResponseStatusException (e.g. 401 from AuthContext): its own status</li>
 *   <li>anything else: 500 INTERNAL_ERROR, logged</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(DomainException ex, HttpServletRequest req) {
        HttpStatus status = ex.getCode().status();
        if (status.is5xxServerError()) {
            log.error("domain failure code={} msg={}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.debug("domain rejection code={} msg={}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(err(ex.getCode().name(), ex.getMessage(), req));
    }

    @ExceptionHandler({
            DateTimeException.class,
            IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("INVALID_ARGUMENT", ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "validation failed"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("INVALID_ARGUMENT", msg, req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatusCode status = ex.getStatusCode();
        String code = (ex.getReason() == null || ex.getReason().isBlank())
                ? String.valueOf(status.value())
                : ex.getReason();
        return ResponseEntity.status(status).body(err(code, ex.getReason(), req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled error path={}", req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", "unexpected error", req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        return ApiErrorWriter.body(code, message, req);
    }
}
