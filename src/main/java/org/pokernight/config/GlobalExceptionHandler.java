package org.pokernight.config;

import lombok.extern.slf4j.Slf4j;
import org.pokernight.exception.ErrorCode;
import org.pokernight.exception.SettlementException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<Map<String, Object>> handleSettlementException(SettlementException e) {
        ErrorCode code = e.getErrorCode();
        log.warn("Settlement error {}: {}", code, e.getMessage());
        return body(code, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", msg);
        return body(ErrorCode.PARAM_ERROR, msg);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return body(ErrorCode.PARAM_ERROR, ErrorCode.PARAM_ERROR.getMsg());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unexpected error", e);
        return body(ErrorCode.SYSTEM_ERROR, ErrorCode.SYSTEM_ERROR.getMsg());
    }

    private ResponseEntity<Map<String, Object>> body(ErrorCode code, String msg) {
        return ResponseEntity.status(code.getHttpStatus())
                .body(Map.of("error", msg, "code", code.getCode()));
    }
}
