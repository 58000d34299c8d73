package com.orgmind.chat.controller;

import com.orgmind.chat.ai.orchestrator.StreamRejectedException;
import com.orgmind.chat.config.RequestIdSupport;
import com.orgmind.chat.policy.ChatGuardException;
import com.orgmind.chat.policy.GuardFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一错误结构：{@code {"error": {"code", "message", "requestId", "details"?}}}。
 * <p>
 * 流式接口声明了 text/event-stream，错误响应显式指定 JSON 内容类型，
 * 前置校验失败时客户端收到普通 JSON 错误而不是事件流。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ChatGuardException.class)
    public ResponseEntity<Map<String, Object>> handleGuard(ChatGuardException ex) {
        GuardFailure failure = ex.getFailure();
        return error(failure.status(), failure.code(), failure.message(), null, null);
    }

    @ExceptionHandler(StreamRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleStreamRejected(StreamRejectedException ex) {
        return error(ex.getStatus(), ex.getCode(), ex.getMessage(), null, null);
    }

    @ExceptionHandler(MissingUserIdentityException.class)
    public ResponseEntity<Map<String, Object>> handleMissingIdentity(MissingUserIdentityException ex) {
        return error(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage(), "header", ChatHeaders.HEADER_USER_ID);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String message = fieldError != null && fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : "Validation failed";
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message,
                fieldError != null ? "field" : null, fieldError != null ? fieldError.getField() : null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument",
                ex.getParameterName() + " query parameter is required", "parameter", ex.getParameterName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.info("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), null, null);
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
            String detailsKey, Object detailsValue) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.resolveCurrent());
        if (detailsKey != null && detailsValue != null) {
            err.put("details", Map.of(detailsKey, detailsValue));
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", err));
    }
}
