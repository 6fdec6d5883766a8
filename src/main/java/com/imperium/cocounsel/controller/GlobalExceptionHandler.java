package com.imperium.cocounsel.controller;

import com.imperium.cocounsel.ai.orchestrator.OrchestrationException;
import com.imperium.cocounsel.ai.orchestrator.OrchestrationStage;
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

import java.util.Map;

/**
 * 全局异常处理：参数校验失败返回 400，编排失败只暴露失败阶段。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String message = first != null && first.getDefaultMessage() != null ? first.getDefaultMessage() : "Validation failed";
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", message,
                "field", first != null ? first.getField() : null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex) {
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument",
                ex.getParameterName() + " is required", "param", ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument",
                ex.getName() + " has an invalid value", "param", ex.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", "Malformed request body", null, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        // 原始信息可能来自下游库，只写日志不回显
        log.warn("Rejected request argument: {}", ex.getMessage());
        return ApiErrors.error(HttpStatus.BAD_REQUEST, "invalid_argument", "Invalid request argument", null, null);
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Map<String, Object>> handleOrchestration(OrchestrationException ex) {
        HttpStatus status = ex.getStage() == OrchestrationStage.GENERATION
                ? HttpStatus.BAD_GATEWAY
                : HttpStatus.INTERNAL_SERVER_ERROR;
        log.warn("Request failed at stage {}: {}", ex.getStage().value(), ex.getMessage());
        return ApiErrors.error(status, "orchestration_failed",
                "Request failed during " + ex.getStage().value().replace('_', ' '),
                "stage", ex.getStage().value());
    }
}
