package com.imperium.cocounsel.controller;

import com.imperium.cocounsel.config.RequestIdSupport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一错误结构：{"error": {code, message, requestId, details}}。
 */
final class ApiErrors {

    static final String HEADER_USER_ID = "X-User-Id";

    private ApiErrors() {}

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
            String detailsKey, Object detailsValue) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.current());
        if (detailsKey != null && detailsValue != null) {
            err.put("details", Map.of(detailsKey, detailsValue));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    static ResponseEntity<Map<String, Object>> missingUser() {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", HEADER_USER_ID + " is required", "header", HEADER_USER_ID);
    }
}
