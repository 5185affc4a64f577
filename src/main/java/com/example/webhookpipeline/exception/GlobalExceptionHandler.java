package com.example.webhookpipeline.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑
 * 所有未捕获的异常都以 JSON 返回，不向调用方泄露堆栈信息。
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResourceNotFound(ResourceNotFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return body(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    /**
     * 处理静态资源缺失 (404)，避免在控制台打印错误堆栈
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return body(HttpStatus.NOT_FOUND, "Not Found", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e,
            HttpServletRequest request) {
        log.warn("[BadRequest] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    /**
     * 处理所有其他异常 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message,
            HttpServletRequest request) {
        Map<String, Object> error = new HashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
