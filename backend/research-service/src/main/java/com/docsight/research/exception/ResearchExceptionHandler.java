package com.docsight.research.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 리서치 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.docsight.research.controller")
@Slf4j
public class ResearchExceptionHandler {

    @ExceptionHandler(ResearchConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfigurationException(ResearchConfigurationException ex) {
        log.warn("Rejected research request: {}", ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid research request: {}", message);
        return respond("INVALID_REQUEST", message, HttpStatus.BAD_REQUEST);
    }

    /**
     * 본문 디코딩 실패, 누락된 파라미터 등 요청 입력 오류
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException ex) {
        ResearchConfigurationException configError = findCause(ex, ResearchConfigurationException.class);
        if (configError != null) {
            return handleConfigurationException(configError);
        }
        log.warn("Unreadable research request: {}", ex.getMessage());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        return respond("INVALID_REQUEST", ex.getReason(), status != null ? status : HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null || status.is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
            return respond("INTERNAL_ERROR", "An unexpected error occurred",
                    status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR);
        }
        log.warn("Rejected research request: {}", ex.getMessage());
        return respond("INVALID_REQUEST", ex.getReason(), status);
    }

    @ExceptionHandler(ResearchException.class)
    public ResponseEntity<Map<String, Object>> handleResearchException(ResearchException ex) {
        log.error("Research error: {}", ex.getMessage(), ex);
        return respond(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond("INTERNAL_ERROR", "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        Throwable current = ex.getCause();
        while (current != null && current != current.getCause()) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }

    private ResponseEntity<Map<String, Object>> respond(String errorCode, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
