package com.fileservice.exception;

import com.fileservice.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FileServiceException.class)
    public ResponseEntity<ErrorResponse> handleFileServiceException(FileServiceException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getStatus();
        if (status.is5xxServerError()) {
            log.error("[{}] {} {} failed: {}", ex.getCode(), exchange.getRequest().getMethod(),
                    exchange.getRequest().getPath(), ex.getMessage(), ex);
        } else {
            log.debug("[{}] {}", ex.getCode(), ex.getMessage());
        }
        return build(status, ex.getCode(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Invalid request {}: {}", exchange.getRequest().getPath(), ex.getReason());
        return build(HttpStatus.BAD_REQUEST, InvalidInputException.CODE, ex.getReason(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        return build(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR,
                "http_" + code.value(), ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}", exchange.getRequest().getPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", exchange);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                       ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .error(code)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now())
                .path(exchange.getRequest().getPath().value())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
