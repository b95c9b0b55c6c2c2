package com.example.presence.shared.exception;

import com.example.presence.shared.config.CorrelationIdFilter;
import com.example.presence.shared.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;

/**
 * Error bodies for the HTTP endpoints. WebSocket failures never reach here; they are answered with
 * close codes by the transport.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        if (status.is5xxServerError()) {
            log.error("Request to {} failed with {}", exchange.getRequest().getPath(), status.value(), ex);
        } else {
            log.warn("Request to {} rejected with {}: {}", exchange.getRequest().getPath(), status.value(), ex.getReason());
        }
        return respond(status, status.toString(), ex.getReason(), exchange);
    }

    @ExceptionHandler(BusUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBusUnavailable(BusUnavailableException ex, ServerWebExchange exchange) {
        log.warn("Channel bus unavailable while serving {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "Live messaging is temporarily degraded. Please retry shortly.", exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error serving {}", exchange.getRequest().getPath(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String error, String message,
                                                         ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .correlationId(exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_KEY))
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
