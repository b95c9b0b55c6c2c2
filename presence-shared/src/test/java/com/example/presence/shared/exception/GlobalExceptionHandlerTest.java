package com.example.presence.shared.exception;

import com.example.presence.shared.config.CorrelationIdFilter;
import com.example.presence.shared.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockServerWebExchange exchange =
            MockServerWebExchange.from(MockServerHttpRequest.get("/api/presence/stats"));

    @Test
    void statusExceptionShouldKeepItsStatusAndReason() {
        ResponseEntity<ErrorResponse> response = handler.handleResponseStatusException(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "no such event"), exchange);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage()).isEqualTo("no such event");
        assertThat(response.getBody().getPath()).isEqualTo("/api/presence/stats");
    }

    @Test
    void unexpectedExceptionShouldNotLeakDetails() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(
                new IllegalStateException("redis password is hunter2"), exchange);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).doesNotContain("hunter2");
    }

    @Test
    void busOutageShouldAnswerServiceUnavailable() {
        exchange.getAttributes().put(CorrelationIdFilter.CORRELATION_ID_KEY, "corr-1");

        ResponseEntity<ErrorResponse> response = handler.handleBusUnavailable(
                new BusUnavailableException("connection refused", null), exchange);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getCorrelationId()).isEqualTo("corr-1");
    }
}
