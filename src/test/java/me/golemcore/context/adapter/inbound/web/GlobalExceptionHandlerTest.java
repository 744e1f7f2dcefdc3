package me.golemcore.context.adapter.inbound.web;

import me.golemcore.context.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.context.domain.service.InvalidContextConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.BAD_REQUEST, "candidates are required");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("candidates are required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleInvalidConfigAsBadRequest() {
        InvalidContextConfigException ex = new InvalidContextConfigException(List.of("totalItemLimit must be >= 0"));

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("Invalid context budget config: totalItemLimit must be >= 0", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalStateException() {
        IllegalStateException ex = new IllegalStateException("Context window debug log is disabled");

        StepVerifier.create(handler.handleIllegalState(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(409, body.getStatus());
                    assertEquals("Context window debug log is disabled", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleGenericException() {
        Exception ex = new RuntimeException("Unexpected failure");

        StepVerifier.create(handler.handleGeneric(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(500, body.getStatus());
                    assertEquals("Internal server error", body.getMessage());
                })
                .verifyComplete();
    }
}
