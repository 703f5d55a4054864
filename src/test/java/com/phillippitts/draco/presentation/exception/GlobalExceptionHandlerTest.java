package com.phillippitts.draco.presentation.exception;

import com.phillippitts.draco.exception.ComponentLoadException;
import com.phillippitts.draco.exception.ComponentLoadTimeoutException;
import com.phillippitts.draco.exception.UnknownComponentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesUnknownComponentReturns404() {
        ResponseEntity<?> response = handler.handleUnknownComponent(new UnknownComponentException("ghost"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("UnknownComponentException")
                .contains("Component not registered: ghost");
    }

    @Test
    void verifiesLoadTimeoutReturns503() {
        ResponseEntity<?> response = handler.handleLoadTimeout(new ComponentLoadTimeoutException("llm", 30_000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("Component is still loading");
    }

    @Test
    void verifiesLoadFailureReturns503WithoutCauseDetails() {
        ComponentLoadException ex = new ComponentLoadException("llm",
                new IllegalStateException("/opt/models/secret-path.gguf unreadable"));

        ResponseEntity<?> response = handler.handleLoadFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("Component temporarily unavailable")
                .doesNotContain("/opt/models");
    }

    @Test
    void verifiesUnexpectedErrorReturns500() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("boom")
                .matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
