package fr.lapetina.seedrl.disruptor.handlers;

import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private InferenceRequestEvent event;

    @BeforeEach
    void setUp() {
        handler = new ValidationHandler(4, 3);
        event = new InferenceRequestEvent();
    }

    private static EnvironmentState state(int width) {
        return EnvironmentState.initial(new float[width], 0L);
    }

    @Test
    @DisplayName("should validate a well-formed state")
    void shouldValidateValidState() {
        event.initialize(2, state(3), null, new CompletableFuture<>());

        handler.onEvent(event, 7, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
        assertThat(event.getErrorType()).isNull();
        assertThat(event.getSequence()).isEqualTo(7);
        assertThat(event.getValidatedAt()).isNotNull();
    }

    @Test
    @DisplayName("should reject a source id outside the configured range")
    void shouldRejectUnknownSource() {
        event.initialize(4, state(3), null, new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.getErrorMessage()).contains("out of range");
    }

    @Test
    @DisplayName("should reject a missing state")
    void shouldRejectMissingState() {
        event.initialize(0, null, null, new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
    }

    @Test
    @DisplayName("should reject an observation of the wrong width")
    void shouldRejectWrongObservationWidth() {
        event.initialize(0, state(5), null, new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("width 5");
    }

    @Test
    @DisplayName("should skip events that already failed")
    void shouldSkipFailedEvents() {
        event.initialize(0, state(3), null, new CompletableFuture<>());
        event.markFailed(ErrorType.INTERNAL_ERROR, new IllegalStateException("boom"));

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.FAILED);
    }
}
