package fr.lapetina.seedrl.session;

import fr.lapetina.seedrl.domain.exception.DuplicateSessionException;
import fr.lapetina.seedrl.domain.exception.ProtocolViolationException;
import fr.lapetina.seedrl.domain.exception.UnknownSessionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
    }

    @Test
    @DisplayName("should register and remove a caller")
    void shouldCheckInAndOut() {
        Session session = registry.checkIn("actor-0", 0);

        assertThat(session.getCallerId()).isEqualTo("actor-0");
        assertThat(registry.isCheckedIn("actor-0")).isTrue();
        assertThat(registry.size()).isEqualTo(1);

        registry.checkOut("actor-0");

        assertThat(registry.isCheckedIn("actor-0")).isFalse();
        assertThat(session.isAlive()).isFalse();
    }

    @Test
    @DisplayName("should reject a second check-in of the same caller")
    void shouldRejectDuplicateCheckIn() {
        registry.checkIn("actor-1", 1);

        assertThatThrownBy(() -> registry.checkIn("actor-1", 1))
                .isInstanceOf(DuplicateSessionException.class)
                .isInstanceOf(ProtocolViolationException.class);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject check-out of a caller that never checked in")
    void shouldRejectUnknownCheckOut() {
        assertThatThrownBy(() -> registry.checkOut("ghost"))
                .isInstanceOf(UnknownSessionException.class);
    }

    @Test
    @DisplayName("should wake waiters once the last caller checks out")
    void shouldAwaitEmpty() throws Exception {
        registry.checkIn("actor-0", 0);
        registry.checkIn("actor-1", 1);

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return registry.awaitEmpty(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        registry.checkOut("actor-0");
        registry.checkOut("actor-1");

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should give up waiting after the timeout")
    void shouldTimeOutWaiting() throws Exception {
        registry.checkIn("actor-0", 0);

        assertThat(registry.awaitEmpty(Duration.ofMillis(20))).isFalse();
        assertThat(registry.awaitEmpty(Duration.ZERO)).isFalse();
    }
}
