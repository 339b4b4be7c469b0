package fr.lapetina.seedrl.actor;

import fr.lapetina.seedrl.domain.exception.ResponseMismatchException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.spi.Environment;
import fr.lapetina.seedrl.support.ScriptedEnvironment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ActorTest {

    /**
     * Answers every submit immediately; raises the shutdown flag from a given call on.
     */
    private static final class FakeEndpoint implements LearnerEndpoint {
        private final int shutdownAfter;
        private final int sourceIdOffset;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<String> sessionCalls = new CopyOnWriteArrayList<>();
        private final List<Integer> submittedSources = new CopyOnWriteArrayList<>();
        private final List<Map<String, Object>> submittedMetrics = new CopyOnWriteArrayList<>();

        FakeEndpoint(int shutdownAfter, int sourceIdOffset) {
            this.shutdownAfter = shutdownAfter;
            this.sourceIdOffset = sourceIdOffset;
        }

        @Override
        public void checkIn(String callerId, int rank) {
            sessionCalls.add("in:" + callerId + ":" + rank);
        }

        @Override
        public void checkOut(String callerId) {
            sessionCalls.add("out:" + callerId);
        }

        @Override
        public CompletableFuture<SubmitResult> submit(int sourceId, EnvironmentState state, Map<String, Object> metrics) {
            submittedSources.add(sourceId);
            submittedMetrics.add(metrics);
            boolean shutdown = calls.incrementAndGet() >= shutdownAfter;
            return CompletableFuture.completedFuture(new SubmitResult(1, shutdown, sourceId + sourceIdOffset));
        }
    }

    @Test
    @DisplayName("should submit every environment each round and stop on the shutdown flag")
    void shouldRunUntilShutdown() {
        FakeEndpoint endpoint = new FakeEndpoint(6, 0);
        ScriptedEnvironment first = new ScriptedEnvironment(4, 2, 10);
        ScriptedEnvironment second = new ScriptedEnvironment(5, 2, 10);
        List<Environment> environments = List.of(first, second);
        Actor actor = new Actor(2, endpoint, environments, Duration.ofSeconds(1));

        actor.run();

        assertThat(actor.getFailure()).isNull();
        assertThat(actor.getSteps()).isEqualTo(6);
        assertThat(endpoint.submittedSources).containsExactly(4, 5, 4, 5, 4, 5);
        assertThat(endpoint.sessionCalls).containsExactly("in:actor-2:2", "out:actor-2");
        assertThat(first.getReceivedActions()).containsOnly(1).hasSize(3);
        assertThat(first.isClosed()).isTrue();
        assertThat(second.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should send the previous round-trip latency with the next request")
    void shouldReportLatency() {
        FakeEndpoint endpoint = new FakeEndpoint(2, 0);
        Actor actor = new Actor(0, endpoint, List.of(new ScriptedEnvironment(0, 2, 10)), Duration.ofSeconds(1));

        actor.run();

        assertThat(endpoint.submittedMetrics).hasSize(2);
        assertThat(endpoint.submittedMetrics.get(0)).isEmpty();
        assertThat(endpoint.submittedMetrics.get(1)).containsKey("latency");
        assertThat((Double) endpoint.submittedMetrics.get(1).get("latency")).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("should fail on an answer for another source and still check out")
    void shouldDetectResponseMismatch() {
        FakeEndpoint endpoint = new FakeEndpoint(100, 1);
        ScriptedEnvironment environment = new ScriptedEnvironment(3, 2, 10);
        Actor actor = new Actor(3, endpoint, List.of(environment), Duration.ofSeconds(1));

        actor.run();

        assertThat(actor.getFailure()).isInstanceOf(ResponseMismatchException.class);
        assertThat(endpoint.sessionCalls).containsExactly("in:actor-3:3", "out:actor-3");
        assertThat(environment.getReceivedActions()).isEmpty();
        assertThat(environment.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should derive global source ids from rank and environment count")
    void shouldComputeSourceIds() {
        List<Environment> environments = List.of(
                new ScriptedEnvironment(0, 2, 1),
                new ScriptedEnvironment(0, 2, 1),
                new ScriptedEnvironment(0, 2, 1)
        );
        Actor actor = new Actor(2, new FakeEndpoint(1, 0), environments, Duration.ofSeconds(1));

        assertThat(actor.sourceId(0)).isEqualTo(6);
        assertThat(actor.sourceId(2)).isEqualTo(8);
        assertThat(actor.getCallerId()).isEqualTo("actor-2");
    }
}
