package fr.lapetina.seedrl.actor;

import fr.lapetina.seedrl.domain.exception.ResponseMismatchException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.SubmitResult;
import fr.lapetina.seedrl.spi.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Steps a fixed set of environments with actions chosen by the learner.
 *
 * <p>Each round submits the current state of every environment, then waits for the
 * answers one by one and steps each environment with its action. The round-trip latency
 * of the previous answer is sent along with the next request as the {@code latency}
 * metric, in seconds. The actor stops after the first answer carrying the shutdown flag
 * and always checks out before returning.
 */
public final class Actor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Actor.class);

    private final int rank;
    private final String callerId;
    private final LearnerEndpoint endpoint;
    private final List<Environment> environments;
    private final Duration responseTimeout;

    private final EnvironmentState[] states;
    private final double[] latencies;

    private volatile boolean shutdown;
    private volatile boolean checkedIn;
    private volatile Throwable failure;
    private volatile long steps;

    public Actor(int rank, LearnerEndpoint endpoint, List<Environment> environments, Duration responseTimeout) {
        if (environments.isEmpty()) {
            throw new IllegalArgumentException("Actor needs at least one environment");
        }
        this.rank = rank;
        this.callerId = callerId(rank);
        this.endpoint = endpoint;
        this.environments = List.copyOf(environments);
        this.responseTimeout = responseTimeout;
        this.states = new EnvironmentState[environments.size()];
        this.latencies = new double[environments.size()];
    }

    public static String callerId(int rank) {
        return "actor-" + rank;
    }

    /**
     * Global source id of the actor's {@code index}-th environment.
     */
    public int sourceId(int index) {
        return rank * environments.size() + index;
    }

    @Override
    public void run() {
        MDC.put("callerId", callerId);
        try {
            endpoint.checkIn(callerId, rank);
            checkedIn = true;
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Actor interrupted: callerId={}, steps={}", callerId, steps);
        } catch (ExecutionException e) {
            fail(e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            fail(e);
        } finally {
            checkOut();
            closeEnvironments();
            MDC.remove("callerId");
        }
    }

    private void loop() throws InterruptedException, ExecutionException, TimeoutException {
        for (int i = 0; i < environments.size(); i++) {
            states[i] = environments.get(i).initial();
            latencies[i] = -1;
        }
        log.info("Actor started: callerId={}, rank={}, sources=[{}..{}]",
                callerId, rank, sourceId(0), sourceId(environments.size() - 1));

        while (!shutdown) {
            act();
        }

        log.info("Actor received shutdown: callerId={}, steps={}", callerId, steps);
    }

    private void act() throws InterruptedException, ExecutionException, TimeoutException {
        int count = environments.size();
        List<CompletableFuture<SubmitResult>> futures = new ArrayList<>(count);
        long[] sentAt = new long[count];

        for (int i = 0; i < count; i++) {
            Map<String, Object> metrics = latencies[i] >= 0 ? Map.of("latency", latencies[i]) : Map.of();
            sentAt[i] = System.nanoTime();
            futures.add(endpoint.submit(sourceId(i), states[i], metrics));
        }

        for (int i = 0; i < count; i++) {
            SubmitResult result = futures.get(i).get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            latencies[i] = (System.nanoTime() - sentAt[i]) / 1e9;

            if (result.sourceId() != sourceId(i)) {
                throw new ResponseMismatchException(sourceId(i), result.sourceId());
            }
            if (result.shutdown()) {
                shutdown = true;
            }
            states[i] = environments.get(i).step(result.action());
        }
        steps += count;
    }

    private void fail(Throwable cause) {
        failure = cause;
        log.error("Actor failed: callerId={}, steps={}, reason={}", callerId, steps, cause.getMessage(), cause);
    }

    private void checkOut() {
        if (!checkedIn) {
            return;
        }
        try {
            endpoint.checkOut(callerId);
            checkedIn = false;
        } catch (RuntimeException e) {
            log.warn("Check-out failed: callerId={}", callerId, e);
        }
    }

    private void closeEnvironments() {
        for (Environment environment : environments) {
            try {
                environment.close();
            } catch (Exception e) {
                log.warn("Error closing environment: callerId={}", callerId, e);
            }
        }
    }

    /**
     * Makes the actor leave its loop after the current round.
     */
    public void requestStop() {
        shutdown = true;
    }

    public int getRank() {
        return rank;
    }

    public String getCallerId() {
        return callerId;
    }

    public long getSteps() {
        return steps;
    }

    /**
     * The exception that ended the actor, or {@code null} if it stopped normally.
     */
    public Throwable getFailure() {
        return failure;
    }
}
