package fr.lapetina.seedrl.actor;

import fr.lapetina.seedrl.spi.Environment;
import fr.lapetina.seedrl.spi.EnvironmentFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed number of actors against one learner endpoint, one thread per actor.
 */
public final class ActorPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActorPool.class);

    private final LearnerEndpoint endpoint;
    private final EnvironmentFactory environmentFactory;
    private final int numActors;
    private final int envsPerActor;
    private final Duration responseTimeout;
    private final Duration joinTimeout;
    private final List<Actor> actors = new ArrayList<>();

    private ExecutorService executor;

    public ActorPool(
            LearnerEndpoint endpoint,
            EnvironmentFactory environmentFactory,
            int numActors,
            int envsPerActor,
            Duration responseTimeout,
            Duration joinTimeout
    ) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint is required");
        this.environmentFactory = Objects.requireNonNull(environmentFactory, "EnvironmentFactory is required");
        this.numActors = numActors;
        this.envsPerActor = envsPerActor;
        this.responseTimeout = responseTimeout;
        this.joinTimeout = joinTimeout;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newFixedThreadPool(numActors, new ActorThreadFactory());
        for (int rank = 0; rank < numActors; rank++) {
            List<Environment> environments = new ArrayList<>(envsPerActor);
            for (int i = 0; i < envsPerActor; i++) {
                environments.add(environmentFactory.create(rank * envsPerActor + i));
            }
            Actor actor = new Actor(rank, endpoint, environments, responseTimeout);
            actors.add(actor);
            executor.execute(actor);
        }
        log.info("Actor pool started: actors={}, envsPerActor={}", numActors, envsPerActor);
    }

    /**
     * Waits for every actor to return.
     *
     * @return true if all actors finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (executor == null) {
            return true;
        }
        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<Actor> getActors() {
        return List.copyOf(actors);
    }

    /**
     * Waits up to the join timeout for the actors, then stops the remaining ones.
     */
    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        try {
            if (!awaitTermination(joinTimeout)) {
                log.warn("Actors did not finish within {}, stopping them", joinTimeout);
                actors.forEach(Actor::requestStop);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static class ActorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "actor-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
