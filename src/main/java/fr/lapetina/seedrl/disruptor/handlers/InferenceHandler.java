package fr.lapetina.seedrl.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.seedrl.domain.event.EventState;
import fr.lapetina.seedrl.domain.event.InferenceRequestEvent;
import fr.lapetina.seedrl.domain.exception.ModelEvaluationException;
import fr.lapetina.seedrl.domain.model.EnvironmentState;
import fr.lapetina.seedrl.domain.model.ErrorType;
import fr.lapetina.seedrl.domain.model.InferenceBatch;
import fr.lapetina.seedrl.domain.model.InferenceOutput;
import fr.lapetina.seedrl.domain.model.StepRecord;
import fr.lapetina.seedrl.infrastructure.metrics.LearnerStatistics;
import fr.lapetina.seedrl.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.seedrl.spi.PolicyModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Second stage handler: evaluates the inference model once per batch cycle.
 *
 * Validated events are collected until the Disruptor signals the end of the available
 * batch, or until the maximum inference batch size is reached. The collected states are
 * stacked in arrival order and evaluated under the model lock; the training-step counter
 * is read under the same lock so every output is stamped with the model version that
 * produced it.
 *
 * The BatchEventProcessor publishes its sequence only after the whole available batch
 * has been handled, so downstream stages never see an event before it has been
 * evaluated here.
 *
 * A model failure fails every event of the cycle and is reported as fatal.
 */
public final class InferenceHandler implements EventHandler<InferenceRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(InferenceHandler.class);

    private final PolicyModel model;
    private final Lock modelLock;
    private final LongSupplier trainingSteps;
    private final int maxBatchSize;
    private final int numActions;
    private final LearnerStatistics statistics;
    private final MetricsRegistry metricsRegistry;
    private final Consumer<Throwable> fatalErrorListener;

    private final List<InferenceRequestEvent> pending = new ArrayList<>();

    public InferenceHandler(
            PolicyModel model,
            Lock modelLock,
            LongSupplier trainingSteps,
            int maxBatchSize,
            int numActions,
            LearnerStatistics statistics,
            MetricsRegistry metricsRegistry,
            Consumer<Throwable> fatalErrorListener
    ) {
        this.model = model;
        this.modelLock = modelLock;
        this.trainingSteps = trainingSteps;
        this.maxBatchSize = maxBatchSize;
        this.numActions = numActions;
        this.statistics = statistics;
        this.metricsRegistry = metricsRegistry;
        this.fatalErrorListener = fatalErrorListener;
    }

    @Override
    public void onEvent(InferenceRequestEvent event, long sequence, boolean endOfBatch) {
        if (!event.shouldSkip() && event.getState() == EventState.VALIDATED) {
            pending.add(event);
        }

        if (!pending.isEmpty() && (endOfBatch || pending.size() >= maxBatchSize)) {
            flush();
        }
    }

    private void flush() {
        List<InferenceRequestEvent> batchEvents = new ArrayList<>(pending);
        pending.clear();

        try {
            evaluate(batchEvents);
        } catch (RuntimeException e) {
            ModelEvaluationException failure = e instanceof ModelEvaluationException
                    ? (ModelEvaluationException) e
                    : new ModelEvaluationException("Model evaluation failed for batch of " + batchEvents.size(), e);

            for (InferenceRequestEvent event : batchEvents) {
                event.markFailed(ErrorType.MODEL_ERROR, failure);
            }

            log.error("Inference batch failed: size={}, reason={}", batchEvents.size(), failure.getMessage());
            fatalErrorListener.accept(failure);
            throw failure;
        }
    }

    private void evaluate(List<InferenceRequestEvent> batchEvents) {
        int size = batchEvents.size();
        int[] sourceIds = new int[size];
        List<EnvironmentState> states = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            InferenceRequestEvent event = batchEvents.get(i);
            sourceIds[i] = event.getSourceId();
            states.add(event.getEnvironmentState());
        }

        InferenceBatch batch = InferenceBatch.of(sourceIds, states);

        long start = System.nanoTime();
        InferenceOutput output;
        long stamp;
        modelLock.lock();
        try {
            output = model.evaluate(batch);
            stamp = trainingSteps.getAsLong();
        } finally {
            modelLock.unlock();
        }
        long elapsedNanos = System.nanoTime() - start;

        checkOutput(output, size);

        for (int i = 0; i < size; i++) {
            StepRecord step = new StepRecord(
                    states.get(i),
                    output.actions()[i],
                    output.policyLogits()[i],
                    output.baselines()[i],
                    stamp
            );
            batchEvents.get(i).markInferred(step, size);
        }

        statistics.recordInference(size, elapsedNanos);
        metricsRegistry.recordInferenceBatch(size, Duration.ofNanos(elapsedNanos));

        log.debug("Inference batch evaluated: size={}, trainingSteps={}, elapsedMicros={}",
                size, stamp, elapsedNanos / 1_000);
    }

    private void checkOutput(InferenceOutput output, int expectedRows) {
        if (output == null) {
            throw new ModelEvaluationException("Model returned no output");
        }
        if (output.size() != expectedRows) {
            throw new ModelEvaluationException(
                    "Model returned " + output.size() + " rows for a batch of " + expectedRows);
        }
        for (float[] logits : output.policyLogits()) {
            if (logits == null || logits.length != numActions) {
                throw new ModelEvaluationException("Model returned policy logits of width "
                        + (logits == null ? "null" : logits.length) + ", expected " + numActions);
            }
        }
    }
}
