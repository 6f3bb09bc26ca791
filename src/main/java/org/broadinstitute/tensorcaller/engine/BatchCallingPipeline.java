package org.broadinstitute.tensorcaller.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.engine.progressmeter.ProgressMeter;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs classification and decoding of consecutive batches side by side, with at most two batches in flight.
 *
 * The first batch is classified on the calling thread. After that, each step submits the decoding of the pending
 * batch and the classification of the next batch to two worker threads, while the calling thread pulls the batch
 * after that from the {@link BatchSource}; the step ends when both workers are done. A batch is therefore never
 * classified and decoded at the same time, batches are decoded strictly in arrival order, and the source is only
 * ever called from the calling thread.
 *
 * Predictions travel from the classifier to the decoder as an immutable {@link ClassifierPredictions} value, so the
 * classifier may reuse its own buffers for the next batch.
 */
public final class BatchCallingPipeline implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(BatchCallingPipeline.class);

    static final int NUMBER_OF_WORKER_THREADS = 2;

    public enum State {
        /** more batches will be pulled from the source */
        FILLING,
        /** the end-of-stream batch has been pulled; the in-flight batches are finishing */
        DRAINING,
        /** every batch has been decoded, or the run failed */
        TERMINATED
    }

    private final BatchSource source;
    private final VariantClassifier classifier;
    private final BatchDecoder decoder;
    private final ProgressMeter progressMeter;
    private final ExecutorService executor;

    private volatile State state = State.FILLING;
    private long batchesDecoded = 0L;
    private long sitesDecoded = 0L;

    /**
     * @param progressMeter started and stopped by {@link #run()}; may be null
     */
    public BatchCallingPipeline(final BatchSource source,
                                final VariantClassifier classifier,
                                final BatchDecoder decoder,
                                final ProgressMeter progressMeter) {
        this.source = Utils.nonNull(source, "source");
        this.classifier = Utils.nonNull(classifier, "classifier");
        this.decoder = Utils.nonNull(decoder, "decoder");
        this.progressMeter = progressMeter;
        this.executor = Executors.newFixedThreadPool(NUMBER_OF_WORKER_THREADS,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("tensor-caller-worker-%d").build());
    }

    /**
     * Pulls, classifies and decodes batches until the end-of-stream batch has been decoded.
     *
     * @return number of sites decoded
     * @throws IllegalStateException if the pipeline has already run
     */
    public long run() {
        Utils.validate(state == State.FILLING && batchesDecoded == 0, "the pipeline can only be run once");
        if (progressMeter != null) {
            progressMeter.start();
        }
        try {
            EvidenceBatch pending = source.nextBatch();
            if (pending.isEndOfStream()) {
                state = State.DRAINING;
            }
            ClassifierPredictions pendingPredictions = classify(pending);
            EvidenceBatch next = pullAfter(pending);

            while (pending != null) {
                final EvidenceBatch toDecode = pending;
                final ClassifierPredictions toDecodePredictions = pendingPredictions;
                final EvidenceBatch toClassify = next;

                final Future<?> decoding = executor.submit(() -> decoder.decode(toDecode, toDecodePredictions));
                final Future<ClassifierPredictions> classifying = toClassify == null ? null : executor.submit(() -> classify(toClassify));
                final EvidenceBatch following = pullAfter(toClassify);

                await(decoding);
                final ClassifierPredictions nextPredictions = classifying == null ? null : await(classifying);
                recordDecoded(toDecode);

                pending = toClassify;
                pendingPredictions = nextPredictions;
                next = following;
            }
        } catch (final RuntimeException e) {
            executor.shutdownNow();
            throw e;
        } finally {
            state = State.TERMINATED;
            if (progressMeter != null) {
                progressMeter.stop();
            }
        }
        logger.info("Decoded {} sites in {} batches", sitesDecoded, batchesDecoded);
        return sitesDecoded;
    }

    /**
     * @return the batch after {@code batch}, or null if there is none
     */
    private EvidenceBatch pullAfter(final EvidenceBatch batch) {
        if (batch == null || batch.isEndOfStream()) {
            return null;
        }
        final EvidenceBatch next = source.nextBatch();
        if (next.isEndOfStream()) {
            state = State.DRAINING;
        }
        return next;
    }

    private ClassifierPredictions classify(final EvidenceBatch batch) {
        final ClassifierPredictions predictions = classifier.predict(batch);
        if (predictions == null || predictions.size() != batch.size()) {
            throw new TensorCallerException.InconsistentBatchShape(batch.size(), predictions == null ? 0 : predictions.size());
        }
        logger.debug("Classified {}", batch);
        return predictions;
    }

    private void recordDecoded(final EvidenceBatch batch) {
        batchesDecoded++;
        sitesDecoded += batch.size();
        if (progressMeter != null) {
            final List<Site> sites = batch.getSites();
            progressMeter.update(sites.isEmpty() ? null : sites.get(sites.size() - 1), sites.size());
        }
    }

    private static <T> T await(final Future<T> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TensorCallerException("Interrupted while waiting for a pipeline worker", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof UserException) {
                throw (UserException) cause;
            } else if (cause instanceof TensorCallerException) {
                throw (TensorCallerException) cause;
            }
            throw new TensorCallerException("A pipeline worker failed", cause);
        }
    }

    public State getState() {
        return state;
    }

    public long getBatchesDecoded() {
        return batchesDecoded;
    }

    @VisibleForTesting
    long getSitesDecoded() {
        return sitesDecoded;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
