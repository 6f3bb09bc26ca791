package org.broadinstitute.tensorcaller.engine;

import java.nio.file.Path;

/**
 * A genotyping classifier that turns evidence tensors into per-site probability vectors.
 *
 * Implementations need not be thread-safe, but {@link #predict} is called from a pipeline worker thread while the
 * previous batch is being decoded on another, so the returned predictions must not share mutable storage with the
 * classifier.
 */
public interface VariantClassifier extends AutoCloseable {

    /**
     * Loads model parameters. Must be called before the first {@link #predict}.
     */
    void restoreParameters(Path parameters);

    /**
     * Hint for how many threads the classifier may use internally. Default implementation ignores it.
     */
    default void setNumberOfInferenceThreads(final int numberOfThreads) {}

    /**
     * Classifies every site in {@code batch}, exactly once per batch.
     *
     * @return one probability bundle per site, in batch order
     */
    ClassifierPredictions predict(EvidenceBatch batch);

    @Override
    default void close() {}
}
