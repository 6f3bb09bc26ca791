package org.broadinstitute.tensorcaller.engine;

/**
 * Lazily produces batches of candidate sites for classification. The stream can be consumed once; the last batch
 * is flagged {@link EvidenceBatch#isEndOfStream()} and asking for another batch after it is an error.
 *
 * Callers never invoke {@link #nextBatch()} concurrently.
 */
public interface BatchSource extends AutoCloseable {

    /**
     * @return the next batch
     * @throws IllegalStateException if the end-of-stream batch was already returned
     */
    EvidenceBatch nextBatch();

    @Override
    default void close() {}
}
