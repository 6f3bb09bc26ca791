package org.broadinstitute.tensorcaller.engine;

/**
 * Read-only access to reference bases.
 */
public interface ReferenceSource extends AutoCloseable {

    /**
     * A source that knows no sequence.
     */
    ReferenceSource EMPTY = (contig, start, end) -> "";

    /**
     * @param contig contig name
     * @param start 0-based start, inclusive
     * @param end 0-based end, exclusive
     * @return upper-case bases, or the empty string if the region cannot be fetched
     */
    String getBases(String contig, int start, int end);

    @Override
    default void close() {}
}
