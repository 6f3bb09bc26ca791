package org.broadinstitute.tensorcaller.engine;

import java.util.Collections;
import java.util.List;

/**
 * Read-only pileup access to the aligned reads behind the evidence tensors.
 *
 * Each read covering a pileup column contributes one signature string: the read's base at the column, followed by
 * {@code +<n><bases>} when the read has an {@code n}-base insertion right after the column, or {@code -<n><N...>}
 * when it has an {@code n}-base deletion right after it. Reads with a deletion spanning the column contribute nothing.
 */
public interface AlignmentSource extends AutoCloseable {

    /**
     * A source without any reads.
     */
    AlignmentSource EMPTY = (contig, start, end) -> Collections.emptyList();

    /**
     * @param contig contig name
     * @param start 0-based first pileup column, inclusive
     * @param end 0-based last pileup column, exclusive
     * @return signatures of the reads at every column in range, column by column; empty if the region cannot be queried
     */
    List<String> getIndelSignatures(String contig, int start, int end);

    @Override
    default void close() {}
}
