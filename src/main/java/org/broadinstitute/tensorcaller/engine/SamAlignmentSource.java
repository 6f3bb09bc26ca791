package org.broadinstitute.tensorcaller.engine;

import htsjdk.samtools.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link AlignmentSource} over an indexed SAM/BAM/CRAM file, read with htsjdk.
 *
 * Reads carrying any bit of the configured flag filter are skipped, and at most {@code maxDepth} reads are taken
 * per pileup column.
 */
public final class SamAlignmentSource implements AlignmentSource {
    private static final Logger logger = LogManager.getLogger(SamAlignmentSource.class);

    private final SamReader reader;
    private final Path alignmentPath;
    private final int flagFilter;
    private final int maxDepth;

    /**
     * @param alignmentPath indexed alignment file
     * @param referencePath reference, needed for CRAM only; may be null
     * @param flagFilter reads with any of these SAM flag bits set are ignored
     * @param maxDepth maximum number of reads considered per column
     */
    public SamAlignmentSource(final Path alignmentPath, final Path referencePath, final int flagFilter, final int maxDepth) {
        Utils.nonNull(alignmentPath, "alignmentPath");
        Utils.validateArg(maxDepth > 0, "maxDepth must be positive");
        this.alignmentPath = alignmentPath;
        this.flagFilter = flagFilter;
        this.maxDepth = maxDepth;

        SamReaderFactory factory = SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT);
        if (referencePath != null) {
            factory = factory.referenceSequence(referencePath);
        }
        try {
            reader = factory.open(alignmentPath);
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(alignmentPath, e);
        }
        if (!reader.hasIndex()) {
            closeQuietlyOnError();
            throw new UserException.CouldNotReadInputFile(alignmentPath.toString(), "an index is required for pileup queries");
        }
    }

    @Override
    public List<String> getIndelSignatures(final String contig, final int start, final int end) {
        Utils.nonNull(contig, "contig");
        if (end <= start) {
            return Collections.emptyList();
        }
        final List<String> signatures = new ArrayList<>();
        final int[] depth = new int[end - start];
        try (final SAMRecordIterator iterator = reader.queryOverlapping(contig, start + 1, end)) {
            while (iterator.hasNext()) {
                final SAMRecord read = iterator.next();
                if ((read.getFlags() & flagFilter) != 0 || read.getReadUnmappedFlag()) {
                    continue;
                }
                for (int column = start; column < end; column++) {
                    if (depth[column - start] >= maxDepth) {
                        continue;
                    }
                    final String signature = signatureAt(read, column);
                    if (signature != null) {
                        depth[column - start]++;
                        signatures.add(signature);
                    }
                }
            }
        } catch (final SAMException | IllegalArgumentException | UnsupportedOperationException e) {
            logger.debug(String.format("No pileup for %s:%d-%d in %s: %s", contig, start + 1, end, alignmentPath, e.getMessage()));
            return Collections.emptyList();
        }
        return signatures;
    }

    /**
     * @param column 0-based reference position
     * @return the pileup signature of {@code read} at {@code column}, or null if the read has no base there
     */
    static String signatureAt(final SAMRecord read, final int column) {
        final byte[] bases = read.getReadBases();
        if (bases == null || bases.length == 0) {
            return null;
        }
        final int target = column + 1;
        final List<CigarElement> elements = read.getCigar().getCigarElements();
        int referencePosition = read.getAlignmentStart();
        int readOffset = 0;
        for (int i = 0; i < elements.size(); i++) {
            final CigarElement element = elements.get(i);
            final CigarOperator operator = element.getOperator();
            final int length = element.getLength();
            if (operator.isAlignment()) {
                final int lastAligned = referencePosition + length - 1;
                if (target >= referencePosition && target <= lastAligned) {
                    final char base = Character.toUpperCase((char) bases[readOffset + target - referencePosition]);
                    if (target != lastAligned || i + 1 >= elements.size()) {
                        return String.valueOf(base);
                    }
                    final CigarElement next = elements.get(i + 1);
                    if (next.getOperator() == CigarOperator.I) {
                        final int insertionStart = readOffset + length;
                        return base + "+" + next.getLength()
                                + new String(bases, insertionStart, next.getLength()).toUpperCase();
                    } else if (next.getOperator() == CigarOperator.D) {
                        return base + "-" + next.getLength() + Utils.dupChar('N', next.getLength());
                    }
                    return String.valueOf(base);
                }
            } else if (operator.consumesReferenceBases() && target >= referencePosition && target < referencePosition + length) {
                // column falls inside a deletion or skipped region of this read
                return null;
            }
            if (operator.consumesReadBases()) {
                readOffset += length;
            }
            if (operator.consumesReferenceBases()) {
                referencePosition += length;
            }
            if (referencePosition > target) {
                return null;
            }
        }
        return null;
    }

    private void closeQuietlyOnError() {
        try {
            reader.close();
        } catch (final IOException e) {
            logger.warn("Error closing " + alignmentPath + " after failed open: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (final IOException e) {
            throw new TensorCallerException("Error closing alignment file " + alignmentPath, e);
        }
    }
}
