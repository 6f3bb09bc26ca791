package org.broadinstitute.tensorcaller.engine;

import org.broadinstitute.tensorcaller.utils.BaseUtils;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;

import java.util.Arrays;

/**
 * Read-support summary for the window around a candidate site: positions x nucleotide channels x
 * {@link EvidenceCategory}. Nucleotide channels are either the four bases {@code ACGT}, or eight channels holding
 * forward-strand {@code ACGT} followed by reverse-strand {@code acgt}.
 *
 * Values are stored flat, position-major, then nucleotide channel, then category. Instances are immutable.
 */
public final class EvidenceTensor {

    public static final int UNSTRANDED_CHANNELS = 4;
    public static final int STRANDED_CHANNELS = 8;

    private final int numberOfPositions;
    private final int numberOfChannels;
    private final float[] values;

    /**
     * @param numberOfPositions window width
     * @param numberOfChannels 4 or 8
     * @param values flattened tensor; copied
     */
    public EvidenceTensor(final int numberOfPositions, final int numberOfChannels, final float[] values) {
        Utils.validateArg(numberOfPositions > 0, "numberOfPositions must be positive");
        Utils.validateArg(numberOfChannels == UNSTRANDED_CHANNELS || numberOfChannels == STRANDED_CHANNELS,
                () -> "numberOfChannels must be 4 or 8 but was " + numberOfChannels);
        Utils.nonNull(values, "values");
        Utils.validateArg(values.length == numberOfPositions * numberOfChannels * EvidenceCategory.NUMBER_OF_CATEGORIES,
                () -> String.format("expected %d tensor values for %d positions and %d channels but found %d",
                        numberOfPositions * numberOfChannels * EvidenceCategory.NUMBER_OF_CATEGORIES,
                        numberOfPositions, numberOfChannels, values.length));
        this.numberOfPositions = numberOfPositions;
        this.numberOfChannels = numberOfChannels;
        this.values = Arrays.copyOf(values, values.length);
    }

    public int getNumberOfPositions() {
        return numberOfPositions;
    }

    public int getNumberOfChannels() {
        return numberOfChannels;
    }

    public float get(final int position, final int channel, final EvidenceCategory category) {
        Utils.validIndex(position, numberOfPositions);
        Utils.validIndex(channel, numberOfChannels);
        return values[(position * numberOfChannels + channel) * EvidenceCategory.NUMBER_OF_CATEGORIES + category.ordinal()];
    }

    /**
     * Support for one base at a position, summing both strands when the tensor is stranded.
     */
    public double getBaseSupport(final int position, final int baseIndex, final EvidenceCategory category) {
        Utils.validIndex(baseIndex, UNSTRANDED_CHANNELS);
        double support = get(position, baseIndex, category);
        if (numberOfChannels == STRANDED_CHANNELS) {
            support += get(position, baseIndex + UNSTRANDED_CHANNELS, category);
        }
        return support;
    }

    /**
     * Support for one base at a position given as a letter; zero for anything other than ACGT.
     */
    public double getBaseSupport(final int position, final char base, final EvidenceCategory category) {
        final int baseIndex = BaseUtils.simpleBaseToBaseIndex(base);
        return baseIndex == -1 ? 0.0 : getBaseSupport(position, baseIndex, category);
    }

    /**
     * Total support in a category at a position, over all nucleotide channels.
     */
    public double getCategorySupport(final int position, final EvidenceCategory category) {
        double total = 0.0;
        for (int channel = 0; channel < numberOfChannels; channel++) {
            total += get(position, channel, category);
        }
        return total;
    }

    /**
     * The base with the highest strand-merged support in a category at a position; the first base in ACGT order wins ties.
     */
    public char getMostSupportedBase(final int position, final EvidenceCategory category) {
        int bestIndex = 0;
        double bestSupport = getBaseSupport(position, 0, category);
        for (int baseIndex = 1; baseIndex < UNSTRANDED_CHANNELS; baseIndex++) {
            final double support = getBaseSupport(position, baseIndex, category);
            if (support > bestSupport) {
                bestSupport = support;
                bestIndex = baseIndex;
            }
        }
        return BaseUtils.baseIndexToSimpleBase(bestIndex);
    }
}
