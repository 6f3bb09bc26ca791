package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Joint probabilities of all {@link VariantHypothesis} values at one site, with the indel lengths each indel
 * hypothesis was scored with.
 */
public final class HypothesisScores {

    private final Map<VariantHypothesis, Double> probabilities;
    private final Map<VariantHypothesis, ResolvedLengths> lengths;
    private final VariantHypothesis best;

    HypothesisScores(final Map<VariantHypothesis, Double> probabilities, final Map<VariantHypothesis, ResolvedLengths> lengths) {
        Utils.validateArg(probabilities.size() == VariantHypothesis.values().length, "every hypothesis must be scored");
        this.probabilities = Collections.unmodifiableMap(new EnumMap<>(probabilities));
        this.lengths = lengths.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(lengths));

        double maximum = Double.NEGATIVE_INFINITY;
        for (final double probability : this.probabilities.values()) {
            maximum = Math.max(maximum, probability);
        }
        VariantHypothesis winner = VariantHypothesis.REFERENCE;
        // EnumMap iterates in declaration order, so the first hypothesis reaching the maximum wins
        for (final Map.Entry<VariantHypothesis, Double> entry : this.probabilities.entrySet()) {
            if (entry.getValue() == maximum) {
                winner = entry.getKey();
                break;
            }
        }
        this.best = winner;
    }

    public VariantHypothesis getBestHypothesis() {
        return best;
    }

    public double getProbability(final VariantHypothesis hypothesis) {
        return probabilities.get(hypothesis);
    }

    /**
     * @return the lengths {@code hypothesis} was scored with
     * @throws IllegalArgumentException if the hypothesis involves no indel
     */
    public ResolvedLengths getLengths(final VariantHypothesis hypothesis) {
        Utils.validateArg(hypothesis.getLengthShape() != null, () -> hypothesis + " involves no indel");
        return lengths.get(hypothesis);
    }

    public boolean isReference() {
        return best == VariantHypothesis.REFERENCE;
    }

    @Override
    public String toString() {
        return "HypothesisScores{best=" + best + ", " + probabilities + "}";
    }
}
