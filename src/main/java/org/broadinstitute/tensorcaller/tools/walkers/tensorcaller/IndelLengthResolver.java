package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.utils.Utils;

/**
 * Finds the most probable assignment of indel lengths to the two haplotypes of a site under a given
 * {@link IndelLengthShape}, by exhaustive search over the classifier's two signed length distributions.
 *
 * Candidates are visited with {@code i} (and then {@code j}) ascending from 1 to the maximum length, and a candidate
 * replaces the current best only if its joint probability is strictly greater, so the earliest candidate wins ties.
 * A search whose candidates all have probability 0 returns lengths of 0 and probability 0.
 */
public final class IndelLengthResolver {

    private IndelLengthResolver() {}

    public static ResolvedLengths resolve(final ProbabilityBundle probabilities, final IndelLengthShape shape) {
        Utils.nonNull(probabilities, "probabilities");
        Utils.nonNull(shape, "shape");
        switch (shape) {
            case HOMOZYGOUS_INSERTION:
                return resolveHomozygous(probabilities, 1);
            case HOMOZYGOUS_DELETION:
                return resolveHomozygous(probabilities, -1);
            case HETEROZYGOUS_BASE_AND_INSERTION:
                return resolveBaseAndIndel(probabilities, 1);
            case HETEROZYGOUS_BASE_AND_DELETION:
                return resolveBaseAndIndel(probabilities, -1);
            case HETEROZYGOUS_INSERTION_INSERTION:
                return resolveDoubleIndel(probabilities, 1, true);
            case HETEROZYGOUS_DELETION_DELETION:
                return resolveDoubleIndel(probabilities, -1, false);
            case HETEROZYGOUS_INSERTION_DELETION:
                return resolveInsertionAndDeletion(probabilities);
            default:
                throw new IllegalArgumentException("Unknown indel length shape " + shape);
        }
    }

    /**
     * @return probability that neither haplotype carries an indel
     */
    public static double noIndelProbability(final ProbabilityBundle probabilities) {
        return probabilities.getVariantLengthProbability1(0) * probabilities.getVariantLengthProbability2(0);
    }

    private static ResolvedLengths resolveHomozygous(final ProbabilityBundle probabilities, final int sign) {
        int bestLength = 0;
        double bestProbability = 0.0;
        for (int i = 1; i <= probabilities.getMaximumVariantLength(); i++) {
            final double probability = probabilities.getVariantLengthProbability1(sign * i) * probabilities.getVariantLengthProbability2(sign * i);
            if (probability > bestProbability) {
                bestLength = i;
                bestProbability = probability;
            }
        }
        return new ResolvedLengths(bestLength, bestLength, bestProbability);
    }

    // Either haplotype may be the one carrying the indel; both orderings are tried at each length.
    private static ResolvedLengths resolveBaseAndIndel(final ProbabilityBundle probabilities, final int sign) {
        int bestLength = 0;
        double bestProbability = 0.0;
        for (int i = 1; i <= probabilities.getMaximumVariantLength(); i++) {
            final double indelOnSecond = probabilities.getVariantLengthProbability1(0) * probabilities.getVariantLengthProbability2(sign * i);
            if (indelOnSecond > bestProbability) {
                bestLength = i;
                bestProbability = indelOnSecond;
            }
            final double indelOnFirst = probabilities.getVariantLengthProbability1(sign * i) * probabilities.getVariantLengthProbability2(0);
            if (indelOnFirst > bestProbability) {
                bestLength = i;
                bestProbability = indelOnFirst;
            }
        }
        return new ResolvedLengths(0, bestLength, bestProbability);
    }

    private static ResolvedLengths resolveDoubleIndel(final ProbabilityBundle probabilities, final int sign, final boolean allowEqualLengths) {
        int bestShorter = 0;
        int bestLonger = 0;
        double bestProbability = 0.0;
        final int maxLength = probabilities.getMaximumVariantLength();
        for (int i = 1; i <= maxLength; i++) {
            for (int j = 1; j <= maxLength; j++) {
                if (i == j && !allowEqualLengths) {
                    continue;
                }
                final double probability = probabilities.getVariantLengthProbability1(sign * i) * probabilities.getVariantLengthProbability2(sign * j);
                if (probability > bestProbability) {
                    bestShorter = Math.min(i, j);
                    bestLonger = Math.max(i, j);
                    bestProbability = probability;
                }
            }
        }
        return new ResolvedLengths(bestShorter, bestLonger, bestProbability);
    }

    private static ResolvedLengths resolveInsertionAndDeletion(final ProbabilityBundle probabilities) {
        int bestDeletion = 0;
        int bestInsertion = 0;
        double bestProbability = 0.0;
        final int maxLength = probabilities.getMaximumVariantLength();
        for (int i = 1; i <= maxLength; i++) {
            for (int j = 1; j <= maxLength; j++) {
                // insertion of i on the first haplotype, deletion of j on the second
                final double insertionFirst = probabilities.getVariantLengthProbability1(i) * probabilities.getVariantLengthProbability2(-j);
                if (insertionFirst > bestProbability) {
                    bestDeletion = j;
                    bestInsertion = i;
                    bestProbability = insertionFirst;
                }
                // deletion of i on the first haplotype, insertion of j on the second
                final double deletionFirst = probabilities.getVariantLengthProbability1(-i) * probabilities.getVariantLengthProbability2(j);
                if (deletionFirst > bestProbability) {
                    bestDeletion = i;
                    bestInsertion = j;
                    bestProbability = deletionFirst;
                }
            }
        }
        return new ResolvedLengths(bestDeletion, bestInsertion, bestProbability);
    }
}
