package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every {@link VariantHypothesis} at a site. Each score is the product of a base-change probability (the best
 * of the matching classes when the hypothesis leaves the base open), a length probability from
 * {@link IndelLengthResolver}, and the probability of the hypothesis' genotype class.
 */
public final class HypothesisScorer {

    private HypothesisScorer() {}

    /**
     * @param probabilities classifier outputs for the site
     * @param referenceBase reference base at the site; the reference hypothesis scores 0 unless it is one of ACGT
     */
    public static HypothesisScores score(final ProbabilityBundle probabilities, final char referenceBase) {
        Utils.nonNull(probabilities, "probabilities");

        final Map<VariantHypothesis, ResolvedLengths> lengths = new EnumMap<>(VariantHypothesis.class);
        for (final VariantHypothesis hypothesis : VariantHypothesis.values()) {
            if (hypothesis.getLengthShape() != null) {
                lengths.put(hypothesis, IndelLengthResolver.resolve(probabilities, hypothesis.getLengthShape()));
            }
        }

        final double noIndel = IndelLengthResolver.noIndelProbability(probabilities);
        final Map<VariantHypothesis, Double> scores = new EnumMap<>(VariantHypothesis.class);
        for (final VariantHypothesis hypothesis : VariantHypothesis.values()) {
            final double lengthProbability = hypothesis.getLengthShape() == null ? noIndel : lengths.get(hypothesis).getProbability();
            final double genotypeProbability = probabilities.getGenotypeProbability(hypothesis.getGenotype());
            scores.put(hypothesis, baseChangeProbability(probabilities, hypothesis, referenceBase) * lengthProbability * genotypeProbability);
        }
        return new HypothesisScores(scores, lengths);
    }

    private static double baseChangeProbability(final ProbabilityBundle probabilities, final VariantHypothesis hypothesis, final char referenceBase) {
        switch (hypothesis) {
            case REFERENCE:
                final BaseChangeClass referenceClass = BaseChangeClass.homozygousClassOf(Character.toUpperCase(referenceBase));
                return referenceClass == null ? 0.0 : probabilities.getBaseChangeProbability(referenceClass);
            case HOMOZYGOUS_SNP:
                return maxOf(probabilities, BaseChangeClass.HOMOZYGOUS_SNP_CLASSES);
            case HETEROZYGOUS_SNP:
                return maxOf(probabilities, BaseChangeClass.HETEROZYGOUS_SNP_CLASSES);
            case HOMOZYGOUS_INSERTION:
            case HETEROZYGOUS_INSERTION_INSERTION:
                return probabilities.getBaseChangeProbability(BaseChangeClass.InsIns);
            case HOMOZYGOUS_DELETION:
            case HETEROZYGOUS_DELETION_DELETION:
                return probabilities.getBaseChangeProbability(BaseChangeClass.DelDel);
            case HETEROZYGOUS_BASE_AND_INSERTION:
                return maxOf(probabilities, BaseChangeClass.BASE_AND_INSERTION_CLASSES);
            case HETEROZYGOUS_BASE_AND_DELETION:
                return maxOf(probabilities, BaseChangeClass.BASE_AND_DELETION_CLASSES);
            case HETEROZYGOUS_INSERTION_DELETION:
                return probabilities.getBaseChangeProbability(BaseChangeClass.InsDel);
            default:
                throw new IllegalArgumentException("Unknown hypothesis " + hypothesis);
        }
    }

    /**
     * @return the first of {@code classes} with the highest probability
     */
    public static BaseChangeClass mostProbableOf(final ProbabilityBundle probabilities, final List<BaseChangeClass> classes) {
        Utils.nonEmpty(classes, "classes");
        BaseChangeClass best = classes.get(0);
        for (final BaseChangeClass candidate : classes) {
            if (probabilities.getBaseChangeProbability(candidate) > probabilities.getBaseChangeProbability(best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static double maxOf(final ProbabilityBundle probabilities, final List<BaseChangeClass> classes) {
        return probabilities.getBaseChangeProbability(mostProbableOf(probabilities, classes));
    }
}
