package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import com.google.common.annotations.VisibleForTesting;
import org.broadinstitute.tensorcaller.engine.EvidenceTensor;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decodes one site: scores the hypotheses, recovers the alleles of the winner and assembles the record with its
 * depth, allele frequency, quality and filter.
 *
 * A winner whose alleles cannot be determined produces no record. Base-plus-indel and double-indel winners are split
 * into two alternate alleles with genotype {@code 1/2} when the two haplotypes turn out to carry different
 * non-reference alleles.
 */
public final class VariantRecordComposer {

    private final TensorCallerArgumentCollection callerArgs;
    private final IndelAlleleRecoverer recoverer;
    private final DecodingParameters parameters;

    public VariantRecordComposer(final TensorCallerArgumentCollection callerArgs,
                                 final DecodingParameters parameters,
                                 final IndelAlleleRecoverer recoverer) {
        this.callerArgs = Utils.nonNull(callerArgs, "callerArgs");
        this.parameters = Utils.nonNull(parameters, "parameters");
        this.recoverer = Utils.nonNull(recoverer, "recoverer");
    }

    public CallOutcome compose(final Site site, final ProbabilityBundle probabilities) {
        Utils.nonNull(site, "site");
        Utils.nonNull(probabilities, "probabilities");

        final HypothesisScores scores = HypothesisScorer.score(probabilities, site.getReferenceBase());
        final VariantHypothesis hypothesis = scores.getBestHypothesis();
        if (scores.isReference() && !callerArgs.showReference && !callerArgs.debug) {
            return CallOutcome.skipped(site, probabilities, hypothesis, SkipReason.REFERENCE_CALL_NOT_REQUESTED);
        }

        final EvidenceTensor tensor = site.getTensor();
        final int center = site.getCenterIndex();
        final double readDepth = tensor.getCategorySupport(center, EvidenceCategory.REFERENCE)
                + tensor.getCategorySupport(center, EvidenceCategory.DELETE);
        if (readDepth <= 0.0) {
            return CallOutcome.skipped(site, probabilities, hypothesis, SkipReason.ZERO_DEPTH);
        }

        final Alleles alleles = new Alleles(hypothesis.getGenotype());
        final SkipReason reason = resolveAlleles(site, probabilities, scores, alleles);
        if (reason != null) {
            return CallOutcome.skipped(site, probabilities, hypothesis, reason);
        }
        if (alleles.reference.isEmpty() || alleles.alternates.isEmpty()) {
            return CallOutcome.skipped(site, probabilities, hypothesis, SkipReason.NO_ALLELES);
        }

        final double alleleFrequency = alleleFrequency(site, hypothesis, alleles, readDepth);
        final String genotypeString = alleles.genotype.getGenotypeString();
        final int quality = VariantQualityCalculator.qualityOf(alleles.reference, alleles.alternates, genotypeString, probabilities);
        final VariantRecord record = new VariantRecord(
                site.getContig(),
                site.getStart(),
                alleles.reference,
                alleles.alternates,
                quality,
                FilterStatus.fromQuality(quality, callerArgs.qualityThreshold),
                alleles.lengthGuess,
                alleles.genotype,
                (int) readDepth,
                alleleFrequency);
        return CallOutcome.called(site, probabilities, hypothesis, record);
    }

    /**
     * Fills in {@code alleles} for the winning hypothesis.
     *
     * @return the reason the site must be skipped, or {@code null}
     */
    private SkipReason resolveAlleles(final Site site, final ProbabilityBundle probabilities, final HypothesisScores scores, final Alleles alleles) {
        final VariantHypothesis hypothesis = scores.getBestHypothesis();
        final String referenceBase = String.valueOf(site.getReferenceBase());
        switch (hypothesis) {
            case REFERENCE:
                alleles.set(referenceBase, referenceBase);
                return null;
            case HOMOZYGOUS_SNP:
                resolveHomozygousSnp(probabilities, referenceBase, alleles);
                return null;
            case HETEROZYGOUS_SNP:
                resolveHeterozygousSnp(probabilities, referenceBase, alleles);
                return null;
            case HOMOZYGOUS_INSERTION:
            case HETEROZYGOUS_BASE_AND_INSERTION:
            case HETEROZYGOUS_INSERTION_INSERTION:
                return resolveInsertion(site, probabilities, scores, referenceBase, alleles);
            case HOMOZYGOUS_DELETION:
            case HETEROZYGOUS_BASE_AND_DELETION:
            case HETEROZYGOUS_DELETION_DELETION:
                return resolveDeletion(site, probabilities, scores, referenceBase, alleles);
            case HETEROZYGOUS_INSERTION_DELETION:
                resolveInsertionAndDeletion(site, scores, referenceBase, alleles);
                return null;
            default:
                throw new IllegalStateException("Unknown hypothesis " + hypothesis);
        }
    }

    private static void resolveHomozygousSnp(final ProbabilityBundle probabilities, final String referenceBase, final Alleles alleles) {
        final BaseChangeClass pair = HypothesisScorer.mostProbableOf(probabilities, BaseChangeClass.HOMOZYGOUS_SNP_CLASSES);
        final String base1 = String.valueOf(pair.getFirstBase());
        final String base2 = String.valueOf(pair.getSecondBase());
        alleles.set(referenceBase, base1.equals(referenceBase) ? base2 : base1);
    }

    private static void resolveHeterozygousSnp(final ProbabilityBundle probabilities, final String referenceBase, final Alleles alleles) {
        final BaseChangeClass pair = HypothesisScorer.mostProbableOf(probabilities, BaseChangeClass.HETEROZYGOUS_SNP_CLASSES);
        final String base1 = String.valueOf(pair.getFirstBase());
        final String base2 = String.valueOf(pair.getSecondBase());
        if (!base1.equals(referenceBase) && !base2.equals(referenceBase)) {
            alleles.setMultiAllelic(referenceBase, base1, base2);
        } else {
            alleles.set(referenceBase, base1.equals(referenceBase) ? base2 : base1);
        }
    }

    private SkipReason resolveInsertion(final Site site, final ProbabilityBundle probabilities, final HypothesisScores scores,
                                        final String referenceBase, final Alleles alleles) {
        final VariantHypothesis hypothesis = scores.getBestHypothesis();
        final ResolvedLengths lengths = scores.getLengths(hypothesis);
        final int length = lengths.getLength2();
        if (hypothesis.isHeterozygousIndel() && length <= 0) {
            return SkipReason.NON_POSITIVE_HETEROZYGOUS_INSERTION_LENGTH;
        }

        final RecoveredIndel insertion = recoverer.recoverInsertion(site, length);
        if (insertion.isEmpty()) {
            return null;
        }
        final String alternate = referenceBase + insertion.getBases();
        alleles.set(referenceBase, alternate);
        if (insertion.isInferred()) {
            alleles.lengthGuess = insertion.getLength();
        }

        if (hypothesis == VariantHypothesis.HETEROZYGOUS_BASE_AND_INSERTION) {
            final String base = String.valueOf(HypothesisScorer.mostProbableOf(probabilities, BaseChangeClass.BASE_AND_INSERTION_CLASSES).getFirstBase());
            if (!base.equals(referenceBase)) {
                alleles.setMultiAllelic(referenceBase, base, alternate);
            }
        } else if (hypothesis == VariantHypothesis.HETEROZYGOUS_INSERTION_INSERTION) {
            final int shorterLength = lengths.getLength1();
            String otherInsertion = recoverer.findInsertionBases(site, shorterLength, parameters.adaptiveMaximumLength(shorterLength), insertion.getBases());
            if (otherInsertion.isEmpty()) {
                otherInsertion = insertion.getBases().substring(0, Math.min(shorterLength, insertion.getLength()));
            }
            final String otherAlternate = referenceBase + otherInsertion;
            if (!otherAlternate.equals(alternate)) {
                alleles.setMultiAllelic(referenceBase, otherAlternate, alternate);
            }
        }
        return null;
    }

    private SkipReason resolveDeletion(final Site site, final ProbabilityBundle probabilities, final HypothesisScores scores,
                                       final String referenceBase, final Alleles alleles) {
        final VariantHypothesis hypothesis = scores.getBestHypothesis();
        final ResolvedLengths lengths = scores.getLengths(hypothesis);
        final int length = lengths.getLength2();
        if (hypothesis.isHeterozygousIndel() && length <= 0) {
            return SkipReason.NON_POSITIVE_HETEROZYGOUS_DELETION_LENGTH;
        }

        final RecoveredIndel deletion = recoverer.recoverDeletion(site, length);
        if (deletion.isEmpty()) {
            return null;
        }
        final String reference = referenceBase + deletion.getBases();
        alleles.set(reference, referenceBase);
        if (deletion.isInferred()) {
            alleles.lengthGuess = deletion.getLength();
        }

        if (hypothesis == VariantHypothesis.HETEROZYGOUS_BASE_AND_DELETION) {
            final char base = HypothesisScorer.mostProbableOf(probabilities, BaseChangeClass.BASE_AND_DELETION_CLASSES).getFirstBase();
            if (base != reference.charAt(0)) {
                alleles.setMultiAllelic(reference, referenceBase, base + reference.substring(1));
            }
        } else if (hypothesis == VariantHypothesis.HETEROZYGOUS_DELETION_DELETION) {
            final String otherAlternate = referenceBase + reference.substring(Math.min(lengths.getLength1() + 1, reference.length()));
            if (!otherAlternate.equals(referenceBase) && !reference.equals(referenceBase) && !reference.equals(otherAlternate)) {
                alleles.setMultiAllelic(reference, referenceBase, otherAlternate);
            }
        }
        return null;
    }

    private void resolveInsertionAndDeletion(final Site site, final HypothesisScores scores, final String referenceBase, final Alleles alleles) {
        final ResolvedLengths lengths = scores.getLengths(VariantHypothesis.HETEROZYGOUS_INSERTION_DELETION);
        final RecoveredIndel insertion = recoverer.recoverInsertion(site, lengths.getLength2());
        final RecoveredIndel deletion = recoverer.recoverDeletion(site, lengths.getLength1());
        if (insertion.isEmpty() || deletion.isEmpty()) {
            return;
        }
        final String reference = referenceBase + deletion.getBases();
        alleles.setMultiAllelic(reference, referenceBase, referenceBase + insertion.getBases() + deletion.getBases());
    }

    /**
     * Fraction of the reads at the site supporting the called alleles, clamped to [0, 1]. Which evidence counts as
     * support depends on the kind of call; indel support is read at the position following the site.
     */
    @VisibleForTesting
    static double alleleFrequency(final Site site, final VariantHypothesis hypothesis, final List<String> alternates, final double readDepth) {
        final EvidenceTensor tensor = site.getTensor();
        final int center = site.getCenterIndex();
        final int next = center + 1;
        double support = 0.0;
        if (hypothesis == VariantHypothesis.REFERENCE) {
            support = tensor.getBaseSupport(center, site.getReferenceBase(), EvidenceCategory.REFERENCE);
        } else if (hypothesis.isSnp()) {
            for (final String alternate : alternates) {
                final char base = alternate.charAt(0);
                support += tensor.getBaseSupport(center, base, EvidenceCategory.SNP) + tensor.getBaseSupport(center, base, EvidenceCategory.REFERENCE);
            }
        } else if (next < tensor.getNumberOfPositions()) {
            if (hypothesis.isInsertion()) {
                support = tensor.getCategorySupport(next, EvidenceCategory.INSERT) - tensor.getCategorySupport(next, EvidenceCategory.SNP);
            } else if (hypothesis.isDeletion()) {
                support = tensor.getCategorySupport(next, EvidenceCategory.DELETE);
            } else {
                support = tensor.getCategorySupport(next, EvidenceCategory.INSERT)
                        + tensor.getCategorySupport(next, EvidenceCategory.DELETE)
                        - tensor.getCategorySupport(next, EvidenceCategory.SNP);
            }
        }
        return Math.min(1.0, Math.max(0.0, support / readDepth));
    }

    private static double alleleFrequency(final Site site, final VariantHypothesis hypothesis, final Alleles alleles, final double readDepth) {
        return alleleFrequency(site, hypothesis, alleles.alternates, readDepth);
    }

    private static final class Alleles {
        private String reference = "";
        private List<String> alternates = Collections.emptyList();
        private GenotypeClass genotype;
        private int lengthGuess = 0;

        private Alleles(final GenotypeClass genotype) {
            this.genotype = genotype;
        }

        private void set(final String reference, final String alternate) {
            this.reference = reference;
            this.alternates = Collections.singletonList(alternate);
        }

        private void setMultiAllelic(final String reference, final String alternate1, final String alternate2) {
            this.reference = reference;
            this.alternates = new ArrayList<>(Arrays.asList(alternate1, alternate2));
            this.genotype = GenotypeClass.HETEROZYGOUS_MULTI_ALLELIC;
        }
    }
}
