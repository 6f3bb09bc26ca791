package org.broadinstitute.tensorcaller.engine;

import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

import java.util.Arrays;

/**
 * The classifier's four output vectors for one site:
 * <ul>
 *     <li>base-change class probabilities, indexed by {@link BaseChangeClass}</li>
 *     <li>genotype class probabilities, indexed by {@link GenotypeClass#getClassifierIndex()}</li>
 *     <li>two signed variant-length distributions over {@code [-maxLength, +maxLength]}, one per haplotype.
 *     Negative lengths are deletions, positive lengths insertions and 0 means no indel.</li>
 * </ul>
 * Values are taken as given; nothing here checks or restores normalization. Instances are immutable.
 */
public final class ProbabilityBundle {

    private final double[] baseChangeProbabilities;
    private final double[] genotypeProbabilities;
    private final double[] variantLengthProbabilities1;
    private final double[] variantLengthProbabilities2;
    private final int maximumVariantLength;

    public ProbabilityBundle(final double[] baseChangeProbabilities,
                             final double[] genotypeProbabilities,
                             final double[] variantLengthProbabilities1,
                             final double[] variantLengthProbabilities2) {
        Utils.nonNull(baseChangeProbabilities, "baseChangeProbabilities");
        Utils.nonNull(genotypeProbabilities, "genotypeProbabilities");
        Utils.nonNull(variantLengthProbabilities1, "variantLengthProbabilities1");
        Utils.nonNull(variantLengthProbabilities2, "variantLengthProbabilities2");
        Utils.validateArg(baseChangeProbabilities.length == BaseChangeClass.NUMBER_OF_CLASSES,
                () -> "expected " + BaseChangeClass.NUMBER_OF_CLASSES + " base-change probabilities but found " + baseChangeProbabilities.length);
        Utils.validateArg(genotypeProbabilities.length == GenotypeClass.NUMBER_OF_CLASSIFIER_CLASSES,
                () -> "expected " + GenotypeClass.NUMBER_OF_CLASSIFIER_CLASSES + " genotype probabilities but found " + genotypeProbabilities.length);
        Utils.validateArg(variantLengthProbabilities1.length % 2 == 1 && variantLengthProbabilities1.length >= 3,
                () -> "variant length vectors must have odd length of at least 3 but found " + variantLengthProbabilities1.length);
        Utils.validateArg(variantLengthProbabilities1.length == variantLengthProbabilities2.length,
                "the two variant length vectors must have the same length");

        this.baseChangeProbabilities = Arrays.copyOf(baseChangeProbabilities, baseChangeProbabilities.length);
        this.genotypeProbabilities = Arrays.copyOf(genotypeProbabilities, genotypeProbabilities.length);
        this.variantLengthProbabilities1 = Arrays.copyOf(variantLengthProbabilities1, variantLengthProbabilities1.length);
        this.variantLengthProbabilities2 = Arrays.copyOf(variantLengthProbabilities2, variantLengthProbabilities2.length);
        this.maximumVariantLength = variantLengthProbabilities1.length / 2;
    }

    public double getBaseChangeProbability(final BaseChangeClass baseChange) {
        return baseChangeProbabilities[baseChange.ordinal()];
    }

    /**
     * @return the probability of the classifier-side class of {@code genotype}; multi-allelic heterozygous reads the
     * heterozygous entry
     */
    public double getGenotypeProbability(final GenotypeClass genotype) {
        return genotypeProbabilities[genotype.getClassifierIndex()];
    }

    /**
     * @param signedLength in {@code [-maxLength, maxLength]}; negative for deletions
     */
    public double getVariantLengthProbability1(final int signedLength) {
        return variantLengthProbabilities1[indexOf(signedLength)];
    }

    /**
     * @param signedLength in {@code [-maxLength, maxLength]}; negative for deletions
     */
    public double getVariantLengthProbability2(final int signedLength) {
        return variantLengthProbabilities2[indexOf(signedLength)];
    }

    private int indexOf(final int signedLength) {
        Utils.validateArg(Math.abs(signedLength) <= maximumVariantLength,
                () -> "variant length " + signedLength + " is outside [-" + maximumVariantLength + ", " + maximumVariantLength + "]");
        return signedLength + maximumVariantLength;
    }

    /**
     * @return the largest indel length the length vectors can express; also the index of length 0 in them
     */
    public int getMaximumVariantLength() {
        return maximumVariantLength;
    }

    public double[] getBaseChangeProbabilities() {
        return Arrays.copyOf(baseChangeProbabilities, baseChangeProbabilities.length);
    }

    public double[] getGenotypeProbabilities() {
        return Arrays.copyOf(genotypeProbabilities, genotypeProbabilities.length);
    }

    public double[] getVariantLengthProbabilities1() {
        return Arrays.copyOf(variantLengthProbabilities1, variantLengthProbabilities1.length);
    }

    public double[] getVariantLengthProbabilities2() {
        return Arrays.copyOf(variantLengthProbabilities2, variantLengthProbabilities2.length);
    }
}
