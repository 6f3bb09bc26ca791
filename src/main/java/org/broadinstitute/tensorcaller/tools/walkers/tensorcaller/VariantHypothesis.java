package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

/**
 * The competing explanations of a site. Declaration order is the order in which ties between equally probable
 * hypotheses are broken: the earlier one wins.
 */
public enum VariantHypothesis {
    REFERENCE(GenotypeClass.HOMOZYGOUS_REFERENCE, null),
    HOMOZYGOUS_SNP(GenotypeClass.HOMOZYGOUS_VARIANT, null),
    HETEROZYGOUS_SNP(GenotypeClass.HETEROZYGOUS_VARIANT, null),
    HOMOZYGOUS_INSERTION(GenotypeClass.HOMOZYGOUS_VARIANT, IndelLengthShape.HOMOZYGOUS_INSERTION),
    HOMOZYGOUS_DELETION(GenotypeClass.HOMOZYGOUS_VARIANT, IndelLengthShape.HOMOZYGOUS_DELETION),
    HETEROZYGOUS_BASE_AND_INSERTION(GenotypeClass.HETEROZYGOUS_VARIANT, IndelLengthShape.HETEROZYGOUS_BASE_AND_INSERTION),
    HETEROZYGOUS_INSERTION_INSERTION(GenotypeClass.HETEROZYGOUS_VARIANT, IndelLengthShape.HETEROZYGOUS_INSERTION_INSERTION),
    HETEROZYGOUS_BASE_AND_DELETION(GenotypeClass.HETEROZYGOUS_VARIANT, IndelLengthShape.HETEROZYGOUS_BASE_AND_DELETION),
    HETEROZYGOUS_DELETION_DELETION(GenotypeClass.HETEROZYGOUS_VARIANT, IndelLengthShape.HETEROZYGOUS_DELETION_DELETION),
    HETEROZYGOUS_INSERTION_DELETION(GenotypeClass.HETEROZYGOUS_MULTI_ALLELIC, IndelLengthShape.HETEROZYGOUS_INSERTION_DELETION);

    private final GenotypeClass genotype;
    private final IndelLengthShape lengthShape;

    VariantHypothesis(final GenotypeClass genotype, final IndelLengthShape lengthShape) {
        this.genotype = genotype;
        this.lengthShape = lengthShape;
    }

    /**
     * @return the genotype a call under this hypothesis starts with, before any multi-allelic split
     */
    public GenotypeClass getGenotype() {
        return genotype;
    }

    /**
     * @return the indel length search used to score this hypothesis, or {@code null} for hypotheses without an indel
     */
    public IndelLengthShape getLengthShape() {
        return lengthShape;
    }

    public boolean isSnp() {
        return this == HOMOZYGOUS_SNP || this == HETEROZYGOUS_SNP;
    }

    public boolean isInsertion() {
        return this == HOMOZYGOUS_INSERTION || this == HETEROZYGOUS_BASE_AND_INSERTION || this == HETEROZYGOUS_INSERTION_INSERTION;
    }

    public boolean isDeletion() {
        return this == HOMOZYGOUS_DELETION || this == HETEROZYGOUS_BASE_AND_DELETION || this == HETEROZYGOUS_DELETION_DELETION;
    }

    public boolean isHeterozygousIndel() {
        return lengthShape != null && this != HOMOZYGOUS_INSERTION && this != HOMOZYGOUS_DELETION;
    }
}
