package org.broadinstitute.tensorcaller.utils.genotyper;

/**
 * Coarse zygosity of a call. The first three constants are the classes a genotyping classifier scores, in the order
 * of its output vector; {@link #HETEROZYGOUS_MULTI_ALLELIC} only exists on the output side, for calls with two
 * distinct alternate alleles.
 */
public enum GenotypeClass {
    HOMOZYGOUS_REFERENCE("0/0", 0),
    HOMOZYGOUS_VARIANT("1/1", 1),
    HETEROZYGOUS_VARIANT("0/1", 2),
    HETEROZYGOUS_MULTI_ALLELIC("1/2", 2);

    /**
     * Number of genotype classes in a classifier's output vector.
     */
    public static final int NUMBER_OF_CLASSIFIER_CLASSES = 3;

    private final String genotypeString;
    private final int classifierIndex;

    GenotypeClass(final String genotypeString, final int classifierIndex) {
        this.genotypeString = genotypeString;
        this.classifierIndex = classifierIndex;
    }

    /**
     * @return the unphased VCF GT value for this class
     */
    public String getGenotypeString() {
        return genotypeString;
    }

    /**
     * @return index of the probability scored for this class in a classifier's genotype vector. Multi-allelic
     * heterozygous calls are scored as heterozygous.
     */
    public int getClassifierIndex() {
        return classifierIndex;
    }

    /**
     * Maps an unphased GT string of the form {@code a/b} back to its coarse class.
     *
     * @return the class, or {@code null} if the string is not a diploid genotype over alleles 0..2
     */
    public static GenotypeClass fromGenotypeString(final String genotypeString) {
        if (genotypeString == null || genotypeString.length() != 3 || genotypeString.charAt(1) != '/') {
            return null;
        }
        int allele1 = Character.digit(genotypeString.charAt(0), 10);
        int allele2 = Character.digit(genotypeString.charAt(2), 10);
        if (allele1 < 0 || allele2 < 0) {
            return null;
        }
        if (allele1 > allele2) {
            final int tmp = allele1;
            allele1 = allele2;
            allele2 = tmp;
        }
        if (allele1 == 0 && allele2 == 0) {
            return HOMOZYGOUS_REFERENCE;
        } else if (allele1 == allele2) {
            return HOMOZYGOUS_VARIANT;
        } else if (allele1 == 0) {
            return HETEROZYGOUS_VARIANT;
        } else {
            return HETEROZYGOUS_MULTI_ALLELIC;
        }
    }
}
