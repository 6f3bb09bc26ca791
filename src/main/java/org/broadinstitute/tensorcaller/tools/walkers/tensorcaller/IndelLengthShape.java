package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

/**
 * The indel-length hypotheses searched by {@link IndelLengthResolver}.
 */
public enum IndelLengthShape {
    /** both haplotypes carry an insertion of the same length */
    HOMOZYGOUS_INSERTION,
    /** both haplotypes carry a deletion of the same length */
    HOMOZYGOUS_DELETION,
    /** one haplotype carries a base, the other an insertion */
    HETEROZYGOUS_BASE_AND_INSERTION,
    /** one haplotype carries a base, the other a deletion */
    HETEROZYGOUS_BASE_AND_DELETION,
    /** each haplotype carries an insertion; lengths may be equal */
    HETEROZYGOUS_INSERTION_INSERTION,
    /** each haplotype carries a deletion; lengths differ */
    HETEROZYGOUS_DELETION_DELETION,
    /** one haplotype carries an insertion, the other a deletion */
    HETEROZYGOUS_INSERTION_DELETION
}
