package org.broadinstitute.tensorcaller.utils.genotyper;

/**
 * The per-nucleotide read-support categories stacked along the last axis of an evidence tensor, in tensor order.
 */
public enum EvidenceCategory {
    /** reads matching the reference at this position */
    REFERENCE,
    /** reads carrying an insertion at this position */
    INSERT,
    /** reads carrying a deletion at this position */
    DELETE,
    /** reads carrying a mismatching base at this position */
    SNP;

    public static final int NUMBER_OF_CATEGORIES = values().length;
}
