package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

/**
 * Why a decoded site produced no record.
 */
public enum SkipReason {
    /** the reference hypothesis won and reference calls were not requested; not traced */
    REFERENCE_CALL_NOT_REQUESTED("Reference call not requested", false),
    ZERO_DEPTH("Read Depth is zero", true),
    NON_POSITIVE_HETEROZYGOUS_INSERTION_LENGTH("is hetero insertion and # of insertion bases predicted is less than 0", true),
    NON_POSITIVE_HETEROZYGOUS_DELETION_LENGTH("is hetero deletion and # of deletion bases predicted is less than 0", true),
    NO_ALLELES("no reference base / alternate base prediction", true);

    private final String message;
    private final boolean traced;

    SkipReason(final String message, final boolean traced) {
        this.message = message;
        this.traced = traced;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return whether a skipped site gets a line in debug mode
     */
    public boolean isTraced() {
        return traced;
    }
}
