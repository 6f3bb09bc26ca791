package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.utils.Utils;

/**
 * The literal bases of an inserted or deleted allele, and whether its length was extrapolated from the evidence
 * rather than observed.
 */
public final class RecoveredIndel {

    private final String bases;
    private final boolean inferred;

    public RecoveredIndel(final String bases, final boolean inferred) {
        this.bases = Utils.nonNull(bases, "bases");
        this.inferred = inferred;
    }

    public String getBases() {
        return bases;
    }

    public int getLength() {
        return bases.length();
    }

    public boolean isInferred() {
        return inferred;
    }

    public boolean isEmpty() {
        return bases.isEmpty();
    }

    @Override
    public String toString() {
        return "RecoveredIndel{" + bases + (inferred ? ", inferred" : "") + "}";
    }
}
