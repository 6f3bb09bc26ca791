package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

/**
 * The most probable pair of indel lengths under one {@link IndelLengthShape}, and the joint probability of that pair.
 *
 * Slot meaning depends on the shape: for homozygous shapes both slots hold the same length; for base-plus-indel
 * shapes {@code length1} is 0 and {@code length2} the indel length; for double insertions/deletions
 * {@code length1 <= length2}; for an insertion with a deletion {@code length1} is the deletion length and
 * {@code length2} the insertion length.
 */
public final class ResolvedLengths {

    private final int length1;
    private final int length2;
    private final double probability;

    public ResolvedLengths(final int length1, final int length2, final double probability) {
        this.length1 = length1;
        this.length2 = length2;
        this.probability = probability;
    }

    public int getLength1() {
        return length1;
    }

    public int getLength2() {
        return length2;
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public String toString() {
        return "ResolvedLengths{" + length1 + ", " + length2 + ", p=" + probability + "}";
    }
}
