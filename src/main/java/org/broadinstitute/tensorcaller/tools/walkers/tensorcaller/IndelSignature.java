package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.utils.Utils;

/**
 * An indel observed in one read at a pileup column, parsed from its text signature: the read's base at the column,
 * {@code +} or {@code -}, the indel length in decimal, then the inserted bases (insertions) or one placeholder per
 * deleted base (deletions). For example {@code A+3TGA} or {@code C-2NN}.
 */
public final class IndelSignature {

    public enum Type {
        INSERTION('+'),
        DELETION('-');

        private final char marker;

        Type(final char marker) {
            this.marker = marker;
        }

        public char getMarker() {
            return marker;
        }
    }

    // The smallest meaningful signature is a base, a marker, one digit and one base, e.g. A+1C.
    private static final int MINIMUM_SIGNATURE_LENGTH = 4;

    // Longer runs of digits cannot come from a real read and would overflow an int.
    private static final int MAXIMUM_LENGTH_DIGITS = 9;

    private final Type type;
    private final int length;
    private final String bases;

    private IndelSignature(final Type type, final int length, final String bases) {
        this.type = type;
        this.length = length;
        this.bases = bases;
    }

    /**
     * @return the parsed signature, or {@code null} if {@code signature} does not describe an indel
     */
    public static IndelSignature parse(final String signature) {
        if (signature == null || signature.length() < MINIMUM_SIGNATURE_LENGTH) {
            return null;
        }
        final Type type;
        switch (signature.charAt(1)) {
            case '+':
                type = Type.INSERTION;
                break;
            case '-':
                type = Type.DELETION;
                break;
            default:
                return null;
        }

        int index = 2;
        int length = 0;
        while (index < signature.length() && Character.isDigit(signature.charAt(index))) {
            if (index - 2 >= MAXIMUM_LENGTH_DIGITS) {
                return null;
            }
            length = length * 10 + Character.digit(signature.charAt(index), 10);
            index++;
        }
        if (index == 2 || index == signature.length()) {
            // no digits, or nothing after them
            return null;
        }
        return new IndelSignature(type, length, signature.substring(index).toUpperCase());
    }

    public Type getType() {
        return type;
    }

    public int getLength() {
        return length;
    }

    /**
     * @return the inserted bases, upper-cased; for deletions, the placeholders that followed the length
     */
    public String getBases() {
        return bases;
    }

    public boolean isInsertion() {
        return type == Type.INSERTION;
    }

    public boolean isDeletion() {
        return type == Type.DELETION;
    }

    @Override
    public String toString() {
        return Utils.join("", type.getMarker(), length, bases);
    }
}
