package org.broadinstitute.tensorcaller.utils;

import java.util.Arrays;

/**
 * BaseUtils contains some basic utilities for manipulating nucleotides.
 */
public final class BaseUtils {

    public enum Base {
        A ('A'),
        C ('C'),
        G ('G'),
        T ('T');

        public final char base;

        Base(final char base) {
            this.base = base;
        }
    }

    public static final char[] BASE_CHARS = {'A', 'C', 'G', 'T'};

    private static final int[] baseIndexMap = new int[256];
    static {
        Arrays.fill(baseIndexMap, -1);
        baseIndexMap['A'] = Base.A.ordinal();
        baseIndexMap['a'] = Base.A.ordinal();
        baseIndexMap['C'] = Base.C.ordinal();
        baseIndexMap['c'] = Base.C.ordinal();
        baseIndexMap['G'] = Base.G.ordinal();
        baseIndexMap['g'] = Base.G.ordinal();
        baseIndexMap['T'] = Base.T.ordinal();
        baseIndexMap['t'] = Base.T.ordinal();
    }

    /**
     * Private constructor.  No instantiating this class!
     */
    private BaseUtils() {}

    /**
     * Converts a simple base to a base index
     *
     * @param base [AaCcGgTt]
     * @return 0, 1, 2, 3, or -1 if the base can't be understood
     */
    public static int simpleBaseToBaseIndex(final char base) {
        return base < 256 ? baseIndexMap[base] : -1;
    }

    /**
     * Converts a base index to a base.
     *
     * @param baseIndex 0, 1, 2, 3
     * @return A, C, G, T
     */
    public static char baseIndexToSimpleBase(final int baseIndex) {
        Utils.validIndex(baseIndex, BASE_CHARS.length);
        return BASE_CHARS[baseIndex];
    }

    public static boolean isRegularBase(final char base) {
        return simpleBaseToBaseIndex(base) != -1;
    }
}
