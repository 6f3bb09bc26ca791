package org.broadinstitute.tensorcaller.utils;

import org.apache.commons.math3.util.FastMath;

/**
 * QualityUtils is a static class with some utility methods for turning call probabilities into quality scores.
 *
 * The definition of a Phred-scaled quality Q in terms of an error probability P(error) is:
 * Q = -10 log_10 P(error)
 */
public final class QualityUtils {

    /**
     * Added to both sides of an odds ratio so that probabilities of exactly 0 or 1 stay finite.
     */
    public static final double PROBABILITY_EPSILON = 1e-300;

    /**
     * Offset added to the Phred-scaled odds before squaring them into a call quality.
     */
    public static final double CALL_QUALITY_OFFSET = 33.0;

    /**
     * Private constructor.  No instantiating this class!
     */
    private QualityUtils() {}

    /**
     * Phred-scaled odds of a call with probability {@code prob} being wrong: {@code -10 log10((1 - p) / p)}, with
     * {@link #PROBABILITY_EPSILON} added to numerator and denominator.
     *
     * @param prob probability that the call is right
     * @return a value that grows with {@code prob}; negative when {@code prob < 0.5}
     */
    public static double phredScaleOddsOfError(final double prob) {
        return -10.0 * FastMath.log10((1.0 - prob + PROBABILITY_EPSILON) / (prob + PROBABILITY_EPSILON));
    }

    /**
     * Quality of a call with probability {@code prob}: the offset Phred-scaled odds, squared and rounded.
     * Never negative. Non-decreasing only above the probability where the offset odds cross zero (about 5e-4);
     * below it the square grows again as {@code prob} falls.
     */
    public static int callQuality(final double prob) {
        final double offsetOdds = phredScaleOddsOfError(prob) + CALL_QUALITY_OFFSET;
        return (int) Math.round(offsetOdds * offsetOdds);
    }
}
