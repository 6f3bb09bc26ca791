package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.config.TensorCallerConfig;

/**
 * Fixed numeric parameters of the decoding engine. Values normally come from {@link TensorCallerConfig}; tests build
 * them directly.
 */
public final class DecodingParameters {

    public static final int DEFAULT_FLANKING_BASE_NUMBER = 16;
    public static final int DEFAULT_MINIMUM_LENGTH_THAT_NEEDS_INFERENCE = 16;
    public static final int DEFAULT_MAXIMUM_LENGTH_THAT_NEEDS_INFERENCE = 50;
    public static final double DEFAULT_INFERENCE_SUPPORT_FRACTION = 0.125;

    public static final DecodingParameters DEFAULT = new DecodingParameters(
            DEFAULT_FLANKING_BASE_NUMBER,
            DEFAULT_MINIMUM_LENGTH_THAT_NEEDS_INFERENCE,
            DEFAULT_MAXIMUM_LENGTH_THAT_NEEDS_INFERENCE,
            DEFAULT_INFERENCE_SUPPORT_FRACTION);

    private final int flankingBaseNumber;
    private final int minimumLengthThatNeedsInference;
    private final int maximumLengthThatNeedsInference;
    private final double inferenceSupportFraction;

    /**
     * @param flankingBaseNumber bases on each side of the site in the evidence window
     * @param minimumLengthThatNeedsInference indels at least this long are not read directly from the evidence window
     * @param maximumLengthThatNeedsInference longest indel accepted from the alignments for a long indel
     * @param inferenceSupportFraction indel support, relative to reference support, needed to extend an inferred indel
     */
    public DecodingParameters(final int flankingBaseNumber,
                              final int minimumLengthThatNeedsInference,
                              final int maximumLengthThatNeedsInference,
                              final double inferenceSupportFraction) {
        Utils.validateArg(flankingBaseNumber > 0, "flankingBaseNumber must be positive");
        Utils.validateArg(minimumLengthThatNeedsInference > 0, "minimumLengthThatNeedsInference must be positive");
        Utils.validateArg(maximumLengthThatNeedsInference >= minimumLengthThatNeedsInference,
                "maximumLengthThatNeedsInference must not be smaller than minimumLengthThatNeedsInference");
        Utils.validateArg(inferenceSupportFraction >= 0.0, "inferenceSupportFraction must not be negative");
        this.flankingBaseNumber = flankingBaseNumber;
        this.minimumLengthThatNeedsInference = minimumLengthThatNeedsInference;
        this.maximumLengthThatNeedsInference = maximumLengthThatNeedsInference;
        this.inferenceSupportFraction = inferenceSupportFraction;
    }

    public static DecodingParameters fromConfig(final TensorCallerConfig config) {
        Utils.nonNull(config, "config");
        return new DecodingParameters(
                config.flanking_base_number(),
                config.minimum_variant_length_that_needs_inference(),
                config.maximum_variant_length_that_needs_inference(),
                config.inferred_indel_length_minimum_allele_frequency());
    }

    public int getFlankingBaseNumber() {
        return flankingBaseNumber;
    }

    public int getWindowWidth() {
        return 2 * flankingBaseNumber + 1;
    }

    public int getMinimumLengthThatNeedsInference() {
        return minimumLengthThatNeedsInference;
    }

    public int getMaximumLengthThatNeedsInference() {
        return maximumLengthThatNeedsInference;
    }

    public double getInferenceSupportFraction() {
        return inferenceSupportFraction;
    }

    /**
     * Upper bound on the indel length to accept from the alignments when the predicted length is {@code length}:
     * lengths too long for the classifier to express may be anything up to the inference ceiling.
     */
    public int adaptiveMaximumLength(final int length) {
        return length >= minimumLengthThatNeedsInference ? maximumLengthThatNeedsInference : length;
    }

    @Override
    public String toString() {
        return String.format("DecodingParameters{flank=%d, inferenceThreshold=%d, inferenceCeiling=%d, supportFraction=%s}",
                flankingBaseNumber, minimumLengthThatNeedsInference, maximumLengthThatNeedsInference, inferenceSupportFraction);
    }
}
