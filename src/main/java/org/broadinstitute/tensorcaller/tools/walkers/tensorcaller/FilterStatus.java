package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import htsjdk.variant.vcf.VCFConstants;

/**
 * FILTER column value of a call.
 */
public enum FilterStatus {
    PASS(VCFConstants.PASSES_FILTERS_v4, "All filters passed"),
    LOW_QUALITY("LowQual", "Confidence in this variant being real is below calling threshold."),
    UNFILTERED(VCFConstants.UNFILTERED, null);

    private final String value;
    private final String description;

    FilterStatus(final String value, final String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the header description, or {@code null} for {@link #UNFILTERED}, which has no header line
     */
    public String getDescription() {
        return description;
    }

    /**
     * @param qualityThreshold minimum quality for {@link #PASS}; {@code null} when calls are not filtered
     */
    public static FilterStatus fromQuality(final int quality, final Integer qualityThreshold) {
        if (qualityThreshold == null) {
            return UNFILTERED;
        }
        return quality >= qualityThreshold ? PASS : LOW_QUALITY;
    }
}
