package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.utils.Utils;

/**
 * What decoding one site produced: either a {@link VariantRecord} or the reason there is none.
 */
public final class CallOutcome {

    public static final String REFERENCE_TRACE_REASON = "Reference";
    public static final String CALLED_TRACE_REASON = "Normal output";

    private final Site site;
    private final ProbabilityBundle probabilities;
    private final VariantHypothesis hypothesis;
    private final VariantRecord record;
    private final SkipReason skipReason;

    private CallOutcome(final Site site, final ProbabilityBundle probabilities, final VariantHypothesis hypothesis,
                        final VariantRecord record, final SkipReason skipReason) {
        this.site = Utils.nonNull(site, "site");
        this.probabilities = Utils.nonNull(probabilities, "probabilities");
        this.hypothesis = Utils.nonNull(hypothesis, "hypothesis");
        this.record = record;
        this.skipReason = skipReason;
    }

    public static CallOutcome called(final Site site, final ProbabilityBundle probabilities, final VariantHypothesis hypothesis, final VariantRecord record) {
        return new CallOutcome(site, probabilities, hypothesis, Utils.nonNull(record, "record"), null);
    }

    public static CallOutcome skipped(final Site site, final ProbabilityBundle probabilities, final VariantHypothesis hypothesis, final SkipReason reason) {
        return new CallOutcome(site, probabilities, hypothesis, null, Utils.nonNull(reason, "reason"));
    }

    public Site getSite() {
        return site;
    }

    public ProbabilityBundle getProbabilities() {
        return probabilities;
    }

    public VariantHypothesis getHypothesis() {
        return hypothesis;
    }

    public boolean isCalled() {
        return record != null;
    }

    public boolean isReference() {
        return hypothesis == VariantHypothesis.REFERENCE;
    }

    /**
     * @return the record, or {@code null} for a skipped site
     */
    public VariantRecord getRecord() {
        return record;
    }

    /**
     * @return the skip reason, or {@code null} for a called site
     */
    public SkipReason getSkipReason() {
        return skipReason;
    }

    public boolean isTraced() {
        return skipReason == null || skipReason.isTraced();
    }

    /**
     * @return the last column of this site's debug trace line
     */
    public String getTraceReason() {
        if (skipReason != null) {
            return skipReason.getMessage();
        }
        return isReference() ? REFERENCE_TRACE_REASON : CALLED_TRACE_REASON;
    }

    @Override
    public String toString() {
        return site + " " + hypothesis + (record != null ? " " + record : " skipped: " + skipReason);
    }
}
