package org.broadinstitute.tensorcaller.engine;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.List;

/**
 * Immutable snapshot of the classifier's output for one {@link EvidenceBatch}, one {@link ProbabilityBundle} per
 * site in batch order. Decoding always works from a snapshot, never from storage the classifier reuses between calls.
 */
public final class ClassifierPredictions {

    private final List<ProbabilityBundle> bundles;

    public ClassifierPredictions(final List<ProbabilityBundle> bundles) {
        this.bundles = ImmutableList.copyOf(Utils.nonNull(bundles, "bundles"));
    }

    public ProbabilityBundle get(final int siteIndex) {
        return bundles.get(Utils.validIndex(siteIndex, bundles.size()));
    }

    public int size() {
        return bundles.size();
    }

    public List<ProbabilityBundle> getBundles() {
        return bundles;
    }
}
