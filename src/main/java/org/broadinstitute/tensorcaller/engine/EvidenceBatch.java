package org.broadinstitute.tensorcaller.engine;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.List;

/**
 * A batch of candidate sites handed to the classifier in one call. The last batch of a stream is flagged with
 * {@link #isEndOfStream()}; it may be empty.
 */
public final class EvidenceBatch {

    private final long batchIndex;
    private final List<Site> sites;
    private final boolean endOfStream;

    public EvidenceBatch(final long batchIndex, final List<Site> sites, final boolean endOfStream) {
        Utils.validateArg(batchIndex >= 0, "batchIndex must be non-negative");
        this.batchIndex = batchIndex;
        this.sites = ImmutableList.copyOf(Utils.nonNull(sites, "sites"));
        this.endOfStream = endOfStream;
    }

    /**
     * @return 0-based arrival order of this batch in its stream
     */
    public long getBatchIndex() {
        return batchIndex;
    }

    public List<Site> getSites() {
        return sites;
    }

    public int size() {
        return sites.size();
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }

    @Override
    public String toString() {
        return "EvidenceBatch{index=" + batchIndex + ", size=" + sites.size() + (endOfStream ? ", end" : "") + "}";
    }
}
