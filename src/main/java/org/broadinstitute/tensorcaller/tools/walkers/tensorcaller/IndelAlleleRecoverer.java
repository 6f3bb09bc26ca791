package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.engine.AlignmentSource;
import org.broadinstitute.tensorcaller.engine.EvidenceTensor;
import org.broadinstitute.tensorcaller.engine.ReferenceSource;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a predicted indel length into the literal inserted or deleted bases.
 *
 * Short indels are read straight from the evidence window: inserted bases are the most supported base of the insert
 * category at each following position, deleted bases are the reference bases that follow the site. An indel at least
 * as long as the inference threshold cannot be measured inside the window, so the alignments are searched for a long
 * indel at the site first; failing that, the indel is extended position by position for as long as the window shows
 * enough indel support, and the result is flagged as inferred. With {@code useAlignmentsForAllIndels} every indel is
 * taken from the alignments.
 */
public final class IndelAlleleRecoverer {
    private static final Logger logger = LogManager.getLogger(IndelAlleleRecoverer.class);

    private final DecodingParameters parameters;
    private final AlignmentSource alignments;
    private final ReferenceSource reference;
    private final boolean useAlignmentsForAllIndels;

    public IndelAlleleRecoverer(final DecodingParameters parameters,
                                final AlignmentSource alignments,
                                final ReferenceSource reference,
                                final boolean useAlignmentsForAllIndels) {
        this.parameters = Utils.nonNull(parameters, "parameters");
        this.alignments = Utils.nonNull(alignments, "alignments");
        this.reference = Utils.nonNull(reference, "reference");
        this.useAlignmentsForAllIndels = useAlignmentsForAllIndels;
    }

    public RecoveredIndel recoverInsertion(final Site site, final int length) {
        Utils.nonNull(site, "site");
        if (useAlignmentsForAllIndels) {
            return new RecoveredIndel(findInsertionBases(site, length, parameters.adaptiveMaximumLength(length), ""), false);
        }
        if (length < parameters.getMinimumLengthThatNeedsInference()) {
            return new RecoveredIndel(insertionBasesFromEvidence(site, length), false);
        }
        final String observed = findInsertionBases(site, parameters.getMinimumLengthThatNeedsInference(),
                parameters.getMaximumLengthThatNeedsInference(), "");
        if (!observed.isEmpty()) {
            return new RecoveredIndel(observed, false);
        }
        final String inferred = inferInsertionBases(site);
        logger.debug("No long insertion found in the alignments at {}; inferred {} inserted bases", site, inferred.length());
        return new RecoveredIndel(inferred, true);
    }

    public RecoveredIndel recoverDeletion(final Site site, final int length) {
        Utils.nonNull(site, "site");
        if (useAlignmentsForAllIndels) {
            return new RecoveredIndel(findDeletionBases(site, length, parameters.adaptiveMaximumLength(length)), false);
        }
        if (length < parameters.getMinimumLengthThatNeedsInference()) {
            return new RecoveredIndel(deletedReferenceBases(site, length), false);
        }
        final String observed = findDeletionBases(site, parameters.getMinimumLengthThatNeedsInference(),
                parameters.getMaximumLengthThatNeedsInference());
        if (!observed.isEmpty()) {
            return new RecoveredIndel(observed, false);
        }
        final int inferredLength = inferDeletionLength(site);
        logger.debug("No long deletion found in the alignments at {}; inferred a deletion of {} bases", site, inferredLength);
        return new RecoveredIndel(deletedReferenceBases(site, inferredLength), true);
    }

    /**
     * Most frequent inserted sequence among the reads at the site whose insertion length lies in
     * {@code [minimumLength, maximumLength]}, skipping insertions of exactly {@code basesToIgnore}.
     * Ties go to the sequence seen first.
     *
     * @return the inserted bases, or an empty string if no read qualifies
     */
    public String findInsertionBases(final Site site, final int minimumLength, final int maximumLength, final String basesToIgnore) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String signature : signaturesAt(site)) {
            final IndelSignature indel = IndelSignature.parse(signature);
            if (indel == null || !indel.isInsertion()) {
                continue;
            }
            if (indel.getLength() >= minimumLength && indel.getLength() <= maximumLength && !indel.getBases().equals(basesToIgnore)) {
                counts.merge(indel.getBases(), 1, Integer::sum);
            }
        }
        return mostFrequent(counts);
    }

    /**
     * Most frequent deleted sequence among the reads at the site whose deletion length lies in
     * {@code [minimumLength, maximumLength]}. Ties go to the sequence seen first.
     *
     * @return the deleted reference bases, or an empty string if no read qualifies
     */
    public String findDeletionBases(final Site site, final int minimumLength, final int maximumLength) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        final Map<Integer, String> basesByLength = new HashMap<>();
        for (final String signature : signaturesAt(site)) {
            final IndelSignature indel = IndelSignature.parse(signature);
            if (indel == null || !indel.isDeletion()) {
                continue;
            }
            if (indel.getLength() >= minimumLength && indel.getLength() <= maximumLength) {
                final String bases = basesByLength.computeIfAbsent(indel.getLength(), length -> deletedReferenceBases(site, length));
                if (!bases.isEmpty()) {
                    counts.merge(bases, 1, Integer::sum);
                }
            }
        }
        return mostFrequent(counts);
    }

    /**
     * Reference bases deleted by a deletion of {@code length} at the site: the bases right after the site, taken
     * from the evidence window when they fit inside it and from the reference otherwise.
     */
    @VisibleForTesting
    String deletedReferenceBases(final Site site, final int length) {
        if (length <= 0) {
            return "";
        }
        final int start = site.getCenterIndex() + 1;
        final String window = site.getReferenceWindow();
        if (start + length <= window.length()) {
            return window.substring(start, start + length);
        }
        return reference.getBases(site.getContig(), site.getPosition() + 1, site.getPosition() + 1 + length);
    }

    @VisibleForTesting
    String insertionBasesFromEvidence(final Site site, final int length) {
        final EvidenceTensor tensor = site.getTensor();
        final int center = site.getCenterIndex();
        final StringBuilder bases = new StringBuilder();
        for (int position = center + 1; position <= center + length && position < tensor.getNumberOfPositions(); position++) {
            bases.append(tensor.getMostSupportedBase(position, EvidenceCategory.INSERT));
        }
        return bases.toString();
    }

    @VisibleForTesting
    String inferInsertionBases(final Site site) {
        final EvidenceTensor tensor = site.getTensor();
        final StringBuilder bases = new StringBuilder();
        final int center = site.getCenterIndex();
        for (int position = center + 1; position <= lastInferablePosition(site); position++) {
            if (!continuesInferredIndel(tensor, center, position, EvidenceCategory.INSERT)) {
                break;
            }
            bases.append(tensor.getMostSupportedBase(position, EvidenceCategory.INSERT));
        }
        return bases.toString();
    }

    @VisibleForTesting
    int inferDeletionLength(final Site site) {
        final EvidenceTensor tensor = site.getTensor();
        final int center = site.getCenterIndex();
        int length = 0;
        for (int position = center + 1; position <= lastInferablePosition(site); position++) {
            if (!continuesInferredIndel(tensor, center, position, EvidenceCategory.DELETE)) {
                break;
            }
            length++;
        }
        return length;
    }

    // An inferred indel always covers the positions up to the inference threshold, and beyond them as long as the
    // indel support stays above the configured fraction of the reference support.
    private boolean continuesInferredIndel(final EvidenceTensor tensor, final int center, final int position, final EvidenceCategory category) {
        return position < center + parameters.getMinimumLengthThatNeedsInference()
                || tensor.getCategorySupport(position, category)
                    >= parameters.getInferenceSupportFraction() * tensor.getCategorySupport(position, EvidenceCategory.REFERENCE);
    }

    private static int lastInferablePosition(final Site site) {
        return Math.min(2 * site.getCenterIndex(), site.getTensor().getNumberOfPositions() - 1);
    }

    private List<String> signaturesAt(final Site site) {
        return alignments.getIndelSignatures(site.getContig(), site.getPosition(), site.getPosition() + 1);
    }

    private static String mostFrequent(final Map<String, Integer> counts) {
        String best = "";
        int bestCount = 0;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
