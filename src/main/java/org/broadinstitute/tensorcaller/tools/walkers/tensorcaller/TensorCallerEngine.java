package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.engine.AlignmentSource;
import org.broadinstitute.tensorcaller.engine.BatchDecoder;
import org.broadinstitute.tensorcaller.engine.ClassifierPredictions;
import org.broadinstitute.tensorcaller.engine.EvidenceBatch;
import org.broadinstitute.tensorcaller.engine.ReferenceSource;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.List;

/**
 * Decodes classified batches into calls and hands them to a {@link VariantRecordWriter}, or writes one trace line per
 * site instead when running in debug mode.
 *
 * Batches must be decoded one at a time; the pipeline guarantees this.
 */
public final class TensorCallerEngine implements BatchDecoder {
    private static final Logger logger = LogManager.getLogger(TensorCallerEngine.class);

    private final TensorCallerArgumentCollection callerArgs;
    private final VariantRecordComposer composer;
    private final VariantRecordWriter writer;

    private long sitesDecoded = 0L;
    private long sitesCalled = 0L;
    private long sitesSkipped = 0L;

    public TensorCallerEngine(final TensorCallerArgumentCollection callerArgs,
                              final DecodingParameters parameters,
                              final AlignmentSource alignments,
                              final ReferenceSource reference,
                              final VariantRecordWriter writer) {
        this(callerArgs,
             new VariantRecordComposer(callerArgs, parameters,
                     new IndelAlleleRecoverer(parameters, alignments, reference, callerArgs.useAlignmentsForAllIndels)),
             writer);
    }

    public TensorCallerEngine(final TensorCallerArgumentCollection callerArgs,
                              final VariantRecordComposer composer,
                              final VariantRecordWriter writer) {
        this.callerArgs = Utils.nonNull(callerArgs, "callerArgs");
        this.composer = Utils.nonNull(composer, "composer");
        this.writer = Utils.nonNull(writer, "writer");
    }

    @Override
    public void decode(final EvidenceBatch batch, final ClassifierPredictions predictions) {
        Utils.nonNull(batch, "batch");
        Utils.nonNull(predictions, "predictions");
        if (predictions.size() != batch.size()) {
            throw new TensorCallerException.InconsistentBatchShape(batch.size(), predictions.size());
        }

        final List<Site> sites = batch.getSites();
        for (int i = 0; i < sites.size(); i++) {
            final CallOutcome outcome = composer.compose(sites.get(i), predictions.get(i));
            sitesDecoded++;
            if (callerArgs.debug) {
                writer.writeTrace(outcome);
            } else if (outcome.isCalled()) {
                writer.write(outcome.getRecord());
            }
            if (outcome.isCalled()) {
                sitesCalled++;
            } else {
                sitesSkipped++;
                logger.debug("Skipping {}: {}", outcome.getSite(), outcome.getSkipReason().getMessage());
            }
        }
        writer.flush();
    }

    public long getSitesDecoded() {
        return sitesDecoded;
    }

    public long getSitesCalled() {
        return sitesCalled;
    }

    public long getSitesSkipped() {
        return sitesSkipped;
    }
}
