package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.barclay.argparser.Advanced;
import org.broadinstitute.barclay.argparser.Argument;

import java.io.Serializable;

/**
 * Arguments controlling which calls the decoding engine emits and how they are annotated.
 */
public class TensorCallerArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String QUALITY_THRESHOLD_LONG_NAME = "quality-threshold";
    public static final String SAMPLE_NAME_LONG_NAME = "sample-name";
    public static final String SHOW_REFERENCE_LONG_NAME = "show-reference";
    public static final String DEBUG_LONG_NAME = "debug";
    public static final String USE_ALIGNMENTS_FOR_ALL_INDELS_LONG_NAME = "use-alignments-for-all-indels";

    public static final String DEFAULT_SAMPLE_NAME = "SAMPLE";

    /**
     * Calls whose quality reaches this value are marked PASS, the others LowQual. Without a threshold every call
     * carries a missing filter value.
     */
    @Argument(fullName = QUALITY_THRESHOLD_LONG_NAME, doc = "Minimum quality for a call to be marked PASS", optional = true)
    public Integer qualityThreshold = null;

    @Argument(fullName = SAMPLE_NAME_LONG_NAME, doc = "Sample name written to the header column", optional = true)
    public String sampleName = DEFAULT_SAMPLE_NAME;

    @Argument(fullName = SHOW_REFERENCE_LONG_NAME, doc = "Emit homozygous-reference calls too", optional = true)
    public boolean showReference = false;

    /**
     * In debug mode no records are written. Every decoded site produces a line with the raw classifier outputs and
     * the reason it was or was not called.
     */
    @Advanced
    @Argument(fullName = DEBUG_LONG_NAME, doc = "Write classifier outputs and call decisions instead of records", optional = true)
    public boolean debug = false;

    @Advanced
    @Argument(fullName = USE_ALIGNMENTS_FOR_ALL_INDELS_LONG_NAME,
            doc = "Take the bases of every indel from the alignments instead of the evidence window", optional = true)
    public boolean useAlignmentsForAllIndels = false;
}
