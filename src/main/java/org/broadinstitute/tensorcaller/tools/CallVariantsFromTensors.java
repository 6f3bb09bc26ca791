package org.broadinstitute.tensorcaller.tools;

import htsjdk.samtools.SAMSequenceRecord;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.tensorcaller.cmdline.CommandLineProgram;
import org.broadinstitute.tensorcaller.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.tensorcaller.cmdline.programgroups.VariantCallingProgramGroup;
import org.broadinstitute.tensorcaller.engine.AlignmentSource;
import org.broadinstitute.tensorcaller.engine.BatchCallingPipeline;
import org.broadinstitute.tensorcaller.engine.BatchSource;
import org.broadinstitute.tensorcaller.engine.FastaReferenceSource;
import org.broadinstitute.tensorcaller.engine.PrecomputedPredictionClassifier;
import org.broadinstitute.tensorcaller.engine.ReferenceSource;
import org.broadinstitute.tensorcaller.engine.SamAlignmentSource;
import org.broadinstitute.tensorcaller.engine.TensorTextBatchSource;
import org.broadinstitute.tensorcaller.engine.VariantClassifier;
import org.broadinstitute.tensorcaller.engine.progressmeter.ProgressMeter;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.DecodingParameters;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.TensorCallerArgumentCollection;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.TensorCallerEngine;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.VariantRecordWriter;
import org.broadinstitute.tensorcaller.utils.config.ConfigFactory;
import org.broadinstitute.tensorcaller.utils.config.TensorCallerConfig;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes the output of a genotyping classifier into variant calls.
 *
 * <p>Candidate sites are read as evidence tensors, classified in batches, and every site whose most probable
 * hypothesis is a variant becomes one VCF record. Classification of a batch runs while the previous batch is being
 * decoded and written.</p>
 *
 * <p>Indel bases that do not fit in the evidence window are taken from the alignments when {@code --alignments} is
 * given, and deleted bases beyond the window from the reference when {@code --reference} is given. The reference
 * index also supplies the contig lines of the output header.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java -jar tensor-caller.jar \
 *     --tensor-file candidates.tensor.gz \
 *     --predictions predictions.tsv \
 *     --alignments sample.bam \
 *     -R reference.fasta \
 *     -O calls.vcf
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Decodes per-site genotyping classifier probabilities into variant calls, writing a VCF.",
        oneLineSummary = "Call variants from classifier output",
        programGroup = VariantCallingProgramGroup.class
)
public final class CallVariantsFromTensors extends CommandLineProgram {

    public static final String TENSOR_FILE_LONG_NAME = "tensor-file";
    public static final String PREDICTIONS_LONG_NAME = "predictions";
    public static final String THREADS_LONG_NAME = "threads";
    public static final String BATCH_SIZE_LONG_NAME = "batch-size";

    /**
     * Classifier threads used when reading from standard input without an explicit thread count.
     */
    static final int DEFAULT_STANDARD_INPUT_CLASSIFIER_THREADS = 4;

    @Argument(fullName = TENSOR_FILE_LONG_NAME,
            doc = "Candidate site tensors, plain or gzipped text, or " + TensorTextBatchSource.STANDARD_INPUT_NAME + " for standard input",
            optional = true)
    public String tensorFile = TensorTextBatchSource.STANDARD_INPUT_NAME;

    @Argument(fullName = PREDICTIONS_LONG_NAME, doc = "Classifier parameters: per-site probabilities computed by the model")
    public String predictionsFile;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output VCF file")
    public String outputFile;

    @Argument(fullName = StandardArgumentDefinitions.ALIGNMENTS_LONG_NAME, shortName = StandardArgumentDefinitions.ALIGNMENTS_SHORT_NAME,
            doc = "Indexed BAM/CRAM the tensors were built from, used to recover long indels", optional = true)
    public String alignmentsFile = null;

    @Argument(fullName = StandardArgumentDefinitions.REFERENCE_LONG_NAME, shortName = StandardArgumentDefinitions.REFERENCE_SHORT_NAME,
            doc = "Indexed reference FASTA, used for contig header lines and deleted bases", optional = true)
    public String referenceFile = null;

    /**
     * One thread is kept for decoding; the remainder, at least one, is offered to the classifier.
     */
    @Argument(fullName = THREADS_LONG_NAME, doc = "Number of threads", optional = true, minValue = 1)
    public Integer threads = null;

    @Argument(fullName = BATCH_SIZE_LONG_NAME, doc = "Number of sites classified together; defaults to the configured batch size",
            optional = true, minValue = 1)
    public Integer batchSize = null;

    @ArgumentCollection
    public TensorCallerArgumentCollection callerArgs = new TensorCallerArgumentCollection();

    private TensorCallerConfig config;
    private DecodingParameters parameters;
    private AlignmentSource alignments;
    private ReferenceSource reference;
    private BatchSource batchSource;
    private VariantClassifier classifier;
    private VariantRecordWriter writer;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (callerArgs.qualityThreshold != null && callerArgs.qualityThreshold < 0) {
            errors.add("--" + TensorCallerArgumentCollection.QUALITY_THRESHOLD_LONG_NAME + " must not be negative");
        }
        if (callerArgs.sampleName == null || callerArgs.sampleName.isEmpty()) {
            errors.add("--" + TensorCallerArgumentCollection.SAMPLE_NAME_LONG_NAME + " must not be empty");
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected void onStartup() {
        config = ConfigFactory.getInstance().getTensorCallerConfig();
        parameters = DecodingParameters.fromConfig(config);

        reference = referenceFile == null ? ReferenceSource.EMPTY : new FastaReferenceSource(Paths.get(referenceFile));
        alignments = alignmentsFile == null ? AlignmentSource.EMPTY
                : new SamAlignmentSource(Paths.get(alignmentsFile),
                        referenceFile == null ? null : Paths.get(referenceFile),
                        config.pileup_flag_filter(),
                        config.pileup_max_depth());
        if (alignmentsFile == null) {
            logger.warn("No alignments given: indels longer than the evidence window are inferred from the tensors only");
        }

        classifier = new PrecomputedPredictionClassifier();
        final Integer classifierThreads = classifierThreads(threads, tensorFile);
        if (classifierThreads != null) {
            classifier.setNumberOfInferenceThreads(classifierThreads);
        }
        classifier.restoreParameters(Paths.get(predictionsFile));

        batchSource = new TensorTextBatchSource(tensorFile, batchSize != null ? batchSize : config.prediction_batch_size(),
                parameters.getWindowWidth());
        writer = new VariantRecordWriter(Paths.get(outputFile));
    }

    /**
     * @return the number of threads to offer the classifier, or null to leave its default
     */
    static Integer classifierThreads(final Integer threads, final String tensorFile) {
        if (threads == null) {
            return TensorTextBatchSource.isStandardInput(tensorFile) ? DEFAULT_STANDARD_INPUT_CLASSIFIER_THREADS : null;
        }
        return Math.max(1, threads - 1);
    }

    @Override
    protected Object doWork() {
        writer.writeHeader(callerArgs.sampleName, headerContigs());

        final TensorCallerEngine engine = new TensorCallerEngine(callerArgs, parameters, alignments, reference, writer);
        final ProgressMeter progressMeter = new ProgressMeter(config.progress_seconds_between_updates());
        logger.info("Calling variants ...");
        try (final BatchCallingPipeline pipeline = new BatchCallingPipeline(batchSource, classifier, engine, progressMeter)) {
            pipeline.run();
        }
        logger.info(String.format("%d sites decoded, %d called, %d skipped; %d lines written to %s",
                engine.getSitesDecoded(), engine.getSitesCalled(), engine.getSitesSkipped(), writer.getRecordsWritten(), outputFile));
        return engine.getSitesCalled();
    }

    private List<SAMSequenceRecord> headerContigs() {
        return reference instanceof FastaReferenceSource
                ? ((FastaReferenceSource) reference).getIndexedContigs()
                : Collections.emptyList();
    }

    @Override
    protected void onShutdown() {
        // close in reverse order of opening; a failed startup leaves later fields null
        if (writer != null) {
            writer.close();
        }
        if (batchSource != null) {
            batchSource.close();
        }
        if (classifier != null) {
            classifier.close();
        }
        if (alignments != null) {
            alignments.close();
        }
        if (reference != null) {
            reference.close();
        }
    }
}
