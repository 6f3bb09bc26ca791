package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFContigHeaderLine;
import htsjdk.variant.vcf.VCFFilterHeaderLine;
import htsjdk.variant.vcf.VCFFormatHeaderLine;
import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFHeaderLine;
import htsjdk.variant.vcf.VCFHeaderLineCount;
import htsjdk.variant.vcf.VCFHeaderLineType;
import htsjdk.variant.vcf.VCFHeaderVersion;
import htsjdk.variant.vcf.VCFInfoHeaderLine;
import htsjdk.variant.vcf.VCFSimpleHeaderLine;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes calls as VCF text: a header, then one data line per {@link VariantRecord}. In debug mode the same stream
 * carries one trace line per decoded site instead.
 *
 * Not thread-safe; a single decoding thread owns the writer.
 */
public final class VariantRecordWriter implements Closeable {

    public static final String FORMAT_FIELD = Utils.join(VCFConstants.GENOTYPE_FIELD_SEPARATOR,
            VCFConstants.GENOTYPE_KEY, VCFConstants.GENOTYPE_QUALITY_KEY, VCFConstants.DEPTH_KEY, VCFConstants.ALLELE_FREQUENCY_KEY);

    public static final String SV_TYPE_KEY = "SVTYPE";

    private final Writer writer;
    private final String outputName;

    private long recordsWritten = 0;

    public VariantRecordWriter(final Path outputPath) {
        this(openForWriting(outputPath), outputPath.toString());
    }

    public VariantRecordWriter(final Writer writer, final String outputName) {
        this.writer = Utils.nonNull(writer, "writer");
        this.outputName = Utils.nonNull(outputName, "outputName");
    }

    private static Writer openForWriting(final Path outputPath) {
        Utils.nonNull(outputPath, "outputPath");
        try {
            return Files.newBufferedWriter(outputPath);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputPath, e);
        }
    }

    /**
     * The fixed header lines, in output order. Contig lines are added by {@link #writeHeader}.
     */
    public static List<VCFHeaderLine> standardHeaderLines() {
        final List<VCFHeaderLine> lines = new ArrayList<>();
        lines.add(new VCFHeaderLine(VCFHeaderVersion.VCF4_1.getFormatString(), VCFHeaderVersion.VCF4_1.getVersionString()));
        lines.add(new VCFFilterHeaderLine(FilterStatus.PASS.getValue(), FilterStatus.PASS.getDescription()));
        lines.add(new VCFFilterHeaderLine(FilterStatus.LOW_QUALITY.getValue(), FilterStatus.LOW_QUALITY.getDescription()));
        lines.add(new VCFSimpleHeaderLine(VCFConstants.ALT_HEADER_KEY, "DEL", "Deletion"));
        lines.add(new VCFSimpleHeaderLine(VCFConstants.ALT_HEADER_KEY, "INS", "Insertion of novel sequence"));
        lines.add(new VCFInfoHeaderLine(SV_TYPE_KEY, 1, VCFHeaderLineType.String, "Type of structural variant"));
        lines.add(new VCFInfoHeaderLine(VariantRecord.LENGTH_GUESS_KEY, VCFHeaderLineCount.UNBOUNDED, VCFHeaderLineType.Integer, "Best guess of the indel length"));
        lines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_KEY, 1, VCFHeaderLineType.String, "Genotype"));
        lines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_QUALITY_KEY, 1, VCFHeaderLineType.Integer, "Genotype Quality"));
        lines.add(new VCFFormatHeaderLine(VCFConstants.DEPTH_KEY, 1, VCFHeaderLineType.Integer, "Read Depth"));
        lines.add(new VCFFormatHeaderLine(VCFConstants.ALLELE_FREQUENCY_KEY, 1, VCFHeaderLineType.Float, "Estimated allele frequency in the range (0,1)"));
        return lines;
    }

    /**
     * @param contigs contigs of the reference, in index order; may be empty
     */
    public void writeHeader(final String sampleName, final List<SAMSequenceRecord> contigs) {
        Utils.nonEmpty(sampleName, "sampleName");
        Utils.nonNull(contigs, "contigs");
        for (final VCFHeaderLine line : standardHeaderLines()) {
            writeLine(VCFHeader.METADATA_INDICATOR + line.toString());
        }
        for (final SAMSequenceRecord contig : contigs) {
            final Map<String, String> fields = new LinkedHashMap<>();
            fields.put("ID", contig.getSequenceName());
            fields.put("length", Integer.toString(contig.getSequenceLength()));
            writeLine(VCFHeader.METADATA_INDICATOR + new VCFContigHeaderLine(fields, contig.getSequenceIndex()).toString());
        }
        final List<String> columns = Arrays.stream(VCFHeader.HEADER_FIELDS.values())
                .map(VCFHeader.HEADER_FIELDS::toString)
                .collect(Collectors.toList());
        columns.add("FORMAT");
        columns.add(sampleName);
        writeLine(VCFHeader.HEADER_INDICATOR + String.join(VCFConstants.FIELD_SEPARATOR, columns));
    }

    public void write(final VariantRecord record) {
        Utils.nonNull(record, "record");
        writeLine(formatRecord(record));
        recordsWritten++;
    }

    /**
     * Writes the debug line for a decoded site, if it has one.
     */
    public void writeTrace(final CallOutcome outcome) {
        Utils.nonNull(outcome, "outcome");
        if (outcome.isTraced()) {
            writeLine(formatTrace(outcome));
        }
    }

    public static String formatRecord(final VariantRecord record) {
        return String.format("%s\t%d\t.\t%s\t%s\t%d\t%s\t%s\t%s\t%s:%d:%d:%.4f",
                record.getContig(),
                record.getStart(),
                record.getReferenceAllele(),
                record.getAlternateAlleleField(),
                record.getQuality(),
                record.getFilter().getValue(),
                record.getInfoField(),
                FORMAT_FIELD,
                record.getGenotype().getGenotypeString(),
                record.getQuality(),
                record.getDepth(),
                record.getAlleleFrequency());
    }

    public static String formatTrace(final CallOutcome outcome) {
        final ProbabilityBundle probabilities = outcome.getProbabilities();
        return Utils.join(VCFConstants.FIELD_SEPARATOR,
                outcome.getSite().getContig(),
                outcome.getSite().getStart(),
                formatProbabilities(probabilities.getBaseChangeProbabilities()),
                formatProbabilities(probabilities.getGenotypeProbabilities()),
                formatProbabilities(probabilities.getVariantLengthProbabilities1()),
                formatProbabilities(probabilities.getVariantLengthProbabilities2()),
                outcome.getTraceReason());
    }

    private static String formatProbabilities(final double[] probabilities) {
        return Arrays.stream(probabilities)
                .mapToObj(p -> String.format("%.8f", p))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public void flush() {
        try {
            writer.flush();
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputName, "the output could not be flushed", e);
        }
    }

    private void writeLine(final String line) {
        try {
            writer.write(line);
            writer.write('\n');
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputName, "a line could not be written", e);
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputName, "the output could not be closed", e);
        }
    }
}
