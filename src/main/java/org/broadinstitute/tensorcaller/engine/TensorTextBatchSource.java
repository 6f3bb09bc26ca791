package org.broadinstitute.tensorcaller.engine;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads candidate sites from tensor text, one site per line:
 * <pre>
 *     contig position referenceWindow v1 v2 ... vN
 * </pre>
 * separated by whitespace, where {@code position} is the 1-based window center and {@code v1..vN} is the evidence
 * tensor flattened position-major, then nucleotide channel, then evidence category. The number of channels (4 or 8)
 * follows from N and the window width, which must match the width the classifier was trained on. Blank lines and
 * lines starting with {@code #} are ignored.
 *
 * The input may be a plain or gzipped file, or standard input when named {@value #STANDARD_INPUT_NAME} or
 * {@value #STANDARD_INPUT_ALIAS}.
 */
public final class TensorTextBatchSource implements BatchSource {
    private static final Logger logger = LogManager.getLogger(TensorTextBatchSource.class);

    public static final String STANDARD_INPUT_NAME = "PIPE";
    public static final String STANDARD_INPUT_ALIAS = "-";

    private static final int NUMBER_OF_LEADING_FIELDS = 3;

    private final String sourceName;
    private final int batchSize;
    private final int windowWidth;
    private final BufferedReader reader;

    private String lookahead;
    private long lineNumber = 0L;
    private long batchesProduced = 0L;
    private boolean endOfStreamReturned = false;

    /**
     * @param tensorFile path of the tensor text, or a standard input name
     * @param batchSize maximum number of sites per batch
     * @param windowWidth number of reference bases every site window must have
     */
    public TensorTextBatchSource(final String tensorFile, final int batchSize, final int windowWidth) {
        this(openReader(Utils.nonEmpty(tensorFile, "tensorFile")), tensorFile, batchSize, windowWidth);
    }

    public TensorTextBatchSource(final Reader reader, final String sourceName, final int batchSize, final int windowWidth) {
        Utils.nonNull(reader, "reader");
        Utils.validateArg(batchSize > 0, "batchSize must be positive");
        Utils.validateArg(windowWidth > 0 && windowWidth % 2 == 1, "windowWidth must be a positive odd number");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.sourceName = Utils.nonNull(sourceName, "sourceName");
        this.batchSize = batchSize;
        this.windowWidth = windowWidth;
        this.lookahead = readDataLine();
    }

    public static boolean isStandardInput(final String tensorFile) {
        return STANDARD_INPUT_NAME.equals(tensorFile) || STANDARD_INPUT_ALIAS.equals(tensorFile);
    }

    private static BufferedReader openReader(final String tensorFile) {
        if (isStandardInput(tensorFile)) {
            logger.info("Reading tensors from standard input");
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        try {
            return IOUtil.openFileForBufferedReading(Paths.get(tensorFile));
        } catch (final RuntimeIOException e) {
            throw new UserException.CouldNotReadInputFile(Paths.get(tensorFile), e);
        }
    }

    @Override
    public EvidenceBatch nextBatch() {
        Utils.validate(!endOfStreamReturned, () -> "the end of " + sourceName + " was already reached");
        final List<Site> sites = new ArrayList<>(batchSize);
        while (sites.size() < batchSize && lookahead != null) {
            sites.add(parseSite(lookahead));
            lookahead = readDataLine();
        }
        endOfStreamReturned = lookahead == null;
        return new EvidenceBatch(batchesProduced++, sites, endOfStreamReturned);
    }

    private String readDataLine() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!StringUtils.isBlank(line) && !line.startsWith("#")) {
                    return line;
                }
            }
            return null;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(sourceName, "read failed after line " + lineNumber, e);
        }
    }

    private Site parseSite(final String line) {
        final String[] fields = StringUtils.split(line);
        if (fields.length <= NUMBER_OF_LEADING_FIELDS) {
            throw malformed("expected contig, position, reference window and tensor values");
        }
        final String window = fields[2];
        if (window.length() != windowWidth) {
            throw malformed(String.format("reference window has %d bases, expected %d", window.length(), windowWidth));
        }
        final int numberOfValues = fields.length - NUMBER_OF_LEADING_FIELDS;
        final int valuesPerChannel = window.length() * EvidenceCategory.NUMBER_OF_CATEGORIES;
        final int numberOfChannels = numberOfValues / valuesPerChannel;
        if (numberOfValues % valuesPerChannel != 0
                || (numberOfChannels != EvidenceTensor.UNSTRANDED_CHANNELS && numberOfChannels != EvidenceTensor.STRANDED_CHANNELS)) {
            throw malformed(String.format("%d tensor values do not fit a window of width %d with 4 or 8 channels", numberOfValues, window.length()));
        }

        final float[] values = new float[numberOfValues];
        for (int i = 0; i < numberOfValues; i++) {
            try {
                values[i] = Float.parseFloat(fields[NUMBER_OF_LEADING_FIELDS + i]);
            } catch (final NumberFormatException e) {
                throw malformed("tensor value is not a number: " + fields[NUMBER_OF_LEADING_FIELDS + i]);
            }
        }

        try {
            final EvidenceTensor tensor = new EvidenceTensor(window.length(), numberOfChannels, values);
            return Site.fromDescriptor(fields[0] + ":" + fields[1] + ":" + window, tensor);
        } catch (final UserException.BadInput | IllegalArgumentException e) {
            throw new UserException.MalformedFile(sourceName, "line " + lineNumber, e);
        }
    }

    private UserException.MalformedFile malformed(final String message) {
        return new UserException.MalformedFile(sourceName, "line " + lineNumber + ": " + message);
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(sourceName, "could not be closed", e);
        }
    }
}
