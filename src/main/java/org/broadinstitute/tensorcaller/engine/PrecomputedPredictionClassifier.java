package org.broadinstitute.tensorcaller.engine;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link VariantClassifier} serving probabilities that an external model computed ahead of time.
 *
 * {@link #restoreParameters} loads a tab-separated file with one line per site:
 * <pre>
 *     contig:position:referenceWindow  baseChange  genotype  variantLength1  variantLength2
 * </pre>
 * where each of the last four fields is a comma-separated probability vector (21, 3, and two vectors of equal odd
 * length). Sites are matched on their descriptor. Blank lines and lines starting with {@code #} are ignored.
 */
public final class PrecomputedPredictionClassifier implements VariantClassifier {
    private static final Logger logger = LogManager.getLogger(PrecomputedPredictionClassifier.class);

    private static final int NUMBER_OF_FIELDS = 5;

    private Map<String, ProbabilityBundle> predictionsBySite = null;
    private String sourceName = null;

    @Override
    public void restoreParameters(final Path parameters) {
        Utils.nonNull(parameters, "parameters");
        final String source = parameters.toString();
        final Map<String, ProbabilityBundle> predictions = new HashMap<>();
        try (final BufferedReader reader = IOUtil.openFileForBufferedReading(parameters)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line) || line.startsWith("#")) {
                    continue;
                }
                final String[] fields = line.split("\t");
                if (fields.length != NUMBER_OF_FIELDS) {
                    throw new UserException.MalformedFile(source, String.format("line %d has %d fields, expected %d", lineNumber, fields.length, NUMBER_OF_FIELDS));
                }
                try {
                    predictions.put(normalizeDescriptor(fields[0]), new ProbabilityBundle(
                            parseVector(fields[1]), parseVector(fields[2]), parseVector(fields[3]), parseVector(fields[4])));
                } catch (final IllegalArgumentException e) {
                    throw new UserException.MalformedFile(source, "line " + lineNumber, e);
                }
            }
        } catch (final IOException | RuntimeIOException e) {
            throw new UserException.CouldNotReadInputFile(parameters, e);
        }
        this.predictionsBySite = predictions;
        this.sourceName = source;
        logger.info("Loaded predictions for {} sites from {}", predictions.size(), source);
    }

    // reference windows are matched regardless of case, as Site upper-cases them
    private static String normalizeDescriptor(final String descriptor) {
        final int windowSeparator = descriptor.lastIndexOf(':');
        return descriptor.substring(0, windowSeparator + 1) + descriptor.substring(windowSeparator + 1).toUpperCase();
    }

    private static double[] parseVector(final String field) {
        final String[] values = StringUtils.split(field, ',');
        final double[] vector = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            // NumberFormatException is an IllegalArgumentException
            vector[i] = Double.parseDouble(values[i].trim());
        }
        return vector;
    }

    @Override
    public ClassifierPredictions predict(final EvidenceBatch batch) {
        Utils.nonNull(batch, "batch");
        Utils.validate(predictionsBySite != null, "restoreParameters must be called before predict");
        final List<ProbabilityBundle> bundles = new ArrayList<>(batch.size());
        for (final Site site : batch.getSites()) {
            final ProbabilityBundle bundle = predictionsBySite.get(site.getDescriptor());
            if (bundle == null) {
                throw new UserException.MalformedFile(sourceName, "no predictions for site " + site.getDescriptor());
            }
            bundles.add(bundle);
        }
        return new ClassifierPredictions(bundles);
    }
}
