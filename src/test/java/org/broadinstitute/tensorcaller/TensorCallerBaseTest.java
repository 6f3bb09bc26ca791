package org.broadinstitute.tensorcaller;

import org.broadinstitute.tensorcaller.engine.EvidenceTensor;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.utils.BaseUtils;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it forces the locale and builds the sites and classifier outputs the decoding tests work with.
 */
public abstract class TensorCallerBaseTest {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    public static final String TEST_CONTIG = "chr1";

    /** 0-based position of the test sites, 1-based 1000 */
    public static final int TEST_POSITION = 999;

    public static final int FLANK = 16;
    public static final int WINDOW_WIDTH = 2 * FLANK + 1;
    public static final int CENTER = FLANK;
    public static final int MAX_LENGTH = 16;

    public static final String LEFT_FLANK = "TTGACCTGAACGTGCA";
    public static final String RIGHT_FLANK = "GATTACAGGCTTAACC";

    /**
     * @return a reference window of the default width with {@code base} at its center
     */
    public static String window(final char base) {
        return LEFT_FLANK + base + RIGHT_FLANK;
    }

    public static Site site(final String window, final EvidenceTensor tensor) {
        return new Site(TEST_CONTIG, TEST_POSITION, window, tensor);
    }

    public static Site site(final char referenceBase, final EvidenceTensor tensor) {
        return site(window(referenceBase), tensor);
    }

    /**
     * @return a length vector over {@code [-MAX_LENGTH, MAX_LENGTH]} filled with {@code background}
     */
    public static double[] lengthVector(final double background) {
        final double[] vector = new double[2 * MAX_LENGTH + 1];
        Arrays.fill(vector, background);
        return vector;
    }

    /**
     * Sets the probability of {@code signedLength} in a length vector centered on index {@code MAX_LENGTH}.
     */
    public static double[] withLength(final double[] vector, final int signedLength, final double probability) {
        vector[vector.length / 2 + signedLength] = probability;
        return vector;
    }

    public static double[] baseChangeVector(final double background, final BaseChangeClass best, final double probability) {
        final double[] vector = new double[BaseChangeClass.NUMBER_OF_CLASSES];
        Arrays.fill(vector, background);
        vector[best.ordinal()] = probability;
        return vector;
    }

    public static double[] genotypeVector(final double homozygousReference, final double homozygousVariant, final double heterozygous) {
        final double[] vector = new double[GenotypeClass.NUMBER_OF_CLASSIFIER_CLASSES];
        vector[GenotypeClass.HOMOZYGOUS_REFERENCE.getClassifierIndex()] = homozygousReference;
        vector[GenotypeClass.HOMOZYGOUS_VARIANT.getClassifierIndex()] = homozygousVariant;
        vector[GenotypeClass.HETEROZYGOUS_VARIANT.getClassifierIndex()] = heterozygous;
        return vector;
    }

    public static ProbabilityBundle bundle(final double[] baseChange, final double[] genotype, final double[] length1, final double[] length2) {
        return new ProbabilityBundle(baseChange, genotype, length1, length2);
    }

    /**
     * @return classifier output favoring no indel on either haplotype, with the given base change and genotype
     */
    public static ProbabilityBundle noIndelBundle(final BaseChangeClass baseChange, final double[] genotype) {
        return bundle(baseChangeVector(0.001, baseChange, 0.9), genotype,
                withLength(lengthVector(0.001), 0, 0.95),
                withLength(lengthVector(0.001), 0, 0.95));
    }

    public static String formatVector(final double[] values) {
        return Arrays.stream(values).mapToObj(Double::toString).collect(Collectors.joining(","));
    }

    /**
     * Builds evidence tensors one base-category cell at a time.
     */
    public static final class TensorBuilder {
        private final int width;
        private final int channels;
        private final float[] values;

        public TensorBuilder() {
            this(WINDOW_WIDTH, EvidenceTensor.UNSTRANDED_CHANNELS);
        }

        public TensorBuilder(final int width, final int channels) {
            this.width = width;
            this.channels = channels;
            this.values = new float[width * channels * EvidenceCategory.NUMBER_OF_CATEGORIES];
        }

        public TensorBuilder set(final int position, final int channel, final EvidenceCategory category, final float value) {
            values[(position * channels + channel) * EvidenceCategory.NUMBER_OF_CATEGORIES + category.ordinal()] = value;
            return this;
        }

        public TensorBuilder set(final int position, final char base, final EvidenceCategory category, final float value) {
            return set(position, BaseUtils.simpleBaseToBaseIndex(base), category, value);
        }

        /**
         * Writes {@code bases} into the insert category at the positions following the center.
         */
        public TensorBuilder insertion(final String bases, final float value) {
            for (int i = 0; i < bases.length(); i++) {
                set(CENTER + 1 + i, bases.charAt(i), EvidenceCategory.INSERT, value);
            }
            return this;
        }

        public float[] values() {
            return Arrays.copyOf(values, values.length);
        }

        public EvidenceTensor build() {
            return new EvidenceTensor(width, channels, values);
        }

        /**
         * @return the tensor values as the whitespace-separated tail of a tensor text line
         */
        public String toText() {
            return IntStream.range(0, values.length)
                    .mapToObj(i -> Float.toString(values[i]))
                    .collect(Collectors.joining(" "));
        }
    }

    /**
     * Creates an empty temp file that is deleted on exit.
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException ex) {
            throw new TensorCallerException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Creates a temp directory whose contents are deleted on exit.
     */
    public static Path createTempDir(final String prefix) {
        try {
            final Path dir = Files.createTempDirectory(prefix);
            dir.toFile().deleteOnExit();
            return dir;
        } catch (final IOException ex) {
            throw new TensorCallerException("Cannot create temp directory: " + ex.getMessage(), ex);
        }
    }
}
