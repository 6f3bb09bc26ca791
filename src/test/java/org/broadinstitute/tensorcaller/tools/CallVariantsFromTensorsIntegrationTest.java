package org.broadinstitute.tensorcaller.tools;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.tensorcaller.CommandLineProgramTest;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.testutils.ArgumentsBuilder;
import org.broadinstitute.tensorcaller.testutils.SyntheticGenome;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.CallOutcome;
import org.broadinstitute.tensorcaller.tools.walkers.tensorcaller.TensorCallerArgumentCollection;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class CallVariantsFromTensorsIntegrationTest extends CommandLineProgramTest {

    // 0-based window centers
    private static final int SNP_SITE = 49;
    private static final int INSERTION_SITE = 99;
    private static final int REFERENCE_SITE = 149;

    private static final String LONG_INSERTION = "GATTACAGATTACAGATTAC";

    private Path directory;
    private SyntheticGenome genome;
    private Path fasta;
    private Path bam;
    private File tensors;
    private File predictions;
    private char snpAlternate;

    @BeforeClass
    public void writeInputs() throws IOException {
        directory = createTempDir("callVariants");
        genome = new SyntheticGenome(directory, 2024);
        fasta = genome.writeFasta();
        // every read carries a 20 base insertion after the insertion site; the classifier can only say "16 or more"
        bam = genome.writeBam("reads", genome.readsWithInsertion("read", 5, 81, INSERTION_SITE + 1, LONG_INSERTION, 30));

        final char snpReference = genome.baseAt(SNP_SITE);
        snpAlternate = snpReference == 'A' ? 'C' : 'A';
        final char insertionReference = genome.baseAt(INSERTION_SITE);
        final char referenceSiteBase = genome.baseAt(REFERENCE_SITE);

        final List<String> tensorLines = new ArrayList<>();
        tensorLines.add(tensorLine(SNP_SITE, new TensorBuilder()
                .set(CENTER, snpReference, EvidenceCategory.REFERENCE, 6)
                .set(CENTER, snpAlternate, EvidenceCategory.SNP, 6)));
        tensorLines.add(tensorLine(INSERTION_SITE, new TensorBuilder()
                .set(CENTER, insertionReference, EvidenceCategory.REFERENCE, 10)
                .insertion(LONG_INSERTION.substring(0, FLANK), 8)));
        tensorLines.add(tensorLine(REFERENCE_SITE, new TensorBuilder()
                .set(CENTER, referenceSiteBase, EvidenceCategory.REFERENCE, 12)));
        tensors = directory.resolve("candidates.tensor").toFile();
        Files.write(tensors.toPath(), tensorLines, StandardCharsets.UTF_8);

        final List<String> predictionLines = new ArrayList<>();
        predictionLines.add(predictionLine(SNP_SITE,
                noIndelBundle(BaseChangeClass.fromAlleles(String.valueOf(snpReference), String.valueOf(snpReference), String.valueOf(snpAlternate)),
                        genotypeVector(0.05, 0.05, 0.9))));
        predictionLines.add(predictionLine(INSERTION_SITE,
                bundle(baseChangeVector(0.001, BaseChangeClass.InsIns, 0.9), genotypeVector(0.05, 0.9, 0.05),
                        withLength(lengthVector(0.001), MAX_LENGTH, 0.9), withLength(lengthVector(0.001), MAX_LENGTH, 0.9))));
        predictionLines.add(predictionLine(REFERENCE_SITE,
                noIndelBundle(BaseChangeClass.homozygousClassOf(referenceSiteBase), genotypeVector(0.9, 0.05, 0.05))));
        predictions = directory.resolve("predictions.tsv").toFile();
        Files.write(predictions.toPath(), predictionLines, StandardCharsets.UTF_8);
    }

    private String tensorLine(final int center, final TensorBuilder tensor) {
        return String.join(" ", SyntheticGenome.CONTIG, Integer.toString(center + 1), genome.window(center, FLANK), tensor.toText());
    }

    private String predictionLine(final int center, final ProbabilityBundle bundle) {
        return String.join("\t", SyntheticGenome.CONTIG + ":" + (center + 1) + ":" + genome.window(center, FLANK),
                formatVector(bundle.getBaseChangeProbabilities()),
                formatVector(bundle.getGenotypeProbabilities()),
                formatVector(bundle.getVariantLengthProbabilities1()),
                formatVector(bundle.getVariantLengthProbabilities2()));
    }

    private ArgumentsBuilder baseArgs(final File output) {
        return new ArgumentsBuilder()
                .add(CallVariantsFromTensors.TENSOR_FILE_LONG_NAME, tensors)
                .add(CallVariantsFromTensors.PREDICTIONS_LONG_NAME, predictions)
                .add("-O", output)
                .add("-R", fasta.toFile())
                .add("-A", bam.toFile());
    }

    private static List<String> dataLines(final File vcf) throws IOException {
        return Files.readAllLines(vcf.toPath()).stream().filter(line -> !line.startsWith("#")).collect(Collectors.toList());
    }

    @Test
    public void testCallsVariants() throws IOException {
        final File output = directory.resolve("calls.vcf").toFile();
        final Object sitesCalled = runCommandLine(baseArgs(output)
                .add(TensorCallerArgumentCollection.SAMPLE_NAME_LONG_NAME, "NA12878")
                .add(CallVariantsFromTensors.BATCH_SIZE_LONG_NAME, 2)
                .getArgsList());
        Assert.assertEquals(sitesCalled, 2L);

        final List<String> lines = Files.readAllLines(output.toPath());
        Assert.assertEquals(lines.get(0), "##fileformat=VCFv4.1");
        Assert.assertTrue(lines.contains("##contig=<ID=chr1,length=200>"), lines.toString());
        Assert.assertTrue(lines.get(lines.indexOf("##contig=<ID=chr1,length=200>") + 1).startsWith("#CHROM"));
        Assert.assertTrue(lines.stream().anyMatch(line -> line.startsWith("#CHROM") && line.endsWith("\tFORMAT\tNA12878")));

        final List<String> records = dataLines(output);
        Assert.assertEquals(records.size(), 2, records.toString());

        final String[] snp = records.get(0).split("\t");
        Assert.assertEquals(snp[0], SyntheticGenome.CONTIG);
        Assert.assertEquals(snp[1], Integer.toString(SNP_SITE + 1));
        Assert.assertEquals(snp[3], String.valueOf(genome.baseAt(SNP_SITE)));
        Assert.assertEquals(snp[4], String.valueOf(snpAlternate));
        Assert.assertEquals(snp[6], ".");
        Assert.assertTrue(snp[9].startsWith("0/1:"), snp[9]);

        final String[] insertion = records.get(1).split("\t");
        final String insertionReference = String.valueOf(genome.baseAt(INSERTION_SITE));
        Assert.assertEquals(insertion[1], Integer.toString(INSERTION_SITE + 1));
        Assert.assertEquals(insertion[3], insertionReference);
        Assert.assertEquals(insertion[4], insertionReference + LONG_INSERTION);
        Assert.assertEquals(insertion[7], ".", "observed in the alignments, not inferred");
        Assert.assertTrue(insertion[9].startsWith("1/1:"), insertion[9]);
        Assert.assertTrue(insertion[9].endsWith(":10:0.8000"), insertion[9]);
    }

    @Test
    public void testInsertionIsInferredWithoutAlignments() throws IOException {
        final File output = directory.resolve("inferred.vcf").toFile();
        runCommandLine(new ArgumentsBuilder()
                .add(CallVariantsFromTensors.TENSOR_FILE_LONG_NAME, tensors)
                .add(CallVariantsFromTensors.PREDICTIONS_LONG_NAME, predictions)
                .add("-O", output)
                .add(TensorCallerArgumentCollection.QUALITY_THRESHOLD_LONG_NAME, 0)
                .getArgsList());

        final List<String> lines = Files.readAllLines(output.toPath());
        Assert.assertFalse(lines.stream().anyMatch(line -> line.startsWith("##contig")), "no reference, no contig lines");
        final String[] insertion = dataLines(output).get(1).split("\t");
        // the tensor shows 16 inserted bases and no support beyond them
        Assert.assertEquals(insertion[4], genome.baseAt(INSERTION_SITE) + LONG_INSERTION.substring(0, FLANK));
        Assert.assertEquals(insertion[6], "PASS");
        Assert.assertEquals(insertion[7], "LENGUESS=" + FLANK);
    }

    @Test
    public void testShowReference() throws IOException {
        final File output = directory.resolve("withReference.vcf").toFile();
        final Object sitesCalled = runCommandLine(baseArgs(output)
                .add(TensorCallerArgumentCollection.SHOW_REFERENCE_LONG_NAME, true)
                .getArgsList());
        Assert.assertEquals(sitesCalled, 3L);

        final String[] reference = dataLines(output).get(2).split("\t");
        final String base = String.valueOf(genome.baseAt(REFERENCE_SITE));
        Assert.assertEquals(reference[3], base);
        Assert.assertEquals(reference[4], base);
        Assert.assertTrue(reference[9].startsWith("0/0:"), reference[9]);
    }

    @Test
    public void testDebugTrace() throws IOException {
        final File output = directory.resolve("trace.txt").toFile();
        runCommandLine(baseArgs(output)
                .add(TensorCallerArgumentCollection.DEBUG_LONG_NAME, true)
                .add(CallVariantsFromTensors.THREADS_LONG_NAME, 4)
                .getArgsList());

        final List<String> traces = dataLines(output);
        Assert.assertEquals(traces.size(), 3, traces.toString());
        Assert.assertTrue(traces.get(0).startsWith(SyntheticGenome.CONTIG + "\t" + (SNP_SITE + 1) + "\t["));
        Assert.assertTrue(traces.get(0).endsWith("\t" + CallOutcome.CALLED_TRACE_REASON));
        Assert.assertTrue(traces.get(2).endsWith("\t" + CallOutcome.REFERENCE_TRACE_REASON));
    }

    @Test
    public void testClassifierThreads() {
        Assert.assertEquals(CallVariantsFromTensors.classifierThreads(null, "PIPE"), Integer.valueOf(CallVariantsFromTensors.DEFAULT_STANDARD_INPUT_CLASSIFIER_THREADS));
        Assert.assertNull(CallVariantsFromTensors.classifierThreads(null, "candidates.tensor"));
        Assert.assertEquals(CallVariantsFromTensors.classifierThreads(1, "candidates.tensor"), Integer.valueOf(1));
        Assert.assertEquals(CallVariantsFromTensors.classifierThreads(8, "PIPE"), Integer.valueOf(7));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testSiteWithoutPrediction() throws IOException {
        final File partialPredictions = directory.resolve("partial.tsv").toFile();
        Files.write(partialPredictions.toPath(), Files.readAllLines(predictions.toPath()).subList(0, 2), StandardCharsets.UTF_8);
        runCommandLine(new ArgumentsBuilder()
                .add(CallVariantsFromTensors.TENSOR_FILE_LONG_NAME, tensors)
                .add(CallVariantsFromTensors.PREDICTIONS_LONG_NAME, partialPredictions)
                .add("-O", directory.resolve("partial.vcf").toFile())
                .getArgsList());
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testPredictionsAreRequired() {
        runCommandLine(Arrays.asList("--" + CallVariantsFromTensors.TENSOR_FILE_LONG_NAME, tensors.getAbsolutePath(),
                "-O", directory.resolve("missing.vcf").toString()));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testNegativeQualityThreshold() {
        runCommandLine(baseArgs(directory.resolve("negative.vcf").toFile())
                .add(TensorCallerArgumentCollection.QUALITY_THRESHOLD_LONG_NAME, -1)
                .getArgsList());
    }
}
