package org.broadinstitute.tensorcaller.engine;

import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public final class TensorTextBatchSourceUnitTest extends TensorCallerBaseTest {

    private static String line(final int oneBasedPosition, final String window, final TensorBuilder tensor) {
        return TEST_CONTIG + " " + oneBasedPosition + " " + window + " " + tensor.toText();
    }

    private static String lines(final int numberOfSites) {
        final StringBuilder text = new StringBuilder();
        for (int i = 1; i <= numberOfSites; i++) {
            text.append(line(1000 + i, window('A'), new TensorBuilder().set(CENTER, 'A', EvidenceCategory.REFERENCE, i))).append('\n');
        }
        return text.toString();
    }

    private static TensorTextBatchSource source(final String text, final int batchSize) {
        return new TensorTextBatchSource(new StringReader(text), "test", batchSize, WINDOW_WIDTH);
    }

    @Test
    public void testBatching() {
        final List<EvidenceBatch> batches = new ArrayList<>();
        try (final TensorTextBatchSource source = source(lines(5), 2)) {
            EvidenceBatch batch;
            do {
                batch = source.nextBatch();
                batches.add(batch);
            } while (!batch.isEndOfStream());
        }
        Assert.assertEquals(batches.size(), 3);
        Assert.assertEquals(batches.get(0).size(), 2);
        Assert.assertEquals(batches.get(1).size(), 2);
        Assert.assertEquals(batches.get(2).size(), 1);
        for (int i = 0; i < batches.size(); i++) {
            Assert.assertEquals(batches.get(i).getBatchIndex(), i);
            Assert.assertEquals(batches.get(i).isEndOfStream(), i == 2);
        }

        final Site first = batches.get(0).getSites().get(0);
        Assert.assertEquals(first.getContig(), TEST_CONTIG);
        Assert.assertEquals(first.getStart(), 1001);
        Assert.assertEquals(first.getPosition(), 1000);
        Assert.assertEquals(first.getReferenceBase(), 'A');
        Assert.assertEquals(first.getTensor().getBaseSupport(CENTER, 'A', EvidenceCategory.REFERENCE), 1.0);
        Assert.assertEquals(batches.get(2).getSites().get(0).getTensor().getBaseSupport(CENTER, 'A', EvidenceCategory.REFERENCE), 5.0);
    }

    @Test
    public void testFullLastBatchIsFlagged() {
        try (final TensorTextBatchSource source = source(lines(4), 2)) {
            Assert.assertFalse(source.nextBatch().isEndOfStream());
            final EvidenceBatch last = source.nextBatch();
            Assert.assertEquals(last.size(), 2);
            Assert.assertTrue(last.isEndOfStream());
        }
    }

    @Test
    public void testEmptyInput() {
        try (final TensorTextBatchSource source = source("# no sites\n\n", 10)) {
            final EvidenceBatch batch = source.nextBatch();
            Assert.assertEquals(batch.size(), 0);
            Assert.assertTrue(batch.isEndOfStream());
        }
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testNoBatchAfterTheEnd() {
        try (final TensorTextBatchSource source = source(lines(1), 10)) {
            source.nextBatch();
            source.nextBatch();
        }
    }

    @Test
    public void testStrandedTensorsAndLowerCaseWindows() {
        final TensorBuilder stranded = new TensorBuilder(WINDOW_WIDTH, EvidenceTensor.STRANDED_CHANNELS)
                .set(CENTER, 0, EvidenceCategory.REFERENCE, 3)
                .set(CENTER, 4, EvidenceCategory.REFERENCE, 2);
        try (final TensorTextBatchSource source = source(line(7, window('a').toLowerCase(), stranded), 1)) {
            final Site site = source.nextBatch().getSites().get(0);
            Assert.assertEquals(site.getReferenceWindow(), window('A'));
            Assert.assertEquals(site.getTensor().getNumberOfChannels(), EvidenceTensor.STRANDED_CHANNELS);
            Assert.assertEquals(site.getTensor().getBaseSupport(CENTER, 'A', EvidenceCategory.REFERENCE), 5.0);
        }
    }

    @Test
    public void testReadsFiles() throws IOException {
        final File file = createTempFile("tensors", ".txt");
        Files.write(file.toPath(), lines(3).getBytes(StandardCharsets.UTF_8));
        try (final TensorTextBatchSource source = new TensorTextBatchSource(file.getAbsolutePath(), 1000, WINDOW_WIDTH)) {
            final EvidenceBatch batch = source.nextBatch();
            Assert.assertEquals(batch.size(), 3);
            Assert.assertTrue(batch.isEndOfStream());
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        new TensorTextBatchSource(new File(createTempDir("tensors").toFile(), "missing.txt").getAbsolutePath(), 10, WINDOW_WIDTH);
    }

    @Test
    public void testStandardInputNames() {
        Assert.assertTrue(TensorTextBatchSource.isStandardInput("PIPE"));
        Assert.assertTrue(TensorTextBatchSource.isStandardInput("-"));
        Assert.assertFalse(TensorTextBatchSource.isStandardInput("tensors.txt"));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testWrongNumberOfValues() {
        source(TEST_CONTIG + " 10 " + window('A') + " 1.0 2.0 3.0\n", 10).nextBatch();
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testNonNumericValue() {
        source(line(10, window('A'), new TensorBuilder()).replaceFirst("0\\.0", "x") + "\n", 10).nextBatch();
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testBadPosition() {
        source(TEST_CONTIG + " 0 " + window('A') + " " + new TensorBuilder().toText() + "\n", 10).nextBatch();
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMissingTensor() {
        source(TEST_CONTIG + " 10 " + window('A') + "\n", 10).nextBatch();
    }

    @Test
    public void testWindowWidthMustMatch() {
        final String narrowWindow = window('A').substring(1, WINDOW_WIDTH - 1);
        final String narrowLine = line(10, narrowWindow, new TensorBuilder(WINDOW_WIDTH - 2, EvidenceTensor.UNSTRANDED_CHANNELS)) + "\n";
        try {
            source(narrowLine, 10).nextBatch();
            Assert.fail("a window of " + narrowWindow.length() + " bases was accepted");
        } catch (final UserException.MalformedFile e) {
            Assert.assertTrue(e.getMessage().contains("expected " + WINDOW_WIDTH), e.getMessage());
        }

        try (final TensorTextBatchSource narrowSource = new TensorTextBatchSource(new StringReader(narrowLine), "test", 10, WINDOW_WIDTH - 2)) {
            Assert.assertEquals(narrowSource.nextBatch().getSites().get(0).getReferenceWindow(), narrowWindow);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBatchSizeMustBePositive() {
        source(lines(1), 0);
    }
}
