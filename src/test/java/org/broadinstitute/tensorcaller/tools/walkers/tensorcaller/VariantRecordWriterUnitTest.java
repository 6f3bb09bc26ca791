package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import htsjdk.samtools.SAMSequenceRecord;
import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.StringWriter;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class VariantRecordWriterUnitTest extends TensorCallerBaseTest {

    private static VariantRecord heterozygousSnp() {
        return new VariantRecord(TEST_CONTIG, 1000, "A", Collections.singletonList("C"), 50, FilterStatus.PASS,
                0, GenotypeClass.HETEROZYGOUS_VARIANT, 12, 0.5);
    }

    @Test
    public void testHeader() {
        final StringWriter out = new StringWriter();
        final SAMSequenceRecord chr1 = new SAMSequenceRecord(TEST_CONTIG, 248956422);
        chr1.setSequenceIndex(0);
        final SAMSequenceRecord chr2 = new SAMSequenceRecord("chr2", 242193529);
        chr2.setSequenceIndex(1);
        try (final VariantRecordWriter writer = new VariantRecordWriter(out, "test")) {
            writer.writeHeader("NA12878", Arrays.asList(chr1, chr2));
        }
        final List<String> lines = Arrays.asList(out.toString().split("\n"));
        Assert.assertEquals(lines.get(0), "##fileformat=VCFv4.1");
        Assert.assertTrue(lines.contains("##FILTER=<ID=LowQual,Description=\"Confidence in this variant being real is below calling threshold.\">"), lines.toString());
        Assert.assertTrue(lines.stream().anyMatch(line -> line.startsWith("##INFO=<ID=LENGUESS,Number=.,Type=Integer")));
        Assert.assertTrue(lines.stream().anyMatch(line -> line.startsWith("##FORMAT=<ID=AF,Number=1,Type=Float")));
        Assert.assertTrue(lines.stream().anyMatch(line -> line.startsWith("##contig=<ID=chr1,length=248956422")));
        Assert.assertTrue(lines.indexOf("##contig=<ID=chr1,length=248956422>") < lines.indexOf("##contig=<ID=chr2,length=242193529>"));
        Assert.assertEquals(lines.get(lines.size() - 1), "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\tFORMAT\tNA12878");
    }

    @Test
    public void testHeaderWithoutContigs() {
        final StringWriter out = new StringWriter();
        try (final VariantRecordWriter writer = new VariantRecordWriter(out, "test")) {
            writer.writeHeader("SAMPLE", Collections.emptyList());
        }
        Assert.assertFalse(out.toString().contains("##contig"));
        Assert.assertEquals(out.toString().split("\n").length, VariantRecordWriter.standardHeaderLines().size() + 1);
    }

    @Test
    public void testRecordLine() {
        final StringWriter out = new StringWriter();
        try (final VariantRecordWriter writer = new VariantRecordWriter(out, "test")) {
            writer.write(heterozygousSnp());
            Assert.assertEquals(writer.getRecordsWritten(), 1L);
        }
        Assert.assertEquals(out.toString(), "chr1\t1000\t.\tA\tC\t50\tPASS\t.\tGT:GQ:DP:AF\t0/1:50:12:0.5000\n");
    }

    @Test
    public void testMultiAllelicInferredRecordLine() {
        final VariantRecord record = new VariantRecord(TEST_CONTIG, 1000, "ATTT", Arrays.asList("A", "AT"), 7, FilterStatus.LOW_QUALITY,
                3, GenotypeClass.HETEROZYGOUS_MULTI_ALLELIC, 20, 0.25);
        Assert.assertEquals(VariantRecordWriter.formatRecord(record),
                "chr1\t1000\t.\tATTT\tA,AT\t7\tLowQual\tLENGUESS=3\tGT:GQ:DP:AF\t1/2:7:20:0.2500");
    }

    @Test
    public void testTraceLines() {
        final Site site = site('A', new TensorBuilder().build());
        final ProbabilityBundle bundle = bundle(baseChangeVector(0.0, BaseChangeClass.AC, 1.0), genotypeVector(0.0, 0.0, 1.0),
                withLength(new double[3], 0, 1.0), withLength(new double[3], 0, 1.0));
        final CallOutcome called = CallOutcome.called(site, bundle, VariantHypothesis.HETEROZYGOUS_SNP, heterozygousSnp());
        final CallOutcome zeroDepth = CallOutcome.skipped(site, bundle, VariantHypothesis.HETEROZYGOUS_SNP, SkipReason.ZERO_DEPTH);
        final CallOutcome notRequested = CallOutcome.skipped(site, bundle, VariantHypothesis.REFERENCE, SkipReason.REFERENCE_CALL_NOT_REQUESTED);

        final String trace = VariantRecordWriter.formatTrace(called);
        final String[] fields = trace.split("\t");
        Assert.assertEquals(fields.length, 7);
        Assert.assertEquals(fields[0], TEST_CONTIG);
        Assert.assertEquals(fields[1], "1000");
        Assert.assertTrue(fields[2].startsWith("[0.00000000, 1.00000000, 0.00000000"), fields[2]);
        Assert.assertEquals(fields[3], "[0.00000000, 0.00000000, 1.00000000]");
        Assert.assertEquals(fields[4], "[0.00000000, 1.00000000, 0.00000000]");
        Assert.assertEquals(fields[6], CallOutcome.CALLED_TRACE_REASON);

        final StringWriter out = new StringWriter();
        try (final VariantRecordWriter writer = new VariantRecordWriter(out, "test")) {
            writer.writeTrace(called);
            writer.writeTrace(zeroDepth);
            writer.writeTrace(notRequested);
            Assert.assertEquals(writer.getRecordsWritten(), 0L);
        }
        final String[] lines = out.toString().split("\n");
        Assert.assertEquals(lines.length, 2);
        Assert.assertTrue(lines[1].endsWith("\t" + SkipReason.ZERO_DEPTH.getMessage()));
    }

    @Test
    public void testWritesFiles() throws Exception {
        final File file = createTempFile("calls", ".vcf");
        try (final VariantRecordWriter writer = new VariantRecordWriter(file.toPath())) {
            writer.writeHeader("SAMPLE", Collections.emptyList());
            writer.write(heterozygousSnp());
        }
        final List<String> lines = Files.readAllLines(file.toPath());
        Assert.assertEquals(lines.get(lines.size() - 1), VariantRecordWriter.formatRecord(heterozygousSnp()));
    }
}
