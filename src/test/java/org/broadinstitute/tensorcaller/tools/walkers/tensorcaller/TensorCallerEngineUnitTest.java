package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.broadinstitute.tensorcaller.engine.AlignmentSource;
import org.broadinstitute.tensorcaller.engine.ClassifierPredictions;
import org.broadinstitute.tensorcaller.engine.EvidenceBatch;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.engine.ReferenceSource;
import org.broadinstitute.tensorcaller.engine.Site;
import org.broadinstitute.tensorcaller.exceptions.TensorCallerException;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.EvidenceCategory;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

public final class TensorCallerEngineUnitTest extends TensorCallerBaseTest {

    private final Site referenceSite = new Site(TEST_CONTIG, 99, window('A'),
            new TensorBuilder().set(CENTER, 'A', EvidenceCategory.REFERENCE, 10).build());
    private final Site snpSite = new Site(TEST_CONTIG, 199, window('A'),
            new TensorBuilder().set(CENTER, 'A', EvidenceCategory.REFERENCE, 6).set(CENTER, 'G', EvidenceCategory.SNP, 6).build());
    private final Site emptySite = new Site(TEST_CONTIG, 299, window('A'), new TensorBuilder().build());

    private final ProbabilityBundle referenceCall = noIndelBundle(BaseChangeClass.AA, genotypeVector(0.9, 0.05, 0.05));
    private final ProbabilityBundle snpCall = noIndelBundle(BaseChangeClass.AG, genotypeVector(0.05, 0.05, 0.9));

    private EvidenceBatch batch() {
        return new EvidenceBatch(0, Arrays.asList(referenceSite, snpSite, emptySite), true);
    }

    private ClassifierPredictions predictions() {
        return new ClassifierPredictions(Arrays.asList(referenceCall, snpCall, snpCall));
    }

    private static TensorCallerEngine engine(final TensorCallerArgumentCollection args, final StringWriter out) {
        return new TensorCallerEngine(args, DecodingParameters.DEFAULT, AlignmentSource.EMPTY, ReferenceSource.EMPTY,
                new VariantRecordWriter(out, "test"));
    }

    @Test
    public void testWritesCalledSites() {
        final StringWriter out = new StringWriter();
        final TensorCallerEngine engine = engine(new TensorCallerArgumentCollection(), out);
        engine.decode(batch(), predictions());

        final String[] lines = out.toString().split("\n");
        Assert.assertEquals(lines.length, 1);
        Assert.assertTrue(lines[0].startsWith("chr1\t200\t.\tA\tG\t"), lines[0]);
        Assert.assertTrue(lines[0].endsWith("\t0/1:" + lines[0].split("\t")[5] + ":6:1.0000"), lines[0]);
        Assert.assertEquals(engine.getSitesDecoded(), 3L);
        Assert.assertEquals(engine.getSitesCalled(), 1L);
        Assert.assertEquals(engine.getSitesSkipped(), 2L);
    }

    @Test
    public void testWritesReferenceCallsWhenRequested() {
        final TensorCallerArgumentCollection args = new TensorCallerArgumentCollection();
        args.showReference = true;
        final StringWriter out = new StringWriter();
        engine(args, out).decode(batch(), predictions());

        final String[] lines = out.toString().split("\n");
        Assert.assertEquals(lines.length, 2);
        Assert.assertTrue(lines[0].startsWith("chr1\t100\t.\tA\tA\t"), lines[0]);
        Assert.assertTrue(lines[1].startsWith("chr1\t200\t"), lines[1]);
    }

    @Test
    public void testDebugModeWritesTraceLines() {
        final TensorCallerArgumentCollection args = new TensorCallerArgumentCollection();
        args.debug = true;
        final StringWriter out = new StringWriter();
        final TensorCallerEngine engine = engine(args, out);
        engine.decode(batch(), predictions());

        final String[] lines = out.toString().split("\n");
        Assert.assertEquals(lines.length, 3);
        Assert.assertTrue(lines[0].endsWith("\t" + CallOutcome.REFERENCE_TRACE_REASON));
        Assert.assertTrue(lines[1].endsWith("\t" + CallOutcome.CALLED_TRACE_REASON));
        Assert.assertTrue(lines[2].endsWith("\t" + SkipReason.ZERO_DEPTH.getMessage()));
        Assert.assertEquals(engine.getSitesCalled(), 2L);
    }

    @Test
    public void testEmptyBatch() {
        final StringWriter out = new StringWriter();
        final TensorCallerEngine engine = engine(new TensorCallerArgumentCollection(), out);
        engine.decode(new EvidenceBatch(0, Collections.emptyList(), true), new ClassifierPredictions(Collections.emptyList()));
        Assert.assertEquals(out.toString(), "");
        Assert.assertEquals(engine.getSitesDecoded(), 0L);
    }

    @Test(expectedExceptions = TensorCallerException.InconsistentBatchShape.class)
    public void testPredictionCountMismatch() {
        engine(new TensorCallerArgumentCollection(), new StringWriter())
                .decode(batch(), new ClassifierPredictions(Collections.singletonList(referenceCall)));
    }
}
