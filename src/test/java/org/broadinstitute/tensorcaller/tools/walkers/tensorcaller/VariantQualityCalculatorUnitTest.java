package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.utils.QualityUtils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class VariantQualityCalculatorUnitTest extends TensorCallerBaseTest {

    private static final ProbabilityBundle HET_AC = noIndelBundle(BaseChangeClass.AC, genotypeVector(0.1, 0.2, 0.7));

    @Test
    public void testClassesAreDerivedFromTheAlleles() {
        Assert.assertEquals(VariantQualityCalculator.qualityOf("A", Collections.singletonList("C"), "0/1", HET_AC),
                QualityUtils.callQuality(0.9 * 0.7));
        // 1/1 with alternate C re-derives CC, which the classifier gave almost nothing
        Assert.assertEquals(VariantQualityCalculator.qualityOf("A", Collections.singletonList("C"), "1/1", HET_AC),
                QualityUtils.callQuality(0.001 * 0.2));
        Assert.assertEquals(VariantQualityCalculator.qualityOf("A", Collections.singletonList("A"), "0/0", HET_AC),
                QualityUtils.callQuality(0.001 * 0.1));
    }

    @Test
    public void testMultiAllelicUsesBothAlternates() {
        final ProbabilityBundle bundle = noIndelBundle(BaseChangeClass.CG, genotypeVector(0.05, 0.05, 0.9));
        Assert.assertEquals(VariantQualityCalculator.qualityOf("A", Arrays.asList("C", "G"), "1/2", bundle),
                QualityUtils.callQuality(0.9 * 0.9));
    }

    @Test
    public void testUnknownGenotypeScoresZero() {
        Assert.assertEquals(VariantQualityCalculator.qualityOf("A", Collections.singletonList("C"), "./.", HET_AC), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAlternatesAreRequired() {
        VariantQualityCalculator.qualityOf("A", Collections.emptyList(), "0/1", HET_AC);
    }
}
