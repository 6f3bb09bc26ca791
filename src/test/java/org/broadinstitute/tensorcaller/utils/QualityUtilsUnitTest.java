package org.broadinstitute.tensorcaller.utils;

import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class QualityUtilsUnitTest extends TensorCallerBaseTest {

    @DataProvider(name = "callQualities")
    public Object[][] callQualities() {
        return new Object[][]{
                {0.5, 1089},
                // saturated by the epsilon: (-3000 + 33)^2
                {0.0, 8803089},
                {1e-6, 729},
                {1e-4, 49},
                {4e-4, 1},
                {0.9, 1810},
        };
    }

    @Test(dataProvider = "callQualities")
    public void testCallQuality(final double probability, final int expected) {
        Assert.assertEquals(QualityUtils.callQuality(probability), expected);
    }

    @Test
    public void testPhredScaleOddsOfError() {
        Assert.assertEquals(QualityUtils.phredScaleOddsOfError(0.5), 0.0, 1e-9);
        Assert.assertEquals(QualityUtils.phredScaleOddsOfError(0.9), 10.0 * Math.log10(9.0), 1e-9);
        Assert.assertTrue(QualityUtils.phredScaleOddsOfError(0.1) < 0.0);
        Assert.assertTrue(Double.isFinite(QualityUtils.phredScaleOddsOfError(1.0)));
    }

    @Test
    public void testCallQualityIsMonotonicAboveTheOffsetRoot() {
        int previous = QualityUtils.callQuality(5e-4);
        for (int i = 1; i <= 1000; i++) {
            final int quality = QualityUtils.callQuality(i / 1000.0);
            Assert.assertTrue(quality >= 0);
            Assert.assertTrue(quality >= previous, "quality dropped at " + i / 1000.0);
            previous = quality;
        }
    }

    @Test
    public void testLowProbabilitiesAreNotFloored() {
        Assert.assertTrue(QualityUtils.callQuality(1e-6) > QualityUtils.callQuality(1e-4));
        Assert.assertTrue(QualityUtils.callQuality(1e-4) > 0);
    }
}
