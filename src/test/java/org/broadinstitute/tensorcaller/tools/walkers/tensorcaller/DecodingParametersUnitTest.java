package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.broadinstitute.tensorcaller.utils.config.ConfigFactory;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class DecodingParametersUnitTest extends TensorCallerBaseTest {

    @Test
    public void testFromDefaultConfig() {
        final DecodingParameters parameters = DecodingParameters.fromConfig(ConfigFactory.getInstance().getTensorCallerConfig());
        Assert.assertEquals(parameters.getFlankingBaseNumber(), DecodingParameters.DEFAULT.getFlankingBaseNumber());
        Assert.assertEquals(parameters.getWindowWidth(), WINDOW_WIDTH);
        Assert.assertEquals(parameters.getMinimumLengthThatNeedsInference(), 16);
        Assert.assertEquals(parameters.getMaximumLengthThatNeedsInference(), 50);
        Assert.assertEquals(parameters.getInferenceSupportFraction(), 0.125);
    }

    @Test
    public void testAdaptiveMaximumLength() {
        Assert.assertEquals(DecodingParameters.DEFAULT.adaptiveMaximumLength(3), 3);
        Assert.assertEquals(DecodingParameters.DEFAULT.adaptiveMaximumLength(15), 15);
        Assert.assertEquals(DecodingParameters.DEFAULT.adaptiveMaximumLength(16), 50);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCeilingBelowThreshold() {
        new DecodingParameters(16, 20, 10, 0.125);
    }
}
