package org.broadinstitute.tensorcaller.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.broadinstitute.tensorcaller.TensorCallerBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends TensorCallerBaseTest {

    @Test
    public void testLevelConversions() {
        for (final Log.LogLevel level : Log.LogLevel.values()) {
            Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(LoggingUtils.levelToLog4jLevel(level)), level);
        }
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(Log.LogLevel.WARNING), Level.WARN);
    }

    @Test
    public void testSetLoggingLevel() {
        try {
            LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
            Assert.assertTrue(LogManager.getLogger(LoggingUtilsUnitTest.class).isDebugEnabled());
            LoggingUtils.setLoggingLevel(Log.LogLevel.ERROR);
            Assert.assertFalse(LogManager.getLogger(LoggingUtilsUnitTest.class).isWarnEnabled());
        } finally {
            LoggingUtils.setLoggingLevel(Log.LogLevel.INFO);
        }
    }
}
