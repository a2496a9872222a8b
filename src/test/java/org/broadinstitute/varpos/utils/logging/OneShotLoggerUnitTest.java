package org.broadinstitute.varpos.utils.logging;

import org.apache.logging.log4j.LogManager;
import org.broadinstitute.varpos.VarPosBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public final class OneShotLoggerUnitTest extends VarPosBaseTest {

    @Test
    public void testWarnsOnlyOnce() {
        final OneShotLogger oneShotLogger = new OneShotLogger(OneShotLoggerUnitTest.class);
        Assert.assertFalse(oneShotLogger.hasWarned());
        Assert.assertTrue(oneShotLogger.warn("first"));
        Assert.assertTrue(oneShotLogger.hasWarned());
        Assert.assertFalse(oneShotLogger.warn("second"));
        Assert.assertTrue(oneShotLogger.hasWarned());
    }

    @Test
    public void testWarnsOnlyOnceAcrossThreads() throws Exception {
        final OneShotLogger oneShotLogger = new OneShotLogger(OneShotLoggerUnitTest.class);
        final int numThreads = 8;
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            final List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < numThreads; i++) {
                final Callable<Boolean> warning = () -> {
                    start.await();
                    return oneShotLogger.warn("concurrent");
                };
                results.add(executor.submit(warning));
            }
            start.countDown();
            int emitted = 0;
            for (final Future<Boolean> result : results) {
                if (result.get()) {
                    emitted++;
                }
            }
            Assert.assertEquals(emitted, 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testWrapsGivenLogger() {
        final OneShotLogger oneShotLogger = new OneShotLogger(LogManager.getLogger("wrapped"));
        Assert.assertEquals(oneShotLogger.logger.getName(), "wrapped");
    }
}
