package io.kubecache.task;

import static org.testng.Assert.assertEquals;

import java.time.Duration;

import org.testng.annotations.Test;

public class BackoffPolicyTest {

    @Test
    public void testExponentialDoublesUntilMaximum() {
        final BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofSeconds(60));

        assertEquals(policy.delayBeforeRestart(0), Duration.ofSeconds(1));
        assertEquals(policy.delayBeforeRestart(1), Duration.ofSeconds(2));
        assertEquals(policy.delayBeforeRestart(2), Duration.ofSeconds(4));
        assertEquals(policy.delayBeforeRestart(5), Duration.ofSeconds(32));
        assertEquals(policy.delayBeforeRestart(6), Duration.ofSeconds(60));
        assertEquals(policy.delayBeforeRestart(1000), Duration.ofSeconds(60));
    }

    @Test
    public void testZeroMaximumMeansNoWait() {
        assertEquals(BackoffPolicy.exponential(Duration.ZERO).delayBeforeRestart(3), Duration.ZERO);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeRestartsAreRejected() {
        BackoffPolicy.exponential(Duration.ofSeconds(10)).delayBeforeRestart(-1);
    }
}
