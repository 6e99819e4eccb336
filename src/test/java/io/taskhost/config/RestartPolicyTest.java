package io.taskhost.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RestartPolicyTest {

    @Test
    void delayGrowsLinearlyUntilTheCap() {
        RestartPolicy policy = RestartPolicy.defaults();

        Assertions.assertEquals(1_000L, policy.delayMs(1));
        Assertions.assertEquals(2_000L, policy.delayMs(2));
        Assertions.assertEquals(5_000L, policy.delayMs(5));
        Assertions.assertEquals(10_000L, policy.delayMs(10));
        Assertions.assertEquals(10_000L, policy.delayMs(11));
        Assertions.assertEquals(10_000L, policy.delayMs(Integer.MAX_VALUE));
        Assertions.assertEquals(0L, policy.delayMs(0));
    }

    @Test
    void attemptsAboveTheMaximumAreExhausted() {
        RestartPolicy policy = RestartPolicy.defaults();

        Assertions.assertFalse(policy.exhausted(1));
        Assertions.assertFalse(policy.exhausted(5));
        Assertions.assertTrue(policy.exhausted(6));
    }

    @Test
    void rejectsNegativeValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RestartPolicy(-1, 10L, 10L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RestartPolicy(1, -10L, 10L));
    }
}
