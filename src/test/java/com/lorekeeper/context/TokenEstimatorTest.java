package com.lorekeeper.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    @Test
    void heuristicIsQuarterLengthRoundedUp() {
        var estimator = TokenEstimator.heuristic();
        assertFalse(estimator.exact());
        assertEquals(1, estimator.estimate("abcd"));
        assertEquals(2, estimator.estimate("abcde"));
        assertEquals(0, estimator.estimate(""));
        assertEquals(0, estimator.estimate(null));
    }

    @Test
    void r50kCountsRealTokens() {
        var estimator = TokenEstimator.r50k();
        assertTrue(estimator.exact());
        assertEquals(2, estimator.estimate("hello world"));
        assertEquals(0, estimator.estimate(""));
    }
}
