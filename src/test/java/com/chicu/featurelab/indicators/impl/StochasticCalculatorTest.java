package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.support.SyntheticBars;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StochasticCalculatorTest {

    private final StochasticCalculator stoch = new StochasticCalculator(14, 3);

    @Test
    void compute_shouldStayWithinBounds() {
        List<IndicatorColumn> out = stoch.compute(SyntheticBars.randomWalk(500, 13));

        for (IndicatorColumn col : out) {
            for (double v : col.values()) {
                if (!Double.isNaN(v)) assertTrue(v >= 0 && v <= 100, col.name() + " out of [0,100]: " + v);
            }
        }
        assertEquals(13, out.get(0).firstDefinedIndex());
        assertEquals(15, out.get(1).firstDefinedIndex());
    }

    @Test
    void compute_shouldBeUndefinedOnZeroRange() {
        double[] prices = new double[20];
        Arrays.fill(prices, 10.0);

        List<IndicatorColumn> out = stoch.compute(SyntheticBars.flatBars(prices));

        assertEquals(-1, out.get(0).firstDefinedIndex());
        assertEquals(-1, out.get(1).firstDefinedIndex());
    }

    @Test
    void compute_shouldHit100AtTopOfRange() {
        double[] k = stoch.compute(SyntheticBars.flatBars(SyntheticBars.range(1, 20))).get(0).values();
        assertEquals(100.0, k[19]);
    }

    @Test
    void warmupBars_shouldIncludeSmoothing() {
        List<IndicatorColumn> out = stoch.compute(SyntheticBars.randomWalk(100, 6));

        assertEquals(16, stoch.warmupBars());
        assertEquals(stoch.warmupBars() - 1, out.get(1).firstDefinedIndex());
    }
}
