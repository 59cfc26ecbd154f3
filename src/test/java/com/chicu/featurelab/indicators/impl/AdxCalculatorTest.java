package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.support.SyntheticBars;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdxCalculatorTest {

    private final AdxCalculator adx = new AdxCalculator(14);

    @Test
    void compute_shouldStayWithinBounds() {
        IndicatorColumn col = adx.compute(SyntheticBars.randomWalk(500, 17)).get(0);

        for (double v : col.values()) {
            if (!Double.isNaN(v)) assertTrue(v >= 0 && v <= 100, "ADX out of [0,100]: " + v);
        }
        assertEquals(2 * 14 - 1, col.firstDefinedIndex());
    }

    @Test
    void compute_shouldReach100OnOneSidedTrend() {
        double[] v = adx.compute(SyntheticBars.steadyUptrend(60)).get(0).values();

        assertEquals(100.0, v[27], 1e-12);
        assertEquals(100.0, v[59], 1e-12);
    }

    @Test
    void compute_shouldBeUndefinedWithoutMovement() {
        double[] prices = new double[40];
        java.util.Arrays.fill(prices, 25.0);

        assertEquals(-1, adx.compute(SyntheticBars.flatBars(prices)).get(0).firstDefinedIndex());
    }

    @Test
    void minimumBars_shouldEqualPeriod() {
        assertEquals(14, adx.minimumBars());
        assertEquals("Directional-Trend", adx.type().displayName());
    }

    @Test
    void warmupBars_shouldMatchFirstDefinedValue() {
        IndicatorColumn col = adx.compute(SyntheticBars.randomWalk(200, 5)).get(0);

        assertEquals(28, adx.warmupBars());
        assertEquals(adx.warmupBars() - 1, col.firstDefinedIndex());
    }
}
