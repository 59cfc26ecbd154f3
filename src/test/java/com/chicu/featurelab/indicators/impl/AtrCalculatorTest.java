package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.support.SyntheticBars;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AtrCalculatorTest {

    @Test
    void compute_shouldAverageTrueRangeOverPeriod() {
        double[] atr = new AtrCalculator(14).compute(SyntheticBars.steadyUptrend(30)).get(0).values();

        assertTrue(Double.isNaN(atr[12]));
        assertEquals(2.0, atr[13], 1e-12);
        assertEquals(2.0, atr[29], 1e-12);
    }

    @Test
    void compute_shouldBeNonNegative() {
        double[] atr = new AtrCalculator(14).compute(SyntheticBars.randomWalk(300, 3)).get(0).values();
        for (double v : atr) {
            if (!Double.isNaN(v)) assertTrue(v >= 0, "ATR < 0: " + v);
        }
    }
}
