package com.chicu.featurelab.indicators;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorColumnTest {

    @Test
    void equals_shouldCompareValuesNotArrayReference() {
        IndicatorColumn a = new IndicatorColumn("RSI", new double[]{Double.NaN, 40, 60});
        IndicatorColumn b = new IndicatorColumn("RSI", new double[]{Double.NaN, 40, 60});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new IndicatorColumn("RSI", new double[]{Double.NaN, 40, 61}));
        assertNotEquals(a, new IndicatorColumn("CCI", new double[]{Double.NaN, 40, 60}));
    }

    @Test
    void values_shouldBeDefensiveCopy() {
        double[] src = {1, 2};
        IndicatorColumn col = new IndicatorColumn("X", src);
        src[0] = 99;
        col.values()[1] = 99;

        assertArrayEquals(new double[]{1, 2}, col.values());
    }

    @Test
    void allNaN_shouldDetectUndefinedColumn() {
        assertTrue(new IndicatorColumn("X", new double[]{Double.NaN, Double.NaN}).allNaN());
        assertFalse(new IndicatorColumn("X", new double[]{Double.NaN, 0}).allNaN());
        assertEquals(1, new IndicatorColumn("X", new double[]{Double.NaN, 0}).firstDefinedIndex());
    }
}
