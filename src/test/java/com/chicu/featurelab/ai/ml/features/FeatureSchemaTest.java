package com.chicu.featurelab.ai.ml.features;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureSchemaTest {

    @Test
    void schemaHash_shouldDependOnNamesAndOrder() {
        FeatureSchema a = new FeatureSchema(List.of("ATR", "RSI", "CCI"));
        FeatureSchema b = new FeatureSchema(List.of("ATR", "RSI", "CCI"));
        FeatureSchema c = new FeatureSchema(List.of("RSI", "ATR", "CCI"));

        assertEquals(a.schemaHash(), b.schemaHash());
        assertNotEquals(a.schemaHash(), c.schemaHash());
        assertEquals(64, a.schemaHash().length());
    }

    @Test
    void constructor_shouldRejectDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema(List.of("RSI", "RSI")));
        assertThrows(IllegalArgumentException.class, () -> new FeatureSchema(List.of()));
    }

    @Test
    void toVector_shouldFollowSchemaOrderAndZeroMissing() {
        FeatureSchema s = new FeatureSchema(List.of("ATR", "RSI", "CCI"));

        double[] x = s.toVector(Map.of("RSI", 55.0, "ATR", 1.5, "CCI", Double.NaN));

        assertArrayEquals(new double[]{1.5, 55.0, 0.0}, x);
        assertEquals(1, s.indexOf("RSI"));
        assertEquals(-1, s.indexOf("MACD"));
    }
}
