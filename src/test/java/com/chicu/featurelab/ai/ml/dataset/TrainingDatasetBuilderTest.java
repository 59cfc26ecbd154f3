package com.chicu.featurelab.ai.ml.dataset;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDatasetBuilderTest {

    private final TrainingDatasetBuilder builder = new TrainingDatasetBuilder();

    @Test
    void build_shouldAssembleArrays() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(List.of("A", "B"));
        rows.add(new double[]{1, 2}, 1, 1.0, false, 10L);
        rows.add(new double[]{3, 4}, 0, 2.0, true, 10L);

        TrainingDatasetBuilder.Dataset ds = builder.build(rows, BalanceStrategy.OVERSAMPLE);

        assertEquals(2, ds.samples());
        assertEquals(2, ds.features());
        assertArrayEquals(new int[]{1, 0}, ds.y());
        assertArrayEquals(new double[]{3, 4}, ds.X()[1]);
        assertEquals(1, ds.syntheticCount());
        assertEquals(List.of("A", "B"), ds.featureNames());
        assertFalse(ds.datasetId().isBlank());
    }

    @Test
    void build_shouldRejectLabelOutsideBinary() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(List.of("A"));
        rows.add(new double[]{1}, 2, 1.0, false, 1L);

        assertThrows(IllegalArgumentException.class, () -> builder.build(rows, BalanceStrategy.NONE));
    }

    @Test
    void build_shouldRejectRowWidthMismatch() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(List.of("A", "B"));
        rows.add(new double[]{1, 2}, 1, 1.0, false, 1L);
        rows.add(new double[]{1}, 0, 1.0, false, 2L);

        assertThrows(IllegalArgumentException.class, () -> builder.build(rows, BalanceStrategy.NONE));
    }

    @Test
    void build_shouldRejectNonPositiveWeight() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(List.of("A"));
        rows.add(new double[]{1}, 1, 0.0, false, 1L);

        assertThrows(IllegalArgumentException.class, () -> builder.build(rows, BalanceStrategy.WEIGHT));
    }

    @Test
    void build_shouldRejectEmptyRows() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(TrainingDatasetBuilder.Rows.empty(List.of("A")), BalanceStrategy.NONE));
    }

    @Test
    void build_shouldDeriveSameIdAndValueForSameRows() {
        TrainingDatasetBuilder.Dataset a = builder.build(twoRows(4.0), BalanceStrategy.WEIGHT);
        TrainingDatasetBuilder.Dataset b = builder.build(twoRows(4.0), BalanceStrategy.WEIGHT);
        TrainingDatasetBuilder.Dataset c = builder.build(twoRows(5.0), BalanceStrategy.WEIGHT);

        assertEquals(a.datasetId(), b.datasetId());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a.datasetId(), c.datasetId());
        assertNotEquals(a, c);
        assertNotEquals(a.datasetId(), builder.build(twoRows(4.0), BalanceStrategy.NONE).datasetId());
    }

    @Test
    void build_shouldKeepExplicitDatasetId() {
        TrainingDatasetBuilder.Rows rows = new TrainingDatasetBuilder.Rows(" run-1 ", List.of("A"),
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        rows.add(new double[]{1}, 1, 1.0, false, 1L);

        assertEquals("run-1", builder.build(rows, BalanceStrategy.NONE).datasetId());
    }

    private static TrainingDatasetBuilder.Rows twoRows(double lastValue) {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(List.of("A", "B"));
        rows.add(new double[]{1, 2}, 1, 1.0, false, 10L);
        rows.add(new double[]{3, lastValue}, 0, 2.0, false, 20L);
        return rows;
    }
}
