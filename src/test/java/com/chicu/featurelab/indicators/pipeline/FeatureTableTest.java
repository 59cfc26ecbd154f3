package com.chicu.featurelab.indicators.pipeline;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTableTest {

    private FeatureTable table() {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("Close", new double[]{10, 11, 12, 13});
        cols.put("A", new double[]{1, 2, 3, 4});
        cols.put("B", new double[]{5, 6, 7, 8});
        return FeatureTable.of(new long[]{100, 200, 300, 400}, cols, List.of("A", "B"), null);
    }

    @Test
    void of_shouldRejectMisalignedColumn() {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("A", new double[]{1, 2});
        assertThrows(IllegalArgumentException.class,
                () -> FeatureTable.of(new long[]{1, 2, 3}, cols, List.of("A"), null));
    }

    @Test
    void of_shouldRejectUnknownFeatureColumn() {
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("A", new double[]{1});
        assertThrows(IllegalArgumentException.class,
                () -> FeatureTable.of(new long[]{1}, cols, List.of("Z"), null));
    }

    @Test
    void slice_shouldKeepRowsAndTimes() {
        FeatureTable s = table().slice(1, 3);

        assertEquals(2, s.rowCount());
        assertArrayEquals(new long[]{200, 300}, s.times());
        assertArrayEquals(new double[]{6, 7}, s.column("B"));
        assertArrayEquals(new double[]{2, 6}, s.featureRow(0));
    }

    @Test
    void withColumns_shouldReplaceOnlyGivenColumns() {
        FeatureTable t = table();
        FeatureTable r = t.withColumns(Map.of("A", new double[]{0, 0, 0, 0}));

        assertArrayEquals(new double[]{0, 0, 0, 0}, r.column("A"));
        assertArrayEquals(t.column("B"), r.column("B"));
        assertArrayEquals(new double[]{1, 2, 3, 4}, t.column("A"), "исходная таблица не меняется");
        assertThrows(IllegalArgumentException.class, () -> t.withColumns(Map.of("Z", new double[4])));
    }

    @Test
    void column_shouldReturnCopy() {
        FeatureTable t = table();
        t.column("A")[0] = 999;
        assertEquals(1.0, t.value(0, "A"));
    }

    @Test
    void nextClose_shouldTravelWithRowThroughSelection() {
        FeatureTable t = table();
        FeatureTable picked = t.selectRows(new int[]{0, 2, 3});

        assertEquals(11, picked.nextClose(0));
        assertEquals(13, picked.nextClose(1));
        assertTrue(Double.isNaN(picked.nextClose(2)), "у последнего бара следующего нет");

        FeatureTable replaced = picked.withColumns(Map.of("Close", new double[]{0, 0, 0}));
        assertEquals(11, replaced.nextClose(0));
    }
}
