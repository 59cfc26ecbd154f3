package com.chicu.featurelab.ai.ml.dataset;

import com.chicu.featurelab.indicators.pipeline.FeatureTable;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Таблица фич + метка на каждую строку. Последней строки исходной серии тут нет.
 */
public record LabeledTable(FeatureTable table, List<Label> labels) {

    public LabeledTable {
        if (table == null) throw new IllegalArgumentException("table=null");
        if (labels == null) throw new IllegalArgumentException("labels=null");
        if (labels.size() != table.rowCount()) {
            throw new IllegalArgumentException("размеры не совпадают: rows=" + table.rowCount() + " labels=" + labels.size());
        }
        if (labels.contains(null)) throw new IllegalArgumentException("labels содержат null");
        labels = List.copyOf(labels);
    }

    public int rowCount() {
        return table.rowCount();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    public Label label(int row) {
        return labels.get(row);
    }

    public int[] labelCodes() {
        int[] y = new int[labels.size()];
        for (int i = 0; i < y.length; i++) y[i] = labels.get(i).code();
        return y;
    }

    public Map<Label, Integer> labelCounts() {
        Map<Label, Integer> counts = new EnumMap<>(Label.class);
        for (Label l : labels) counts.merge(l, 1, Integer::sum);
        return counts;
    }

    /** Строки [from, to) с их метками */
    public LabeledTable slice(int from, int to) {
        return new LabeledTable(table.slice(from, to), labels.subList(from, to));
    }

    /** Та же разметка поверх другой таблицы с тем же числом строк (например, нормализованной) */
    public LabeledTable withTable(FeatureTable other) {
        return new LabeledTable(other, labels);
    }
}
