package com.chicu.featurelab.ai.ml.features;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Замороженные (mean, std) по каждой колонке фич, посчитанные на train-сегменте.
 *
 * Отдаётся вызывающему: нужен, чтобы нормализовать новые данные так же
 * и переводить значения обратно в исходные единицы.
 */
public record NormalizationState(
        List<String> featureNames,
        Map<String, ColumnStats> stats,
        Set<String> degenerateColumns,
        int referenceRows
) {

    public record ColumnStats(double mean, double std) {}

    public NormalizationState {
        if (featureNames == null || stats == null || degenerateColumns == null) {
            throw new IllegalArgumentException("normalization state is incomplete");
        }
        for (String name : featureNames) {
            if (!stats.containsKey(name)) {
                throw new IllegalArgumentException("no stats for column " + name);
            }
        }
        featureNames = List.copyOf(featureNames);
        stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        degenerateColumns = Collections.unmodifiableSet(new LinkedHashSet<>(degenerateColumns));
    }

    public ColumnStats statsOf(String column) {
        ColumnStats s = stats.get(column);
        if (s == null) {
            throw new IllegalArgumentException("column " + column + " не входит в состояние нормализации");
        }
        return s;
    }

    public boolean isDegenerate(String column) {
        return degenerateColumns.contains(column);
    }

    public String toJson(ObjectMapper om) {
        try {
            return om.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("normalization state serialization failed: " + e.getMessage(), e);
        }
    }

    public static NormalizationState fromJson(ObjectMapper om, String json) {
        try {
            return om.readValue(json, NormalizationState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("normalization state parse failed: " + e.getMessage(), e);
        }
    }
}
