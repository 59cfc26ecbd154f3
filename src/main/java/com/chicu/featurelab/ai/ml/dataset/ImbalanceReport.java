package com.chicu.featurelab.ai.ml.dataset;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Распределение классов в train-сегменте.
 *
 * imbalanceRatio = majority / minority (≥ 1, бесконечность если класс один),
 * imbalanced = доля миноритарного класса ниже threshold.
 * classWeights = total / (classes * count) для каждого присутствующего класса.
 */
public record ImbalanceReport(
        Map<Label, Integer> counts,
        int total,
        Label majority,
        Label minority,
        double minorityShare,
        double imbalanceRatio,
        double threshold,
        boolean imbalanced,
        Map<Label, Double> classWeights
) {

    public ImbalanceReport {
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
        classWeights = classWeights.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(classWeights));
    }

    public int count(Label label) {
        return counts.getOrDefault(label, 0);
    }

    public boolean singleClass() {
        return count(Label.UP) == 0 || count(Label.DOWN) == 0;
    }

    /** Доли классов, для метаданных */
    public Map<Label, Double> distribution() {
        Map<Label, Double> d = new EnumMap<>(Label.class);
        for (Map.Entry<Label, Integer> e : counts.entrySet()) {
            d.put(e.getKey(), total == 0 ? 0.0 : (double) e.getValue() / total);
        }
        return d;
    }
}
