package com.chicu.featurelab.ai.ml.analysis;

import lombok.Builder;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Метрики бинарного классификатора на отложенном сегменте.
 *
 * confusionMatrix всегда 2x2, строки = истинный класс, колонки = предсказанный:
 * [[TN, FP], [FN, TP]] (0 = DOWN, 1 = UP).
 * rocAuc / fpr / tpr есть только если тренер отдал вероятности (иначе NaN и пустые массивы).
 */
@Builder(toBuilder = true)
public record EvaluationMetrics(

        int samples,

        // качество классификации
        double accuracy,
        double precision,
        double recall,
        double f1Score,

        int[][] confusionMatrix,

        // ранжирование по вероятностям
        double rocAuc,
        double[] fpr,
        double[] tpr
) {

    public static final String ACCURACY = "accuracy";
    public static final String PRECISION = "precision";
    public static final String RECALL = "recall";
    public static final String F1_SCORE = "f1_score";
    public static final String ROC_AUC = "roc_auc";

    public boolean hasRocAuc() {
        return !Double.isNaN(rocAuc);
    }

    public int trueNegatives() {
        return confusionMatrix[0][0];
    }

    public int falsePositives() {
        return confusionMatrix[0][1];
    }

    public int falseNegatives() {
        return confusionMatrix[1][0];
    }

    public int truePositives() {
        return confusionMatrix[1][1];
    }

    /** Скалярные метрики по именам, в таком виде их читает {@link IndicatorAnalyzer} */
    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(ACCURACY, accuracy);
        m.put(PRECISION, precision);
        m.put(RECALL, recall);
        m.put(F1_SCORE, f1Score);
        if (hasRocAuc()) m.put(ROC_AUC, rocAuc);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationMetrics other)) return false;
        return samples == other.samples
                && Double.compare(accuracy, other.accuracy) == 0
                && Double.compare(precision, other.precision) == 0
                && Double.compare(recall, other.recall) == 0
                && Double.compare(f1Score, other.f1Score) == 0
                && Double.compare(rocAuc, other.rocAuc) == 0
                && Arrays.deepEquals(confusionMatrix, other.confusionMatrix)
                && Arrays.equals(fpr, other.fpr)
                && Arrays.equals(tpr, other.tpr);
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(accuracy);
        h = 31 * h + samples;
        h = 31 * h + Double.hashCode(precision);
        h = 31 * h + Double.hashCode(recall);
        h = 31 * h + Double.hashCode(f1Score);
        h = 31 * h + Double.hashCode(rocAuc);
        h = 31 * h + Arrays.deepHashCode(confusionMatrix);
        h = 31 * h + Arrays.hashCode(fpr);
        return 31 * h + Arrays.hashCode(tpr);
    }

    @Override
    public String toString() {
        return "EvaluationMetrics[samples=" + samples + ", " + asMap()
                + ", confusionMatrix=" + Arrays.deepToString(confusionMatrix) + "]";
    }
}
