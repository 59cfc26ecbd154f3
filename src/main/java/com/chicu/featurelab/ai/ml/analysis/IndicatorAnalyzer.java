package com.chicu.featurelab.ai.ml.analysis;

import com.chicu.featurelab.ai.ml.dataset.LabeledTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Разбор важностей фич, которые вернул внешний тренер.
 *
 * Контракт на вход: importance ≥ 0 по каждой колонке, сумма = 1 (допуск 1e-6).
 * Ранжирование стабильное: при равной важности сохраняется порядок входной мапы.
 */
@Slf4j
@Component
public class IndicatorAnalyzer {

    static final double SUM_TOLERANCE = 1e-6;
    static final double STRONG_CORRELATION = 0.3;
    static final double GOOD_ACCURACY = 0.60;
    static final double MODERATE_ACCURACY = 0.55;

    public void validateImportances(Map<String, Double> importances) {
        if (importances == null || importances.isEmpty()) {
            throw new IllegalArgumentException("feature importances пустые");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : importances.entrySet()) {
            Double v = e.getValue();
            if (v == null || !(v >= 0) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("importance must be >= 0: " + e.getKey() + "=" + v);
            }
            sum += v;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("importances must sum to 1.0, got " + sum);
        }
    }

    public List<Map.Entry<String, Double>> rankByImportance(Map<String, Double> importances) {
        validateImportances(importances);
        List<Map.Entry<String, Double>> ranked = new ArrayList<>();
        importances.forEach((k, v) -> ranked.add(Map.entry(k, v)));
        ranked.sort(Map.Entry.<String, Double>comparingByValue().reversed());
        return ranked;
    }

    public List<String> topIndicators(Map<String, Double> importances, int topN) {
        if (topN < 1) throw new IllegalArgumentException("topN must be >= 1, got " + topN);
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Double> e : rankByImportance(importances)) {
            if (out.size() == topN) break;
            out.add(e.getKey());
        }
        return out;
    }

    /** Вложенные комбинации из лучших: [top1], [top1, top2], [top1, top2, top3] ... */
    public List<List<String>> topCombinations(Map<String, Double> importances, int topN) {
        List<String> top = topIndicators(importances, topN);
        List<List<String>> combos = new ArrayList<>();
        for (int i = 1; i <= top.size(); i++) {
            combos.add(List.copyOf(top.subList(0, i)));
        }
        return combos;
    }

    /**
     * |корреляция Пирсона| каждой колонки с метками (0/1), по убыванию.
     * Если корреляция не определена (константная колонка), пишем 0.
     */
    public Map<String, Double> correlationWithLabels(LabeledTable table, List<String> columns) {
        if (table == null) throw new IllegalArgumentException("table=null");
        if (columns == null) throw new IllegalArgumentException("columns=null");

        double[] y = new double[table.rowCount()];
        int[] codes = table.labelCodes();
        for (int i = 0; i < y.length; i++) y[i] = codes[i];

        List<Map.Entry<String, Double>> list = new ArrayList<>();
        for (String col : columns) {
            if (!table.table().hasColumn(col)) continue;
            double r = pearson(table.table().column(col), y);
            list.add(Map.entry(col, Double.isNaN(r) ? 0.0 : Math.abs(r)));
        }
        list.sort(Map.Entry.<String, Double>comparingByValue().reversed());

        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : list) out.put(e.getKey(), e.getValue());
        return out;
    }

    public List<String> generateInsights(Map<String, Double> importances,
                                         Map<String, Double> correlations,
                                         Map<String, Double> metrics) {
        List<String> insights = new ArrayList<>();

        List<String> top = topIndicators(importances, 3);
        insights.add("Top " + top.size() + " most predictive indicators: " + String.join(", ", top));

        double accuracy = metric(metrics, EvaluationMetrics.ACCURACY);
        String pct = String.format(Locale.ROOT, "%.1f%%", accuracy * 100.0);
        if (accuracy > GOOD_ACCURACY) {
            insights.add("Model shows good predictive power with " + pct + " accuracy");
        } else if (accuracy > MODERATE_ACCURACY) {
            insights.add("Model shows moderate predictive power with " + pct + " accuracy");
        } else {
            insights.add("Model shows weak predictive power with " + pct + " accuracy");
        }

        List<String> strong = new ArrayList<>();
        if (correlations != null) {
            correlations.forEach((k, v) -> {
                if (v != null && v > STRONG_CORRELATION) strong.add(k);
            });
        }
        if (!strong.isEmpty()) {
            insights.add("Indicators with strong correlation to price movements: " + String.join(", ", strong));
        }

        log.info("💡 Insights: {}", insights);
        return insights;
    }

    /**
     * Советы по результатам оценки: по accuracy, по лучшим индикаторам и по перекосу precision/recall.
     * metrics в формате {@link EvaluationMetrics#asMap()}, отсутствующая метрика = 0.
     */
    public List<String> generateRecommendations(Map<String, Double> metrics, Map<String, Double> importances) {
        List<String> recommendations = new ArrayList<>();

        double accuracy = metric(metrics, EvaluationMetrics.ACCURACY);
        if (accuracy < MODERATE_ACCURACY) {
            recommendations.add("Model accuracy is below 55%. Consider collecting more data or adjusting features.");
        } else if (accuracy < GOOD_ACCURACY) {
            recommendations.add("Model shows moderate performance. Consider feature engineering or hyperparameter tuning.");
        }

        recommendations.add("Focus trading strategy on top indicators: " + String.join(", ", topIndicators(importances, 3)));

        double precision = metric(metrics, EvaluationMetrics.PRECISION);
        double recall = metric(metrics, EvaluationMetrics.RECALL);
        if (precision > recall) {
            recommendations.add("Model has high precision but lower recall. "
                    + "Consider adjusting decision threshold to catch more positive cases.");
        } else if (recall > precision) {
            recommendations.add("Model has high recall but lower precision. "
                    + "Consider adjusting decision threshold to reduce false positives.");
        }

        log.info("🧭 Recommendations: {}", recommendations);
        return recommendations;
    }

    private static double metric(Map<String, Double> metrics, String name) {
        Double v = metrics != null ? metrics.get(name) : null;
        return v != null ? v : 0.0;
    }

    static double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n != y.length) throw new IllegalArgumentException("length mismatch: " + n + " vs " + y.length);
        if (n < 2) return Double.NaN;

        double mx = 0.0;
        double my = 0.0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;

        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) return Double.NaN;
        return sxy / Math.sqrt(sxx * syy);
    }
}
