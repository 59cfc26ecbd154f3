package com.chicu.featurelab.ai.ml.features;

import com.chicu.featurelab.indicators.pipeline.FeatureTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Z-score нормализация колонок фич: (x - mean) / std.
 *
 * fit видит только референсные строки (train). Колонка с нулевым std считается вырожденной:
 * transform даёт 0, inverse возвращает mean, в лог уходит предупреждение.
 * OHLCV-колонки не трогаются.
 */
@Slf4j
@Component
public class FeatureNormalizer {

    /** std ниже этого (относительно масштаба колонки) считаем нулевым */
    static final double DEGENERATE_EPS = 1e-12;

    public NormalizationState fit(FeatureTable reference) {
        if (reference == null) throw new IllegalArgumentException("reference=null");
        if (reference.isEmpty()) throw new IllegalArgumentException("reference rows пустые");

        List<String> names = reference.featureColumns();
        Map<String, NormalizationState.ColumnStats> stats = new LinkedHashMap<>();
        Set<String> degenerate = new LinkedHashSet<>();

        int n = reference.rowCount();
        for (String name : names) {
            double[] v = reference.column(name);

            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                if (Double.isNaN(v[i])) {
                    throw new IllegalArgumentException("NaN in reference column " + name + " row=" + i);
                }
                sum += v[i];
            }
            double mean = sum / n;

            double sq = 0.0;
            for (int i = 0; i < n; i++) {
                double d = v[i] - mean;
                sq += d * d;
            }
            double std = Math.sqrt(sq / n);

            if (std <= DEGENERATE_EPS * Math.max(1.0, Math.abs(mean))) {
                degenerate.add(name);
                log.warn("⚠️ Degenerate column {}: zero variance over {} reference rows (mean={})", name, n, mean);
            }
            stats.put(name, new NormalizationState.ColumnStats(mean, std));
        }

        log.info("📐 Normalizer fit: columns={} referenceRows={} degenerate={}", names.size(), n, degenerate);
        return new NormalizationState(names, stats, degenerate, n);
    }

    /** fit по строкам [fromRow, toRow) */
    public NormalizationState fit(FeatureTable table, int fromRow, int toRow) {
        return fit(table.slice(fromRow, toRow));
    }

    public FeatureTable transform(FeatureTable table, NormalizationState state) {
        requireColumns(table, state);
        Map<String, double[]> out = new HashMap<>();
        for (String name : state.featureNames()) {
            NormalizationState.ColumnStats s = state.statsOf(name);
            boolean degenerate = state.isDegenerate(name);
            double[] v = table.column(name);
            for (int i = 0; i < v.length; i++) {
                v[i] = degenerate ? 0.0 : (v[i] - s.mean()) / s.std();
            }
            out.put(name, v);
        }
        return table.withColumns(out);
    }

    public FeatureTable inverse(FeatureTable table, NormalizationState state) {
        requireColumns(table, state);
        Map<String, double[]> out = new HashMap<>();
        for (String name : state.featureNames()) {
            NormalizationState.ColumnStats s = state.statsOf(name);
            boolean degenerate = state.isDegenerate(name);
            double[] v = table.column(name);
            for (int i = 0; i < v.length; i++) {
                v[i] = degenerate ? s.mean() : v[i] * s.std() + s.mean();
            }
            out.put(name, v);
        }
        return table.withColumns(out);
    }

    /**
     * Проверка inverse(transform(x)) == x для невырожденных колонок.
     * Допуск относительный: |back - x| <= tolerance * max(1, |x|).
     */
    public void verifyRoundTrip(FeatureTable original, NormalizationState state, double tolerance) {
        FeatureTable back = inverse(transform(original, state), state);
        for (String name : state.featureNames()) {
            if (state.isDegenerate(name)) continue;
            double[] a = original.column(name);
            double[] b = back.column(name);
            for (int i = 0; i < a.length; i++) {
                double diff = Math.abs(a[i] - b[i]);
                if (!(diff <= tolerance * Math.max(1.0, Math.abs(a[i])))) {
                    throw new IllegalStateException("normalization round-trip broken: column=" + name
                            + " row=" + i + " original=" + a[i] + " restored=" + b[i]);
                }
            }
        }
    }

    private static void requireColumns(FeatureTable table, NormalizationState state) {
        if (table == null) throw new IllegalArgumentException("table=null");
        if (state == null) throw new IllegalArgumentException("state=null");
        for (String name : state.featureNames()) {
            if (!table.hasColumn(name)) {
                throw new IllegalArgumentException("table has no column " + name);
            }
        }
    }
}
