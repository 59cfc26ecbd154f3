package com.chicu.featurelab.ai.ml.dataset;

import com.chicu.featurelab.common.error.SingleClassLabelsException;
import com.chicu.featurelab.config.FeatureSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Балансировка классов train-сегмента.
 *
 * <ul>
 *     <li>OVERSAMPLE: синтетические строки миноритарного класса (интерполяция
 *     к одному из k ближайших соседей того же класса), пока классы не сравняются;</li>
 *     <li>WEIGHT: строки не добавляются, каждой строке вес total / (classes * count);</li>
 *     <li>NONE: как есть, веса 1.</li>
 * </ul>
 *
 * Сюда приходит только train (уже нормализованный). Validation/test балансировщик не видит.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassBalancer {

    private final TrainingDatasetBuilder datasetBuilder;

    public ImbalanceReport inspect(List<Label> labels, double threshold) {
        if (labels == null || labels.isEmpty()) throw new IllegalArgumentException("labels пустые");
        if (!(threshold > 0 && threshold <= 0.5)) {
            throw new IllegalArgumentException("threshold must be in (0, 0.5], got " + threshold);
        }

        Map<Label, Integer> counts = new EnumMap<>(Label.class);
        for (Label l : labels) counts.merge(l, 1, Integer::sum);

        int up = counts.getOrDefault(Label.UP, 0);
        int down = counts.getOrDefault(Label.DOWN, 0);
        int total = up + down;

        // при равенстве миноритарным считаем DOWN
        Label minority = up < down ? Label.UP : Label.DOWN;
        Label majority = minority.opposite();
        int minCount = counts.getOrDefault(minority, 0);
        int maxCount = counts.getOrDefault(majority, 0);

        double share = (double) minCount / total;
        double ratio = minCount == 0 ? Double.POSITIVE_INFINITY : (double) maxCount / minCount;
        boolean imbalanced = share < threshold;

        Map<Label, Double> weights = new EnumMap<>(Label.class);
        int classes = counts.size();
        for (Map.Entry<Label, Integer> e : counts.entrySet()) {
            weights.put(e.getKey(), (double) total / (classes * e.getValue()));
        }

        return new ImbalanceReport(counts, total, majority, minority, share, ratio, threshold, imbalanced, weights);
    }

    public TrainingDatasetBuilder.Dataset rebalance(LabeledTable train, FeatureSettings settings) {
        if (settings == null) throw new IllegalArgumentException("settings=null");
        return rebalance(train, settings.balanceStrategy(), settings.imbalanceThreshold(),
                settings.oversampleNeighbors(), settings.oversampleSeed());
    }

    public TrainingDatasetBuilder.Dataset rebalance(LabeledTable train,
                                                    BalanceStrategy strategy,
                                                    double threshold,
                                                    int neighbors,
                                                    long seed) {
        if (train == null) throw new IllegalArgumentException("train=null");
        if (strategy == null) throw new IllegalArgumentException("strategy=null");
        if (neighbors < 1) throw new IllegalArgumentException("neighbors must be >= 1, got " + neighbors);

        ImbalanceReport report = inspect(train.labels(), threshold);
        if (report.singleClass()) {
            throw new SingleClassLabelsException(report.majority(), train.rowCount());
        }

        if (report.imbalanced()) {
            log.warn("⚠️ Class imbalance: minority={} share={} ratio={} threshold={} strategy={}",
                    report.minority(), String.format("%.4f", report.minorityShare()),
                    String.format("%.3f", report.imbalanceRatio()), threshold, strategy);
        }

        BalanceStrategy applied = report.imbalanced() ? strategy : BalanceStrategy.NONE;
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty(train.table().featureColumns());

        switch (applied) {
            case NONE -> addOriginal(rows, train, null);
            case WEIGHT -> addOriginal(rows, train, report.classWeights());
            case OVERSAMPLE -> {
                addOriginal(rows, train, null);
                oversample(rows, train, report, neighbors, seed);
            }
        }

        return datasetBuilder.build(rows, applied);
    }

    private static void addOriginal(TrainingDatasetBuilder.Rows rows, LabeledTable train, Map<Label, Double> weights) {
        for (int i = 0; i < train.rowCount(); i++) {
            Label l = train.label(i);
            double w = weights == null ? 1.0 : weights.get(l);
            rows.add(train.table().featureRow(i), l.code(), w, false, train.table().time(i));
        }
    }

    private void oversample(TrainingDatasetBuilder.Rows rows,
                            LabeledTable train,
                            ImbalanceReport report,
                            int neighbors,
                            long seed) {
        Label minority = report.minority();
        int need = report.count(report.majority()) - report.count(minority);

        List<Integer> idx = new ArrayList<>();
        for (int i = 0; i < train.rowCount(); i++) {
            if (train.label(i) == minority) idx.add(i);
        }
        int m = idx.size();
        double[][] points = new double[m][];
        for (int a = 0; a < m; a++) points[a] = train.table().featureRow(idx.get(a));

        int k = Math.min(neighbors, m - 1);
        int[][] nearest = nearestNeighbours(points, k);

        Random random = new Random(seed);
        for (int s = 0; s < need; s++) {
            int base = s % m;
            double[] x = points[base].clone();
            if (k > 0) {
                double[] nb = points[nearest[base][random.nextInt(k)]];
                double gap = random.nextDouble();
                for (int j = 0; j < x.length; j++) {
                    x[j] = x[j] + gap * (nb[j] - x[j]);
                }
            }
            rows.add(x, minority.code(), 1.0, true, train.table().time(idx.get(base)));
        }

        log.info("🧬 Oversampled: minority={} originalRows={} syntheticRows={} neighbours={} seed={}",
                minority, m, need, k, seed);
    }

    /** k ближайших соседей каждой точки (евклидово расстояние, при равенстве берётся меньший индекс) */
    static int[][] nearestNeighbours(double[][] points, int k) {
        int m = points.length;
        int[][] out = new int[m][];
        for (int a = 0; a < m; a++) {
            final int self = a;
            double[] dist = new double[m];
            List<Integer> others = new ArrayList<>(m - 1);
            for (int b = 0; b < m; b++) {
                if (b == self) continue;
                dist[b] = distance(points[self], points[b]);
                others.add(b);
            }
            others.sort(Comparator.<Integer>comparingDouble(b -> dist[b]).thenComparingInt(b -> b));
            out[a] = others.subList(0, k).stream().mapToInt(Integer::intValue).toArray();
        }
        return out;
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0.0;
        for (int j = 0; j < a.length; j++) {
            double d = a[j] - b[j];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
