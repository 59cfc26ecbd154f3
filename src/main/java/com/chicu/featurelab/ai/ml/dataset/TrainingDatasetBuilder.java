package com.chicu.featurelab.ai.ml.dataset;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * TrainingDatasetBuilder
 * ======================
 * Собирает обучающую матрицу из (возможно перебалансированного) train-сегмента:
 * - X: double[][]
 * - y: int[] (1 = UP, 0 = DOWN)
 * - weights: вес каждой строки
 * - synthetic: строка сгенерирована оверсэмплингом
 * - sourceTimes: время исходной строки (для синтетики время базовой строки)
 *
 * Если datasetId не задан, он выводится из содержимого (имена фич, стратегия, все строки):
 * одинаковый вход и seed дают одинаковый id.
 */
@Slf4j
@Service
public class TrainingDatasetBuilder {

    /**
     * Сырые строки датасета до сборки.
     */
    public record Rows(
            String datasetId,
            List<String> featureNames,
            List<double[]> xRows,
            List<Integer> y,
            List<Double> weights,
            List<Boolean> synthetic,
            List<Long> sourceTimes
    ) {
        public static Rows empty(List<String> featureNames) {
            return new Rows(null, featureNames,
                    new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        }

        public void add(double[] x, int label, double weight, boolean isSynthetic, long sourceTime) {
            xRows.add(x);
            y.add(label);
            weights.add(weight);
            synthetic.add(isSynthetic);
            sourceTimes.add(sourceTime);
        }
    }

    /**
     * Готовый датасет для внешнего тренера.
     * X: матрица [n_samples][n_features]
     * y: массив меток [n_samples]
     *
     * Массивы отдаются как есть, без копий: датасет большой и уходит тренеру целиком.
     * equals/hashCode сравнивают содержимое массивов.
     */
    public record Dataset(
            String datasetId,
            List<String> featureNames,
            double[][] X,
            int[] y,
            double[] weights,
            boolean[] synthetic,
            long[] sourceTimes,
            BalanceStrategy strategy,
            int samples,
            int features
    ) {
        public int syntheticCount() {
            int c = 0;
            for (boolean s : synthetic) if (s) c++;
            return c;
        }

        public int count(Label label) {
            int c = 0;
            for (int v : y) if (v == label.code()) c++;
            return c;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Dataset other)) return false;
            return samples == other.samples
                    && features == other.features
                    && strategy == other.strategy
                    && datasetId.equals(other.datasetId)
                    && featureNames.equals(other.featureNames)
                    && Arrays.deepEquals(X, other.X)
                    && Arrays.equals(y, other.y)
                    && Arrays.equals(weights, other.weights)
                    && Arrays.equals(synthetic, other.synthetic)
                    && Arrays.equals(sourceTimes, other.sourceTimes);
        }

        @Override
        public int hashCode() {
            int h = Objects.hash(datasetId, featureNames, strategy, samples, features);
            h = 31 * h + Arrays.deepHashCode(X);
            h = 31 * h + Arrays.hashCode(y);
            h = 31 * h + Arrays.hashCode(weights);
            h = 31 * h + Arrays.hashCode(synthetic);
            return 31 * h + Arrays.hashCode(sourceTimes);
        }

        @Override
        public String toString() {
            return "Dataset[id=" + datasetId + ", samples=" + samples + ", features=" + features
                    + ", strategy=" + strategy + ", synthetic=" + syntheticCount() + "]";
        }
    }

    public Dataset build(Rows rows, BalanceStrategy strategy) {
        if (rows == null) throw new IllegalArgumentException("rows=null");

        List<double[]> xRows = rows.xRows();
        List<Integer> yList = rows.y();

        if (xRows == null || yList == null || rows.weights() == null
                || rows.synthetic() == null || rows.sourceTimes() == null) {
            throw new IllegalArgumentException("rows.xRows/y/weights/synthetic/sourceTimes is null");
        }
        if (xRows.isEmpty()) {
            throw new IllegalArgumentException("dataset пустой (xRows=0)");
        }
        int n = xRows.size();
        if (yList.size() != n || rows.weights().size() != n
                || rows.synthetic().size() != n || rows.sourceTimes().size() != n) {
            throw new IllegalArgumentException("размеры не совпадают: xRows=" + n + " y=" + yList.size()
                    + " weights=" + rows.weights().size());
        }

        int f = rows.featureNames() != null ? rows.featureNames().size() : -1;

        for (int i = 0; i < n; i++) {
            double[] r = xRows.get(i);
            if (r == null) throw new IllegalArgumentException("xRows[" + i + "]=null");
            if (f < 0) f = r.length;
            if (r.length != f) {
                throw new IllegalArgumentException("разная длина фич: row=" + i + " len=" + r.length + " expected=" + f);
            }
            Integer lbl = yList.get(i);
            if (lbl == null) throw new IllegalArgumentException("y[" + i + "]=null");
            if (lbl != 0 && lbl != 1) {
                throw new IllegalArgumentException("y[" + i + "] должен быть 0/1, а пришло: " + lbl);
            }
            Double w = rows.weights().get(i);
            if (w == null || !(w > 0) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("weights[" + i + "] должен быть > 0, а пришло: " + w);
            }
        }

        double[][] x = new double[n][f];
        int[] y = new int[n];
        double[] weights = new double[n];
        boolean[] synthetic = new boolean[n];
        long[] times = new long[n];

        for (int i = 0; i < n; i++) {
            System.arraycopy(xRows.get(i), 0, x[i], 0, f);
            y[i] = yList.get(i);
            weights[i] = rows.weights().get(i);
            synthetic[i] = Boolean.TRUE.equals(rows.synthetic().get(i));
            times[i] = rows.sourceTimes().get(i);
        }

        List<String> names = rows.featureNames() != null ? List.copyOf(rows.featureNames()) : List.of();
        String id = (rows.datasetId() == null || rows.datasetId().isBlank())
                ? contentId(names, strategy, x, y, weights, synthetic, times)
                : rows.datasetId().trim();

        Dataset ds = new Dataset(id, names, x, y, weights, synthetic, times, strategy, n, f);

        log.info("📦 Dataset built: id={} samples={} features={} synthetic={} strategy={}",
                id, n, f, ds.syntheticCount(), strategy);
        return ds;
    }

    static String contentId(List<String> names,
                            BalanceStrategy strategy,
                            double[][] x,
                            int[] y,
                            double[] weights,
                            boolean[] synthetic,
                            long[] times) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(String.join("|", names).getBytes(StandardCharsets.UTF_8));
            md.update(String.valueOf(strategy).getBytes(StandardCharsets.UTF_8));

            int f = x.length > 0 ? x[0].length : 0;
            ByteBuffer row = ByteBuffer.allocate(Long.BYTES * (f + 2) + Integer.BYTES + 1);
            for (int i = 0; i < x.length; i++) {
                row.clear();
                row.putLong(times[i]).putInt(y[i]).put((byte) (synthetic[i] ? 1 : 0));
                row.putDouble(weights[i]);
                for (double v : x[i]) row.putDouble(v);
                md.update(row.array(), 0, row.position());
            }
            return UUID.nameUUIDFromBytes(md.digest()).toString();
        } catch (Exception e) {
            throw new IllegalStateException("dataset id error: " + e.getMessage(), e);
        }
    }
}
