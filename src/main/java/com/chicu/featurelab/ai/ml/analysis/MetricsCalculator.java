package com.chicu.featurelab.ai.ml.analysis;

import com.chicu.featurelab.ai.ml.dataset.LabeledTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Метрики предсказаний внешнего тренера на отложенном сегменте.
 *
 * precision / recall / f1 усредняются по классам с весом = число истинных примеров класса.
 * Если у класса знаменатель 0 (ни одного предсказания или ни одного примера), его метрика 0.
 */
@Slf4j
@Component
public class MetricsCalculator {

    /** Метки test-сегмента против предсказаний тренера */
    public EvaluationMetrics compute(LabeledTable test, int[] predicted, double[] upProbabilities) {
        if (test == null) throw new IllegalArgumentException("test=null");
        return compute(test.labelCodes(), predicted, upProbabilities);
    }

    /**
     * @param actual          истинные метки 0/1
     * @param predicted       предсказанные метки 0/1
     * @param upProbabilities вероятность UP по каждой строке, null если тренер их не отдал
     */
    public EvaluationMetrics compute(int[] actual, int[] predicted, double[] upProbabilities) {
        int[][] cm = confusionMatrix(actual, predicted);
        int n = actual.length;

        EvaluationMetrics.EvaluationMetricsBuilder b = EvaluationMetrics.builder()
                .samples(n)
                .accuracy((double) (cm[0][0] + cm[1][1]) / n)
                .confusionMatrix(cm);

        double precision = 0.0;
        double recall = 0.0;
        double f1 = 0.0;
        for (int c = 0; c <= 1; c++) {
            int tp = cm[c][c];
            int fp = cm[1 - c][c];
            int fn = cm[c][1 - c];
            int support = tp + fn;
            precision += support * ratio(tp, tp + fp);
            recall += support * ratio(tp, tp + fn);
            f1 += support * ratio(2 * tp, 2 * tp + fp + fn);
        }
        b.precision(precision / n).recall(recall / n).f1Score(f1 / n);

        if (upProbabilities != null) {
            RocCurve roc = rocCurve(actual, upProbabilities);
            b.rocAuc(roc.auc()).fpr(roc.fpr()).tpr(roc.tpr());
        } else {
            b.rocAuc(Double.NaN).fpr(new double[0]).tpr(new double[0]);
        }

        EvaluationMetrics m = b.build();
        log.info("📈 Metrics: samples={} {} cm={}", n, m.asMap(), Arrays.deepToString(cm));
        return m;
    }

    /** [[TN, FP], [FN, TP]] */
    public int[][] confusionMatrix(int[] actual, int[] predicted) {
        requireLabels("actual", actual);
        requireLabels("predicted", predicted);
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("размеры не совпадают: actual=" + actual.length + " predicted=" + predicted.length);
        }
        int[][] cm = new int[2][2];
        for (int i = 0; i < actual.length; i++) {
            cm[actual[i]][predicted[i]]++;
        }
        return cm;
    }

    public record RocCurve(double auc, double[] fpr, double[] tpr) {}

    /**
     * ROC по убыванию вероятности UP. Точка добавляется на каждом различном пороге,
     * одинаковые вероятности идут одним шагом. AUC = площадь под ломаной (трапеции).
     */
    public RocCurve rocCurve(int[] actual, double[] upProbabilities) {
        requireLabels("actual", actual);
        if (upProbabilities == null || upProbabilities.length != actual.length) {
            throw new IllegalArgumentException("probabilities length="
                    + (upProbabilities == null ? "null" : upProbabilities.length) + " expected=" + actual.length);
        }
        for (int i = 0; i < upProbabilities.length; i++) {
            double p = upProbabilities[i];
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new IllegalArgumentException("probability[" + i + "] must be in [0, 1], got " + p);
            }
        }

        int pos = 0;
        for (int a : actual) pos += a;
        int neg = actual.length - pos;
        if (pos == 0 || neg == 0) {
            throw new IllegalArgumentException("roc_auc не определён: в actual только один класс (up=" + pos + ", down=" + neg + ")");
        }

        Integer[] order = IntStream.range(0, actual.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> upProbabilities[i]).reversed());

        List<double[]> points = new ArrayList<>();
        points.add(new double[]{0.0, 0.0});
        int tp = 0;
        int fp = 0;
        for (int k = 0; k < order.length; k++) {
            int i = order[k];
            if (actual[i] == 1) tp++;
            else fp++;
            boolean lastOfThreshold = k == order.length - 1 || upProbabilities[order[k + 1]] != upProbabilities[i];
            if (lastOfThreshold) {
                points.add(new double[]{(double) fp / neg, (double) tp / pos});
            }
        }

        double[] fpr = new double[points.size()];
        double[] tpr = new double[points.size()];
        double auc = 0.0;
        for (int k = 0; k < points.size(); k++) {
            fpr[k] = points.get(k)[0];
            tpr[k] = points.get(k)[1];
            if (k > 0) {
                auc += (fpr[k] - fpr[k - 1]) * (tpr[k] + tpr[k - 1]) / 2.0;
            }
        }
        return new RocCurve(auc, fpr, tpr);
    }

    private static double ratio(int num, int den) {
        return den == 0 ? 0.0 : (double) num / den;
    }

    private static void requireLabels(String name, int[] labels) {
        if (labels == null || labels.length == 0) throw new IllegalArgumentException(name + " пустые");
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != 0 && labels[i] != 1) {
                throw new IllegalArgumentException(name + "[" + i + "] должен быть 0/1, а пришло: " + labels[i]);
            }
        }
    }
}
