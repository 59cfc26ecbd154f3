package com.chicu.featurelab.indicators;

import java.util.Arrays;

/**
 * Оконные функции над выровненными массивами.
 *
 * Каждое окно суммируется заново слева направо (без скользящей суммы),
 * поэтому результат не зависит от истории вычислений и бит-в-бит повторяется.
 * Окно, где есть хоть один NaN, даёт NaN.
 */
public final class IndicatorMath {

    private IndicatorMath() {}

    public static double[] nans(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    public static double[] rollingSum(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        for (int i = window - 1; i < values.length; i++) {
            out[i] = windowSum(values, i - window + 1, i);
        }
        return out;
    }

    public static double[] rollingMean(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double sum = windowSum(values, i - window + 1, i);
            out[i] = Double.isNaN(sum) ? Double.NaN : sum / window;
        }
        return out;
    }

    /** Выборочное стандартное отклонение (n - 1), как у rolling().std() */
    public static double[] rollingSampleStd(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        if (window < 2) return out;
        for (int i = window - 1; i < values.length; i++) {
            int from = i - window + 1;
            double sum = windowSum(values, from, i);
            if (Double.isNaN(sum)) continue;
            double mean = sum / window;
            double sq = 0.0;
            for (int j = from; j <= i; j++) {
                double d = values[j] - mean;
                sq += d * d;
            }
            out[i] = Math.sqrt(sq / (window - 1));
        }
        return out;
    }

    /** Среднее абсолютное отклонение от среднего окна */
    public static double[] rollingMeanAbsDeviation(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        for (int i = window - 1; i < values.length; i++) {
            int from = i - window + 1;
            double sum = windowSum(values, from, i);
            if (Double.isNaN(sum)) continue;
            double mean = sum / window;
            double dev = 0.0;
            for (int j = from; j <= i; j++) {
                dev += Math.abs(values[j] - mean);
            }
            out[i] = dev / window;
        }
        return out;
    }

    public static double[] rollingMin(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            boolean hasNaN = false;
            for (int j = i - window + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) { hasNaN = true; break; }
                min = Math.min(min, values[j]);
            }
            out[i] = hasNaN ? Double.NaN : min;
        }
        return out;
    }

    public static double[] rollingMax(double[] values, int window) {
        requireWindow(window);
        double[] out = nans(values.length);
        for (int i = window - 1; i < values.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            boolean hasNaN = false;
            for (int j = i - window + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) { hasNaN = true; break; }
                max = Math.max(max, values[j]);
            }
            out[i] = hasNaN ? Double.NaN : max;
        }
        return out;
    }

    /**
     * EMA как явная свёртка {@link EmaState} по массиву.
     * Затравка: простое среднее первых {@code period} определённых значений.
     */
    public static double[] ema(double[] values, int period) {
        double[] out = nans(values.length);
        EmaState state = EmaState.start(period);
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) continue;
            state = state.next(values[i]);
            out[i] = state.current();
        }
        return out;
    }

    /**
     * True range: max(H-L, |H-prevC|, |L-prevC|). Для первой строки prevC нет, берём H-L.
     */
    public static double[] trueRange(double[] highs, double[] lows, double[] closes) {
        int n = closes.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double hl = highs[i] - lows[i];
            if (i == 0) {
                out[i] = hl;
                continue;
            }
            double prevClose = closes[i - 1];
            out[i] = Math.max(hl, Math.max(Math.abs(highs[i] - prevClose), Math.abs(lows[i] - prevClose)));
        }
        return out;
    }

    private static double windowSum(double[] values, int from, int to) {
        double sum = 0.0;
        for (int j = from; j <= to; j++) {
            double v = values[j];
            if (Double.isNaN(v)) return Double.NaN;
            sum += v;
        }
        return sum;
    }

    private static void requireWindow(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got " + window);
        }
    }
}
