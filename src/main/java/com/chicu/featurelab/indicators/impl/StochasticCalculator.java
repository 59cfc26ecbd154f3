package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * Стохастик: %K по диапазону high/low за period баров, %D = SMA(%K, smoothing).
 * Нулевой диапазон → %K не определён (NaN), дальше его разрулит политика пропусков.
 */
public class StochasticCalculator implements IndicatorCalculator {

    public static final String K = "Stoch_K";
    public static final String D = "Stoch_D";

    private final int period;
    private final int smoothing;

    public StochasticCalculator(int period, int smoothing) {
        if (period < 1) throw new IllegalArgumentException("stochastic period must be >= 1, got " + period);
        if (smoothing < 1) throw new IllegalArgumentException("stochastic smoothing must be >= 1, got " + smoothing);
        this.period = period;
        this.smoothing = smoothing;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.STOCHASTIC;
    }

    @Override
    public List<String> columnNames() {
        return List.of(K, D);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    @Override
    public int warmupBars() {
        return period + smoothing - 1;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] closes = bars.closes();
        double[] lowest = IndicatorMath.rollingMin(bars.lows(), period);
        double[] highest = IndicatorMath.rollingMax(bars.highs(), period);

        int n = closes.length;
        double[] k = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(lowest[i]) || Double.isNaN(highest[i])) continue;
            double range = highest[i] - lowest[i];
            if (range <= 0.0) continue;
            double v = 100.0 * (closes[i] - lowest[i]) / range;
            k[i] = Math.max(0.0, Math.min(100.0, v));
        }

        double[] d = IndicatorMath.rollingMean(k, smoothing);

        return List.of(new IndicatorColumn(K, k), new IndicatorColumn(D, d));
    }
}
