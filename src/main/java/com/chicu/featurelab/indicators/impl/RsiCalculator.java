package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * RSI по простым средним приростов/потерь за {@code period} изменений close.
 * Если средняя потеря 0, значение насыщается в 100, деления на ноль нет.
 */
public class RsiCalculator implements IndicatorCalculator {

    public static final String COLUMN = "RSI";

    private final int period;

    public RsiCalculator(int period) {
        if (period < 1) throw new IllegalArgumentException("rsi period must be >= 1, got " + period);
        this.period = period;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.RSI;
    }

    @Override
    public List<String> columnNames() {
        return List.of(COLUMN);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    /** period изменений close, то есть period + 1 бар */
    @Override
    public int warmupBars() {
        return period + 1;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] closes = bars.closes();
        int n = closes.length;

        // изменение для строки 0 не определено
        double[] gains = IndicatorMath.nans(n);
        double[] losses = IndicatorMath.nans(n);
        for (int i = 1; i < n; i++) {
            double change = closes[i] - closes[i - 1];
            gains[i] = change > 0 ? change : 0.0;
            losses[i] = change < 0 ? -change : 0.0;
        }

        double[] avgGain = IndicatorMath.rollingMean(gains, period);
        double[] avgLoss = IndicatorMath.rollingMean(losses, period);

        double[] rsi = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(avgGain[i]) || Double.isNaN(avgLoss[i])) continue;
            rsi[i] = value(avgGain[i], avgLoss[i]);
        }
        return List.of(new IndicatorColumn(COLUMN, rsi));
    }

    static double value(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        double v = 100.0 - 100.0 / (1.0 + rs);
        return Math.max(0.0, Math.min(100.0, v));
    }
}
