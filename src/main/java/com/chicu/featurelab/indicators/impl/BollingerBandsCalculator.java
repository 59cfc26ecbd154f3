package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * Полосы Боллинджера: middle = SMA(close), полуширина = width × выборочное std(close).
 */
public class BollingerBandsCalculator implements IndicatorCalculator {

    public static final String UPPER = "BB_Upper";
    public static final String MIDDLE = "BB_Middle";
    public static final String LOWER = "BB_Lower";

    private final int period;
    private final double width;

    public BollingerBandsCalculator(int period, double width) {
        if (period < 2) throw new IllegalArgumentException("bollinger period must be >= 2, got " + period);
        if (!(width > 0)) throw new IllegalArgumentException("bollinger width must be > 0, got " + width);
        this.period = period;
        this.width = width;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.BOLLINGER;
    }

    @Override
    public List<String> columnNames() {
        return List.of(UPPER, MIDDLE, LOWER);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] closes = bars.closes();
        double[] middle = IndicatorMath.rollingMean(closes, period);
        double[] std = IndicatorMath.rollingSampleStd(closes, period);

        int n = closes.length;
        double[] upper = IndicatorMath.nans(n);
        double[] lower = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(middle[i]) || Double.isNaN(std[i])) continue;
            double half = width * std[i];
            upper[i] = middle[i] + half;
            lower[i] = middle[i] - half;
        }

        return List.of(
                new IndicatorColumn(UPPER, upper),
                new IndicatorColumn(MIDDLE, middle),
                new IndicatorColumn(LOWER, lower)
        );
    }
}
