package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/** CCI по типичной цене (H+L+C)/3. Нулевое среднее отклонение → NaN. */
public class CciCalculator implements IndicatorCalculator {

    public static final String COLUMN = "CCI";
    public static final double LAMBERT_CONSTANT = 0.015;

    private final int period;

    public CciCalculator(int period) {
        if (period < 1) throw new IllegalArgumentException("cci period must be >= 1, got " + period);
        this.period = period;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.CCI;
    }

    @Override
    public List<String> columnNames() {
        return List.of(COLUMN);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] tp = bars.typicalPrices();
        double[] mean = IndicatorMath.rollingMean(tp, period);
        double[] mad = IndicatorMath.rollingMeanAbsDeviation(tp, period);

        int n = tp.length;
        double[] cci = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(mean[i]) || Double.isNaN(mad[i]) || mad[i] == 0.0) continue;
            cci[i] = (tp[i] - mean[i]) / (LAMBERT_CONSTANT * mad[i]);
        }
        return List.of(new IndicatorColumn(COLUMN, cci));
    }
}
