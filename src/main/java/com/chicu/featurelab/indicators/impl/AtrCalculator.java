package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * ATR: простое скользящее среднее true range за {@code period} баров.
 * Первые period-1 строк не определены.
 */
public class AtrCalculator implements IndicatorCalculator {

    public static final String COLUMN = "ATR";

    private final int period;

    public AtrCalculator(int period) {
        if (period < 1) throw new IllegalArgumentException("atr period must be >= 1, got " + period);
        this.period = period;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.ATR;
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
        double[] tr = IndicatorMath.trueRange(bars.highs(), bars.lows(), bars.closes());
        return List.of(new IndicatorColumn(COLUMN, IndicatorMath.rollingMean(tr, period)));
    }
}
