package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.ArrayList;
import java.util.List;

/** Простые скользящие средние close, по одной колонке SMA_{period} на каждый период */
public class SmaCalculator implements IndicatorCalculator {

    private final List<Integer> periods;

    public SmaCalculator(List<Integer> periods) {
        if (periods == null || periods.isEmpty()) {
            throw new IllegalArgumentException("sma periods пустые");
        }
        for (Integer p : periods) {
            if (p == null || p < 1) throw new IllegalArgumentException("sma period must be >= 1, got " + p);
        }
        if (periods.stream().distinct().count() != periods.size()) {
            throw new IllegalArgumentException("sma periods must be distinct: " + periods);
        }
        this.periods = List.copyOf(periods);
    }

    public static String columnName(int period) {
        return "SMA_" + period;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.SMA;
    }

    @Override
    public List<String> columnNames() {
        return periods.stream().map(SmaCalculator::columnName).toList();
    }

    @Override
    public int minimumBars() {
        return periods.stream().mapToInt(Integer::intValue).max().orElse(1);
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] closes = bars.closes();
        List<IndicatorColumn> out = new ArrayList<>(periods.size());
        for (int period : periods) {
            out.add(new IndicatorColumn(columnName(period), IndicatorMath.rollingMean(closes, period)));
        }
        return out;
    }
}
