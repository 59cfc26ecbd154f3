package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * ADX (сила тренда, 0..100).
 *
 * 1) +DM/-DM и true range начиная со строки 1 (у строки 0 нет предыдущего бара)
 * 2) суммы за period → +DI / -DI
 * 3) DX = 100 * |+DI - -DI| / (+DI + -DI)
 * 4) ADX = простое среднее DX за period
 *
 * Сглаживание простое (скользящие суммы/среднее), не Уайлдер.
 */
public class AdxCalculator implements IndicatorCalculator {

    public static final String COLUMN = "ADX";

    private final int period;

    public AdxCalculator(int period) {
        if (period < 1) throw new IllegalArgumentException("adx period must be >= 1, got " + period);
        this.period = period;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.ADX;
    }

    @Override
    public List<String> columnNames() {
        return List.of(COLUMN);
    }

    @Override
    public int minimumBars() {
        return period;
    }

    /** DI с бара period, ADX как среднее period значений DX: первый на строке 2*period - 1 */
    @Override
    public int warmupBars() {
        return 2 * period;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] highs = bars.highs();
        double[] lows = bars.lows();
        double[] closes = bars.closes();
        int n = closes.length;

        double[] plusDm = IndicatorMath.nans(n);
        double[] minusDm = IndicatorMath.nans(n);
        double[] tr = IndicatorMath.trueRange(highs, lows, closes);
        if (n > 0) tr[0] = Double.NaN;

        for (int i = 1; i < n; i++) {
            double up = highs[i] - highs[i - 1];
            double down = lows[i - 1] - lows[i];
            plusDm[i] = (up > down && up > 0) ? up : 0.0;
            minusDm[i] = (down > up && down > 0) ? down : 0.0;
        }

        double[] plusSum = IndicatorMath.rollingSum(plusDm, period);
        double[] minusSum = IndicatorMath.rollingSum(minusDm, period);
        double[] trSum = IndicatorMath.rollingSum(tr, period);

        double[] dx = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(trSum[i]) || trSum[i] <= 0.0) continue;
            double plusDi = 100.0 * plusSum[i] / trSum[i];
            double minusDi = 100.0 * minusSum[i] / trSum[i];
            double diSum = plusDi + minusDi;
            if (diSum <= 0.0) continue;
            dx[i] = 100.0 * Math.abs(plusDi - minusDi) / diSum;
        }

        double[] adx = IndicatorMath.rollingMean(dx, period);
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(adx[i])) adx[i] = Math.max(0.0, Math.min(100.0, adx[i]));
        }
        return List.of(new IndicatorColumn(COLUMN, adx));
    }
}
