package com.chicu.featurelab.indicators.impl;

import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.indicators.IndicatorMath;
import com.chicu.featurelab.indicators.IndicatorType;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * MACD: line = EMA(fast) - EMA(slow), signal = EMA(line, signal), histogram = line - signal.
 *
 * Все EMA считаются свёрткой от начала серии с затравкой простым средним,
 * поэтому значения зависят от точки старта: пересчёт всегда с нулевого бара.
 */
public class MacdCalculator implements IndicatorCalculator {

    public static final String LINE = "MACD";
    public static final String SIGNAL = "MACD_Signal";
    public static final String HISTOGRAM = "MACD_Histogram";

    private final int fast;
    private final int slow;
    private final int signal;

    public MacdCalculator(int fast, int slow, int signal) {
        if (fast < 1 || slow < 1 || signal < 1) {
            throw new IllegalArgumentException("macd periods must be >= 1: fast=" + fast + " slow=" + slow + " signal=" + signal);
        }
        if (fast >= slow) {
            throw new IllegalArgumentException("macd fast must be < slow: fast=" + fast + " slow=" + slow);
        }
        this.fast = fast;
        this.slow = slow;
        this.signal = signal;
    }

    @Override
    public IndicatorType type() {
        return IndicatorType.MACD;
    }

    @Override
    public List<String> columnNames() {
        return List.of(LINE, SIGNAL, HISTOGRAM);
    }

    @Override
    public int minimumBars() {
        return slow;
    }

    @Override
    public int warmupBars() {
        return slow + signal - 1;
    }

    @Override
    public List<IndicatorColumn> compute(BarSeries bars) {
        double[] closes = bars.closes();
        int n = closes.length;

        double[] emaFast = IndicatorMath.ema(closes, fast);
        double[] emaSlow = IndicatorMath.ema(closes, slow);

        double[] line = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(emaFast[i]) || Double.isNaN(emaSlow[i])) continue;
            line[i] = emaFast[i] - emaSlow[i];
        }

        double[] signalLine = IndicatorMath.ema(line, signal);

        double[] histogram = IndicatorMath.nans(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(line[i]) || Double.isNaN(signalLine[i])) continue;
            histogram[i] = line[i] - signalLine[i];
        }

        return List.of(
                new IndicatorColumn(LINE, line),
                new IndicatorColumn(SIGNAL, signalLine),
                new IndicatorColumn(HISTOGRAM, histogram)
        );
    }
}
