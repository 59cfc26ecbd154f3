package com.chicu.featurelab.support;

import com.chicu.featurelab.market.model.Bar;
import com.chicu.featurelab.market.model.BarSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Детерминированные серии баров для тестов.
 */
public final class SyntheticBars {

    public static final long START = 1_700_000_000_000L;
    public static final long STEP = 60_000L;

    private SyntheticBars() {}

    /** Случайное блуждание с фиксированным seed: корректные OHLC, объём > 0 */
    public static BarSeries randomWalk(int n, long seed) {
        Random rnd = new Random(seed);
        List<Bar> bars = new ArrayList<>(n);
        double close = 100.0;
        for (int i = 0; i < n; i++) {
            double open = close;
            close = open * (1.0 + (rnd.nextDouble() - 0.5) * 0.02);
            double high = Math.max(open, close) * (1.0 + rnd.nextDouble() * 0.005);
            double low = Math.min(open, close) * (1.0 - rnd.nextDouble() * 0.005);
            long volume = 1_000L + rnd.nextInt(9_000);
            bars.add(new Bar(START + i * STEP, open, high, low, close, volume));
        }
        return BarSeries.of(bars);
    }

    /** Случайное блуждание с плоским участком [flatFrom, flatFrom + flatLength): o = h = l = c */
    public static BarSeries withFlatSegment(int n, long seed, int flatFrom, int flatLength) {
        BarSeries walk = randomWalk(n, seed);
        List<Bar> bars = new ArrayList<>(n);
        double flat = walk.get(flatFrom - 1).close();
        for (int i = 0; i < n; i++) {
            Bar b = walk.get(i);
            if (i >= flatFrom && i < flatFrom + flatLength) {
                bars.add(new Bar(b.time(), flat, flat, flat, flat, b.volume()));
            } else {
                bars.add(b);
            }
        }
        return BarSeries.of(bars);
    }

    /** Бары с заданными close: open = close, high/low = close ± 1% */
    public static BarSeries fromCloses(double... closes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            bars.add(new Bar(START + i * STEP, c, c * 1.01, c * 0.99, c, 1_000L));
        }
        return BarSeries.of(bars);
    }

    /** Бары, где o = h = l = c (типичная цена равна цене) */
    public static BarSeries flatBars(double... prices) {
        List<Bar> bars = new ArrayList<>(prices.length);
        for (int i = 0; i < prices.length; i++) {
            double p = prices[i];
            bars.add(new Bar(START + i * STEP, p, p, p, p, 1_000L));
        }
        return BarSeries.of(bars);
    }

    /** Ровный рост: close = 100 + i, high = close + 1, low = close - 1 */
    public static BarSeries steadyUptrend(int n) {
        List<Bar> bars = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double c = 100.0 + i;
            bars.add(new Bar(START + i * STEP, c, c + 1.0, c - 1.0, c, 1_000L));
        }
        return BarSeries.of(bars);
    }

    public static double[] range(int fromInclusive, int toInclusive) {
        double[] out = new double[toInclusive - fromInclusive + 1];
        for (int i = 0; i < out.length; i++) out[i] = fromInclusive + i;
        return out;
    }
}
