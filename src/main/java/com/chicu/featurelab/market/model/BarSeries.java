package com.chicu.featurelab.market.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Неизменяемая упорядоченная по времени последовательность баров.
 * Загружается снаружи один раз на прогон, калькуляторы только читают.
 */
public final class BarSeries {

    private final List<Bar> bars;

    private BarSeries(List<Bar> bars) {
        this.bars = bars;
    }

    public static BarSeries of(List<Bar> bars) {
        if (bars == null) {
            throw new IllegalArgumentException("bars=null");
        }
        List<Bar> copy = new ArrayList<>(bars.size());
        Bar prev = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar b = bars.get(i);
            if (b == null) {
                throw new IllegalArgumentException("bars[" + i + "]=null");
            }
            if (prev != null && b.time() <= prev.time()) {
                throw new IllegalArgumentException("timestamps must be strictly increasing: row=" + i
                        + " prev=" + prev.time() + " current=" + b.time());
            }
            copy.add(b);
            prev = b;
        }
        return new BarSeries(Collections.unmodifiableList(copy));
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    public List<Bar> bars() {
        return bars;
    }

    // колонки в виде массивов: всегда свежая копия

    public long[] times() {
        long[] out = new long[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).time();
        return out;
    }

    public double[] opens() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).open();
        return out;
    }

    public double[] highs() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).high();
        return out;
    }

    public double[] lows() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).low();
        return out;
    }

    public double[] closes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).close();
        return out;
    }

    public double[] volumes() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).volume();
        return out;
    }

    public double[] typicalPrices() {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) out[i] = bars.get(i).typicalPrice();
        return out;
    }
}
