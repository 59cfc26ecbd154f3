package com.chicu.featurelab.indicators;

/**
 * Состояние рекуррентной EMA, которое явно передаётся из шага в шаг.
 *
 * Пока не набрано {@code period} значений, копится сумма для затравки (простое среднее).
 * После затравки: {@code ema = prev + alpha * (x - prev)}, {@code alpha = 2 / (period + 1)}.
 */
public record EmaState(int period, int seen, double seedSum, double value) {

    public EmaState {
        if (period < 1) {
            throw new IllegalArgumentException("ema period must be >= 1, got " + period);
        }
    }

    public static EmaState start(int period) {
        return new EmaState(period, 0, 0.0, Double.NaN);
    }

    public boolean seeded() {
        return seen >= period;
    }

    public double alpha() {
        return 2.0 / (period + 1);
    }

    /** Один шаг свёртки. NaN на входе состояние не двигает. */
    public EmaState next(double x) {
        if (Double.isNaN(x)) {
            return this;
        }
        if (seeded()) {
            return new EmaState(period, seen + 1, seedSum, value + alpha() * (x - value));
        }
        double sum = seedSum + x;
        int count = seen + 1;
        if (count == period) {
            return new EmaState(period, count, sum, sum / period);
        }
        return new EmaState(period, count, sum, Double.NaN);
    }

    /** Текущее значение EMA или NaN, пока затравка не набрана */
    public double current() {
        return seeded() ? value : Double.NaN;
    }
}
