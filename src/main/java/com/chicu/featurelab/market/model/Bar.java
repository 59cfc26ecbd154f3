package com.chicu.featurelab.market.model;

/**
 * Один OHLCV-бар фиксированного интервала.
 *
 *  - time в миллисекундах (long), уникален внутри серии
 *  - цены в double, объём целый
 */
public record Bar(
        long time,
        double open,
        double high,
        double low,
        double close,
        long volume
) {

    public Bar {
        if (!(open > 0) || !(high > 0) || !(low > 0) || !(close > 0)) {
            throw new IllegalArgumentException(
                    "prices must be positive: time=" + time + " o=" + open + " h=" + high + " l=" + low + " c=" + close);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("volume must be >= 0: time=" + time + " volume=" + volume);
        }
        if (high < Math.max(open, close) || low > Math.min(open, close)) {
            throw new IllegalArgumentException(
                    "inconsistent bar: time=" + time + " o=" + open + " h=" + high + " l=" + low + " c=" + close);
        }
    }

    /** Типичная цена (H+L+C)/3 */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
