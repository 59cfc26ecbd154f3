package com.chicu.featurelab.config;

import lombok.Builder;

import java.util.List;

/**
 * Периоды индикаторов на один прогон. Неизменяемые.
 */
@Builder(toBuilder = true)
public record IndicatorPeriods(
        int atrPeriod,
        List<Integer> smaPeriods,
        int bollingerPeriod,
        double bollingerWidth,
        int rsiPeriod,
        int macdFast,
        int macdSlow,
        int macdSignal,
        int stochasticPeriod,
        int stochasticSmoothing,
        int adxPeriod,
        int cciPeriod
) {

    public IndicatorPeriods {
        requirePositive("atr-period", atrPeriod);
        if (smaPeriods == null || smaPeriods.isEmpty()) {
            throw new IllegalArgumentException("features.indicators.sma-periods пустые");
        }
        smaPeriods.forEach(p -> requirePositive("sma-periods", p == null ? 0 : p));
        smaPeriods = List.copyOf(smaPeriods);
        requirePositive("bollinger-period", bollingerPeriod);
        if (!(bollingerWidth > 0)) {
            throw new IllegalArgumentException("features.indicators.bollinger-width must be > 0, got " + bollingerWidth);
        }
        requirePositive("rsi-period", rsiPeriod);
        requirePositive("macd-fast", macdFast);
        requirePositive("macd-slow", macdSlow);
        requirePositive("macd-signal", macdSignal);
        if (macdFast >= macdSlow) {
            throw new IllegalArgumentException("features.indicators.macd-fast must be < macd-slow: "
                    + macdFast + " >= " + macdSlow);
        }
        requirePositive("stochastic-period", stochasticPeriod);
        requirePositive("stochastic-smoothing", stochasticSmoothing);
        requirePositive("adx-period", adxPeriod);
        requirePositive("cci-period", cciPeriod);
    }

    public static IndicatorPeriods defaults() {
        return new IndicatorPeriods(14, List.of(20, 50), 20, 2.0, 14, 12, 26, 9, 14, 3, 14, 20);
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException("features.indicators." + key + " must be >= 1, got " + value);
        }
    }
}
