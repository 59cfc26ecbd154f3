package com.chicu.featurelab.indicators;

/** Семейства индикаторов, которые считает пайплайн */
public enum IndicatorType {
    ATR("Range-Volatility"),
    SMA("Moving-Average"),
    BOLLINGER("Banded-Volatility"),
    RSI("Momentum-Oscillator"),
    MACD("Convergence-Divergence"),
    STOCHASTIC("Stochastic-Oscillator"),
    ADX("Directional-Trend"),
    CCI("Channel-Index");

    private final String displayName;

    IndicatorType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
