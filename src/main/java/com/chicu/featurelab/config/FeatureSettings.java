package com.chicu.featurelab.config;

import com.chicu.featurelab.ai.ml.dataset.BalanceStrategy;
import com.chicu.featurelab.ai.ml.dataset.SplitRatios;
import com.chicu.featurelab.indicators.pipeline.MissingValuePolicy;
import lombok.Builder;

/**
 * Снимок настроек на один прогон.
 * Передаётся явно в каждый компонент, глобального изменяемого состояния нет.
 */
@Builder(toBuilder = true)
public record FeatureSettings(
        IndicatorPeriods indicatorPeriods,
        MissingValuePolicy missingValuePolicy,
        double labelThreshold,
        SplitRatios splitRatios,
        double imbalanceThreshold,
        BalanceStrategy balanceStrategy,
        int oversampleNeighbors,
        long oversampleSeed,
        boolean verifyRoundTrip,
        double roundTripTolerance,
        boolean parallel
) {

    public FeatureSettings {
        if (indicatorPeriods == null) throw new IllegalArgumentException("features.indicators=null");
        if (missingValuePolicy == null) throw new IllegalArgumentException("features.missing-value-policy=null");
        if (splitRatios == null) throw new IllegalArgumentException("features.split=null");
        if (balanceStrategy == null) throw new IllegalArgumentException("features.balance-strategy=null");
        if (!(labelThreshold >= 0) || Double.isInfinite(labelThreshold)) {
            throw new IllegalArgumentException("features.label-threshold must be >= 0, got " + labelThreshold);
        }
        if (!(imbalanceThreshold > 0 && imbalanceThreshold <= 0.5)) {
            throw new IllegalArgumentException("features.imbalance-threshold must be in (0, 0.5], got " + imbalanceThreshold);
        }
        if (oversampleNeighbors < 1) {
            throw new IllegalArgumentException("features.oversample.neighbors must be >= 1, got " + oversampleNeighbors);
        }
        if (!(roundTripTolerance > 0)) {
            throw new IllegalArgumentException("features.normalization.round-trip-tolerance must be > 0, got " + roundTripTolerance);
        }
    }

    public static FeatureSettings defaults() {
        return FeatureSettings.builder()
                .indicatorPeriods(IndicatorPeriods.defaults())
                .missingValuePolicy(MissingValuePolicy.FORWARD_FILL)
                .labelThreshold(0.005)
                .splitRatios(SplitRatios.defaults())
                .imbalanceThreshold(0.40)
                .balanceStrategy(BalanceStrategy.OVERSAMPLE)
                .oversampleNeighbors(5)
                .oversampleSeed(42L)
                .verifyRoundTrip(true)
                .roundTripTolerance(1e-9)
                .parallel(false)
                .build();
    }
}
