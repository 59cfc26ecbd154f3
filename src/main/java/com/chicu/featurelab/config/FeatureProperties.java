package com.chicu.featurelab.config;

import com.chicu.featurelab.ai.ml.dataset.BalanceStrategy;
import com.chicu.featurelab.ai.ml.dataset.SplitRatios;
import com.chicu.featurelab.indicators.pipeline.MissingValuePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Настройки из application.yml (prefix = features).
 * В вычисления уходит не этот бин, а неизменяемый снимок {@link #toSettings()}.
 */
@Data
@ConfigurationProperties(prefix = "features")
public class FeatureProperties {

    private Indicators indicators = new Indicators();

    /** forward_fill | drop */
    private MissingValuePolicy missingValuePolicy = MissingValuePolicy.FORWARD_FILL;

    /** 0.005 = рост > 0.5% к следующему бару считается "up" */
    private double labelThreshold = 0.005;

    private Split split = new Split();

    /** доля миноритарного класса ниже порога → дисбаланс */
    private double imbalanceThreshold = 0.40;

    /** oversample | weight | none */
    private BalanceStrategy balanceStrategy = BalanceStrategy.OVERSAMPLE;

    private Oversample oversample = new Oversample();

    private Normalization normalization = new Normalization();

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Indicators {
        private int atrPeriod = 14;
        private List<Integer> smaPeriods = new ArrayList<>(List.of(20, 50));
        private int bollingerPeriod = 20;
        private double bollingerWidth = 2.0;
        private int rsiPeriod = 14;
        private int macdFast = 12;
        private int macdSlow = 26;
        private int macdSignal = 9;
        private int stochasticPeriod = 14;
        private int stochasticSmoothing = 3;
        private int adxPeriod = 14;
        private int cciPeriod = 20;
    }

    @Data
    public static class Split {
        private double train = 0.70;
        private double validation = 0.15;
        private double test = 0.15;
    }

    @Data
    public static class Oversample {
        private int neighbors = 5;
        private long seed = 42L;
    }

    @Data
    public static class Normalization {
        private boolean verifyRoundTrip = true;
        private double roundTripTolerance = 1e-9;
    }

    @Data
    public static class Pipeline {
        /** считать калькуляторы в пуле потоков (результат тот же, что и последовательно) */
        private boolean parallel = false;
        private int threads = 4;
    }

    public FeatureSettings toSettings() {
        IndicatorPeriods periods = IndicatorPeriods.builder()
                .atrPeriod(indicators.getAtrPeriod())
                .smaPeriods(indicators.getSmaPeriods())
                .bollingerPeriod(indicators.getBollingerPeriod())
                .bollingerWidth(indicators.getBollingerWidth())
                .rsiPeriod(indicators.getRsiPeriod())
                .macdFast(indicators.getMacdFast())
                .macdSlow(indicators.getMacdSlow())
                .macdSignal(indicators.getMacdSignal())
                .stochasticPeriod(indicators.getStochasticPeriod())
                .stochasticSmoothing(indicators.getStochasticSmoothing())
                .adxPeriod(indicators.getAdxPeriod())
                .cciPeriod(indicators.getCciPeriod())
                .build();

        return FeatureSettings.builder()
                .indicatorPeriods(periods)
                .missingValuePolicy(missingValuePolicy)
                .labelThreshold(labelThreshold)
                .splitRatios(new SplitRatios(split.getTrain(), split.getValidation(), split.getTest()))
                .imbalanceThreshold(imbalanceThreshold)
                .balanceStrategy(balanceStrategy)
                .oversampleNeighbors(oversample.getNeighbors())
                .oversampleSeed(oversample.getSeed())
                .verifyRoundTrip(normalization.isVerifyRoundTrip())
                .roundTripTolerance(normalization.getRoundTripTolerance())
                .parallel(pipeline.isParallel())
                .build();
    }
}
