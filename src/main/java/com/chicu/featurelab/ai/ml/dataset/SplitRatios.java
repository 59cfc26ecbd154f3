package com.chicu.featurelab.ai.ml.dataset;

/** Доли train / validation / test. Каждая в (0,1), сумма = 1 (допуск 1e-3). */
public record SplitRatios(double train, double validation, double test) {

    public SplitRatios {
        if (!inOpenUnit(train) || !inOpenUnit(validation) || !inOpenUnit(test)) {
            throw new IllegalArgumentException("split ratios must be in (0,1): train=" + train
                    + " validation=" + validation + " test=" + test);
        }
        if (Math.abs(train + validation + test - 1.0) > 1e-3) {
            throw new IllegalArgumentException("split ratios must sum to 1.0: train=" + train
                    + " validation=" + validation + " test=" + test);
        }
    }

    public static SplitRatios defaults() {
        return new SplitRatios(0.70, 0.15, 0.15);
    }

    private static boolean inOpenUnit(double v) {
        return v > 0.0 && v < 1.0;
    }

    @Override
    public String toString() {
        return "(" + train + ", " + validation + ", " + test + ")";
    }
}
