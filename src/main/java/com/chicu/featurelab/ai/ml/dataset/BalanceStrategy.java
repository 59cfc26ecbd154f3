package com.chicu.featurelab.ai.ml.dataset;

/** Как выравнивать классы в train-сегменте. Одна стратегия на прогон. */
public enum BalanceStrategy {
    /** синтетические строки миноритарного класса (интерполяция к ближайшим соседям) */
    OVERSAMPLE,
    /** веса строк обратно пропорциональны частоте класса, число строк не меняется */
    WEIGHT,
    NONE
}
