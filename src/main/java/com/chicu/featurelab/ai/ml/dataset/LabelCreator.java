package com.chicu.featurelab.ai.ml.dataset;

import com.chicu.featurelab.indicators.pipeline.FeatureTable;

import java.util.List;

public interface LabelCreator {

    /**
     * Метки по close: для i < n-1 UP, если close[i+1] > close[i] * (1 + threshold), иначе DOWN.
     * У последнего значения цели нет, в результат оно не попадает (размер n-1).
     */
    List<Label> label(double[] closes, double threshold);

    /**
     * То же для таблицы, но цель строки берётся из close следующего бара исходной серии
     * ({@link FeatureTable#nextClose(int)}). Строки без следующего бара отбрасываются.
     */
    LabeledTable label(FeatureTable table, double threshold);
}
