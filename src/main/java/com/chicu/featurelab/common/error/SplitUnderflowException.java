package com.chicu.featurelab.common.error;

import com.chicu.featurelab.ai.ml.dataset.SplitRatios;

/**
 * Разбиение даёт пустой сегмент.
 */
public class SplitUnderflowException extends FeaturePipelineException {

    private final SplitRatios ratios;
    private final int totalRows;

    public SplitUnderflowException(SplitRatios ratios, int totalRows, int trainRows, int validationRows, int testRows) {
        super(String.format("Split underflow: ratios=%s totalRows=%d -> train=%d validation=%d test=%d",
                ratios, totalRows, trainRows, validationRows, testRows));
        this.ratios = ratios;
        this.totalRows = totalRows;
    }

    public SplitRatios getRatios() {
        return ratios;
    }

    public int getTotalRows() {
        return totalRows;
    }
}
