package com.chicu.featurelab.common.error;

import com.chicu.featurelab.ai.ml.dataset.Label;

/**
 * В train-сегменте только один класс — классификатор обучать не на чем.
 */
public class SingleClassLabelsException extends FeaturePipelineException {

    private final Label presentLabel;
    private final int rows;

    public SingleClassLabelsException(Label presentLabel, int rows) {
        super(String.format("Training segment has a single label class: label=%s rows=%d",
                presentLabel, rows));
        this.presentLabel = presentLabel;
        this.rows = rows;
    }

    public Label getPresentLabel() {
        return presentLabel;
    }

    public int getRows() {
        return rows;
    }
}
