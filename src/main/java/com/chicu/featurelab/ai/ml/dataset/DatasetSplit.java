package com.chicu.featurelab.ai.ml.dataset;

/** Три непересекающихся подряд идущих сегмента: train < validation < test по времени */
public record DatasetSplit(LabeledTable train, LabeledTable validation, LabeledTable test) {

    public DatasetSplit {
        if (train == null || validation == null || test == null) {
            throw new IllegalArgumentException("split segments must not be null");
        }
    }

    public int totalRows() {
        return train.rowCount() + validation.rowCount() + test.rowCount();
    }
}
