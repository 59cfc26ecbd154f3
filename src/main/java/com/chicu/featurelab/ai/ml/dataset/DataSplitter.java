package com.chicu.featurelab.ai.ml.dataset;

import com.chicu.featurelab.common.error.SplitUnderflowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Разбиение по времени без перемешивания:
 * train = [0, n1), validation = [n1, n1+n2), test = [n1+n2, n).
 *
 * n1 = floor(n * train), n2 = floor(n * validation), остаток уходит в test.
 * К произведению добавляется 1e-9, чтобы 100 * 0.7 не превращалось в 69.
 */
@Slf4j
@Component
public class DataSplitter {

    private static final double FLOOR_EPS = 1e-9;

    public DatasetSplit split(LabeledTable table, SplitRatios ratios) {
        if (table == null) throw new IllegalArgumentException("table=null");
        if (ratios == null) throw new IllegalArgumentException("ratios=null");

        int n = table.rowCount();
        int[] sizes = segmentSizes(n, ratios);
        if (sizes[0] == 0 || sizes[1] == 0 || sizes[2] == 0) {
            throw new SplitUnderflowException(ratios, n, sizes[0], sizes[1], sizes[2]);
        }

        int trainEnd = sizes[0];
        int valEnd = trainEnd + sizes[1];

        DatasetSplit split = new DatasetSplit(
                table.slice(0, trainEnd),
                table.slice(trainEnd, valEnd),
                table.slice(valEnd, n)
        );
        verifyTemporalIntegrity(split);

        log.info("✂️ Split: total={} train={} validation={} test={} ratios={}",
                n, sizes[0], sizes[1], sizes[2], ratios);
        return split;
    }

    /** Размеры сегментов {train, validation, test} для n строк */
    public int[] segmentSizes(int n, SplitRatios ratios) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0, got " + n);
        int train = (int) Math.floor(n * ratios.train() + FLOOR_EPS);
        int validation = (int) Math.floor(n * ratios.validation() + FLOOR_EPS);
        train = Math.min(train, n);
        validation = Math.min(validation, n - train);
        return new int[]{train, validation, n - train - validation};
    }

    /**
     * max(time train) < min(time validation) и max(time validation) < min(time test).
     * Нарушение означает баг, а не плохие данные: IllegalStateException.
     */
    public void verifyTemporalIntegrity(DatasetSplit split) {
        checkOrdered("train", split.train(), "validation", split.validation());
        checkOrdered("validation", split.validation(), "test", split.test());
    }

    private static void checkOrdered(String leftName, LabeledTable left, String rightName, LabeledTable right) {
        if (left.isEmpty() || right.isEmpty()) return;
        long leftMax = left.table().time(left.rowCount() - 1);
        for (int i = 0; i < left.rowCount(); i++) {
            leftMax = Math.max(leftMax, left.table().time(i));
        }
        long rightMin = right.table().time(0);
        for (int i = 0; i < right.rowCount(); i++) {
            rightMin = Math.min(rightMin, right.table().time(i));
        }
        if (leftMax >= rightMin) {
            throw new IllegalStateException("temporal leakage: max(" + leftName + ")=" + leftMax
                    + " >= min(" + rightName + ")=" + rightMin);
        }
    }
}
