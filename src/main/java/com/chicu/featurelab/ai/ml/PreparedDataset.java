package com.chicu.featurelab.ai.ml;

import com.chicu.featurelab.ai.ml.dataset.DatasetSplit;
import com.chicu.featurelab.ai.ml.dataset.ImbalanceReport;
import com.chicu.featurelab.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.featurelab.ai.ml.features.NormalizationState;

/**
 * Результат подготовки фич.
 *
 * @param split         нормализованные train/validation/test с метками (OHLCV в исходных единицах)
 * @param normalization состояние нормализации, посчитанное только на train
 * @param imbalance     распределение классов train до балансировки
 * @param training      матрица для тренера: train после балансировки
 * @param metadata      сводка по датасету
 */
public record PreparedDataset(
        DatasetSplit split,
        NormalizationState normalization,
        ImbalanceReport imbalance,
        TrainingDatasetBuilder.Dataset training,
        DatasetMetadata metadata
) {
}
