package com.chicu.featurelab.ai.ml;

import com.chicu.featurelab.ai.ml.dataset.BalanceStrategy;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Паспорт подготовленного датасета: что в нём лежит и как он получен.
 * Ключи распределения классов: displayName меток ("up" / "down").
 */
@Builder
public record DatasetMetadata(
        List<String> featureNames,
        int featureCount,
        int trainSamples,
        int validationSamples,
        int testSamples,
        int trainingRows,
        Map<String, Double> classDistribution,
        double imbalanceRatio,
        boolean imbalanced,
        Map<String, Double> classWeights,
        Set<String> degenerateColumns,
        BalanceStrategy requestedStrategy,
        BalanceStrategy appliedStrategy,
        int syntheticRows,
        String schemaHash
) {

    public DatasetMetadata {
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        classDistribution = classDistribution == null ? Map.of() : Map.copyOf(classDistribution);
        classWeights = classWeights == null ? Map.of() : Map.copyOf(classWeights);
        degenerateColumns = degenerateColumns == null ? Set.of() : Set.copyOf(degenerateColumns);
    }

    public int totalSamples() {
        return trainSamples + validationSamples + testSamples;
    }
}
