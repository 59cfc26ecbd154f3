package com.chicu.featurelab.ai.ml;

import com.chicu.featurelab.ai.ml.dataset.ClassBalancer;
import com.chicu.featurelab.ai.ml.dataset.DataSplitter;
import com.chicu.featurelab.ai.ml.dataset.DatasetSplit;
import com.chicu.featurelab.ai.ml.dataset.ImbalanceReport;
import com.chicu.featurelab.ai.ml.dataset.Label;
import com.chicu.featurelab.ai.ml.dataset.LabelCreator;
import com.chicu.featurelab.ai.ml.dataset.LabeledTable;
import com.chicu.featurelab.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.featurelab.ai.ml.features.FeatureNormalizer;
import com.chicu.featurelab.ai.ml.features.FeatureSchema;
import com.chicu.featurelab.ai.ml.features.NormalizationState;
import com.chicu.featurelab.config.FeatureSettings;
import com.chicu.featurelab.indicators.pipeline.FeatureTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FeatureEngineer
 * ===============
 * Из таблицы индикаторов делает датасет без утечек:
 *
 * 1) метки по сырым close: цель строки = close следующего бара серии (последний бар уходит);
 * 2) split по времени;
 * 3) fit нормализатора только на train, transform всех трёх сегментов;
 * 4) проверка/балансировка классов только на train.
 *
 * Close не нормализуется, поэтому порядок «метки → split → нормализация»
 * даёт те же метки, что и «нормализация → метки».
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureEngineer {

    private final FeatureNormalizer normalizer;
    private final LabelCreator labelCreator;
    private final DataSplitter splitter;
    private final ClassBalancer balancer;

    public PreparedDataset prepare(FeatureTable table, FeatureSettings settings) {
        if (table == null) throw new IllegalArgumentException("table=null");
        if (settings == null) throw new IllegalArgumentException("settings=null");
        if (table.containsNaN()) {
            throw new IllegalArgumentException("feature table содержит NaN, сначала примените missing-value policy");
        }

        LabeledTable labeled = labelCreator.label(table, settings.labelThreshold());
        DatasetSplit raw = splitter.split(labeled, settings.splitRatios());

        NormalizationState state = normalizer.fit(raw.train().table());
        if (settings.verifyRoundTrip()) {
            normalizer.verifyRoundTrip(raw.train().table(), state, settings.roundTripTolerance());
        }

        DatasetSplit normalized = new DatasetSplit(
                raw.train().withTable(normalizer.transform(raw.train().table(), state)),
                raw.validation().withTable(normalizer.transform(raw.validation().table(), state)),
                raw.test().withTable(normalizer.transform(raw.test().table(), state))
        );

        ImbalanceReport report = balancer.inspect(normalized.train().labels(), settings.imbalanceThreshold());
        TrainingDatasetBuilder.Dataset training = balancer.rebalance(normalized.train(), settings);

        DatasetMetadata metadata = metadata(normalized, state, report, training, settings);

        log.info("✅ Dataset prepared: features={} train={} validation={} test={} trainingRows={} synthetic={} strategy={}",
                metadata.featureCount(), metadata.trainSamples(), metadata.validationSamples(),
                metadata.testSamples(), metadata.trainingRows(), metadata.syntheticRows(), metadata.appliedStrategy());

        return new PreparedDataset(normalized, state, report, training, metadata);
    }

    private static DatasetMetadata metadata(DatasetSplit split,
                                            NormalizationState state,
                                            ImbalanceReport report,
                                            TrainingDatasetBuilder.Dataset training,
                                            FeatureSettings settings) {
        FeatureSchema schema = new FeatureSchema(state.featureNames());

        Map<String, Double> distribution = new LinkedHashMap<>();
        report.distribution().forEach((label, share) -> distribution.put(label.displayName(), share));
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<Label, Double> e : report.classWeights().entrySet()) {
            weights.put(e.getKey().displayName(), e.getValue());
        }

        return DatasetMetadata.builder()
                .featureNames(schema.featureNames())
                .featureCount(schema.size())
                .trainSamples(split.train().rowCount())
                .validationSamples(split.validation().rowCount())
                .testSamples(split.test().rowCount())
                .trainingRows(training.samples())
                .classDistribution(distribution)
                .imbalanceRatio(report.imbalanceRatio())
                .imbalanced(report.imbalanced())
                .classWeights(weights)
                .degenerateColumns(state.degenerateColumns())
                .requestedStrategy(settings.balanceStrategy())
                .appliedStrategy(training.strategy())
                .syntheticRows(training.syntheticCount())
                .schemaHash(schema.schemaHash())
                .build();
    }
}
