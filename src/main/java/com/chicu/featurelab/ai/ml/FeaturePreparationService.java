package com.chicu.featurelab.ai.ml;

import com.chicu.featurelab.config.FeatureSettings;
import com.chicu.featurelab.indicators.pipeline.FeatureTable;
import com.chicu.featurelab.indicators.pipeline.IndicatorPipeline;
import com.chicu.featurelab.market.model.BarSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Один вызов: бары → индикаторы → готовый датасет.
 * Без аргумента настроек берётся снимок из application.yml.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeaturePreparationService {

    private final IndicatorPipeline pipeline;
    private final FeatureEngineer engineer;
    private final FeatureSettings defaultSettings;

    public PreparedDataset prepare(BarSeries bars) {
        return prepare(bars, defaultSettings);
    }

    public PreparedDataset prepare(BarSeries bars, FeatureSettings settings) {
        if (bars == null) throw new IllegalArgumentException("bars=null");
        FeatureSettings s = settings != null ? settings : defaultSettings;

        long t0 = System.currentTimeMillis();
        log.info("🚀 Feature preparation started: bars={} [{} .. {}]",
                bars.size(),
                bars.isEmpty() ? "-" : bars.get(0).time(),
                bars.isEmpty() ? "-" : bars.get(bars.size() - 1).time());

        log.info("📊 Step 1/2: computing indicators");
        FeatureTable table = pipeline.computeAll(bars, s);

        log.info("🧪 Step 2/2: labels, split, normalization, balancing");
        PreparedDataset prepared = engineer.prepare(table, s);

        log.info("🏁 Feature preparation finished in {} ms: schemaHash={}",
                System.currentTimeMillis() - t0, prepared.metadata().schemaHash());
        return prepared;
    }
}
