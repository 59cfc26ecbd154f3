package com.chicu.featurelab.smoke;

import com.chicu.featurelab.ai.ml.FeaturePreparationService;
import com.chicu.featurelab.ai.ml.PreparedDataset;
import com.chicu.featurelab.ai.ml.analysis.IndicatorAnalyzer;
import com.chicu.featurelab.config.FeatureSettings;
import com.chicu.featurelab.support.SyntheticBars;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class FeatureLabSmokeTest {

    @Autowired
    FeaturePreparationService preparationService;

    @Autowired
    FeatureSettings settings;

    @Autowired
    IndicatorAnalyzer analyzer;

    @Test
    void contextShouldBindDefaultSettings() {
        assertEquals(FeatureSettings.defaults(), settings);
        assertNotNull(analyzer);
    }

    @Test
    void prepare_shouldRunWholePipelineFromBars() {
        PreparedDataset prepared = preparationService.prepare(SyntheticBars.randomWalk(500, 2024));

        assertNotNull(prepared);
        assertEquals(14, prepared.metadata().featureCount());
        assertEquals(450, prepared.metadata().totalSamples());
        assertFalse(prepared.metadata().schemaHash().isBlank());
        assertTrue(prepared.training().samples() >= prepared.metadata().trainSamples());
    }
}
