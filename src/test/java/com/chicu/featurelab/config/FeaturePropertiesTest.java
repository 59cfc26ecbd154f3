package com.chicu.featurelab.config;

import com.chicu.featurelab.ai.ml.dataset.BalanceStrategy;
import com.chicu.featurelab.indicators.pipeline.MissingValuePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeaturePropertiesTest {

    @Test
    void toSettings_defaultsShouldMatchFeatureSettingsDefaults() {
        assertEquals(FeatureSettings.defaults(), new FeatureProperties().toSettings());
    }

    @Test
    void binder_shouldReadKebabCaseKeysAndLowercaseEnums() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "features.missing-value-policy", "drop",
                "features.balance-strategy", "weight",
                "features.label-threshold", "0.01",
                "features.indicators.sma-periods", "10,30",
                "features.split.train", "0.6",
                "features.split.validation", "0.2",
                "features.split.test", "0.2",
                "features.pipeline.parallel", "true"
        ));

        FeatureProperties props = new Binder(source).bind("features", FeatureProperties.class).get();
        FeatureSettings s = props.toSettings();

        assertEquals(MissingValuePolicy.DROP, s.missingValuePolicy());
        assertEquals(BalanceStrategy.WEIGHT, s.balanceStrategy());
        assertEquals(0.01, s.labelThreshold());
        assertEquals(List.of(10, 30), s.indicatorPeriods().smaPeriods());
        assertEquals(0.6, s.splitRatios().train());
        assertTrue(s.parallel());
        assertEquals(14, s.indicatorPeriods().adxPeriod());
    }

    @Test
    void toSettings_shouldNameInvalidKey() {
        FeatureProperties props = new FeatureProperties();
        props.getIndicators().setMacdFast(30);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, props::toSettings);
        assertTrue(ex.getMessage().contains("macd-fast"), ex.getMessage());
    }

    @Test
    void toSettings_shouldRejectImbalanceThresholdAboveHalf() {
        FeatureProperties props = new FeatureProperties();
        props.setImbalanceThreshold(0.7);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, props::toSettings);
        assertTrue(ex.getMessage().contains("imbalance-threshold"));
    }
}
