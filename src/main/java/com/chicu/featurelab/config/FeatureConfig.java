package com.chicu.featurelab.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Configuration
@EnableConfigurationProperties(FeatureProperties.class)
public class FeatureConfig {

    /**
     * Имена вида: indicator-exec-1, indicator-exec-2, ...
     */
    private static final class IndicatorThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("indicator-exec-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Снимок настроек строится один раз при старте.
     * Кривой конфиг валит контекст сразу, а не посреди прогона.
     */
    @Bean
    public FeatureSettings featureSettings(FeatureProperties props) {
        FeatureSettings settings = props.toSettings();
        log.info("⚙️ Feature settings: policy={} threshold={} split={} balance={} imbalanceThreshold={} parallel={}",
                settings.missingValuePolicy(), settings.labelThreshold(), settings.splitRatios(),
                settings.balanceStrategy(), settings.imbalanceThreshold(), settings.parallel());
        return settings;
    }

    /** Пул под калькуляторы индикаторов (используется только при features.pipeline.parallel=true) */
    @Bean(name = "indicatorExecutor", destroyMethod = "shutdown")
    public ExecutorService indicatorExecutor(FeatureProperties props) {
        int threads = Math.max(1, props.getPipeline().getThreads());
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new IndicatorThreadFactory()
        );
    }
}
