package com.chicu.featurelab.indicators.pipeline;

import com.chicu.featurelab.common.error.FeaturePipelineException;
import com.chicu.featurelab.common.error.InsufficientHistoryException;
import com.chicu.featurelab.config.FeatureSettings;
import com.chicu.featurelab.config.IndicatorPeriods;
import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.IndicatorColumn;
import com.chicu.featurelab.market.model.BarSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * IndicatorPipeline
 * =================
 * Раздаёт серию баров всем калькуляторам, склеивает их колонки с OHLCV по индексу строки
 * и применяет политику пропусков.
 *
 * Калькуляторы друг от друга не зависят, поэтому при parallel=true считаются в пуле;
 * склейка всё равно идёт в фиксированном порядке, результат тот же, что и последовательно.
 * Ошибка любого калькулятора валит весь прогон — частичной таблицы не бывает.
 */
@Slf4j
@Service
public class IndicatorPipeline {

    private final IndicatorCalculatorFactory calculatorFactory;
    private final ExecutorService executor;

    public IndicatorPipeline(IndicatorCalculatorFactory calculatorFactory,
                             @Qualifier("indicatorExecutor") ExecutorService executor) {
        this.calculatorFactory = calculatorFactory;
        this.executor = executor;
    }

    public FeatureTable computeAll(BarSeries bars, FeatureSettings settings) {
        if (bars == null) throw new IllegalArgumentException("bars=null");
        if (settings == null) throw new IllegalArgumentException("settings=null");

        List<IndicatorCalculator> calculators = calculatorFactory.create(settings.indicatorPeriods());
        checkHistory(bars, calculators);

        List<List<IndicatorColumn>> outputs = settings.parallel()
                ? computeParallel(bars, calculators)
                : computeSerial(bars, calculators);

        FeatureTable raw = merge(bars, calculators, outputs);
        FeatureTable table = settings.missingValuePolicy().apply(raw);
        if (table.isEmpty()) {
            throw emptyAfterPolicy(bars, calculators, outputs, settings.missingValuePolicy());
        }

        log.info("📊 Indicators computed: bars={} columns={} rows={} dropped={} policy={}",
                bars.size(), raw.featureColumns().size(), table.rowCount(),
                raw.rowCount() - table.rowCount(), settings.missingValuePolicy());
        return table;
    }

    /** Имена колонок индикаторов для заданных периодов, в порядке таблицы */
    public List<String> indicatorColumns(IndicatorPeriods periods) {
        List<String> names = new ArrayList<>();
        for (IndicatorCalculator c : calculatorFactory.create(periods)) {
            names.addAll(c.columnNames());
        }
        return names;
    }

    private void checkHistory(BarSeries bars, List<IndicatorCalculator> calculators) {
        List<InsufficientHistoryException.Shortfall> shortfalls = new ArrayList<>();
        for (IndicatorCalculator c : calculators) {
            if (bars.size() < c.minimumBars()) {
                shortfalls.add(new InsufficientHistoryException.Shortfall(c.type().displayName(), c.minimumBars()));
            }
        }
        if (!shortfalls.isEmpty()) {
            InsufficientHistoryException ex = new InsufficientHistoryException(bars.size(), shortfalls);
            log.warn("⛔ {}", ex.getMessage());
            throw ex;
        }
    }

    /**
     * Периоды прошли проверку, но после политики не осталось ни одной строки.
     * Либо серия короче прогрева цепочки (RSI, ADX, MACD signal, %D), либо
     * индикатор не определён ни на одном баре (например, вся серия плоская).
     */
    private FeaturePipelineException emptyAfterPolicy(BarSeries bars,
                                                      List<IndicatorCalculator> calculators,
                                                      List<List<IndicatorColumn>> outputs,
                                                      MissingValuePolicy policy) {
        List<InsufficientHistoryException.Shortfall> shortfalls = new ArrayList<>();
        List<String> undefined = new ArrayList<>();
        for (int i = 0; i < calculators.size(); i++) {
            IndicatorCalculator c = calculators.get(i);
            if (bars.size() < c.warmupBars()) {
                shortfalls.add(new InsufficientHistoryException.Shortfall(c.type().displayName(), c.warmupBars()));
            } else if (outputs.get(i).stream().anyMatch(IndicatorColumn::allNaN)) {
                undefined.add(c.type().displayName());
            }
        }

        FeaturePipelineException ex;
        if (!shortfalls.isEmpty()) {
            ex = new InsufficientHistoryException(bars.size(), shortfalls);
        } else if (!undefined.isEmpty()) {
            ex = new FeaturePipelineException("indicators undefined on every bar: " + undefined
                    + ", policy " + policy + " left 0 rows of " + bars.size());
        } else {
            ex = new FeaturePipelineException("policy " + policy + " left 0 rows of " + bars.size());
        }
        log.warn("⛔ {}", ex.getMessage());
        return ex;
    }

    private List<List<IndicatorColumn>> computeSerial(BarSeries bars, List<IndicatorCalculator> calculators) {
        List<List<IndicatorColumn>> out = new ArrayList<>(calculators.size());
        for (IndicatorCalculator c : calculators) {
            out.add(run(c, bars));
        }
        return out;
    }

    private List<List<IndicatorColumn>> computeParallel(BarSeries bars, List<IndicatorCalculator> calculators) {
        List<CompletableFuture<List<IndicatorColumn>>> futures = new ArrayList<>(calculators.size());
        for (IndicatorCalculator c : calculators) {
            futures.add(CompletableFuture.supplyAsync(() -> run(c, bars), executor));
        }

        List<List<IndicatorColumn>> out = new ArrayList<>(calculators.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).join());
            } catch (CompletionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException re) throw re;
                throw new FeaturePipelineException(
                        "indicator " + calculators.get(i).type().displayName() + " failed: " + cause.getMessage(), cause);
            }
        }
        return out;
    }

    private List<IndicatorColumn> run(IndicatorCalculator c, BarSeries bars) {
        long t0 = System.nanoTime();
        List<IndicatorColumn> columns;
        try {
            columns = c.compute(bars);
        } catch (RuntimeException e) {
            log.error("❗ Indicator {} failed: {}", c.type().displayName(), e.getMessage(), e);
            throw e;
        }

        List<String> expected = c.columnNames();
        if (columns == null || columns.size() != expected.size()) {
            throw new IllegalStateException("indicator " + c.type().displayName() + " returned "
                    + (columns == null ? "null" : columns.size()) + " columns, expected " + expected);
        }
        for (int i = 0; i < columns.size(); i++) {
            IndicatorColumn col = columns.get(i);
            if (!col.name().equals(expected.get(i)) || col.size() != bars.size()) {
                throw new IllegalStateException("indicator " + c.type().displayName() + " column mismatch: got "
                        + col.name() + "[" + col.size() + "], expected " + expected.get(i) + "[" + bars.size() + "]");
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("⏱ {} {} in {} µs", c.type().displayName(), expected, (System.nanoTime() - t0) / 1_000);
        }
        return columns;
    }

    private FeatureTable merge(BarSeries bars,
                               List<IndicatorCalculator> calculators,
                               List<List<IndicatorColumn>> outputs) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(FeatureTable.OPEN, bars.opens());
        columns.put(FeatureTable.HIGH, bars.highs());
        columns.put(FeatureTable.LOW, bars.lows());
        columns.put(FeatureTable.CLOSE, bars.closes());
        columns.put(FeatureTable.VOLUME, bars.volumes());

        List<String> indicatorNames = new ArrayList<>();
        for (int i = 0; i < calculators.size(); i++) {
            for (IndicatorColumn col : outputs.get(i)) {
                if (columns.putIfAbsent(col.name(), col.values()) != null) {
                    throw new IllegalStateException("duplicate column " + col.name());
                }
                indicatorNames.add(col.name());
            }
        }
        return FeatureTable.of(bars.times(), columns, indicatorNames, null);
    }
}
