package com.chicu.featurelab.indicators.pipeline;

import com.chicu.featurelab.common.error.FeaturePipelineException;
import com.chicu.featurelab.common.error.InsufficientHistoryException;
import com.chicu.featurelab.config.FeatureSettings;
import com.chicu.featurelab.config.IndicatorPeriods;
import com.chicu.featurelab.market.model.BarSeries;
import com.chicu.featurelab.support.SyntheticBars;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorPipelineTest {

    private static final List<String> DEFAULT_COLUMNS = List.of(
            "ATR", "SMA_20", "SMA_50", "BB_Upper", "BB_Middle", "BB_Lower", "RSI",
            "MACD", "MACD_Signal", "MACD_Histogram", "Stoch_K", "Stoch_D", "ADX", "CCI");

    private ExecutorService executor;
    private IndicatorPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pipeline = new IndicatorPipeline(new IndicatorCalculatorFactory(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void computeAll_shouldProduceAlignedTableWithoutNaN() {
        BarSeries bars = SyntheticBars.randomWalk(500, 42);

        FeatureTable table = pipeline.computeAll(bars, FeatureSettings.defaults());

        assertFalse(table.containsNaN());
        assertEquals(DEFAULT_COLUMNS, table.featureColumns());

        List<String> expected = new ArrayList<>(FeatureTable.OHLCV);
        expected.addAll(DEFAULT_COLUMNS);
        assertEquals(expected, table.columnNames());

        // SMA_50: самый длинный прогрев: первые 49 строк уходят
        assertEquals(500 - 49, table.rowCount());
        assertEquals(bars.get(49).time(), table.time(0));
        assertEquals(bars.get(49).close(), table.value(0, FeatureTable.CLOSE));
        assertEquals(MissingValuePolicy.FORWARD_FILL, table.missingValuePolicy().orElseThrow());
    }

    @Test
    void computeAll_shouldBeBitIdenticalOnRerun() {
        BarSeries bars = SyntheticBars.randomWalk(500, 7);

        FeatureTable a = pipeline.computeAll(bars, FeatureSettings.defaults());
        FeatureTable b = pipeline.computeAll(bars, FeatureSettings.defaults());

        assertArrayEquals(a.times(), b.times());
        for (String col : a.columnNames()) {
            assertArrayEquals(a.column(col), b.column(col), col);
        }
    }

    @Test
    void computeAll_parallelShouldMatchSerial() {
        BarSeries bars = SyntheticBars.randomWalk(500, 99);
        FeatureSettings serial = FeatureSettings.defaults();
        FeatureSettings parallel = serial.toBuilder().parallel(true).build();

        FeatureTable a = pipeline.computeAll(bars, serial);
        FeatureTable b = pipeline.computeAll(bars, parallel);

        assertEquals(a.columnNames(), b.columnNames());
        for (String col : a.columnNames()) {
            assertArrayEquals(a.column(col), b.column(col), col);
        }
    }

    @Test
    void computeAll_forwardFillShouldKeepRowsThatDropRemoves() {
        // плоский участок: нулевой диапазон у стохастика, нулевое отклонение у CCI
        BarSeries bars = SyntheticBars.withFlatSegment(400, 5, 200, 30);
        FeatureSettings ffill = FeatureSettings.defaults();
        FeatureSettings drop = ffill.toBuilder().missingValuePolicy(MissingValuePolicy.DROP).build();

        FeatureTable filled = pipeline.computeAll(bars, ffill);
        FeatureTable dropped = pipeline.computeAll(bars, drop);

        assertFalse(filled.containsNaN());
        assertFalse(dropped.containsNaN());
        assertEquals(400 - 49, filled.rowCount());
        assertTrue(dropped.rowCount() < filled.rowCount());

        // внутри плоского участка %K протянут с последнего определённого значения
        long flatTime = bars.get(220).time();
        long beforeFlat = bars.get(212).time();
        int flatRow = rowOf(filled, flatTime);
        int lastDefinedRow = rowOf(filled, beforeFlat);
        assertEquals(filled.value(lastDefinedRow, "Stoch_K"), filled.value(flatRow, "Stoch_K"));
        assertEquals(-1, rowOf(dropped, flatTime));
    }

    @Test
    void computeAll_shouldReportDirectionalTrendOnShortSeries() {
        BarSeries bars = SyntheticBars.randomWalk(10, 1);

        InsufficientHistoryException ex = assertThrows(InsufficientHistoryException.class,
                () -> pipeline.computeAll(bars, FeatureSettings.defaults()));

        assertEquals(10, ex.getAvailableBars());
        assertTrue(ex.names("Directional-Trend"));
        InsufficientHistoryException.Shortfall adx = ex.getShortfalls().stream()
                .filter(s -> s.indicator().equals("Directional-Trend"))
                .findFirst().orElseThrow();
        assertEquals(14, adx.requiredBars());
        assertEquals(50, ex.getRequiredBars());
        assertTrue(ex.getMessage().contains("Directional-Trend=14"));
    }

    @Test
    void computeAll_shouldNameOnlyTheShortIndicator() {
        IndicatorPeriods periods = new IndicatorPeriods(5, List.of(5), 5, 2.0, 5, 3, 6, 3, 5, 3, 14, 5);
        FeatureSettings settings = FeatureSettings.defaults().toBuilder().indicatorPeriods(periods).build();

        InsufficientHistoryException ex = assertThrows(InsufficientHistoryException.class,
                () -> pipeline.computeAll(SyntheticBars.randomWalk(13, 1), settings));

        assertEquals(List.of(new InsufficientHistoryException.Shortfall("Directional-Trend", 14)), ex.getShortfalls());
    }

    @Test
    void computeAll_shouldReportRsiWarmupWhenPeriodsPassButRsiNeverStarts() {
        // RSI(13) проходит проверку периодов на 13 барах, но первое значение появится только на 14-м
        IndicatorPeriods periods = new IndicatorPeriods(5, List.of(5), 5, 2.0, 13, 3, 6, 3, 5, 3, 5, 5);

        for (MissingValuePolicy policy : MissingValuePolicy.values()) {
            FeatureSettings settings = FeatureSettings.defaults().toBuilder()
                    .indicatorPeriods(periods)
                    .missingValuePolicy(policy)
                    .build();

            InsufficientHistoryException ex = assertThrows(InsufficientHistoryException.class,
                    () -> pipeline.computeAll(SyntheticBars.randomWalk(13, 2), settings), policy.name());

            assertEquals(13, ex.getAvailableBars());
            assertEquals(List.of(new InsufficientHistoryException.Shortfall("Momentum-Oscillator", 14)),
                    ex.getShortfalls(), policy.name());
        }
    }

    @Test
    void computeAll_shouldNameIndicatorsUndefinedOnFlatSeries() {
        double[] prices = new double[80];
        Arrays.fill(prices, 50.0);

        FeaturePipelineException ex = assertThrows(FeaturePipelineException.class,
                () -> pipeline.computeAll(SyntheticBars.flatBars(prices), FeatureSettings.defaults()));

        assertFalse(ex instanceof InsufficientHistoryException);
        assertTrue(ex.getMessage().contains("Stochastic-Oscillator"), ex.getMessage());
        assertTrue(ex.getMessage().contains("Channel-Index"), ex.getMessage());
    }

    @Test
    void indicatorColumns_shouldFollowConfiguredSmaPeriods() {
        IndicatorPeriods periods = IndicatorPeriods.defaults().toBuilder().smaPeriods(List.of(10, 30, 100)).build();

        List<String> cols = pipeline.indicatorColumns(periods);

        assertTrue(cols.containsAll(List.of("SMA_10", "SMA_30", "SMA_100")));
        assertFalse(cols.contains("SMA_20"));
        assertEquals(15, cols.size());
    }

    private static int rowOf(FeatureTable table, long time) {
        for (int i = 0; i < table.rowCount(); i++) {
            if (table.time(i) == time) return i;
        }
        return -1;
    }
}
