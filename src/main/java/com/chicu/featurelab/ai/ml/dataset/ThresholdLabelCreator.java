package com.chicu.featurelab.ai.ml.dataset;

import com.chicu.featurelab.indicators.pipeline.FeatureTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ThresholdLabelCreator implements LabelCreator {

    @Override
    public List<Label> label(double[] closes, double threshold) {
        if (closes == null) throw new IllegalArgumentException("closes=null");
        if (!(threshold >= 0)) throw new IllegalArgumentException("threshold must be >= 0, got " + threshold);

        int n = closes.length;
        List<Label> y = new ArrayList<>(Math.max(0, n - 1));

        for (int i = 0; i < n - 1; i++) {
            y.add(of(closes[i], closes[i + 1], threshold));
        }
        return y;
    }

    @Override
    public LabeledTable label(FeatureTable table, double threshold) {
        if (table == null) throw new IllegalArgumentException("table=null");

        if (!(threshold >= 0)) throw new IllegalArgumentException("threshold must be >= 0, got " + threshold);

        // цель строки: close следующего бара серии, а не следующей уцелевшей строки таблицы
        double[] closes = table.column(FeatureTable.CLOSE);
        List<Integer> rows = new ArrayList<>(table.rowCount());
        List<Label> labels = new ArrayList<>(table.rowCount());
        for (int i = 0; i < table.rowCount(); i++) {
            double next = table.nextClose(i);
            if (Double.isNaN(next)) continue;
            rows.add(i);
            labels.add(of(closes[i], next, threshold));
        }
        LabeledTable labeled = new LabeledTable(
                table.selectRows(rows.stream().mapToInt(Integer::intValue).toArray()), labels);

        Map<Label, Integer> counts = labeled.labelCounts();
        log.info("🏷 Labels created: rows={} up={} down={} threshold={}",
                labeled.rowCount(), counts.getOrDefault(Label.UP, 0), counts.getOrDefault(Label.DOWN, 0), threshold);
        return labeled;
    }

    // строго мультипликативное правило, без округлений
    private static Label of(double close, double nextClose, double threshold) {
        return nextClose > close * (1.0 + threshold) ? Label.UP : Label.DOWN;
    }
}
