package com.chicu.featurelab.indicators.pipeline;

import java.util.HashMap;
import java.util.Map;

/**
 * Политика пропусков. Выбирается один раз на прогон и применяется ко всем колонкам одинаково.
 * После любой из политик в таблице нет NaN.
 */
public enum MissingValuePolicy {

    /**
     * Каждая колонка протягивается вперёд от своего первого определённого значения,
     * затем выкидываются строки, где NaN остался (прогрев до первого значения).
     * Назад не заполняем: это была бы утечка будущего.
     */
    FORWARD_FILL {
        @Override
        public FeatureTable apply(FeatureTable raw) {
            Map<String, double[]> filled = new HashMap<>();
            for (String name : raw.columnNames()) {
                double[] v = raw.column(name);
                double last = Double.NaN;
                for (int i = 0; i < v.length; i++) {
                    if (Double.isNaN(v[i])) {
                        v[i] = last;
                    } else {
                        last = v[i];
                    }
                }
                filled.put(name, v);
            }
            FeatureTable table = raw.withColumns(filled);
            return table.selectRows(table.completeRows()).withPolicy(this);
        }
    },

    /** Выкидываются все строки, где есть хоть один NaN */
    DROP {
        @Override
        public FeatureTable apply(FeatureTable raw) {
            return raw.selectRows(raw.completeRows()).withPolicy(this);
        }
    };

    public abstract FeatureTable apply(FeatureTable raw);
}
