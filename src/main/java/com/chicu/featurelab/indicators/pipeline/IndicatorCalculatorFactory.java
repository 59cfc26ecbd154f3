package com.chicu.featurelab.indicators.pipeline;

import com.chicu.featurelab.config.IndicatorPeriods;
import com.chicu.featurelab.indicators.IndicatorCalculator;
import com.chicu.featurelab.indicators.impl.AdxCalculator;
import com.chicu.featurelab.indicators.impl.AtrCalculator;
import com.chicu.featurelab.indicators.impl.BollingerBandsCalculator;
import com.chicu.featurelab.indicators.impl.CciCalculator;
import com.chicu.featurelab.indicators.impl.MacdCalculator;
import com.chicu.featurelab.indicators.impl.RsiCalculator;
import com.chicu.featurelab.indicators.impl.SmaCalculator;
import com.chicu.featurelab.indicators.impl.StochasticCalculator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Собирает все восемь калькуляторов под периоды прогона.
 * Порядок фиксированный, он же порядок колонок в таблице.
 */
@Component
public class IndicatorCalculatorFactory {

    public List<IndicatorCalculator> create(IndicatorPeriods p) {
        if (p == null) throw new IllegalArgumentException("periods=null");
        return List.of(
                new AtrCalculator(p.atrPeriod()),
                new SmaCalculator(p.smaPeriods()),
                new BollingerBandsCalculator(p.bollingerPeriod(), p.bollingerWidth()),
                new RsiCalculator(p.rsiPeriod()),
                new MacdCalculator(p.macdFast(), p.macdSlow(), p.macdSignal()),
                new StochasticCalculator(p.stochasticPeriod(), p.stochasticSmoothing()),
                new AdxCalculator(p.adxPeriod()),
                new CciCalculator(p.cciPeriod())
        );
    }
}
