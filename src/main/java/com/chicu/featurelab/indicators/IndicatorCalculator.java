package com.chicu.featurelab.indicators;

import com.chicu.featurelab.market.model.BarSeries;

import java.util.List;

/**
 * Калькулятор одного семейства индикаторов.
 *
 * Чистая функция от серии баров и своих параметров: никакого скрытого состояния,
 * на одинаковом входе всегда одинаковый выход. На короткой серии не падает —
 * возвращает NaN там, где окно ещё не набрано.
 */
public interface IndicatorCalculator {

    IndicatorType type();

    /** Имена колонок в том порядке, в каком их вернёт {@link #compute(BarSeries)} */
    List<String> columnNames();

    /**
     * Самый длинный настроенный период калькулятора.
     * Серия короче этого значения для пайплайна фатальна.
     */
    int minimumBars();

    /**
     * Сколько баров нужно, чтобы во всех колонках появилось первое значение.
     * Для цепочек (RSI по изменениям, ADX по DX, сигнальная линия MACD) больше периода.
     */
    default int warmupBars() {
        return minimumBars();
    }

    List<IndicatorColumn> compute(BarSeries bars);
}
