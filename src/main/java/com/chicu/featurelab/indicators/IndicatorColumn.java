package com.chicu.featurelab.indicators;

import java.util.Arrays;

/**
 * Именованная колонка значений индикатора, выровненная 1:1 с барами.
 * NaN = окно ещё не заполнено или значение не определено.
 * Сравнивается по значениям массива, не по ссылке.
 */
public record IndicatorColumn(String name, double[] values) {

    public IndicatorColumn {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name пустой");
        }
        if (values == null) {
            throw new IllegalArgumentException("values=null for column " + name);
        }
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double value(int row) {
        return values[row];
    }

    public int size() {
        return values.length;
    }

    /** Индекс первого определённого значения, -1 если колонка пустая */
    public int firstDefinedIndex() {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) return i;
        }
        return -1;
    }

    public boolean allNaN() {
        return firstDefinedIndex() < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndicatorColumn other)) return false;
        return name.equals(other.name) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "IndicatorColumn[name=" + name + ", size=" + values.length + "]";
    }
}
