package com.chicu.featurelab.indicators.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Таблица фич, выровненная по строкам с барами: OHLCV + колонки индикаторов.
 *
 * Неизменяемая: каждая трансформация (политика пропусков, нормализация, срез)
 * возвращает новую таблицу. Колонки хранятся массивами, по одному на имя.
 *
 * Для каждой строки хранится close следующего бара исходной серии (nextClose).
 * Он едет вместе со строкой через любой отбор строк, поэтому метка строки всегда
 * считается по соседнему бару, даже если этот бар выкинула политика пропусков.
 * У последнего бара серии nextClose = NaN.
 */
public final class FeatureTable {

    public static final String OPEN = "Open";
    public static final String HIGH = "High";
    public static final String LOW = "Low";
    public static final String CLOSE = "Close";
    public static final String VOLUME = "Volume";

    public static final List<String> OHLCV = List.of(OPEN, HIGH, LOW, CLOSE, VOLUME);

    private final long[] times;
    private final Map<String, double[]> columns;
    private final double[] nextCloses;
    private final List<String> featureColumns;
    private final MissingValuePolicy policy;

    private FeatureTable(long[] times,
                         Map<String, double[]> columns,
                         double[] nextCloses,
                         List<String> featureColumns,
                         MissingValuePolicy policy) {
        this.times = times;
        this.columns = columns;
        this.nextCloses = nextCloses;
        this.featureColumns = featureColumns;
        this.policy = policy;
    }

    /**
     * Таблица над непрерывной серией: nextClose строки i берётся из Close строки i+1.
     *
     * @param columns        колонки в порядке вставки, каждая длины times.length
     * @param featureColumns подмножество колонок, которые идут в модель (индикаторы)
     * @param policy         применённая политика пропусков, null для «сырой» таблицы
     */
    public static FeatureTable of(long[] times,
                                  Map<String, double[]> columns,
                                  List<String> featureColumns,
                                  MissingValuePolicy policy) {
        Map<String, double[]> copy = validated(times, columns, featureColumns);

        double[] next = new double[times.length];
        Arrays.fill(next, Double.NaN);
        double[] close = copy.get(CLOSE);
        if (close != null) {
            for (int i = 0; i + 1 < close.length; i++) next[i] = close[i + 1];
        }
        return new FeatureTable(times.clone(),
                Collections.unmodifiableMap(copy),
                next,
                List.copyOf(featureColumns),
                policy);
    }

    private static Map<String, double[]> validated(long[] times,
                                                   Map<String, double[]> columns,
                                                   List<String> featureColumns) {
        if (times == null) throw new IllegalArgumentException("times=null");
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns пустые");
        if (featureColumns == null) throw new IllegalArgumentException("featureColumns=null");

        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] v = e.getValue();
            if (v == null || v.length != times.length) {
                throw new IllegalArgumentException("column " + e.getKey() + " length="
                        + (v == null ? "null" : v.length) + " expected=" + times.length);
            }
            copy.put(e.getKey(), v.clone());
        }
        for (String f : featureColumns) {
            if (!copy.containsKey(f)) {
                throw new IllegalArgumentException("feature column " + f + " отсутствует в таблице");
            }
        }
        return copy;
    }

    public int rowCount() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<String> featureColumns() {
        return featureColumns;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Optional<MissingValuePolicy> missingValuePolicy() {
        return Optional.ofNullable(policy);
    }

    public long time(int row) {
        return times[row];
    }

    public long[] times() {
        return times.clone();
    }

    /** Close следующего бара исходной серии, NaN у последнего бара */
    public double nextClose(int row) {
        return nextCloses[row];
    }

    public double value(int row, String column) {
        return raw(column)[row];
    }

    public double[] column(String name) {
        return raw(name).clone();
    }

    /** Значения фич строки в порядке {@link #featureColumns()} */
    public double[] featureRow(int row) {
        double[] out = new double[featureColumns.size()];
        for (int j = 0; j < out.length; j++) {
            out[j] = columns.get(featureColumns.get(j))[row];
        }
        return out;
    }

    public boolean containsNaN() {
        for (double[] v : columns.values()) {
            for (double d : v) {
                if (Double.isNaN(d)) return true;
            }
        }
        return false;
    }

    public boolean rowContainsNaN(int row) {
        for (double[] v : columns.values()) {
            if (Double.isNaN(v[row])) return true;
        }
        return false;
    }

    /** Строки [from, to) */
    public FeatureTable slice(int from, int to) {
        if (from < 0 || to > times.length || from > to) {
            throw new IndexOutOfBoundsException("slice [" + from + ", " + to + ") of " + times.length);
        }
        int[] rows = new int[to - from];
        for (int i = 0; i < rows.length; i++) rows[i] = from + i;
        return selectRows(rows);
    }

    /** Новая таблица из выбранных строк, порядок сохраняется как в rows */
    public FeatureTable selectRows(int[] rows) {
        long[] t = new long[rows.length];
        double[] next = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            t[i] = times[rows[i]];
            next[i] = nextCloses[rows[i]];
        }

        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] src = e.getValue();
            double[] dst = new double[rows.length];
            for (int i = 0; i < rows.length; i++) dst[i] = src[rows[i]];
            out.put(e.getKey(), dst);
        }
        return new FeatureTable(t, Collections.unmodifiableMap(out), next, featureColumns, policy);
    }

    /** Заменить значения существующих колонок, остальное без изменений */
    public FeatureTable withColumns(Map<String, double[]> replacements) {
        Map<String, double[]> out = new LinkedHashMap<>(columns);
        for (Map.Entry<String, double[]> e : replacements.entrySet()) {
            if (!columns.containsKey(e.getKey())) {
                throw new IllegalArgumentException("unknown column " + e.getKey());
            }
            out.put(e.getKey(), e.getValue());
        }
        Map<String, double[]> copy = validated(times, out, featureColumns);
        return new FeatureTable(times, Collections.unmodifiableMap(copy), nextCloses, featureColumns, policy);
    }

    public FeatureTable withPolicy(MissingValuePolicy applied) {
        return new FeatureTable(times, columns, nextCloses, featureColumns, applied);
    }

    /** Индексы строк без единого NaN */
    int[] completeRows() {
        List<Integer> keep = new ArrayList<>(times.length);
        for (int i = 0; i < times.length; i++) {
            if (!rowContainsNaN(i)) keep.add(i);
        }
        return keep.stream().mapToInt(Integer::intValue).toArray();
    }

    private double[] raw(String name) {
        double[] v = columns.get(name);
        if (v == null) {
            throw new IllegalArgumentException("unknown column " + name + ", known=" + columns.keySet());
        }
        return v;
    }
}
