package com.chicu.featurelab.ai.ml.features;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Упорядоченный набор имён фич, которые уходят в модель, и его хэш.
 * Хэш одинаковый для одинакового конфига, по нему сверяются датасет и модель.
 */
public class FeatureSchema {

    private final List<String> names;
    private final String schemaHash;

    public FeatureSchema(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("schema names пустые");
        }
        if (names.stream().distinct().count() != names.size()) {
            throw new IllegalArgumentException("schema names должны быть уникальны: " + names);
        }
        this.names = List.copyOf(names);
        this.schemaHash = sha256(String.join("|", this.names));
    }

    public List<String> featureNames() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public int indexOf(String name) {
        return names.indexOf(name);
    }

    public String schemaHash() {
        return schemaHash;
    }

    /** Вектор в порядке схемы; отсутствующие и нечисловые значения → 0 */
    public double[] toVector(Map<String, Double> features) {
        double[] x = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            Double v = features != null ? features.get(names.get(i)) : null;
            x[i] = (v != null && Double.isFinite(v)) ? v : 0.0;
        }
        return x;
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("sha256 error: " + e.getMessage(), e);
        }
    }
}
