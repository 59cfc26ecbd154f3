package com.chicu.featurelab.common.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Серия баров короче окна одного или нескольких индикаторов.
 */
public class InsufficientHistoryException extends FeaturePipelineException {

    public record Shortfall(String indicator, int requiredBars) {}

    private final int availableBars;
    private final List<Shortfall> shortfalls;

    public InsufficientHistoryException(int availableBars, List<Shortfall> shortfalls) {
        super(String.format("Insufficient history: available=%d bars, required %s",
                availableBars,
                shortfalls.stream()
                        .map(s -> s.indicator() + "=" + s.requiredBars())
                        .collect(Collectors.joining(", ", "[", "]"))));
        this.availableBars = availableBars;
        this.shortfalls = List.copyOf(shortfalls);
    }

    public int getAvailableBars() {
        return availableBars;
    }

    public List<Shortfall> getShortfalls() {
        return shortfalls;
    }

    public boolean names(String indicator) {
        return shortfalls.stream().anyMatch(s -> s.indicator().equals(indicator));
    }

    /** Сколько баров нужно, чтобы хватило всем индикаторам */
    public int getRequiredBars() {
        return shortfalls.stream().mapToInt(Shortfall::requiredBars).max().orElse(0);
    }
}
