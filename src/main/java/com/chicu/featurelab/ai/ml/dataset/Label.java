package com.chicu.featurelab.ai.ml.dataset;

/** Бинарная цель: 1 = UP, 0 = DOWN */
public enum Label {
    DOWN(0, "down"),
    UP(1, "up");

    private final int code;
    private final String displayName;

    Label(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public Label opposite() {
        return this == UP ? DOWN : UP;
    }
}
