package com.chicu.featurelab.common.error;

/**
 * Структурная ошибка подготовки датасета. Не ретраится: вызывающий должен
 * поменять вход или конфиг.
 */
public class FeaturePipelineException extends RuntimeException {

    public FeaturePipelineException(String message) {
        super(message);
    }

    public FeaturePipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
