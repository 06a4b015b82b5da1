package com.brandpulse.processing.classifier;

/** A scoring capability could not be loaded; the pipeline cannot serve without it. */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
