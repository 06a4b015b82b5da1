package com.brandpulse.processing.classifier;

/**
 * Produces the full classifier set. Called at most once per registry.
 *
 * @throws ModelLoadException when any capability cannot be loaded
 */
@FunctionalInterface
public interface ClassifierLoader {

    Classifiers load();
}
