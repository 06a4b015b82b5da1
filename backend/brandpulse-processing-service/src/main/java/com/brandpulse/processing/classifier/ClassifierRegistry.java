package com.brandpulse.processing.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Loads the classifier set once, on first use, and hands out the same instances
 * afterwards. Concurrent first callers block on one load; a failed load is rethrown
 * and retried by the next caller.
 */
@Component
public class ClassifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClassifierRegistry.class);

    private final ClassifierLoader loader;
    private final Object loadLock = new Object();
    private volatile Classifiers loaded;

    public ClassifierRegistry(ClassifierLoader loader) {
        this.loader = loader;
    }

    public Classifiers get() {
        Classifiers current = loaded;
        if (current != null) return current;
        synchronized (loadLock) {
            if (loaded == null) {
                long start = System.nanoTime();
                Classifiers result;
                try {
                    result = loader.load();
                } catch (ModelLoadException e) {
                    log.error("Classifier load failed: {}", e.getMessage());
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Classifier load failed: {}", e.getMessage());
                    throw new ModelLoadException("Classifier load failed", e);
                }
                if (result == null) {
                    throw new ModelLoadException("Classifier loader returned nothing");
                }
                loaded = result;
                log.info("Classifiers loaded in {} ms", Duration.ofNanos(System.nanoTime() - start).toMillis());
            }
            return loaded;
        }
    }

    public boolean isLoaded() {
        return loaded != null;
    }
}
