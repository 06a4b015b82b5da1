package com.brandpulse.api.config;

import com.brandpulse.processing.classifier.ClassifierRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads the classifiers before traffic arrives. A load failure propagates and stops
 * startup; serving without models is not an option.
 */
@Component
@ConditionalOnProperty(name = "brandpulse.models.preload", havingValue = "true", matchIfMissing = true)
public class ModelWarmup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ModelWarmup.class);

  private final ClassifierRegistry classifiers;

  public ModelWarmup(ClassifierRegistry classifiers) {
    this.classifiers = classifiers;
  }

  @Override
  public void run(ApplicationArguments args) {
    classifiers.get();
    log.info("Classifier warmup complete");
  }
}
