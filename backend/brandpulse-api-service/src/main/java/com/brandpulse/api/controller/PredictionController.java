package com.brandpulse.api.controller;

import com.brandpulse.api.service.PredictionService;
import com.brandpulse.processing.model.BatchPredictionRequest;
import com.brandpulse.processing.model.BatchPredictionResponse;
import com.brandpulse.processing.model.PredictionRequest;
import com.brandpulse.processing.model.PredictionResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PredictionController {

  private final PredictionService predictions;

  public PredictionController(PredictionService predictions) {
    this.predictions = predictions;
  }

  @PostMapping("/api/predict")
  public PredictionResponse predict(@RequestBody PredictionRequest request) {
    return predictions.predict(request);
  }

  @PostMapping("/api/predict/batch")
  public BatchPredictionResponse predictBatch(@RequestBody BatchPredictionRequest batch) {
    return predictions.predictBatch(batch);
  }
}
