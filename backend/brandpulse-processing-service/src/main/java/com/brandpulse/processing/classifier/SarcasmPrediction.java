package com.brandpulse.processing.classifier;

public record SarcasmPrediction(boolean sarcastic, double score) {

    public static SarcasmPrediction none() {
        return new SarcasmPrediction(false, 0.0);
    }
}
