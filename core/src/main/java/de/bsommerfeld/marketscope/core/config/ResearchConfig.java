package de.bsommerfeld.marketscope.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ResearchConfig {

    /** Share one provider call between concurrent misses on the same fingerprint. */
    @JsonProperty("single-flight")
    private boolean singleFlight = true;

    @JsonProperty("analysis-source")
    private String analysisSource = "openai";

    /** Rough tokens-per-word factor used when the provider reports no usage. */
    @JsonProperty("tokens-per-word")
    private double tokensPerWord = 1.3;

    @JsonProperty("confirmation-window-seconds")
    private int confirmationWindowSeconds = 30;

    public boolean isSingleFlight() {
        return singleFlight;
    }

    public void setSingleFlight(boolean singleFlight) {
        this.singleFlight = singleFlight;
    }

    public String getAnalysisSource() {
        return analysisSource;
    }

    public void setAnalysisSource(String analysisSource) {
        this.analysisSource = analysisSource;
    }

    public double getTokensPerWord() {
        return tokensPerWord;
    }

    public void setTokensPerWord(double tokensPerWord) {
        this.tokensPerWord = tokensPerWord;
    }

    public int getConfirmationWindowSeconds() {
        return confirmationWindowSeconds;
    }

    public void setConfirmationWindowSeconds(int confirmationWindowSeconds) {
        this.confirmationWindowSeconds = confirmationWindowSeconds;
    }
}
