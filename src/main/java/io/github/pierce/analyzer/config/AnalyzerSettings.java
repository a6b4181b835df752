package io.github.pierce.analyzer.config;

/**
 * Limits and inference settings loaded together from external configuration.
 */
public final class AnalyzerSettings {

    private final AnalysisLimits limits;
    private final InferenceConfig inferenceConfig;

    public AnalyzerSettings(AnalysisLimits limits, InferenceConfig inferenceConfig) {
        this.limits = limits != null ? limits : AnalysisLimits.defaults();
        this.inferenceConfig = inferenceConfig != null ? inferenceConfig : InferenceConfig.defaults();
    }

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(AnalysisLimits.defaults(), InferenceConfig.defaults());
    }

    public AnalysisLimits getLimits() {
        return limits;
    }

    public InferenceConfig getInferenceConfig() {
        return inferenceConfig;
    }

    @Override
    public String toString() {
        return "AnalyzerSettings{" + limits + ", " + inferenceConfig + "}";
    }
}
