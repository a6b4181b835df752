package io.github.pierce.analyzer;

import io.github.pierce.analyzer.report.AnalysisReport;

import java.util.Optional;

/**
 * Result of analyzing one file: a complete report or exactly one error.
 */
public final class AnalysisResult {

    private final AnalysisReport report;
    private final EngineError error;

    private AnalysisResult(AnalysisReport report, EngineError error) {
        this.report = report;
        this.error = error;
    }

    /**
     * Creates a successful result.
     */
    public static AnalysisResult success(AnalysisReport report) {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }
        return new AnalysisResult(report, null);
    }

    /**
     * Creates a failed result.
     */
    public static AnalysisResult failure(EngineError error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new AnalysisResult(null, error);
    }

    public boolean isSuccess() {
        return report != null;
    }

    public Optional<AnalysisReport> getReport() {
        return Optional.ofNullable(report);
    }

    public Optional<EngineError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the report or throws the failure as an {@link AnalysisException}.
     */
    public AnalysisReport getReportOrThrow() {
        if (error != null) {
            throw new AnalysisException(error);
        }
        return report;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AnalysisResult{success}" : "AnalysisResult{" + error + "}";
    }
}
