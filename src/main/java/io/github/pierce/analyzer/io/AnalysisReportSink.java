package io.github.pierce.analyzer.io;

import io.github.pierce.analyzer.EngineError;
import io.github.pierce.analyzer.report.AnalysisReport;

import java.io.IOException;

/**
 * Receives the outcome of an analysis for serialization or storage.
 */
public interface AnalysisReportSink {

    void accept(String fileId, AnalysisReport report) throws IOException;

    /**
     * Receives a failed analysis. Ignored unless overridden.
     */
    default void reject(String fileId, EngineError error) throws IOException {
    }
}
