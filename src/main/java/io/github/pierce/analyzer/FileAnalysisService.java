package io.github.pierce.analyzer;

import io.github.pierce.analyzer.config.AnalyzerSettings;
import io.github.pierce.analyzer.io.AnalysisReportSink;
import io.github.pierce.analyzer.io.RawFileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Loads a stored file, analyzes it and hands the outcome to a sink.
 */
public class FileAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(FileAnalysisService.class);

    private final RawFileSource source;
    private final AnalysisReportSink sink;
    private final TabularFileAnalyzer analyzer;
    private final AnalyzerSettings settings;

    public FileAnalysisService(RawFileSource source, AnalysisReportSink sink, AnalyzerSettings settings) {
        this(source, sink, new TabularFileAnalyzer(), settings);
    }

    public FileAnalysisService(RawFileSource source, AnalysisReportSink sink,
                               TabularFileAnalyzer analyzer, AnalyzerSettings settings) {
        this.source = source;
        this.sink = sink;
        this.analyzer = analyzer;
        this.settings = settings != null ? settings : AnalyzerSettings.defaults();
    }

    /**
     * Processes one stored file.
     *
     * @throws IOException if the file cannot be loaded or the sink fails
     */
    public AnalysisResult process(String fileId) throws IOException {
        RawFile file = source.fetch(fileId);
        LOG.debug("Processing file {}", fileId);
        AnalysisResult result = analyzer.analyze(file, settings.getLimits(), settings.getInferenceConfig());
        if (result.isSuccess()) {
            sink.accept(fileId, result.getReportOrThrow());
        } else {
            sink.reject(fileId, result.getError().orElseThrow());
        }
        return result;
    }
}
