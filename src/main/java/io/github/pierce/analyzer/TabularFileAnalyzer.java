package io.github.pierce.analyzer;

import io.github.pierce.analyzer.config.AnalysisLimits;
import io.github.pierce.analyzer.config.InferenceConfig;
import io.github.pierce.analyzer.encoding.DecodedText;
import io.github.pierce.analyzer.encoding.EncodingResolver;
import io.github.pierce.analyzer.inference.CellClassifierRegistry;
import io.github.pierce.analyzer.inference.ColumnType;
import io.github.pierce.analyzer.inference.TypeInferenceEngine;
import io.github.pierce.analyzer.parser.DataRow;
import io.github.pierce.analyzer.parser.ParsedTable;
import io.github.pierce.analyzer.parser.TabularParser;
import io.github.pierce.analyzer.report.AnalysisReport;
import io.github.pierce.analyzer.report.ReportAssembler;
import io.github.pierce.analyzer.report.SampleExtractor;
import io.github.pierce.analyzer.stats.ColumnProfile;
import io.github.pierce.analyzer.stats.ColumnStatisticsCollector;
import io.github.pierce.analyzer.validation.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the analysis engine: validates a CSV file, infers a type per column
 * and profiles every column.
 *
 * <p>Each call is a pure, synchronous computation over one file. Limits and inference
 * settings are passed per call and the analyzer keeps no state between calls, so a
 * single instance can serve concurrent analyses.</p>
 *
 * <p>Stages run in this order, and the first failure ends the analysis:
 * <ol>
 *   <li>extension and byte size checks</li>
 *   <li>strict decoding</li>
 *   <li>header, row count, column count and duplicate column checks</li>
 *   <li>parsing; malformed rows are flagged</li>
 *   <li>type inference and preview extraction</li>
 *   <li>column statistics</li>
 *   <li>report assembly</li>
 * </ol>
 */
public class TabularFileAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TabularFileAnalyzer.class);

    private final EncodingResolver encodingResolver;
    private final SampleExtractor sampleExtractor;
    private final ReportAssembler reportAssembler;

    public TabularFileAnalyzer() {
        this(new EncodingResolver(), new SampleExtractor(), new ReportAssembler());
    }

    public TabularFileAnalyzer(EncodingResolver encodingResolver, SampleExtractor sampleExtractor,
                               ReportAssembler reportAssembler) {
        this.encodingResolver = encodingResolver;
        this.sampleExtractor = sampleExtractor;
        this.reportAssembler = reportAssembler;
    }

    /**
     * Analyzes raw bytes.
     *
     * @param encodingHint declared encoding, or null to detect it
     */
    public AnalysisResult analyze(byte[] bytes, String encodingHint, AnalysisLimits limits, InferenceConfig config) {
        return analyze(RawFile.of(bytes, encodingHint), limits, config);
    }

    /**
     * Analyzes a file. Never throws for bad input: every failure is returned as the
     * result's {@link EngineError}.
     */
    public AnalysisResult analyze(RawFile file, AnalysisLimits limits, InferenceConfig config) {
        AnalysisLimits effectiveLimits = limits != null ? limits : AnalysisLimits.defaults();
        InferenceConfig effectiveConfig = config != null ? config : InferenceConfig.defaults();
        try {
            AnalysisReport report = run(file, effectiveLimits, effectiveConfig);
            LOG.info("Analyzed {}: {} rows, {} columns, {} malformed rows",
                    describe(file), report.getRowCount(), report.getColumnCount(), report.getMalformedRowCount());
            return AnalysisResult.success(report);
        } catch (AnalysisException e) {
            LOG.info("Analysis of {} failed: {}", describe(file), e.getMessage());
            return AnalysisResult.failure(e.getError());
        }
    }

    private AnalysisReport run(RawFile file, AnalysisLimits limits, InferenceConfig config) {
        StructuralValidator validator = new StructuralValidator(limits);
        TabularParser parser = new TabularParser(config);

        requireAccepted(validator.validateFile(file));
        DecodedText decoded = encodingResolver.decode(file);
        ValidationOutcome outcome = validator.validateStructure(decoded.text(), parser);
        requireAccepted(outcome);

        ParsedTable table = parser.parse(decoded.text());
        checkMalformedRows(table, config);

        CellClassifierRegistry registry = new CellClassifierRegistry(config);
        List<ColumnType> types = new TypeInferenceEngine(registry, config.isTrimWhitespace()).infer(table);
        List<DataRow> preview = sampleExtractor.extract(table, limits.getPreviewSize());
        List<ColumnProfile> profiles = new ColumnStatisticsCollector(registry, config.isTrimWhitespace())
                .collect(table, types, limits.getSampleValueCount());

        return reportAssembler.assemble(outcome, table, profiles, preview,
                new ReportAssembler.FileMetadata(file.getFileName().orElse(null), file.size(), decoded.encoding()));
    }

    private static void checkMalformedRows(ParsedTable table, InferenceConfig config) {
        if (table.getMalformedRowCount() == 0) {
            return;
        }
        if (config.getMalformedRowPolicy() == InferenceConfig.MalformedRowPolicy.REJECT) {
            int first = table.getMalformedRowIndexes().get(0);
            throw new AnalysisException(new EngineError.Rejected(ValidationRule.MALFORMED_ROW, String.format(
                    "Data row %d does not have %d cells (%d malformed rows in total)",
                    first, table.getColumnCount(), table.getMalformedRowCount())));
        }
        if (table.getValidRows().isEmpty()) {
            throw new AnalysisException(new EngineError.NoValidRows(table.getMalformedRowCount(), String.format(
                    "All %d data rows are malformed: none has the %d cells of the header",
                    table.getMalformedRowCount(), table.getColumnCount())));
        }
        LOG.debug("Excluding {} malformed rows from inference and statistics", table.getMalformedRowCount());
    }

    private static void requireAccepted(ValidationOutcome outcome) {
        if (outcome instanceof EngineError.Rejected rejected) {
            throw new AnalysisException(rejected);
        }
    }

    private static String describe(RawFile file) {
        return file.getFileName().orElse("<unnamed>") + " (" + file.size() + " bytes)";
    }
}
