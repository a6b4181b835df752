package io.github.pierce.analyzer.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.pierce.analyzer.EngineError;
import io.github.pierce.analyzer.parser.DataRow;
import io.github.pierce.analyzer.stats.ColumnProfile;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders reports and errors as JSON documents.
 *
 * <p>Preview rows are written as objects keyed by column name when well-formed, and as
 * plain arrays of cells when malformed. Min/max are written as numbers for INTEGER and
 * FLOAT and as ISO-8601 strings for DATE.</p>
 */
public class ReportJsonWriter {

    // Thread-safe once configured
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final boolean pretty;

    public ReportJsonWriter() {
        this(false);
    }

    public ReportJsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    public String toJson(AnalysisReport report) {
        return write(toNode(report));
    }

    public String toJson(EngineError error) {
        return write(toNode(error));
    }

    public ObjectNode toNode(AnalysisReport report) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("status", "success");
        report.getFileName().ifPresent(name -> root.put("file_name", name));
        root.put("file_size", report.getFileSize());
        root.put("encoding", report.getEncoding());
        root.put("total_rows", report.getRowCount());
        root.put("total_columns", report.getColumnCount());
        root.put("malformed_rows", report.getMalformedRowCount());
        ArrayNode malformed = root.putArray("malformed_row_numbers");
        report.getMalformedRows().forEach(malformed::add);

        ArrayNode columns = root.putArray("columns");
        report.getColumns().forEach(columns::add);

        ObjectNode types = root.putObject("column_types");
        for (ColumnProfile profile : report.getProfiles()) {
            types.set(profile.getName(), toNode(profile));
        }

        ArrayNode sample = root.putArray("sample_data");
        for (DataRow row : report.getPreview()) {
            sample.add(toNode(row, report));
        }
        return root;
    }

    public ObjectNode toNode(EngineError error) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("status", "error");
        root.put("error", error.code());
        root.put("detail", error.detail());
        return root;
    }

    private ObjectNode toNode(ColumnProfile profile) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("type", profile.getType().getDisplayName());
        node.put("null_count", profile.getNullCount());
        node.put("unique_count", profile.getDistinctCount());
        node.put("unique_ratio", BigDecimal.valueOf(profile.getDistinctRatio()).setScale(2, RoundingMode.HALF_UP));
        profile.getMin().ifPresent(min -> putValue(node, "min", min));
        profile.getMax().ifPresent(max -> putValue(node, "max", max));
        ArrayNode samples = node.putArray("sample_values");
        profile.getSampleValues().forEach(samples::add);
        return node;
    }

    private static void putValue(ObjectNode node, String field, Object value) {
        if (value instanceof Long l) {
            node.put(field, l);
        } else if (value instanceof BigDecimal bd) {
            node.put(field, bd);
        } else {
            node.put(field, value.toString());
        }
    }

    private static JsonNode toNode(DataRow row, AnalysisReport report) {
        if (row.malformed()) {
            ArrayNode cells = OBJECT_MAPPER.createArrayNode();
            row.cells().forEach(cells::add);
            return cells;
        }
        ObjectNode record = OBJECT_MAPPER.createObjectNode();
        for (int i = 0; i < row.size(); i++) {
            record.put(report.getColumns().get(i), row.cell(i));
        }
        return record;
    }

    private String write(ObjectNode node) {
        try {
            if (pretty) {
                return OBJECT_MAPPER.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node);
            }
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }
}
