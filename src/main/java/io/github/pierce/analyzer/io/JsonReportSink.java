package io.github.pierce.analyzer.io;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.pierce.analyzer.EngineError;
import io.github.pierce.analyzer.report.AnalysisReport;
import io.github.pierce.analyzer.report.ReportJsonWriter;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes each outcome as one JSON document per line.
 */
public class JsonReportSink implements AnalysisReportSink {

    private final Writer writer;
    private final ReportJsonWriter json;

    public JsonReportSink(Writer writer) {
        this(writer, new ReportJsonWriter());
    }

    public JsonReportSink(Writer writer, ReportJsonWriter json) {
        this.writer = writer;
        this.json = json;
    }

    @Override
    public void accept(String fileId, AnalysisReport report) throws IOException {
        write(fileId, json.toNode(report));
    }

    @Override
    public void reject(String fileId, EngineError error) throws IOException {
        write(fileId, json.toNode(error));
    }

    private void write(String fileId, ObjectNode node) throws IOException {
        node.put("file_id", fileId);
        writer.write(node.toString());
        writer.write(System.lineSeparator());
        writer.flush();
    }
}
