package io.github.pierce.analyzer.report;

import io.github.pierce.analyzer.parser.DataRow;
import io.github.pierce.analyzer.parser.ParsedTable;

import java.util.List;

/**
 * Returns the leading rows of a table verbatim, malformed rows included.
 */
public class SampleExtractor {

    public List<DataRow> extract(ParsedTable table, int previewSize) {
        List<DataRow> rows = table.getRows();
        return List.copyOf(rows.subList(0, Math.min(Math.max(previewSize, 0), rows.size())));
    }
}
