package io.github.pierce.analyzer.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Header and data rows of a parsed file. Malformed rows are kept in place and flagged.
 */
public final class ParsedTable {

    private final List<String> header;
    private final List<DataRow> rows;
    private final List<DataRow> validRows;
    private final List<Integer> malformedRowIndexes;

    public ParsedTable(List<String> header, List<DataRow> rows) {
        this.header = List.copyOf(header);
        this.rows = List.copyOf(rows);
        List<DataRow> valid = new ArrayList<>(rows.size());
        List<Integer> malformed = new ArrayList<>();
        for (DataRow row : rows) {
            if (row.malformed()) {
                malformed.add(row.index());
            } else {
                valid.add(row);
            }
        }
        this.validRows = List.copyOf(valid);
        this.malformedRowIndexes = List.copyOf(malformed);
    }

    public List<String> getHeader() {
        return header;
    }

    public int getColumnCount() {
        return header.size();
    }

    /**
     * All data rows in file order, malformed ones included.
     */
    public List<DataRow> getRows() {
        return rows;
    }

    /**
     * Data rows whose cell count matches the header.
     */
    public List<DataRow> getValidRows() {
        return validRows;
    }

    public List<Integer> getMalformedRowIndexes() {
        return malformedRowIndexes;
    }

    public int getMalformedRowCount() {
        return malformedRowIndexes.size();
    }

    /**
     * Returns the raw cells of one column across the well-formed rows.
     */
    public List<String> columnValues(int column) {
        List<String> values = new ArrayList<>(validRows.size());
        for (DataRow row : validRows) {
            values.add(row.cell(column));
        }
        return values;
    }
}
