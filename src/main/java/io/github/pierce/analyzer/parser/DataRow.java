package io.github.pierce.analyzer.parser;

import java.util.List;

/**
 * One data row exactly as it appeared in the file.
 *
 * @param index     1-based position among the data rows (the header is not counted)
 * @param cells     raw cell text, quotes removed but otherwise untouched
 * @param malformed true when the cell count differs from the header or a quoted field never closed
 */
public record DataRow(int index, List<String> cells, boolean malformed) {

    public DataRow {
        cells = List.copyOf(cells);
    }

    public int size() {
        return cells.size();
    }

    public String cell(int column) {
        return cells.get(column);
    }
}
