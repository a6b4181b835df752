package io.github.pierce.analyzer.parser;

import io.github.pierce.analyzer.config.InferenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits decoded text into a header and data rows using a configurable delimiter
 * and quote character.
 *
 * <p>Quoting rules:
 * <ul>
 *   <li>A field is quoted when its first character is the quote character</li>
 *   <li>Inside a quoted field a doubled quote is one literal quote</li>
 *   <li>Delimiters and line breaks inside a quoted field are content</li>
 *   <li>Text after a closing quote, up to the next delimiter, is appended verbatim</li>
 * </ul>
 * Records end at {@code \n}, {@code \r\n} or {@code \r}. Empty lines are skipped.
 */
public class TabularParser {

    private static final Logger LOG = LoggerFactory.getLogger(TabularParser.class);

    private final char delimiter;
    private final char quote;

    public TabularParser(InferenceConfig config) {
        InferenceConfig effective = config != null ? config : InferenceConfig.defaults();
        this.delimiter = effective.getDelimiter();
        this.quote = effective.getQuoteChar();
    }

    /**
     * Reads only the header record.
     *
     * @return the header cells, or empty when the text holds no record at all
     */
    public Optional<List<String>> readHeader(String text) {
        RecordReader reader = new RecordReader(text);
        Record header = reader.next(true);
        return header == null ? Optional.empty() : Optional.of(header.cells());
    }

    /**
     * Counts the data records after the header without materializing any cell.
     */
    public int countDataRows(String text) {
        RecordReader reader = new RecordReader(text);
        if (reader.next(false) == null) {
            return 0;
        }
        int count = 0;
        while (reader.next(false) != null) {
            count++;
        }
        return count;
    }

    /**
     * Parses the whole text. Rows with a cell count different from the header are
     * flagged as malformed.
     *
     * @throws IllegalArgumentException if the text holds no header record
     */
    public ParsedTable parse(String text) {
        RecordReader reader = new RecordReader(text);
        Record header = reader.next(true);
        if (header == null) {
            throw new IllegalArgumentException("Text contains no header record");
        }
        int width = header.cells().size();
        List<DataRow> rows = new ArrayList<>();
        Record record;
        while ((record = reader.next(true)) != null) {
            boolean malformed = record.unterminated() || record.cells().size() != width;
            rows.add(new DataRow(rows.size() + 1, record.cells(), malformed));
        }
        LOG.debug("Parsed {} data rows against a {} column header", rows.size(), width);
        return new ParsedTable(header.cells(), rows);
    }

    private record Record(List<String> cells, boolean unterminated) {
    }

    /**
     * Cursor over the records of one text.
     */
    private final class RecordReader {

        private final String text;
        private final int length;
        private int pos;

        RecordReader(String text) {
            this.text = text;
            this.length = text.length();
        }

        /**
         * Returns the next non-empty record, or null at end of input. When
         * {@code collect} is false the cells are scanned but not built.
         */
        Record next(boolean collect) {
            while (pos < length && isLineBreak(text.charAt(pos))) {
                skipLineBreak();
            }
            if (pos >= length) {
                return null;
            }
            List<String> cells = collect ? new ArrayList<>() : List.of();
            StringBuilder cell = collect ? new StringBuilder() : null;
            boolean unterminated = false;

            while (true) {
                if (pos < length && text.charAt(pos) == quote) {
                    unterminated |= !readQuoted(cell);
                }
                readUnquoted(cell);
                if (collect) {
                    cells.add(cell.toString());
                    cell.setLength(0);
                }
                if (pos < length && text.charAt(pos) == delimiter) {
                    pos++;
                    continue;
                }
                skipLineBreak();
                return new Record(cells, unterminated);
            }
        }

        /**
         * Consumes a quoted section starting at the opening quote.
         *
         * @return false when input ended before the closing quote
         */
        private boolean readQuoted(StringBuilder cell) {
            pos++;
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == quote) {
                    if (pos + 1 < length && text.charAt(pos + 1) == quote) {
                        append(cell, quote);
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return true;
                }
                append(cell, c);
                pos++;
            }
            return false;
        }

        private void readUnquoted(StringBuilder cell) {
            while (pos < length) {
                char c = text.charAt(pos);
                if (c == delimiter || isLineBreak(c)) {
                    return;
                }
                append(cell, c);
                pos++;
            }
        }

        private void skipLineBreak() {
            if (pos >= length) {
                return;
            }
            if (text.charAt(pos) == '\r') {
                pos++;
                if (pos < length && text.charAt(pos) == '\n') {
                    pos++;
                }
            } else if (text.charAt(pos) == '\n') {
                pos++;
            }
        }

        private void append(StringBuilder cell, char c) {
            if (cell != null) {
                cell.append(c);
            }
        }
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
