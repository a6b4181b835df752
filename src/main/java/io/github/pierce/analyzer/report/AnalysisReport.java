package io.github.pierce.analyzer.report;

import io.github.pierce.analyzer.ValidationOutcome;
import io.github.pierce.analyzer.parser.DataRow;
import io.github.pierce.analyzer.stats.ColumnProfile;

import java.util.List;
import java.util.Optional;

/**
 * Immutable result of a successful analysis.
 *
 * <p>{@link #getRowCount()} counts the well-formed data rows every column profile is
 * computed over; malformed rows are counted and listed separately.</p>
 */
public final class AnalysisReport {

    private final String fileName;
    private final long fileSize;
    private final String encoding;
    private final List<String> columns;
    private final int rowCount;
    private final List<Integer> malformedRows;
    private final List<ColumnProfile> profiles;
    private final List<DataRow> preview;
    private final ValidationOutcome validation;

    private AnalysisReport(Builder builder) {
        this.fileName = builder.fileName;
        this.fileSize = builder.fileSize;
        this.encoding = builder.encoding;
        this.columns = List.copyOf(builder.columns);
        this.rowCount = builder.rowCount;
        this.malformedRows = List.copyOf(builder.malformedRows);
        this.profiles = List.copyOf(builder.profiles);
        this.preview = List.copyOf(builder.preview);
        this.validation = builder.validation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getFileName() {
        return Optional.ofNullable(fileName);
    }

    public long getFileSize() {
        return fileSize;
    }

    /**
     * Canonical name of the charset the file was decoded with.
     */
    public String getEncoding() {
        return encoding;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getMalformedRowCount() {
        return malformedRows.size();
    }

    /**
     * 1-based data row positions of the malformed rows.
     */
    public List<Integer> getMalformedRows() {
        return malformedRows;
    }

    /**
     * Well-formed plus malformed data rows.
     */
    public int getTotalRowCount() {
        return rowCount + malformedRows.size();
    }

    public List<ColumnProfile> getProfiles() {
        return profiles;
    }

    public Optional<ColumnProfile> getProfile(String column) {
        return profiles.stream().filter(p -> p.getName().equals(column)).findFirst();
    }

    public List<DataRow> getPreview() {
        return preview;
    }

    public ValidationOutcome getValidation() {
        return validation;
    }

    @Override
    public String toString() {
        return "AnalysisReport{fileName=" + fileName + ", rows=" + rowCount
                + ", malformed=" + malformedRows.size() + ", columns=" + columns.size()
                + ", validation=" + validation + "}";
    }

    public static final class Builder {
        private String fileName;
        private long fileSize;
        private String encoding;
        private List<String> columns = List.of();
        private int rowCount;
        private List<Integer> malformedRows = List.of();
        private List<ColumnProfile> profiles = List.of();
        private List<DataRow> preview = List.of();
        private ValidationOutcome validation = ValidationOutcome.accepted();

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns = columns;
            return this;
        }

        public Builder rowCount(int rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder malformedRows(List<Integer> malformedRows) {
            this.malformedRows = malformedRows;
            return this;
        }

        public Builder profiles(List<ColumnProfile> profiles) {
            this.profiles = profiles;
            return this;
        }

        public Builder preview(List<DataRow> preview) {
            this.preview = preview;
            return this;
        }

        public Builder validation(ValidationOutcome validation) {
            this.validation = validation;
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }
}
