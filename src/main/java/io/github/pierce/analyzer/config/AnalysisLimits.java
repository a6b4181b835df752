package io.github.pierce.analyzer.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural limits a file must satisfy before it is analyzed.
 *
 * <p>Limits are non-negotiable inputs: they bound the memory an analysis can use.
 * This class uses the builder pattern and is immutable once constructed.</p>
 */
public final class AnalysisLimits {

    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_ROWS = 1_000_000;
    public static final int DEFAULT_MAX_COLUMNS = 100;
    public static final int DEFAULT_PREVIEW_SIZE = 10;
    public static final int DEFAULT_SAMPLE_VALUE_COUNT = 5;

    private final long maxBytes;
    private final int maxRows;
    private final int maxColumns;
    private final int previewSize;
    private final int sampleValueCount;
    private final Set<String> allowedExtensions;

    private AnalysisLimits(Builder builder) {
        this.maxBytes = builder.maxBytes;
        this.maxRows = builder.maxRows;
        this.maxColumns = builder.maxColumns;
        this.previewSize = builder.previewSize;
        this.sampleValueCount = builder.sampleValueCount;
        this.allowedExtensions = Set.copyOf(builder.allowedExtensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default limits: 10 MiB, one million rows, 100 columns, a ten row preview.
     */
    public static AnalysisLimits defaults() {
        return builder().build();
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getPreviewSize() {
        return previewSize;
    }

    /**
     * Number of leading non-null values echoed per column profile.
     */
    public int getSampleValueCount() {
        return sampleValueCount;
    }

    /**
     * Lower-cased extensions including the dot, e.g. {@code .csv}. Empty disables the check.
     */
    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public Builder toBuilder() {
        return builder()
                .maxBytes(maxBytes)
                .maxRows(maxRows)
                .maxColumns(maxColumns)
                .previewSize(previewSize)
                .sampleValueCount(sampleValueCount)
                .allowedExtensions(allowedExtensions);
    }

    @Override
    public String toString() {
        return "AnalysisLimits{maxBytes=" + maxBytes + ", maxRows=" + maxRows
                + ", maxColumns=" + maxColumns + ", previewSize=" + previewSize
                + ", sampleValueCount=" + sampleValueCount
                + ", allowedExtensions=" + allowedExtensions + "}";
    }

    public static final class Builder {
        private long maxBytes = DEFAULT_MAX_BYTES;
        private int maxRows = DEFAULT_MAX_ROWS;
        private int maxColumns = DEFAULT_MAX_COLUMNS;
        private int previewSize = DEFAULT_PREVIEW_SIZE;
        private int sampleValueCount = DEFAULT_SAMPLE_VALUE_COUNT;
        private Set<String> allowedExtensions = new LinkedHashSet<>(List.of(".csv"));

        public Builder maxBytes(long maxBytes) {
            if (maxBytes < 0) {
                throw new IllegalArgumentException("maxBytes must not be negative: " + maxBytes);
            }
            this.maxBytes = maxBytes;
            return this;
        }

        public Builder maxRows(int maxRows) {
            if (maxRows < 0) {
                throw new IllegalArgumentException("maxRows must not be negative: " + maxRows);
            }
            this.maxRows = maxRows;
            return this;
        }

        public Builder maxColumns(int maxColumns) {
            if (maxColumns < 1) {
                throw new IllegalArgumentException("maxColumns must be positive: " + maxColumns);
            }
            this.maxColumns = maxColumns;
            return this;
        }

        public Builder previewSize(int previewSize) {
            if (previewSize < 0) {
                throw new IllegalArgumentException("previewSize must not be negative: " + previewSize);
            }
            this.previewSize = previewSize;
            return this;
        }

        public Builder sampleValueCount(int sampleValueCount) {
            if (sampleValueCount < 0) {
                throw new IllegalArgumentException("sampleValueCount must not be negative: " + sampleValueCount);
            }
            this.sampleValueCount = sampleValueCount;
            return this;
        }

        public Builder allowedExtensions(Set<String> extensions) {
            Set<String> normalized = new LinkedHashSet<>();
            for (String extension : extensions) {
                String ext = extension.trim().toLowerCase(Locale.ROOT);
                if (ext.isEmpty()) {
                    continue;
                }
                normalized.add(ext.startsWith(".") ? ext : "." + ext);
            }
            this.allowedExtensions = normalized;
            return this;
        }

        public Builder allowedExtensions(String... extensions) {
            return allowedExtensions(new LinkedHashSet<>(List.of(extensions)));
        }

        public AnalysisLimits build() {
            return new AnalysisLimits(this);
        }
    }
}
