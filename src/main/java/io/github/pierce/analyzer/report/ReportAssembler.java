package io.github.pierce.analyzer.report;

import io.github.pierce.analyzer.ValidationOutcome;
import io.github.pierce.analyzer.parser.DataRow;
import io.github.pierce.analyzer.parser.ParsedTable;
import io.github.pierce.analyzer.stats.ColumnProfile;

import java.util.List;

/**
 * Combines the outputs of every stage into one {@link AnalysisReport}.
 */
public class ReportAssembler {

    /**
     * Builds the report for an accepted file.
     *
     * @throws IllegalArgumentException if the outcome is a rejection or the profiles
     *                                  do not line up with the header
     */
    public AnalysisReport assemble(ValidationOutcome outcome, ParsedTable table, List<ColumnProfile> profiles,
                                   List<DataRow> preview, FileMetadata metadata) {
        if (!outcome.isAccepted()) {
            throw new IllegalArgumentException("A rejected file has no report: " + outcome);
        }
        List<String> header = table.getHeader();
        if (profiles.size() != header.size()) {
            throw new IllegalArgumentException("Expected " + header.size() + " profiles but got " + profiles.size());
        }
        int rowCount = table.getValidRows().size();
        for (int i = 0; i < profiles.size(); i++) {
            ColumnProfile profile = profiles.get(i);
            if (!profile.getName().equals(header.get(i))) {
                throw new IllegalArgumentException("Profile '" + profile.getName()
                        + "' does not match header column '" + header.get(i) + "' at position " + (i + 1));
            }
            if (profile.getRowCount() != rowCount) {
                throw new IllegalArgumentException("Profile '" + profile.getName() + "' covers "
                        + profile.getRowCount() + " rows, expected " + rowCount);
            }
        }
        return AnalysisReport.builder()
                .fileName(metadata.fileName())
                .fileSize(metadata.fileSize())
                .encoding(metadata.encoding())
                .columns(header)
                .rowCount(rowCount)
                .malformedRows(table.getMalformedRowIndexes())
                .profiles(profiles)
                .preview(preview)
                .validation(outcome)
                .build();
    }

    /**
     * Facts about the uploaded file echoed in the report.
     */
    public record FileMetadata(String fileName, long fileSize, String encoding) {
    }
}
