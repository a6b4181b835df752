package io.github.pierce.analyzer.validation;

import io.github.pierce.analyzer.RawFile;
import io.github.pierce.analyzer.ValidationOutcome;
import io.github.pierce.analyzer.ValidationRule;
import io.github.pierce.analyzer.config.AnalysisLimits;
import io.github.pierce.analyzer.parser.TabularParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the shape of a file against the configured limits before any cell is interpreted.
 *
 * <p>Rules run in a fixed order and the first failure wins:
 * <ol>
 *   <li>file extension, when the file is named and extensions are restricted</li>
 *   <li>byte size</li>
 *   <li>presence of a header row</li>
 *   <li>data row count</li>
 *   <li>column count</li>
 *   <li>duplicate header names (exact, case-sensitive)</li>
 * </ol>
 * The first two work on raw bytes and run before decoding; the rest only read the
 * header record and count records.</p>
 */
public class StructuralValidator {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralValidator.class);

    private final AnalysisLimits limits;

    public StructuralValidator(AnalysisLimits limits) {
        this.limits = limits != null ? limits : AnalysisLimits.defaults();
    }

    /**
     * Runs the rules that need only the raw bytes.
     */
    public ValidationOutcome validateFile(RawFile file) {
        Optional<String> fileName = file.getFileName();
        if (fileName.isPresent() && !limits.getAllowedExtensions().isEmpty()) {
            String extension = extensionOf(fileName.get());
            if (!limits.getAllowedExtensions().contains(extension)) {
                return reject(ValidationRule.UNSUPPORTED_EXTENSION, String.format(
                        "Invalid file type '%s'. Allowed types: %s",
                        extension.isEmpty() ? "(none)" : extension,
                        String.join(", ", limits.getAllowedExtensions())));
            }
        }
        if (file.size() > limits.getMaxBytes()) {
            return reject(ValidationRule.FILE_TOO_LARGE, String.format(
                    "File size %d bytes exceeds the limit of %d bytes", file.size(), limits.getMaxBytes()));
        }
        return ValidationOutcome.accepted();
    }

    /**
     * Runs the rules that need the decoded text.
     */
    public ValidationOutcome validateStructure(String text, TabularParser parser) {
        Optional<List<String>> header = text.isBlank() ? Optional.empty() : parser.readHeader(text);
        if (header.isEmpty()) {
            return reject(ValidationRule.EMPTY_FILE, "The file is empty: no header row found");
        }

        int rows = parser.countDataRows(text);
        if (rows > limits.getMaxRows()) {
            return reject(ValidationRule.TOO_MANY_ROWS, String.format(
                    "Too many rows: %d data rows, maximum allowed is %d", rows, limits.getMaxRows()));
        }

        List<String> columns = header.get();
        if (columns.size() > limits.getMaxColumns()) {
            return reject(ValidationRule.TOO_MANY_COLUMNS, String.format(
                    "Too many columns: %d columns, maximum allowed is %d", columns.size(), limits.getMaxColumns()));
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            if (!seen.add(name)) {
                return reject(ValidationRule.DUPLICATE_COLUMN, String.format(
                        "Duplicate column name '%s' at position %d", name, i + 1));
            }
        }
        return ValidationOutcome.accepted();
    }

    /**
     * Runs every rule in order.
     */
    public ValidationOutcome validate(RawFile file, String text, TabularParser parser) {
        ValidationOutcome outcome = validateFile(file);
        if (!outcome.isAccepted()) {
            return outcome;
        }
        return validateStructure(text, parser);
    }

    private static ValidationOutcome reject(ValidationRule rule, String detail) {
        LOG.info("File rejected by {}: {}", rule.getRuleName(), detail);
        return ValidationOutcome.rejected(rule, detail);
    }

    private static String extensionOf(String fileName) {
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public AnalysisLimits getLimits() {
        return limits;
    }
}
