package io.github.pierce.analyzer.validation;

import io.github.pierce.analyzer.EngineError;
import io.github.pierce.analyzer.RawFile;
import io.github.pierce.analyzer.ValidationOutcome;
import io.github.pierce.analyzer.ValidationRule;
import io.github.pierce.analyzer.config.AnalysisLimits;
import io.github.pierce.analyzer.config.InferenceConfig;
import io.github.pierce.analyzer.parser.TabularParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the ordered structural rules.
 */
class StructuralValidatorTest {

    private final TabularParser parser = new TabularParser(InferenceConfig.defaults());

    private static EngineError.Rejected rejection(ValidationOutcome outcome) {
        assertThat(outcome.isAccepted()).isFalse();
        return (EngineError.Rejected) outcome;
    }

    @Nested
    @DisplayName("file rules")
    class FileRules {

        @Test
        @DisplayName("rejects files above the byte limit")
        void rejectsLargeFile() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder().maxBytes(10).build());

            EngineError.Rejected rejected = rejection(validator.validateFile(RawFile.of(new byte[11])));

            assertThat(rejected.rule()).isEqualTo(ValidationRule.FILE_TOO_LARGE);
            assertThat(rejected.detail()).contains("11").contains("10");
            assertThat(rejected.code()).isEqualTo("FileTooLarge");
        }

        @Test
        @DisplayName("accepts a file exactly at the byte limit")
        void acceptsFileAtLimit() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder().maxBytes(10).build());

            assertThat(validator.validateFile(RawFile.of(new byte[10])).isAccepted()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"data.xlsx", "report.json", "noextension", ".csv.bak"})
        @DisplayName("rejects named files with a disallowed extension")
        void rejectsExtension(String name) {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            EngineError.Rejected rejected = rejection(validator.validateFile(RawFile.of(new byte[1], null, name)));

            assertThat(rejected.rule()).isEqualTo(ValidationRule.UNSUPPORTED_EXTENSION);
            assertThat(rejected.detail()).contains(".csv");
        }

        @ParameterizedTest
        @ValueSource(strings = {"data.csv", "DATA.CSV", "uploads/2024/in.Csv"})
        @DisplayName("accepts allowed extensions regardless of case")
        void acceptsExtension(String name) {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            assertThat(validator.validateFile(RawFile.of(new byte[1], null, name)).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("skips the extension rule for unnamed files or an empty allow-list")
        void extensionRuleIsOptional() {
            StructuralValidator open = new StructuralValidator(AnalysisLimits.builder()
                    .allowedExtensions(Set.of())
                    .build());

            assertThat(open.validateFile(RawFile.of(new byte[1], null, "data.xlsx")).isAccepted()).isTrue();
            assertThat(new StructuralValidator(AnalysisLimits.defaults())
                    .validateFile(RawFile.of(new byte[1])).isAccepted()).isTrue();
        }
    }

    @Nested
    @DisplayName("structure rules")
    class StructureRules {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\n", "\r\n"})
        @DisplayName("rejects text without a header")
        void rejectsEmpty(String text) {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            assertThat(rejection(validator.validateStructure(text, parser)).rule())
                    .isEqualTo(ValidationRule.EMPTY_FILE);
        }

        @Test
        @DisplayName("rejects too many rows, stating observed count and limit")
        void rejectsTooManyRows() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder().maxRows(2).build());

            EngineError.Rejected rejected = rejection(validator.validateStructure("a\n1\n2\n3\n", parser));

            assertThat(rejected.rule()).isEqualTo(ValidationRule.TOO_MANY_ROWS);
            assertThat(rejected.detail()).isEqualTo("Too many rows: 3 data rows, maximum allowed is 2");
        }

        @Test
        @DisplayName("rejects too many columns")
        void rejectsTooManyColumns() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder().maxColumns(2).build());

            EngineError.Rejected rejected = rejection(validator.validateStructure("a,b,c\n1,2,3", parser));

            assertThat(rejected.rule()).isEqualTo(ValidationRule.TOO_MANY_COLUMNS);
            assertThat(rejected.detail()).contains("3 columns").contains("maximum allowed is 2");
        }

        @Test
        @DisplayName("rejects duplicate column names")
        void rejectsDuplicateColumns() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            EngineError.Rejected rejected = rejection(validator.validateStructure("a,b,a\n1,2,3", parser));

            assertThat(rejected.rule()).isEqualTo(ValidationRule.DUPLICATE_COLUMN);
            assertThat(rejected.detail()).contains("'a'").contains("position 3");
        }

        @Test
        @DisplayName("column names are compared case-sensitively")
        void duplicateCheckIsCaseSensitive() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            assertThat(validator.validateStructure("Name,name\nx,y", parser).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("row limit is checked before column limit")
        void rulesRunInOrder() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder()
                    .maxRows(1)
                    .maxColumns(1)
                    .build());

            assertThat(rejection(validator.validateStructure("a,a\n1,2\n3,4", parser)).rule())
                    .isEqualTo(ValidationRule.TOO_MANY_ROWS);
        }

        @Test
        @DisplayName("accepts a header without data rows")
        void acceptsHeaderOnly() {
            StructuralValidator validator = new StructuralValidator(AnalysisLimits.defaults());

            assertThat(validator.validateStructure("a,b\n", parser).isAccepted()).isTrue();
        }
    }

    @Test
    @DisplayName("validate stops at the size rule before reading text")
    void validateRunsFileRulesFirst() {
        StructuralValidator validator = new StructuralValidator(AnalysisLimits.builder().maxBytes(3).build());
        byte[] bytes = "a,a\n1,2".getBytes(StandardCharsets.UTF_8);

        ValidationOutcome outcome = validator.validate(RawFile.of(bytes), "a,a\n1,2", parser);

        assertThat(rejection(outcome).rule()).isEqualTo(ValidationRule.FILE_TOO_LARGE);
    }
}
