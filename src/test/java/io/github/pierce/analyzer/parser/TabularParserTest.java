package io.github.pierce.analyzer.parser;

import io.github.pierce.analyzer.config.InferenceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CSV dialect handling in {@link TabularParser}.
 */
class TabularParserTest {

    private final TabularParser parser = new TabularParser(InferenceConfig.defaults());

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        @DisplayName("splits header and data rows")
        void splitsHeaderAndRows() {
            ParsedTable table = parser.parse("id,name\n1,alice\n2,bob\n");

            assertThat(table.getHeader()).containsExactly("id", "name");
            assertThat(table.getRows()).extracting(DataRow::cells)
                    .containsExactly(List.of("1", "alice"), List.of("2", "bob"));
            assertThat(table.getRows()).extracting(DataRow::index).containsExactly(1, 2);
        }

        @Test
        @DisplayName("accepts CRLF and CR line endings")
        void acceptsAllLineEndings() {
            ParsedTable table = parser.parse("a,b\r\n1,2\r3,4");

            assertThat(table.getRows()).extracting(DataRow::cells)
                    .containsExactly(List.of("1", "2"), List.of("3", "4"));
        }

        @Test
        @DisplayName("skips empty lines")
        void skipsEmptyLines() {
            ParsedTable table = parser.parse("\n\na,b\n\n1,2\n\n");

            assertThat(table.getHeader()).containsExactly("a", "b");
            assertThat(table.getRows()).hasSize(1);
        }

        @Test
        @DisplayName("keeps empty cells, including a trailing one")
        void keepsEmptyCells() {
            ParsedTable table = parser.parse("a,b,c\n,,\n1,,");

            assertThat(table.getRows()).extracting(DataRow::cells)
                    .containsExactly(List.of("", "", ""), List.of("1", "", ""));
            assertThat(table.getMalformedRowCount()).isZero();
        }

        @Test
        @DisplayName("keeps surrounding whitespace verbatim")
        void keepsWhitespace() {
            ParsedTable table = parser.parse("a,b\n 1 , x ");

            assertThat(table.getRows().get(0).cells()).containsExactly(" 1 ", " x ");
        }
    }

    @Nested
    @DisplayName("quoting")
    class Quoting {

        @Test
        @DisplayName("treats delimiters and line breaks inside quotes as content")
        void quotedContent() {
            ParsedTable table = parser.parse("name,note\n\"Smith, J\",\"line one\nline two\"\n");

            assertThat(table.getRows()).hasSize(1);
            assertThat(table.getRows().get(0).cells()).containsExactly("Smith, J", "line one\nline two");
        }

        @Test
        @DisplayName("unescapes doubled quotes")
        void doubledQuotes() {
            ParsedTable table = parser.parse("q\n\"say \"\"hi\"\"\"");

            assertThat(table.getRows().get(0).cell(0)).isEqualTo("say \"hi\"");
        }

        @Test
        @DisplayName("quote characters inside an unquoted field are literal")
        void quoteInsideUnquotedField() {
            ParsedTable table = parser.parse("size\n5\"10");

            assertThat(table.getRows().get(0).cell(0)).isEqualTo("5\"10");
        }

        @Test
        @DisplayName("an unterminated quote makes the row malformed")
        void unterminatedQuote() {
            ParsedTable table = parser.parse("a,b\n1,2\n3,\"open");

            assertThat(table.getRows()).hasSize(2);
            assertThat(table.getRows().get(1).malformed()).isTrue();
            assertThat(table.getRows().get(1).cells()).containsExactly("3", "open");
        }

        @Test
        @DisplayName("honors a custom delimiter and quote")
        void customDialect() {
            TabularParser semicolon = new TabularParser(InferenceConfig.builder()
                    .delimiter(';')
                    .quoteChar('\'')
                    .build());

            ParsedTable table = semicolon.parse("a;b\n'x;y';'it''s'");

            assertThat(table.getRows().get(0).cells()).containsExactly("x;y", "it's");
        }
    }

    @Nested
    @DisplayName("malformed rows")
    class MalformedRows {

        @Test
        @DisplayName("flags rows with too few or too many cells")
        void flagsWrongCellCount() {
            ParsedTable table = parser.parse("a,b\n1,2\n3\n4,5,6\n7,8");

            assertThat(table.getRows()).extracting(DataRow::malformed)
                    .containsExactly(false, true, true, false);
            assertThat(table.getMalformedRowIndexes()).containsExactly(2, 3);
            assertThat(table.getValidRows()).extracting(DataRow::index).containsExactly(1, 4);
        }

        @Test
        @DisplayName("keeps malformed cells unpadded")
        void keepsCellsUnpadded() {
            ParsedTable table = parser.parse("a,b,c\n1");

            assertThat(table.getRows().get(0).cells()).containsExactly("1");
        }

        @Test
        @DisplayName("column values come from well-formed rows only")
        void columnValuesSkipMalformed() {
            ParsedTable table = parser.parse("a,b\n1,x\n2\n3,y");

            assertThat(table.columnValues(0)).containsExactly("1", "3");
            assertThat(table.columnValues(1)).containsExactly("x", "y");
        }
    }

    @Nested
    @DisplayName("structural scan")
    class StructuralScan {

        @Test
        @DisplayName("reads only the header")
        void readsHeader() {
            assertThat(parser.readHeader("x,\"y,z\"\n1,2")).contains(List.of("x", "y,z"));
            assertThat(parser.readHeader("\n\n")).isEmpty();
            assertThat(parser.readHeader("")).isEmpty();
        }

        @Test
        @DisplayName("counts data rows, treating quoted line breaks as content")
        void countsRows() {
            assertThat(parser.countDataRows("a\n1\n\"2\n2\"\n3\n")).isEqualTo(3);
            assertThat(parser.countDataRows("a\n")).isZero();
            assertThat(parser.countDataRows("")).isZero();
        }
    }

    @Test
    @DisplayName("parse without a header is an error")
    void parseRequiresHeader() {
        assertThatThrownBy(() -> parser.parse("\n"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
