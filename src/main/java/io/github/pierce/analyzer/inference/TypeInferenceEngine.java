package io.github.pierce.analyzer.inference;

import io.github.pierce.analyzer.config.InferenceConfig;
import io.github.pierce.analyzer.parser.ParsedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;

/**
 * Assigns each column the narrowest type shared by all of its non-null cells.
 *
 * <p>Every column starts with all types as candidates. Each non-null cell removes the
 * candidates it is not a literal of, and the most specific survivor wins. Because
 * candidate removal is an intersection, the outcome does not depend on row order.
 * {@link ColumnType#STRING} accepts every cell, so inference always succeeds; a column
 * without non-null cells is STRING.</p>
 */
public class TypeInferenceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TypeInferenceEngine.class);

    private final CellClassifierRegistry registry;
    private final boolean trimWhitespace;

    public TypeInferenceEngine(InferenceConfig config) {
        this(new CellClassifierRegistry(config), config != null ? config.isTrimWhitespace() : true);
    }

    public TypeInferenceEngine(CellClassifierRegistry registry, boolean trimWhitespace) {
        this.registry = registry;
        this.trimWhitespace = trimWhitespace;
    }

    /**
     * Infers the type of every column over the table's well-formed rows, in header order.
     */
    public List<ColumnType> infer(ParsedTable table) {
        List<ColumnType> types = new ArrayList<>(table.getColumnCount());
        for (int column = 0; column < table.getColumnCount(); column++) {
            ColumnType type = inferColumn(table.columnValues(column));
            LOG.debug("Column '{}' inferred as {}", table.getHeader().get(column), type.getDisplayName());
            types.add(type);
        }
        return types;
    }

    /**
     * Infers the type of one column from its raw cells.
     */
    public ColumnType inferColumn(List<String> rawCells) {
        EnumSet<ColumnType> candidates = EnumSet.allOf(ColumnType.class);
        boolean sawValue = false;
        for (String raw : rawCells) {
            String cell = CellNormalizer.normalize(raw, trimWhitespace);
            if (cell == null) {
                continue;
            }
            sawValue = true;
            narrow(candidates, cell);
            if (candidates.size() == 1) {
                break;
            }
        }
        if (!sawValue) {
            return ColumnType.STRING;
        }
        return candidates.iterator().next();
    }

    private void narrow(EnumSet<ColumnType> candidates, String cell) {
        Iterator<ColumnType> it = candidates.iterator();
        while (it.hasNext()) {
            ColumnType type = it.next();
            if (type != ColumnType.STRING && !registry.forType(type).accepts(cell)) {
                it.remove();
            }
        }
    }
}
