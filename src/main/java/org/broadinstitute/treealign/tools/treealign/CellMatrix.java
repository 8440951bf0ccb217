package org.broadinstitute.treealign.tools.treealign;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.treealign.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A rectangular table of values with one row per feature (gene or SNP) and one column per cell or clone.
 *
 * <p>
 *     Either dimension may be zero; such a table is present but carries no signal.
 * </p>
 *
 * Developer note: any public constructor of this class must verify that row and column names do not contain duplicates.
 */
public final class CellMatrix {

    /**
     * Unmodifiable row-name list in the row order of {@link #values}.
     */
    private final List<String> rowNames;

    /**
     * Unmodifiable column-name list in the column order of {@link #values}.
     */
    private final List<String> columnNames;

    private final Map<String, Integer> columnIndexMap;

    /**
     * Values with one row per entry of {@link #rowNames} and one column per entry of {@link #columnNames};
     * {@code null} when either dimension is zero, since {@link RealMatrix} cannot be empty.
     */
    private final RealMatrix values;

    /**
     * Creates a new table.
     * <p>
     *     The new instance has its own copy of the names and values, so the arguments can be modified after this call.
     * </p>
     *
     * @param rowNames the row names.
     * @param columnNames the column names.
     * @param values the values, with as many rows as {@code rowNames} and as many columns as {@code columnNames}.
     * @throws IllegalArgumentException if any argument is {@code null}, names contain {@code null}s or duplicates,
     *  or the dimensions do not match.
     */
    public CellMatrix(final List<String> rowNames, final List<String> columnNames, final double[][] values) {
        Utils.nonNull(rowNames, "the row names cannot be null");
        Utils.nonNull(columnNames, "the column names cannot be null");
        Utils.nonNull(values, "the values cannot be null");
        Utils.containsNoNull(rowNames, "row names contain nulls");
        Utils.containsNoNull(columnNames, "column names contain nulls");
        Utils.checkForDuplicatesAndReturnSet(rowNames, "row names contain duplicates.");
        Utils.checkForDuplicatesAndReturnSet(columnNames, "column names contain duplicates.");
        Utils.validateArg(values.length == rowNames.size(), "number of value rows does not match the number of row names");
        for (final double[] row : values) {
            Utils.validateArg(row != null && row.length == columnNames.size(),
                    "number of value columns does not match the number of column names");
        }
        this.rowNames = Collections.unmodifiableList(new ArrayList<>(rowNames));
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.values = rowNames.isEmpty() || columnNames.isEmpty() ? null : new Array2DRowRealMatrix(values, true);
        this.columnIndexMap = createIndexMap(this.columnNames);
    }

    private CellMatrix(final List<String> rowNames, final List<String> columnNames, final RealMatrix values) {
        this.rowNames = rowNames;
        this.columnNames = columnNames;
        this.values = values;
        this.columnIndexMap = createIndexMap(columnNames);
    }

    /**
     * Creates a table with the given names and no values, i.e. with zero rows or zero columns.
     */
    public static CellMatrix empty(final List<String> rowNames, final List<String> columnNames) {
        Utils.validateArg(rowNames.isEmpty() || columnNames.isEmpty(), "an empty table must have no rows or no columns");
        return new CellMatrix(rowNames, columnNames, new double[rowNames.size()][columnNames.size()]);
    }

    public List<String> rowNames() {
        return rowNames;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public int numRows() {
        return rowNames.size();
    }

    public int numColumns() {
        return columnNames.size();
    }

    public boolean isEmpty() {
        return values == null;
    }

    public double get(final int rowIndex, final int columnIndex) {
        Utils.validIndex(rowIndex, numRows());
        Utils.validIndex(columnIndex, numColumns());
        return values.getEntry(rowIndex, columnIndex);
    }

    public double[] getRow(final int rowIndex) {
        Utils.validIndex(rowIndex, numRows());
        return isEmpty() ? new double[0] : values.getRow(rowIndex);
    }

    public double[] getColumn(final String columnName) {
        final Integer columnIndex = columnIndexMap.get(Utils.nonNull(columnName));
        Utils.validateArg(columnIndex != null, () -> "unknown column: " + columnName);
        return isEmpty() ? new double[0] : values.getColumn(columnIndex);
    }

    /**
     * Subsets the columns, keeping those named in {@code columnsToKeep} that are present in this table.
     * <p>
     *     Creates a brand-new table. The order of columns in the result follows {@code columnsToKeep}.
     * </p>
     *
     * @param columnsToKeep column names to keep; names absent from this table are ignored.
     * @return never {@code null}.
     */
    public CellMatrix subsetColumns(final List<String> columnsToKeep) {
        Utils.nonNull(columnsToKeep, "the list of columns to keep cannot be null.");
        final List<String> resultColumns = columnsToKeep.stream()
                .filter(columnIndexMap::containsKey)
                .distinct()
                .collect(Collectors.toList());
        if (resultColumns.equals(columnNames)) {
            return this;
        }
        if (isEmpty() || resultColumns.isEmpty()) {
            return new CellMatrix(rowNames, Collections.unmodifiableList(resultColumns), (RealMatrix) null);
        }
        final int[] columnIndices = resultColumns.stream().mapToInt(columnIndexMap::get).toArray();
        final int[] rowIndices = IntStream.range(0, numRows()).toArray();
        return new CellMatrix(rowNames, Collections.unmodifiableList(resultColumns),
                values.getSubMatrix(rowIndices, columnIndices));
    }

    private static Map<String, Integer> createIndexMap(final List<String> names) {
        final Map<String, Integer> result = new HashMap<>(names.size());
        IntStream.range(0, names.size()).forEach(i -> result.put(names.get(i), i));
        return result;
    }

    @Override
    public String toString() {
        return String.format("CellMatrix[%d rows x %d columns]", numRows(), numColumns());
    }
}
