package com.graphload.core.service.csv;

import com.graphload.core.service.task.FileKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Classified header row of an uploaded CSV file.
 *
 * Cells are matched case-insensitively after trimming. A cell equal to
 * {@code source_id}/{@code target_id}, or of the form {@code Label:source_id}/
 * {@code Label:target_id}, makes the file a relationship file; otherwise it is
 * a node file keyed by {@code id}. Kind depends on the header alone.
 */
public final class CsvHeader {

    public static final String ID = "id";
    public static final String SOURCE_ID = "source_id";
    public static final String TARGET_ID = "target_id";

    private static final char LABEL_SEPARATOR = ':';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final List<String> columns;
    private final List<String> normalized;
    private final FileKind kind;
    private final String idColumn;
    private final String sourceColumn;
    private final String targetColumn;
    private final String declaredSourceLabel;
    private final String declaredTargetLabel;

    private CsvHeader(List<String> columns) {
        this.columns = Collections.unmodifiableList(columns);
        this.normalized = columns.stream()
                .map(column -> column.toLowerCase(Locale.ROOT))
                .toList();

        String id = null;
        String source = null;
        String target = null;
        String sourceLabel = null;
        String targetLabel = null;

        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            String role = roleOf(normalized.get(i));
            if (ID.equals(normalized.get(i)) && id == null) {
                id = column;
            } else if (SOURCE_ID.equals(role) && source == null) {
                source = column;
                sourceLabel = labelPrefix(column);
            } else if (TARGET_ID.equals(role) && target == null) {
                target = column;
                targetLabel = labelPrefix(column);
            }
        }

        this.idColumn = id;
        this.sourceColumn = source;
        this.targetColumn = target;
        this.declaredSourceLabel = sourceLabel;
        this.declaredTargetLabel = targetLabel;
        this.kind = source != null || target != null ? FileKind.RELATIONSHIP : FileKind.NODE;
    }

    /**
     * Builds a header from raw cells; cells are trimmed and a leading byte order mark is dropped.
     */
    public static CsvHeader of(List<String> rawCells) {
        var cells = new ArrayList<String>(rawCells.size());
        for (int i = 0; i < rawCells.size(); i++) {
            String cell = rawCells.get(i) == null ? "" : rawCells.get(i);
            if (i == 0 && !cell.isEmpty() && cell.charAt(0) == BYTE_ORDER_MARK) {
                cell = cell.substring(1);
            }
            cells.add(cell.trim());
        }
        return new CsvHeader(cells);
    }

    // ==================== Classification ====================

    public FileKind kind() {
        return kind;
    }

    /**
     * Required columns this header lacks for its kind, in report order.
     */
    public List<String> missingRequiredColumns() {
        if (kind == FileKind.RELATIONSHIP) {
            var missing = new ArrayList<String>(2);
            if (sourceColumn == null) {
                missing.add(SOURCE_ID);
            }
            if (targetColumn == null) {
                missing.add(TARGET_ID);
            }
            return missing;
        }
        return idColumn == null ? List.of(ID) : List.of();
    }

    /**
     * Lower-cased column names occurring more than once, in first-repeat order.
     */
    public List<String> duplicateColumns() {
        var seen = new HashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        for (String column : normalized) {
            if (!seen.add(column)) {
                duplicates.add(column);
            }
        }
        return List.copyOf(duplicates);
    }

    public boolean hasBlankColumn() {
        return columns.stream().anyMatch(String::isEmpty);
    }

    // ==================== Accessors ====================

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public String idColumn() {
        return idColumn;
    }

    public String sourceColumn() {
        return sourceColumn;
    }

    public String targetColumn() {
        return targetColumn;
    }

    /**
     * Label named by a {@code Label:source_id} cell, or null.
     */
    public String declaredSourceLabel() {
        return declaredSourceLabel;
    }

    public String declaredTargetLabel() {
        return declaredTargetLabel;
    }

    /**
     * Whether the column holds an identifier for this file's kind.
     */
    public boolean isIdentifierColumn(String column) {
        if (kind == FileKind.RELATIONSHIP) {
            return column.equals(sourceColumn) || column.equals(targetColumn);
        }
        return column.equals(idColumn);
    }

    // ==================== Helpers ====================

    private static String roleOf(String normalizedCell) {
        int separator = normalizedCell.indexOf(LABEL_SEPARATOR);
        return separator < 0 ? normalizedCell : normalizedCell.substring(separator + 1).trim();
    }

    private static String labelPrefix(String column) {
        int separator = column.indexOf(LABEL_SEPARATOR);
        if (separator < 0) {
            return null;
        }
        String label = column.substring(0, separator).trim();
        return label.isEmpty() ? null : label;
    }

    @Override
    public String toString() {
        return "CsvHeader" + columns + " (" + kind + ")";
    }
}
