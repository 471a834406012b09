package co.fanki.drivesync.content.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rows as a markdown pipe table.
 *
 * <p>The first row is the header. Short rows are padded with empty cells,
 * null cells render empty, and every column is at least three characters
 * wide so the separator row stays valid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class MarkdownTable {

    private static final int MIN_WIDTH = 3;

    private MarkdownTable() {
    }

    /**
     * Formats the rows.
     *
     * @param rows the rows, header first
     * @return the table, or an empty string when there are no rows
     */
    static String format(final List<List<String>> rows) {
        if (rows.isEmpty()) {
            return "";
        }

        int columns = 0;
        for (final List<String> row : rows) {
            columns = Math.max(columns, row.size());
        }

        final List<List<String>> cleaned = new ArrayList<>();
        for (final List<String> row : rows) {
            final List<String> cells = new ArrayList<>();
            for (int c = 0; c < columns; c++) {
                final String cell = c < row.size() ? row.get(c) : null;
                cells.add(cell != null ? cell : "");
            }
            cleaned.add(cells);
        }

        final int[] widths = new int[columns];
        for (int c = 0; c < columns; c++) {
            int width = MIN_WIDTH;
            for (final List<String> row : cleaned) {
                width = Math.max(width, row.get(c).length());
            }
            widths[c] = width;
        }

        final StringBuilder out = new StringBuilder();
        appendRow(out, cleaned.get(0), widths);

        final List<String> separator = new ArrayList<>();
        for (final int width : widths) {
            separator.add("-".repeat(width));
        }
        out.append('\n');
        appendRow(out, separator, widths);

        for (int r = 1; r < cleaned.size(); r++) {
            out.append('\n');
            appendRow(out, cleaned.get(r), widths);
        }
        return out.toString();
    }

    private static void appendRow(final StringBuilder out,
            final List<String> cells, final int[] widths) {
        out.append('|');
        for (int c = 0; c < cells.size(); c++) {
            final String cell = cells.get(c);
            out.append(' ').append(cell)
                    .append(" ".repeat(widths[c] - cell.length()))
                    .append(" |");
        }
    }

}
