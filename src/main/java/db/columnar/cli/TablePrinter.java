package db.columnar.cli;

import java.io.PrintStream;
import java.util.List;

import db.columnar.storage.Relation;

/**
 * Simple ASCII table printer for relations. Absent values render as NULL.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Relation relation, PrintStream out) {
        out.print(render(relation));
    }

    public static String render(Relation relation) {
        List<String> headers = relation.columnNames();
        int colCount = headers.size();
        int rowCount = relation.rowCount();
        if (colCount == 0) return "(" + rowCount + " row(s))" + System.lineSeparator();

        String[][] cells = new String[rowCount][colCount];
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (int r = 0; r < rowCount; r++) {
            List<Object> vals = relation.row(r);
            for (int i = 0; i < colCount; i++) {
                String s = format(vals.get(i));
                cells[r][i] = s;
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String nl = System.lineSeparator();
        String divLine = buildDivider(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(divLine).append(nl);
        sb.append(buildRow(headers.toArray(new String[0]), widths)).append(nl);
        sb.append(divLine).append(nl);
        for (String[] row : cells) sb.append(buildRow(row, widths)).append(nl);
        sb.append(divLine).append(nl);
        sb.append('(').append(rowCount).append(" row(s))").append(nl);
        return sb.toString();
    }

    private static String format(Object value) {
        return value == null ? "NULL" : String.valueOf(value);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int w : widths) line.append("-".repeat(w + 2)).append('+');
        return line.toString();
    }

    private static String buildRow(String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            line.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        return line.toString();
    }
}
