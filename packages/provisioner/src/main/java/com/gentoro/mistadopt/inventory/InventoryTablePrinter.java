package com.gentoro.mistadopt.inventory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the raw inventory as a psql-style text table. Columns whose name contains {@code
 * password} are masked and empty cells are shown as {@code Empty}.
 */
public final class InventoryTablePrinter {
  static final String EMPTY_CELL = "Empty";

  private InventoryTablePrinter() {}

  public static String render(InventoryTable table) {
    List<String> columns = new ArrayList<>();
    columns.add("");
    columns.addAll(table.columns());

    List<List<String>> cells = new ArrayList<>();
    int index = 0;
    for (Map<String, String> row : table.rows()) {
      List<String> line = new ArrayList<>();
      line.add(String.valueOf(index++));
      for (String column : table.columns()) {
        line.add(cell(column, row.get(column)));
      }
      cells.add(line);
    }

    int[] widths = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      widths[i] = columns.get(i).length();
      for (List<String> line : cells) {
        widths[i] = Math.max(widths[i], line.get(i).length());
      }
    }

    StringBuilder sb = new StringBuilder();
    border(sb, widths, '+', '+');
    row(sb, widths, columns);
    border(sb, widths, '|', '+');
    for (List<String> line : cells) {
      row(sb, widths, line);
    }
    border(sb, widths, '+', '+');
    return sb.toString();
  }

  private static String cell(String column, String value) {
    if (value == null || value.isEmpty()) return EMPTY_CELL;
    if (column.contains("password")) return "*".repeat(value.length());
    return value;
  }

  private static void border(StringBuilder sb, int[] widths, char edge, char joint) {
    sb.append(edge);
    for (int i = 0; i < widths.length; i++) {
      sb.append("-".repeat(widths[i] + 2));
      sb.append(i < widths.length - 1 ? joint : edge);
    }
    sb.append('\n');
  }

  private static void row(StringBuilder sb, int[] widths, List<String> values) {
    sb.append('|');
    for (int i = 0; i < widths.length; i++) {
      String v = values.get(i);
      sb.append(' ').append(v).append(" ".repeat(widths[i] - v.length())).append(" |");
    }
    sb.append('\n');
  }
}
