package com.gentoro.mistadopt.inventory;

import java.util.List;
import java.util.Map;

/**
 * Raw tabular inventory as read from disk, before validation.
 *
 * @param columns header names in file order
 * @param rows one map per row keyed by header name, in file order
 */
public record InventoryTable(List<String> columns, List<Map<String, String>> rows) {
  public InventoryTable {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
  }
}
