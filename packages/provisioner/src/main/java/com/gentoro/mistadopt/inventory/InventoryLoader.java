package com.gentoro.mistadopt.inventory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.mistadopt.exception.InventoryException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the device inventory from a CSV file with a header row.
 *
 * <p>Required columns are {@code org_id, site_id, ip, user_id, password}; other columns are kept in
 * the raw table but ignored for provisioning. When several rows share an {@code ip} the last one
 * wins.
 */
public class InventoryLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(InventoryLoader.class);

  public static final List<String> REQUIRED_COLUMNS =
      List.of("org_id", "site_id", "ip", "user_id", "password");

  private final CsvMapper mapper;

  public InventoryLoader() {
    this.mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  /** Read and validate the inventory in one step. */
  public List<DeviceRecord> load(Path file) {
    return toDevices(read(file));
  }

  /** Read the raw table without validating it. */
  public InventoryTable read(Path file) {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<Map<String, String>> rows = new ArrayList<>();
    List<String> columns = new ArrayList<>();

    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> it =
            mapper
                .readerFor(new TypeReference<Map<String, String>>() {})
                .with(schema)
                .readValues(reader)) {
      while (it.hasNextValue()) {
        Map<String, String> raw = it.nextValue();
        Map<String, String> row = new LinkedHashMap<>();
        raw.forEach((k, v) -> row.put(normalizeColumn(k), v == null ? "" : v.trim()));
        rows.add(row);
      }
      if (it.getParserSchema() instanceof CsvSchema parsed) {
        for (CsvSchema.Column column : parsed) {
          columns.add(normalizeColumn(column.getName()));
        }
      }
    } catch (NoSuchFileException e) {
      throw new InventoryException("Cannot open inventory file '%s'".formatted(file), e);
    } catch (IOException | RuntimeException e) {
      throw new InventoryException(
          "Failed to read inventory file '%s': %s".formatted(file, e.getMessage()), e);
    }

    if (columns.isEmpty() && !rows.isEmpty()) {
      columns.addAll(rows.get(0).keySet());
    }
    log.debug("Read {} inventory rows with columns {} from {}", rows.size(), columns, file);
    return new InventoryTable(columns, rows);
  }

  /**
   * Validate the raw table and build the device records in file order.
   *
   * @throws InventoryException when a required column is missing or any row is incomplete
   */
  public List<DeviceRecord> toDevices(InventoryTable table) {
    List<String> missing =
        REQUIRED_COLUMNS.stream().filter(c -> !table.columns().contains(c)).toList();
    if (!missing.isEmpty()) {
      throw new InventoryException(
          "Invalid inventory format. Required fields: %s (missing: %s)"
              .formatted(String.join(", ", REQUIRED_COLUMNS), String.join(", ", missing)));
    }

    // keyed by ip; a later duplicate replaces the earlier row and takes its own position
    Map<String, DeviceRecord> byIp = new LinkedHashMap<>();
    int line = 1;
    for (Map<String, String> row : table.rows()) {
      line++;
      DeviceRecord device;
      try {
        device =
            new DeviceRecord(
                row.get("org_id"),
                row.get("site_id"),
                row.get("ip"),
                row.get("user_id"),
                row.get("password"));
      } catch (InventoryException e) {
        throw new InventoryException("Inventory row %d: %s".formatted(line, e.getMessage()), e);
      }
      if (byIp.remove(device.ip()) != null) {
        log.warn("Duplicate inventory entry for {}; keeping the last one", device.ip());
      }
      byIp.put(device.ip(), device);
    }

    if (byIp.isEmpty()) {
      throw new InventoryException("Inventory contains no devices");
    }
    return List.copyOf(byIp.values());
  }

  private static String normalizeColumn(String name) {
    return name == null ? "" : name.trim().toLowerCase();
  }
}
