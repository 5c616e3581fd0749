package com.mk.fx.qa.dbstress.catalog;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.List;
import java.util.Map;

/**
 * What the engine reports about one provisioned schema: its tables, the row count per table and
 * the space its segments take. {@code error} is set when the engine could only partly inspect the
 * schema.
 */
public record EntityInfo(
    EntityKey id,
    boolean exists,
    List<TableStats> tables,
    Map<String, Long> rowCounts,
    double totalSizeMb,
    String error) {

  /** Optimizer statistics of one table as last gathered by the database. */
  public record TableStats(String name, long rows, long blocks, long avgRowLength) {}

  public EntityInfo {
    tables = tables == null ? List.of() : List.copyOf(tables);
    rowCounts = rowCounts == null ? Map.of() : Map.copyOf(rowCounts);
  }

  public static EntityInfo missing(EntityKey id) {
    return new EntityInfo(id, false, List.of(), Map.of(), 0, null);
  }

  public long totalRows() {
    return rowCounts.values().stream().mapToLong(Long::longValue).sum();
  }
}
