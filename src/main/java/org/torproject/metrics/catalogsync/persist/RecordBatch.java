/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Downloaded records with values in schema column order.
 */
public final class RecordBatch {

  private final SchemaDescriptor schema;

  private final List<Object[]> rows;

  private final SortedSet<Long> ids = new TreeSet<>();

  /**
   * Projects rows with the given column names onto the schema. Rows whose
   * columns are already the schema columns are taken over as they are.
   *
   * @throws IllegalArgumentException if a schema column is missing from
   *     {@code columns} or a row has no numeric identifier.
   */
  public static RecordBatch project(SchemaDescriptor schema,
      List<String> columns, List<Object[]> rows) {
    if (schema.getColumns().equals(columns)) {
      return new RecordBatch(schema, rows);
    }
    int[] positions = new int[schema.getColumns().size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = columns.indexOf(schema.getColumns().get(i));
      if (positions[i] < 0) {
        throw new IllegalArgumentException("Column "
            + schema.getColumns().get(i) + " missing from result.");
      }
    }
    List<Object[]> projected = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Object[] values = new Object[positions.length];
      for (int i = 0; i < positions.length; i++) {
        values[i] = row[positions[i]];
      }
      projected.add(values);
    }
    return new RecordBatch(schema, projected);
  }

  RecordBatch(SchemaDescriptor schema, List<Object[]> rows) {
    int idIndex = schema.indexOfId();
    for (Object[] row : rows) {
      Object id = row[idIndex];
      if (!(id instanceof Long)) {
        throw new IllegalArgumentException("Record without numeric "
            + schema.getIdColumn() + ": " + id);
      }
      this.ids.add((Long) id);
    }
    this.schema = schema;
    this.rows = Collections.unmodifiableList(rows);
  }

  public SchemaDescriptor getSchema() {
    return this.schema;
  }

  public List<Object[]> getRows() {
    return this.rows;
  }

  /** Distinct record identifiers of this batch. */
  public SortedSet<Long> getIds() {
    return Collections.unmodifiableSortedSet(this.ids);
  }

  public int size() {
    return this.rows.size();
  }
}
