/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered list of record columns shared by the downloader, which selects
 * them remotely, and the store, which writes them locally.
 */
public final class SchemaDescriptor {

  /** Classpath resource listing the Gaia DR2 {@code gaia_source} columns. */
  public static final String GAIA_DR2_SOURCE = "gaiadr2.gaia_source.columns";

  private final String name;

  private final List<String> columns;

  private final String idColumn;

  /**
   * Creates a descriptor.
   *
   * @throws IllegalArgumentException if columns repeat or the identifier
   *     column is not one of them.
   */
  public SchemaDescriptor(String name, List<String> columns,
      String idColumn) {
    if (new LinkedHashSet<>(columns).size() != columns.size()) {
      throw new IllegalArgumentException("Duplicate columns in schema "
          + name + ".");
    }
    if (!columns.contains(idColumn)) {
      throw new IllegalArgumentException("Schema " + name
          + " lacks identifier column " + idColumn + ".");
    }
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.idColumn = idColumn;
  }

  /**
   * Reads a descriptor from a classpath resource with one column name per
   * line; blank lines and lines starting with {@code #} are ignored.
   */
  public static SchemaDescriptor fromResource(String resource,
      String idColumn) throws IOException {
    InputStream stream = SchemaDescriptor.class.getClassLoader()
        .getResourceAsStream(resource);
    if (null == stream) {
      throw new IOException("Schema resource " + resource + " not found.");
    }
    List<String> columns = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(new InputStreamReader(stream,
        StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        line = line.trim();
        if (!line.isEmpty() && !line.startsWith("#")) {
          columns.add(line);
        }
      }
    }
    return new SchemaDescriptor(resource, columns, idColumn);
  }

  public String getName() {
    return this.name;
  }

  public List<String> getColumns() {
    return this.columns;
  }

  public String getIdColumn() {
    return this.idColumn;
  }

  public int indexOfId() {
    return this.columns.indexOf(this.idColumn);
  }
}
