/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.query;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Identifiers a query must not return, expressed either as an inline list
 * or as a reference to an uploaded table.
 */
public final class Exclusion {

  private final SortedSet<Long> inlineIds;

  private final String uploadTableName;

  private Exclusion(SortedSet<Long> inlineIds, String uploadTableName) {
    this.inlineIds = inlineIds;
    this.uploadTableName = uploadTableName;
  }

  /** Excludes the given identifiers with a {@code NOT IN} list. */
  public static Exclusion inline(SortedSet<Long> ids) {
    return new Exclusion(Collections.unmodifiableSortedSet(new TreeSet<>(ids)),
        null);
  }

  /** Excludes all identifiers of the named uploaded table by anti-join. */
  public static Exclusion uploadedTable(String tableName) {
    return new Exclusion(null, tableName);
  }

  public boolean isInline() {
    return null != this.inlineIds;
  }

  public SortedSet<Long> getInlineIds() {
    return this.inlineIds;
  }

  public String getUploadTableName() {
    return this.uploadTableName;
  }
}
