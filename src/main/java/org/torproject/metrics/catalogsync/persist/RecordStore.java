/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

import org.torproject.metrics.catalogsync.region.Region;

import java.util.SortedSet;

/**
 * Local store of regions and their records. All writes are idempotent, so
 * that a region can be synchronized again after any failure.
 */
public interface RecordStore {

  /**
   * Inserts the region, or updates its properties if a region with that name
   * exists, and returns its serial. Coordinates and shape are never changed.
   *
   * @throws StorageException if the store fails, or the stored region has
   *     different coordinates or shape.
   */
  int saveRegion(Region region) throws StorageException;

  /**
   * Inserts records of a region, silently skipping records whose identifier
   * is already stored for that region.
   *
   * @return Number of records actually inserted.
   */
  int saveRecords(int regionSerial, RecordBatch batch)
      throws StorageException;

  /** Returns the identifiers of all records committed for the region. */
  SortedSet<Long> getKnownRecordIds(Region region) throws StorageException;
}
