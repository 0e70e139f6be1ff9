/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

/** How the synchronization of one region ended. */
public enum RegionOutcome {

  /** New records were stored and the last partition was short or empty. */
  DONE(true),

  /** The first partition was empty although records were stored before. */
  NO_NEW_DATA(true),

  /** The remote source has no records at all for the region. */
  NO_DATA(true),

  /** A fetch or a write failed; earlier partitions stay stored. */
  FAILED(false),

  /** Stopped before completion on request. */
  CANCELLED(false);

  private final boolean completed;

  RegionOutcome(boolean completed) {
    this.completed = completed;
  }

  public boolean isCompleted() {
    return this.completed;
  }
}
