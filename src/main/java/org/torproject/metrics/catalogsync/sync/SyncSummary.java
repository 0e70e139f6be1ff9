/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Results of all regions of one synchronization batch. */
public class SyncSummary {

  private final List<RegionResult> results;

  SyncSummary(List<RegionResult> results) {
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
  }

  /** Region results, in processing order. */
  public List<RegionResult> getResults() {
    return this.results;
  }

  public int getCompleted() {
    int completed = 0;
    for (RegionResult result : this.results) {
      if (result.getOutcome().isCompleted()) {
        completed++;
      }
    }
    return completed;
  }

  public int getFailed() {
    return this.count(RegionOutcome.FAILED);
  }

  public int getCancelled() {
    return this.count(RegionOutcome.CANCELLED);
  }

  private int count(RegionOutcome outcome) {
    int count = 0;
    for (RegionResult result : this.results) {
      if (result.getOutcome() == outcome) {
        count++;
      }
    }
    return count;
  }

  public long getInserted() {
    long inserted = 0L;
    for (RegionResult result : this.results) {
      inserted += result.getInserted();
    }
    return inserted;
  }

  @Override
  public String toString() {
    return this.results.size() + " region(s): " + this.getCompleted()
        + " completed, " + this.getFailed() + " failed, "
        + this.getCancelled() + " cancelled; " + this.getInserted()
        + " records inserted";
  }
}
