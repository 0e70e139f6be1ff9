/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import org.torproject.metrics.catalogsync.tap.CatalogServiceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Counters and outcome of synchronizing one region. */
public class RegionResult {

  private final String regionName;

  private final List<Integer> exclusionSizes = new ArrayList<>();

  private long downloaded;

  private long inserted;

  private int attempts = 1;

  private RegionOutcome outcome;

  private Throwable cause;

  RegionResult(String regionName) {
    this.regionName = regionName;
  }

  static RegionResult failed(String regionName, Throwable cause) {
    RegionResult result = new RegionResult(regionName);
    result.finish(RegionOutcome.FAILED, cause);
    return result;
  }

  void fetchStarted(int exclusionSize) {
    this.exclusionSizes.add(exclusionSize);
  }

  void partitionSaved(int rows, int insertedRows) {
    this.downloaded += rows;
    this.inserted += insertedRows;
  }

  void finish(RegionOutcome regionOutcome, Throwable failure) {
    this.outcome = regionOutcome;
    this.cause = failure;
  }

  void setAttempts(int attempts) {
    this.attempts = attempts;
  }

  public String getRegionName() {
    return this.regionName;
  }

  public RegionOutcome getOutcome() {
    return this.outcome;
  }

  /** Failure ending the region, or {@code null}. */
  public Throwable getCause() {
    return this.cause;
  }

  /** Whether the failure may go away when the region is synchronized again. */
  public boolean isTransientFailure() {
    return this.cause instanceof CatalogServiceException
        && ((CatalogServiceException) this.cause).isTransient();
  }

  public int getFetches() {
    return this.exclusionSizes.size();
  }

  /** Sizes of the exclusion set at the start of each fetch, in order. */
  public List<Integer> getExclusionSizes() {
    return Collections.unmodifiableList(this.exclusionSizes);
  }

  public long getDownloaded() {
    return this.downloaded;
  }

  public long getInserted() {
    return this.inserted;
  }

  /** Downloaded records that were already stored. */
  public long getSkipped() {
    return this.downloaded - this.inserted;
  }

  public int getAttempts() {
    return this.attempts;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(this.regionName).append(": ").append(this.outcome)
        .append(", ").append(this.getFetches()).append(" fetch(es), ")
        .append(this.downloaded).append(" downloaded, ")
        .append(this.inserted).append(" inserted, ")
        .append(this.getSkipped()).append(" skipped as duplicates");
    if (this.attempts > 1) {
      sb.append(", ").append(this.attempts).append(" attempts");
    }
    if (null != this.cause) {
      sb.append(", cause: ").append(this.cause.getMessage());
    }
    return sb.toString();
  }
}
