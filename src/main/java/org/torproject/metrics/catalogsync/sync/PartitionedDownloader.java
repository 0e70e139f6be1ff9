/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import org.torproject.metrics.catalogsync.persist.RecordBatch;
import org.torproject.metrics.catalogsync.persist.RecordStore;
import org.torproject.metrics.catalogsync.persist.SchemaDescriptor;
import org.torproject.metrics.catalogsync.persist.StorageException;
import org.torproject.metrics.catalogsync.query.SpatialQueryBuilder;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.tap.CatalogServiceException;
import org.torproject.metrics.catalogsync.tap.RemoteServiceException;
import org.torproject.metrics.catalogsync.tap.ResultTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Downloads the records of one region in partitions of bounded size and
 * stores each partition before requesting the next one.
 *
 * <p>Every partition excludes all identifiers known at its start, so
 * partitions never overlap. A partition with fewer rows than the partition
 * size is the last one.</p>
 */
public class PartitionedDownloader {

  private static final Logger logger = LoggerFactory.getLogger(
      PartitionedDownloader.class);

  private final Region region;

  private final RecordStore store;

  private final SpatialQueryBuilder builder;

  private final SchemaDescriptor schema;

  private final int partitionSize;

  private final BooleanSupplier cancelled;

  private DownloadState state = DownloadState.IDLE;

  /**
   * Creates a downloader for one region.
   *
   * @param partitionSize Maximum rows per fetch, or
   *     {@link SpatialQueryBuilder#UNBOUNDED} for a single fetch.
   * @param cancelled Polled before each fetch; once true, no further fetch
   *     is issued.
   */
  public PartitionedDownloader(Region region, RecordStore store,
      SpatialQueryBuilder builder, SchemaDescriptor schema, int partitionSize,
      BooleanSupplier cancelled) {
    if (partitionSize < 1) {
      throw new IllegalArgumentException("Partition size must be at least 1, "
          + "but is " + partitionSize + ".");
    }
    this.region = region;
    this.store = store;
    this.builder = builder;
    this.schema = schema;
    this.partitionSize = partitionSize;
    this.cancelled = cancelled;
  }

  public DownloadState getState() {
    return this.state;
  }

  /**
   * Downloads and stores all records of the region not in the exclusion set,
   * growing the set with every stored partition.
   *
   * @return Counters and outcome; failures are reported there, not thrown.
   */
  public RegionResult download(ExclusionSet exclusion) {
    RegionResult result = new RegionResult(this.region.getName());
    boolean nothingKnown = exclusion.isEmpty();
    while (true) {
      if (this.cancelled.getAsBoolean()) {
        logger.info("Download of region {} cancelled after {} fetch(es).",
            this.region, result.getFetches());
        this.transition(DownloadState.DONE);
        result.finish(RegionOutcome.CANCELLED, null);
        return result;
      }
      this.transition(DownloadState.FETCHING);
      result.fetchStarted(exclusion.size());
      ResultTable table;
      RecordBatch batch;
      try {
        table = exclusion.query(this.builder, this.partitionSize);
        batch = this.toBatch(table);
      } catch (CatalogServiceException e) {
        return this.fail(result, e);
      }
      if (batch.size() == 0) {
        this.transition(DownloadState.EMPTY);
        if (result.getDownloaded() > 0) {
          result.finish(RegionOutcome.DONE, null);
        } else if (nothingKnown) {
          logger.warn("No data has been found in the remote source for "
              + "region {}.", this.region);
          result.finish(RegionOutcome.NO_DATA, null);
        } else {
          logger.info("No new data has been downloaded for region {}.",
              this.region);
          result.finish(RegionOutcome.NO_NEW_DATA, null);
        }
        return result;
      }
      logger.debug("Downloaded {} records for region {}.", batch.size(),
          this.region);
      int inserted;
      try {
        inserted = this.save(batch);
      } catch (StorageException e) {
        return this.fail(result, e);
      }
      int added = exclusion.absorb(batch.getIds());
      result.partitionSaved(batch.size(), inserted);
      this.transition(DownloadState.SAVED);
      if (batch.size() < this.partitionSize) {
        this.transition(DownloadState.DONE);
        result.finish(RegionOutcome.DONE, null);
        return result;
      }
      if (added == 0) {
        return this.fail(result, new RemoteServiceException("Full partition "
            + "for region " + this.region + " contained only known records; "
            + "the remote service ignores the exclusion."));
      }
    }
  }

  private RecordBatch toBatch(ResultTable table)
      throws RemoteServiceException {
    try {
      return RecordBatch.project(this.schema, table.getColumns(),
          table.getRows());
    } catch (IllegalArgumentException e) {
      throw new RemoteServiceException("Unusable result for region "
          + this.region + ": " + e.getMessage(), e);
    }
  }

  private int save(RecordBatch batch) throws StorageException {
    Integer serial = this.region.getSerial();
    if (null == serial) {
      serial = this.store.saveRegion(this.region);
      this.region.assignSerial(serial);
      logger.debug("Region {} saved with serial {}.", this.region, serial);
    }
    return this.store.saveRecords(serial, batch);
  }

  private RegionResult fail(RegionResult result, Exception cause) {
    this.transition(DownloadState.FAILED);
    result.finish(RegionOutcome.FAILED, cause);
    return result;
  }

  private void transition(DownloadState next) {
    logger.trace("Region {}: {} -> {}", this.region, this.state, next);
    this.state = next;
  }
}
