/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import org.torproject.metrics.catalogsync.conf.Configuration;
import org.torproject.metrics.catalogsync.conf.ConfigurationException;
import org.torproject.metrics.catalogsync.conf.Key;
import org.torproject.metrics.catalogsync.persist.RecordStore;
import org.torproject.metrics.catalogsync.persist.SchemaDescriptor;
import org.torproject.metrics.catalogsync.query.SpatialQueryBuilder;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.session.SessionManager;
import org.torproject.metrics.catalogsync.tap.CatalogService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Synchronizes a batch of regions with the remote catalog service.
 *
 * <p>Regions are processed in name order, on a pool of {@code SyncThreads}
 * workers, within one optional authenticated session. A failing region is
 * logged and recorded in the summary, and the batch continues with the next
 * one.</p>
 */
public class SyncManager implements ThreadFactory {

  private static final Logger logger = LoggerFactory.getLogger(
      SyncManager.class);

  private final RecordStore store;

  private final CatalogService service;

  private final SchemaDescriptor schema;

  private final SessionManager session;

  private final SpatialQueryBuilder builder;

  private final int partitionSize;

  private final int threads;

  private final int retries;

  private final long backoffMillis;

  private final int inlineWarnLimit;

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  private volatile CountDownLatch finished = new CountDownLatch(0);

  private final ThreadFactory defaultThreads
      = Executors.defaultThreadFactory();

  private final AtomicInteger currentThreadNo = new AtomicInteger();

  /**
   * Creates a manager reading its settings from the given configuration.
   *
   * @throws ConfigurationException if a setting is missing or invalid.
   */
  public SyncManager(Configuration conf, RecordStore store,
      CatalogService service, SchemaDescriptor schema)
      throws ConfigurationException {
    this.store = store;
    this.service = service;
    this.schema = schema;
    this.partitionSize = conf.getInt(Key.PartitionSize);
    if (this.partitionSize < 1) {
      throw new ConfigurationException("PartitionSize must be positive or "
          + "inf, but is " + this.partitionSize + ".");
    }
    this.threads = Math.max(1, intOrDefault(conf, Key.SyncThreads, 1));
    this.retries = Math.max(0, intOrDefault(conf, Key.RegionRetries, 0));
    this.backoffMillis = isSet(conf, Key.RetryBackoffMillis)
        ? conf.getLong(Key.RetryBackoffMillis) : 1000L;
    this.inlineWarnLimit = intOrDefault(conf, Key.InlineExclusionWarnLimit,
        Integer.MAX_VALUE);
    double extraSize = isSet(conf, Key.ExtraSize)
        ? conf.getDouble(Key.ExtraSize) : 1.0;
    String remoteTable = conf.getString(Key.RemoteTable);
    if (null == remoteTable) {
      throw new ConfigurationException("Missing property RemoteTable.");
    }
    this.builder = new SpatialQueryBuilder(remoteTable, schema, extraSize);
    this.session = new SessionManager(service, conf.getString(Key.TapUser),
        conf.getString(Key.TapPassword));
  }

  private static int intOrDefault(Configuration conf, Key key, int def)
      throws ConfigurationException {
    return isSet(conf, key) ? conf.getInt(key) : def;
  }

  private static boolean isSet(Configuration conf, Key key) {
    String value = conf.getProperty(key.name());
    return null != value && !value.trim().isEmpty();
  }

  public SessionManager getSession() {
    return this.session;
  }

  /**
   * Synchronizes all given regions and returns when all are done, failed,
   * or cancelled. Never throws because of a single region.
   */
  public SyncSummary run(Collection<? extends Region> regions) {
    List<Region> ordered = new ArrayList<>(regions);
    ordered.sort(Comparator.comparing(Region::getName));
    List<RegionResult> results = new ArrayList<>();
    final CountDownLatch batchFinished = new CountDownLatch(1);
    this.finished = batchFinished;
    ExecutorService pool = Executors.newFixedThreadPool(this.threads, this);
    try {
      this.session.login();
      logger.info("Synchronizing {} region(s) using {} thread(s).",
          ordered.size(), this.threads);
      List<Future<RegionResult>> futures = new ArrayList<>();
      for (int i = 0; i < ordered.size(); i++) {
        futures.add(pool.submit(this.task(ordered.get(i), i + 1,
            ordered.size())));
      }
      for (int i = 0; i < futures.size(); i++) {
        results.add(this.collect(ordered.get(i), futures.get(i)));
      }
    } finally {
      pool.shutdownNow();
      this.session.logout();
      batchFinished.countDown();
    }
    SyncSummary summary = new SyncSummary(results);
    logger.info("Synchronization finished: {}.", summary);
    return summary;
  }

  private Callable<RegionResult> task(final Region region, final int number,
      final int total) {
    return new Callable<RegionResult>() {
      @Override
      public RegionResult call() {
        RegionResult result = synchronizeWithRetries(region);
        if (result.getOutcome().isCompleted()) {
          logger.info("({}/{}) {}", number, total, result);
        } else {
          logger.warn("({}/{}) {}", number, total, result);
        }
        return result;
      }
    };
  }

  private RegionResult collect(Region region, Future<RegionResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      this.cancel();
      return RegionResult.failed(region.getName(), e);
    } catch (ExecutionException e) {
      return RegionResult.failed(region.getName(), e.getCause());
    }
  }

  private RegionResult synchronizeWithRetries(Region region) {
    int attempt = 1;
    while (true) {
      RegionResult result = this.synchronize(region);
      result.setAttempts(attempt);
      if (!result.isTransientFailure() || attempt > this.retries
          || this.cancelled.get()) {
        return result;
      }
      long wait = this.backoffMillis << Math.min(attempt - 1, 20);
      logger.info("Region {} failed transiently ({}), retrying in {} ms.",
          region, result.getCause().getMessage(), wait);
      try {
        this.sleep(wait);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return result;
      }
      attempt++;
    }
  }

  /** Synchronizes a single region, reporting every failure in the result. */
  RegionResult synchronize(Region region) {
    if (this.cancelled.get()) {
      RegionResult result = new RegionResult(region.getName());
      result.finish(RegionOutcome.CANCELLED, null);
      return result;
    }
    try {
      logger.debug("Synchronizing region {} ...", region);
      ExclusionSet exclusion = ExclusionSet.load(this.store, region,
          this.schema.getIdColumn(), this.service, this.session,
          this.inlineWarnLimit);
      PartitionedDownloader downloader = new PartitionedDownloader(region,
          this.store, this.builder, this.schema, this.partitionSize,
          this.cancelled::get);
      RegionResult result = downloader.download(exclusion);
      if (RegionOutcome.FAILED == result.getOutcome()) {
        logger.error("Unable to synchronize region {}. Cause: {}", region,
            result.getCause().getMessage(), result.getCause());
      }
      return result;
    } catch (Throwable th) { // Catching all to continue with other regions.
      logger.error("Unable to synchronize region {}. Cause: {}", region,
          th.getMessage(), th);
      return RegionResult.failed(region.getName(), th);
    }
  }

  protected void sleep(long millis) throws InterruptedException {
    Thread.sleep(millis);
  }

  /**
   * Stops issuing new fetches and starting new regions. Running fetches
   * complete and their artifacts are removed.
   */
  public void cancel() {
    if (!this.cancelled.getAndSet(true)) {
      logger.info("Synchronization cancelled.");
    }
  }

  public boolean isCancelled() {
    return this.cancelled.get();
  }

  /**
   * Waits until the batch started last has finished. Returns at once if no
   * batch was started.
   *
   * @return Whether the batch finished in time.
   */
  public boolean awaitCompletion(long minutes) throws InterruptedException {
    return this.finished.await(minutes, TimeUnit.MINUTES);
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = this.defaultThreads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("CatalogSync-Worker-"
        + this.currentThreadNo.incrementAndGet());
    logger.debug("New Thread created: {}", newThread.getName());
    return newThread;
  }
}
