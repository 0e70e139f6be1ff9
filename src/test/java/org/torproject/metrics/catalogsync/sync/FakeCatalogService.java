/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import org.torproject.metrics.catalogsync.query.SpatialQueryBuilder;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.tap.ArtifactCleanupException;
import org.torproject.metrics.catalogsync.tap.CatalogService;
import org.torproject.metrics.catalogsync.tap.CatalogServiceException;
import org.torproject.metrics.catalogsync.tap.RemoteServiceException;
import org.torproject.metrics.catalogsync.tap.ResultTable;
import org.torproject.metrics.catalogsync.tap.SessionException;
import org.torproject.metrics.catalogsync.tap.UploadTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Remote service holding records per region in memory and evaluating the
 * queries built by {@link SpatialQueryBuilder} well enough for tests.
 */
class FakeCatalogService implements CatalogService {

  static final List<String> COLUMNS = Collections.unmodifiableList(
      Arrays.asList("source_id", "ra", "dec", "phot_g_mean_mag"));

  private static final Pattern TOP = Pattern.compile("SELECT TOP (\\d+) ");

  private static final Pattern NOT_IN = Pattern.compile(
      "NOT IN \\(([0-9,]+)\\)");

  private final SpatialQueryBuilder builder;

  private final Map<String, SortedSet<Long>> catalog = new LinkedHashMap<>();

  private final Map<String, Deque<CatalogServiceException>> failures
      = new HashMap<>();

  private final Map<String, UploadTable> jobUploads = new HashMap<>();

  private final Map<String, String> jobQueries = new HashMap<>();

  final List<String> queries = new ArrayList<>();

  final List<String> submitted = new ArrayList<>();

  final List<String> deleted = new ArrayList<>();

  int logins;

  int logouts;

  boolean refuseLogin;

  boolean ignoreExclusion;

  CatalogServiceException failFetch;

  ArtifactCleanupException failDelete;

  private int jobCounter;

  FakeCatalogService(SpatialQueryBuilder builder) {
    this.builder = builder;
  }

  /** Adds the records with identifiers from first on to the region. */
  synchronized FakeCatalogService withRecords(Region region, long first,
      int count) {
    SortedSet<Long> ids = new TreeSet<>();
    for (long id = first; id < first + count; id++) {
      ids.add(id);
    }
    this.catalog.put(this.builder.containment(region), ids);
    return this;
  }

  /**
   * Lets the next queries of the region fail with the given exception,
   * {@code times} times.
   */
  synchronized void failRegion(Region region, CatalogServiceException cause,
      int times) {
    Deque<CatalogServiceException> queue = this.failures.computeIfAbsent(
        this.builder.containment(region), k -> new ArrayDeque<>());
    for (int i = 0; i < times; i++) {
      queue.add(cause);
    }
  }

  synchronized int openJobs() {
    return this.jobUploads.size();
  }

  @Override
  public synchronized void login(String user, String password)
      throws CatalogServiceException {
    this.logins++;
    if (this.refuseLogin) {
      throw new SessionException("Invalid credentials for " + user + ".");
    }
  }

  @Override
  public synchronized void logout() {
    this.logouts++;
  }

  @Override
  public synchronized ResultTable query(String adql)
      throws CatalogServiceException {
    if (adql.contains("tap_upload.")) {
      throw new RemoteServiceException("No table uploaded with the query.");
    }
    this.queries.add(adql);
    SortedSet<Long> excluded = new TreeSet<>();
    Matcher notIn = NOT_IN.matcher(adql);
    if (notIn.find()) {
      for (String id : notIn.group(1).split(",")) {
        excluded.add(Long.parseLong(id));
      }
    }
    return this.evaluate(adql, excluded);
  }

  @Override
  public synchronized String submitJob(String adql, UploadTable upload)
      throws CatalogServiceException {
    if (!adql.contains("tap_upload." + upload.getName() + " B")) {
      throw new RemoteServiceException("Query does not use the upload.");
    }
    String jobId = "job-" + ++this.jobCounter;
    this.queries.add(adql);
    this.submitted.add(jobId);
    this.jobUploads.put(jobId, upload);
    this.jobQueries.put(jobId, adql);
    return jobId;
  }

  @Override
  public synchronized ResultTable fetchJobResults(String jobId)
      throws CatalogServiceException {
    if (null != this.failFetch) {
      throw this.failFetch;
    }
    UploadTable upload = this.jobUploads.get(jobId);
    if (null == upload) {
      throw new RemoteServiceException("Unknown job " + jobId + ".");
    }
    return this.evaluate(this.jobQueries.get(jobId), upload.getIds());
  }

  @Override
  public synchronized void deleteJob(String jobId)
      throws ArtifactCleanupException {
    this.deleted.add(jobId);
    if (null != this.failDelete) {
      throw this.failDelete;
    }
    this.jobUploads.remove(jobId);
    this.jobQueries.remove(jobId);
  }

  private ResultTable evaluate(String adql, SortedSet<Long> excluded)
      throws CatalogServiceException {
    for (Map.Entry<String, SortedSet<Long>> entry
        : this.catalog.entrySet()) {
      if (!adql.contains(entry.getKey())) {
        continue;
      }
      Deque<CatalogServiceException> failing = this.failures.get(
          entry.getKey());
      if (null != failing && !failing.isEmpty()) {
        throw failing.poll();
      }
      int limit = Integer.MAX_VALUE;
      Matcher top = TOP.matcher(adql);
      if (top.find()) {
        limit = Integer.parseInt(top.group(1));
      }
      List<Object[]> rows = new ArrayList<>();
      for (Long id : entry.getValue()) {
        if (rows.size() >= limit) {
          break;
        }
        if (this.ignoreExclusion || !excluded.contains(id)) {
          rows.add(new Object[] { id, 56.75, 24.1, 11.0 + id % 7 });
        }
      }
      return new ResultTable(COLUMNS, rows);
    }
    return ResultTable.empty(COLUMNS);
  }
}
