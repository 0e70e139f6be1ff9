/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

import org.torproject.metrics.catalogsync.persist.RecordStore;
import org.torproject.metrics.catalogsync.persist.StorageException;
import org.torproject.metrics.catalogsync.query.Exclusion;
import org.torproject.metrics.catalogsync.query.SpatialQueryBuilder;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.session.SessionManager;
import org.torproject.metrics.catalogsync.tap.ArtifactCleanupException;
import org.torproject.metrics.catalogsync.tap.CatalogService;
import org.torproject.metrics.catalogsync.tap.CatalogServiceException;
import org.torproject.metrics.catalogsync.tap.ResultTable;
import org.torproject.metrics.catalogsync.tap.UploadTable;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;

/**
 * Identifiers of one region that are known during one synchronization run,
 * either stored before the run or downloaded in it, and the way they are
 * excluded from remote queries.
 *
 * <p>With an authenticated session and at least one known identifier, the
 * identifiers are uploaded as a table named after the MD5 digest of the
 * region name and anti-joined. The job carrying the upload is deleted right
 * after its results are fetched, or after fetching failed. Otherwise they are
 * listed inline in a {@code NOT IN} predicate, which works without a session
 * but gets slow, or even rejected, for large sets.</p>
 */
public class ExclusionSet {

  private static final Logger logger = LoggerFactory.getLogger(
      ExclusionSet.class);

  static final String ARTIFACT_PREFIX = "catalogsync_";

  private final Region region;

  private final SortedSet<Long> ids;

  private final String idColumn;

  private final CatalogService service;

  private final SessionManager session;

  private final int inlineWarnLimit;

  ExclusionSet(Region region, SortedSet<Long> known, String idColumn,
      CatalogService service, SessionManager session, int inlineWarnLimit) {
    this.region = region;
    this.ids = new TreeSet<>(known);
    this.idColumn = idColumn;
    this.service = service;
    this.session = session;
    this.inlineWarnLimit = inlineWarnLimit;
  }

  /**
   * Creates the exclusion set of a region from the identifiers already
   * stored for it.
   *
   * @throws StorageException if the store cannot be read.
   */
  public static ExclusionSet load(RecordStore store, Region region,
      String idColumn, CatalogService service, SessionManager session,
      int inlineWarnLimit) throws StorageException {
    SortedSet<Long> known = store.getKnownRecordIds(region);
    return new ExclusionSet(region, known, idColumn, service, session,
        inlineWarnLimit);
  }

  public int size() {
    return this.ids.size();
  }

  public boolean isEmpty() {
    return this.ids.isEmpty();
  }

  public boolean contains(long id) {
    return this.ids.contains(id);
  }

  /**
   * Adds newly downloaded identifiers.
   *
   * @return Number of identifiers that were not known before.
   */
  public int absorb(Collection<Long> downloaded) {
    int before = this.ids.size();
    this.ids.addAll(downloaded);
    return this.ids.size() - before;
  }

  /** Name of the uploaded table, stable across runs for the region. */
  public String artifactName() {
    return ARTIFACT_PREFIX + DigestUtils.md5Hex(
        this.region.getName().getBytes(StandardCharsets.UTF_8));
  }

  /** Whether the next query uploads the identifiers as a table. */
  public boolean usesArtifact() {
    return !this.ids.isEmpty() && this.session.isAuthenticated();
  }

  /**
   * Queries the region, leaving out all known identifiers.
   *
   * @param builder Builds the spatial query.
   * @param limit Maximum number of rows.
   */
  public ResultTable query(SpatialQueryBuilder builder, int limit)
      throws CatalogServiceException {
    if (!this.usesArtifact()) {
      Exclusion exclusion = null;
      if (!this.ids.isEmpty()) {
        if (this.ids.size() > this.inlineWarnLimit) {
          logger.warn("Excluding {} known records of region {} by inline "
              + "list; queries this large are slow and may be rejected. "
              + "Configure credentials to upload them instead.",
              this.ids.size(), this.region);
        }
        exclusion = Exclusion.inline(this.ids);
      }
      return this.service.query(builder.build(this.region, limit, exclusion));
    }
    UploadTable upload = new UploadTable(this.artifactName(), this.idColumn,
        this.ids);
    String adql = builder.build(this.region, limit,
        Exclusion.uploadedTable(upload.getName()));
    Lock lock = this.session.artifactLock();
    lock.lock();
    try {
      String jobId = this.service.submitJob(adql, upload);
      try {
        return this.service.fetchJobResults(jobId);
      } finally {
        this.release(jobId);
      }
    } finally {
      lock.unlock();
    }
  }

  private void release(String jobId) {
    try {
      this.service.deleteJob(jobId);
    } catch (ArtifactCleanupException | RuntimeException e) {
      logger.error("Error removing job {} and its table {} from the remote "
          + "service. Cause: {}", jobId, this.artifactName(), e.getMessage(),
          e);
    }
  }
}
