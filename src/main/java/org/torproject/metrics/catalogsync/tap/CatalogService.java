/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/**
 * Remote catalog service accepting ADQL queries.
 *
 * <p>Queries with an uploaded table run as jobs that stay on the server,
 * together with the uploaded table, until deleted. Callers must delete every
 * job they submitted, whether fetching its results worked or not.</p>
 */
public interface CatalogService {

  /**
   * Opens an authenticated session; later requests run within it.
   *
   * @throws SessionException if the credentials are rejected.
   */
  void login(String user, String password) throws CatalogServiceException;

  /** Closes the authenticated session. */
  void logout() throws CatalogServiceException;

  /** Runs a query synchronously and returns its result. */
  ResultTable query(String adql) throws CatalogServiceException;

  /**
   * Submits a query job with an uploaded table and starts it.
   *
   * @return The job identifier, needed to fetch results and delete the job.
   */
  String submitJob(String adql, UploadTable upload)
      throws CatalogServiceException;

  /** Waits for the job to finish and returns its result. */
  ResultTable fetchJobResults(String jobId) throws CatalogServiceException;

  /**
   * Deletes the job and the table uploaded with it.
   *
   * @throws ArtifactCleanupException if the job could not be deleted.
   */
  void deleteJob(String jobId) throws ArtifactCleanupException;
}
