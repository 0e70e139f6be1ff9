/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/** A remote job, and with it its uploaded table, could not be deleted. */
public class ArtifactCleanupException extends CatalogServiceException {

  public ArtifactCleanupException(String msg) {
    super(msg);
  }

  public ArtifactCleanupException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
