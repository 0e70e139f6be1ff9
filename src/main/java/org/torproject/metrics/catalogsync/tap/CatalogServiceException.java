/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/** Base class of all failures talking to the remote catalog service. */
public abstract class CatalogServiceException extends Exception {

  protected CatalogServiceException(String msg) {
    super(msg);
  }

  protected CatalogServiceException(String msg, Throwable cause) {
    super(msg, cause);
  }

  /**
   * Whether running the same request again later may succeed without any
   * change on our side.
   */
  public boolean isTransient() {
    return false;
  }
}
