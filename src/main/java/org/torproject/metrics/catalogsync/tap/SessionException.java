/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/** Login or logout was refused by the remote service. */
public class SessionException extends CatalogServiceException {

  public SessionException(String msg) {
    super(msg);
  }

  public SessionException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
