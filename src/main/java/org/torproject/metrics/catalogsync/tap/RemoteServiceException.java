/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/**
 * The remote service rejected a request (malformed query, quota exceeded,
 * failed job) or answered with something that cannot be understood.
 */
public class RemoteServiceException extends CatalogServiceException {

  private final int responseCode;

  public RemoteServiceException(String msg) {
    this(msg, -1);
  }

  public RemoteServiceException(String msg, int responseCode) {
    super(msg);
    this.responseCode = responseCode;
  }

  public RemoteServiceException(String msg, Throwable cause) {
    super(msg, cause);
    this.responseCode = -1;
  }

  /** HTTP response code, or -1 if the failure was not an HTTP error. */
  public int getResponseCode() {
    return this.responseCode;
  }
}
