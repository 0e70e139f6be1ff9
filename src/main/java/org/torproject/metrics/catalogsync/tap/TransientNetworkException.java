/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

/**
 * Network failure or timeout while talking to the remote service. The request
 * is not retried by the client itself.
 */
public class TransientNetworkException extends CatalogServiceException {

  public TransientNetworkException(String msg, Throwable cause) {
    super(msg, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
