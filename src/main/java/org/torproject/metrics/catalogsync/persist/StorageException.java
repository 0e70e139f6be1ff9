/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

/**
 * The store is unreachable, or a write violated a constraint other than the
 * expected duplicate key, or stored data contradicts what is being saved.
 */
public class StorageException extends Exception {

  public StorageException(String msg) {
    super(msg);
  }

  public StorageException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
