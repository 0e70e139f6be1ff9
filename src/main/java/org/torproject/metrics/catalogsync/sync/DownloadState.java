/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.sync;

/** States of a {@link PartitionedDownloader}. */
public enum DownloadState {
  IDLE,
  FETCHING,
  SAVED,
  EMPTY,
  FAILED,
  DONE
}
