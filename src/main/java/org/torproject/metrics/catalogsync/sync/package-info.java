/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

/** Synchronization of regions with the remote catalog service.
 * <p>The central class is {@code SyncManager}, which runs a batch of regions
 * within one session. Each region gets an {@code ExclusionSet} of the
 * identifiers it already has and a {@code PartitionedDownloader} fetching
 * and storing the rest.</p>
 */
package org.torproject.metrics.catalogsync.sync;
