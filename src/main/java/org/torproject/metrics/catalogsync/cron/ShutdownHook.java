/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.cron;

import org.torproject.metrics.catalogsync.sync.SyncManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancels a running synchronization on JVM shutdown and waits a grace period
 * for it to remove remote artifacts and log out.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final SyncManager syncManager;

  private final long gracePeriodMinutes;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(SyncManager syncManager, long gracePeriodMinutes) {
    super("CatalogSync-ShutdownThread");
    this.syncManager = syncManager;
    this.gracePeriodMinutes = gracePeriodMinutes;
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    this.syncManager.cancel();
    try {
      logger.info("Waiting at most {} minutes for the running "
          + "synchronization to finish ... ", this.gracePeriodMinutes);
      if (this.syncManager.awaitCompletion(this.gracePeriodMinutes)) {
        logger.info("Shutdown finished. Exiting.");
      } else {
        logger.error("Synchronization did not finish within {} minutes; "
            + "remote artifacts may be left behind.", this.gracePeriodMinutes);
      }
    } catch (InterruptedException e) {
      logger.error("Interrupted while waiting for synchronization to "
          + "finish.", e);
    }
  }
}
