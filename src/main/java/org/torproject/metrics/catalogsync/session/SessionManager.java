/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.session;

import org.torproject.metrics.catalogsync.tap.CatalogService;
import org.torproject.metrics.catalogsync.tap.CatalogServiceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the optional authenticated session with the remote service for one
 * synchronization batch.
 *
 * <p>Without credentials, or when login fails, the batch runs anonymously.
 * Every successful login is followed by at most one logout, so a manager can
 * serve one batch after another.</p>
 */
public class SessionManager {

  private static final Logger logger = LoggerFactory.getLogger(
      SessionManager.class);

  private final CatalogService service;

  private final String user;

  private final String password;

  private final Lock artifactLock = new ReentrantLock();

  private SessionState state = SessionState.LOGGED_OUT;

  /**
   * Creates a session manager.
   *
   * @param user User name, or {@code null} for anonymous mode.
   * @param password Password, or {@code null} for anonymous mode.
   */
  public SessionManager(CatalogService service, String user,
      String password) {
    this.service = service;
    this.user = user;
    this.password = password;
  }

  /**
   * Logs in, if credentials are present. Never fails: a refused or failed
   * login is logged and leaves the session anonymous.
   *
   * @return The resulting state.
   */
  public synchronized SessionState login() {
    if (this.state == SessionState.LOGGED_IN) {
      return this.state;
    }
    if (null == this.user || null == this.password) {
      logger.info("No credentials configured, running anonymously. Known "
          + "records will be excluded by inline identifier lists.");
      return this.state;
    }
    try {
      logger.info("Logging in to the remote service as {} ...", this.user);
      this.service.login(this.user, this.password);
      this.state = SessionState.LOGGED_IN;
      logger.info("Logged in as {}.", this.user);
    } catch (CatalogServiceException | RuntimeException e) {
      logger.error("Unable to log in as {}, continuing anonymously. Cause: {}",
          this.user, e.getMessage(), e);
    }
    return this.state;
  }

  /**
   * Logs out, if logged in. Failures are logged.
   */
  public synchronized void logout() {
    if (this.state != SessionState.LOGGED_IN) {
      return;
    }
    this.state = SessionState.LOGGED_OUT;
    try {
      this.service.logout();
      logger.info("Logged out from the remote service.");
    } catch (CatalogServiceException | RuntimeException e) {
      logger.error("An error occurred while logging out. Cause: {}",
          e.getMessage(), e);
    }
  }

  public synchronized SessionState getState() {
    return this.state;
  }

  public synchronized boolean isAuthenticated() {
    return this.state == SessionState.LOGGED_IN;
  }

  /**
   * Lock serializing the create, use and delete sequence of uploaded tables
   * among all regions sharing this session.
   */
  public Lock artifactLock() {
    return this.artifactLock;
  }
}
