/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.session;

public enum SessionState {
  LOGGED_OUT,
  LOGGED_IN
}
