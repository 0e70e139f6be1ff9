/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.conf;

/**
 * Thrown when the configuration file cannot be read or a property is missing,
 * has the wrong type, or names something that does not exist, e.g. an unknown
 * region.
 */
public class ConfigurationException extends Exception {

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Throwable cause) {
    super(msg, cause);
  }

}
