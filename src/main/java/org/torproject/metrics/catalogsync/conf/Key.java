/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.conf;

import java.net.URL;
import java.nio.file.Path;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type and, for connection targets and secrets, the
 * environment variable that overrides the configured value.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  TapUrl(URL.class),
  TapUser(String.class, "GAIA_USERNAME"),
  TapPassword(String.class, "GAIA_PASSWORD"),
  TapConnectTimeoutMillis(Integer.class),
  TapReadTimeoutMillis(Integer.class),
  TapJobPollMillis(Long.class),
  TapJobTimeoutMinutes(Long.class),
  RemoteTable(String.class),
  PartitionSize(Integer.class),
  ExtraSize(Double.class),
  InlineExclusionWarnLimit(Integer.class),
  DbUrl(String.class, "DB_URL"),
  DbUser(String.class, "POSTGRES_USER"),
  DbPassword(String.class, "POSTGRES_PASSWORD"),
  DbInitialize(Boolean.class),
  RegionsTable(String.class),
  RecordsTable(String.class),
  InsertChunkSize(Integer.class),
  CatalogueFile(Path.class),
  Regions(String[].class),
  SyncThreads(Integer.class),
  RegionRetries(Integer.class),
  RetryBackoffMillis(Long.class);

  private Class clazz;
  private String environmentVariable;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this(clazz, null);
  }

  Key(Class clazz, String environmentVariable) {
    this.clazz = clazz;
    this.environmentVariable = environmentVariable;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Name of the overriding environment variable, or {@code null}. */
  public String environmentVariable() {
    return environmentVariable;
  }

}
