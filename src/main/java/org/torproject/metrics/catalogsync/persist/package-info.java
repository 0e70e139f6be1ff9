/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

/** This package stores regions and their downloaded records.
 * <p>The only contract between downloader and store is the
 * {@code SchemaDescriptor}; {@code PostgresRecordStore} is the relational
 * implementation of {@code RecordStore}.</p>
 */
package org.torproject.metrics.catalogsync.persist;
