/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import java.io.IOException;
import java.util.SortedMap;

/** Source of region definitions, keyed by region name. */
public interface RegionCatalogue {

  /**
   * Loads all regions of the catalogue.
   *
   * @return Regions by name, sorted by name.
   * @throws IOException Thrown if the catalogue cannot be read.
   */
  SortedMap<String, Region> load() throws IOException;
}
