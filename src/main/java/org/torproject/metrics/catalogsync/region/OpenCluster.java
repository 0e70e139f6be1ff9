/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import java.util.Collections;
import java.util.Map;

/**
 * Open cluster from the OPENCLUST catalogue, always circular.
 */
public class OpenCluster extends Region {

  static final String G1_CLASS = "g1_class";

  private final String g1Class;

  /**
   * Creates an open cluster.
   *
   * @param g1Class G1 classification flag, or {@code null} if unknown.
   */
  public OpenCluster(String name, double ra, double dec, double diameter,
      String g1Class) {
    super(name, ra, dec, new Circle(diameter));
    this.g1Class = g1Class;
  }

  public String getG1Class() {
    return this.g1Class;
  }

  @Override
  protected Map<String, String> collectProperties() {
    return null == this.g1Class ? Collections.emptyMap()
        : Collections.singletonMap(G1_CLASS, this.g1Class);
  }
}
