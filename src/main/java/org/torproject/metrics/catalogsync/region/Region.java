/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Named area on the sky whose catalog records are synchronized as a unit.
 *
 * <p>Regions are identified by name. The serial is assigned by the store
 * the first time the region is saved and never changes afterwards; it is
 * the anchor of all records belonging to the region.</p>
 */
public class Region {

  private final String name;

  private final double ra;

  private final double dec;

  private final Shape shape;

  private Integer serial;

  /**
   * Creates a region that has not been saved yet.
   *
   * @param name Unique name.
   * @param ra Right ascension (ICRS) in degrees.
   * @param dec Declination (ICRS) in degrees.
   * @param shape Angular extent.
   */
  public Region(String name, double ra, double dec, Shape shape) {
    if (null == name || name.trim().isEmpty()) {
      throw new IllegalArgumentException("A region needs a name.");
    }
    if (dec < -90.0 || dec > 90.0 || Double.isNaN(ra)) {
      throw new IllegalArgumentException("Invalid coordinates for region "
          + name + ": ra=" + ra + ", dec=" + dec);
    }
    this.name = name.trim();
    this.ra = ra;
    this.dec = dec;
    this.shape = Objects.requireNonNull(shape, "shape");
  }

  public String getName() {
    return this.name;
  }

  public double getRa() {
    return this.ra;
  }

  public double getDec() {
    return this.dec;
  }

  public Shape getShape() {
    return this.shape;
  }

  /** Returns the serial assigned by the store, or {@code null}. */
  public synchronized Integer getSerial() {
    return this.serial;
  }

  /**
   * Stamps the serial assigned by the store. Assigning the same serial again
   * is a no-op.
   *
   * @throws IllegalStateException if a different serial was assigned before.
   */
  public synchronized void assignSerial(int assigned) {
    if (null != this.serial && this.serial != assigned) {
      throw new IllegalStateException("Region " + this.name
          + " already has serial " + this.serial + ", refusing " + assigned
          + ".");
    }
    this.serial = assigned;
  }

  /**
   * Type-specific properties stored opaquely next to the region, keyed by
   * property name. Plain regions have none.
   */
  public SortedMap<String, String> getProperties() {
    return Collections.unmodifiableSortedMap(new TreeMap<>(
        this.collectProperties()));
  }

  /** Subclasses add their properties here. */
  protected Map<String, String> collectProperties() {
    return Collections.emptyMap();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Region
        && ((Region) other).name.equals(this.name);
  }

  @Override
  public int hashCode() {
    return this.name.hashCode();
  }

  @Override
  public String toString() {
    return this.name;
  }
}
