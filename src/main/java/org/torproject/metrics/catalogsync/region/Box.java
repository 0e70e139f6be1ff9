/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import java.util.Objects;

/** Rectangular region aligned with the equatorial axes. */
public final class Box extends Shape {

  private final double width;

  private final double height;

  /**
   * Creates a box.
   *
   * @param width Extent in right ascension, in arcminutes.
   * @param height Extent in declination, in arcminutes.
   */
  public Box(double width, double height) {
    this.width = checkSize("width", width);
    this.height = checkSize("height", height);
  }

  public double getWidth() {
    return this.width;
  }

  public double getHeight() {
    return this.height;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitBox(this);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Box)) {
      return false;
    }
    Box box = (Box) other;
    return Double.compare(box.width, this.width) == 0
        && Double.compare(box.height, this.height) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.width, this.height);
  }

  @Override
  public String toString() {
    return "Box[width=" + this.width + "', height=" + this.height + "']";
  }
}
