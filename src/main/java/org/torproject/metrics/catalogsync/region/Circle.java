/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import java.util.Objects;

/** Circular region given by its apparent diameter. */
public final class Circle extends Shape {

  private final double diameter;

  /**
   * Creates a circle.
   *
   * @param diameter Diameter in arcminutes, strictly positive.
   */
  public Circle(double diameter) {
    this.diameter = checkSize("diameter", diameter);
  }

  /** Diameter in arcminutes. */
  public double getDiameter() {
    return this.diameter;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitCircle(this);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Circle
        && Double.compare(((Circle) other).diameter, this.diameter) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.diameter);
  }

  @Override
  public String toString() {
    return "Circle[diam=" + this.diameter + "']";
  }
}
