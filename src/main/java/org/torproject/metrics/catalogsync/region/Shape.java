/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

/**
 * Angular extent of a region on the sky, either a {@link Circle} or a
 * {@link Box}. All sizes are given in arcminutes.
 *
 * <p>Code that depends on the kind of shape implements a {@link Visitor},
 * which forces it to handle both kinds.</p>
 */
public abstract class Shape {

  /** Handles each kind of shape. */
  public interface Visitor<R> {

    R visitCircle(Circle circle);

    R visitBox(Box box);
  }

  Shape() {
  }

  public abstract <R> R accept(Visitor<R> visitor);

  static double checkSize(String what, double arcmin) {
    if (!(arcmin > 0.0) || Double.isInfinite(arcmin)) {
      throw new IllegalArgumentException("The " + what
          + " of a region must be a positive number of arcminutes, but was "
          + arcmin + ".");
    }
    return arcmin;
  }

  /** Converts arcminutes to degrees. */
  public static double toDegrees(double arcmin) {
    return arcmin / 60.0;
  }
}
