/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.query;

import org.torproject.metrics.catalogsync.persist.SchemaDescriptor;
import org.torproject.metrics.catalogsync.region.Box;
import org.torproject.metrics.catalogsync.region.Circle;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.region.Shape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes ADQL queries selecting all schema columns of the records located
 * inside a region, optionally excluding known identifiers.
 *
 * <p>Results are always ordered by identifier, ascending, so that a
 * {@code TOP n} partition is well-defined and a rerun continues from the
 * last stored identifier.</p>
 */
public class SpatialQueryBuilder {

  private static final Logger logger = LoggerFactory.getLogger(
      SpatialQueryBuilder.class);

  static final String UPLOAD_SCHEMA = "tap_upload";

  /** Row limit meaning "no limit". */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private final String remoteTable;

  private final SchemaDescriptor schema;

  private final double extraSize;

  /**
   * Creates a builder for the given remote table.
   *
   * @param remoteTable Qualified remote table, e.g.
   *     {@code gaiadr2.gaia_source}.
   * @param schema Columns to select.
   * @param extraSize Factor applied to the region size; negative values are
   *     replaced by their absolute value.
   */
  public SpatialQueryBuilder(String remoteTable, SchemaDescriptor schema,
      double extraSize) {
    if (extraSize < 0.0) {
      logger.warn("Extra size must be positive. Taking absolute value {} "
          + "instead of {}.", Math.abs(extraSize), extraSize);
    }
    this.remoteTable = remoteTable;
    this.schema = schema;
    this.extraSize = Math.abs(extraSize);
  }

  public double getExtraSize() {
    return this.extraSize;
  }

  /**
   * Builds the query for a region.
   *
   * @param region Region whose records are selected.
   * @param limit Maximum number of rows, or {@link #UNBOUNDED}.
   * @param exclusion Identifiers to leave out, or {@code null}.
   */
  public String build(Region region, int limit, Exclusion exclusion) {
    String id = this.schema.getIdColumn();
    StringBuilder sb = new StringBuilder("SELECT ");
    if (limit != UNBOUNDED) {
      sb.append("TOP ").append(limit).append(' ');
    }
    List<String> columns = new ArrayList<>();
    for (String column : this.schema.getColumns()) {
      columns.add("A." + column);
    }
    sb.append(String.join(", ", columns)).append('\n')
        .append("FROM ").append(this.remoteTable).append(" A\n");
    if (null != exclusion && !exclusion.isInline()) {
      sb.append("LEFT JOIN ").append(UPLOAD_SCHEMA).append('.')
          .append(exclusion.getUploadTableName()).append(" B ON A.")
          .append(id).append(" = B.").append(id).append('\n')
          .append("WHERE B.").append(id).append(" IS NULL\n")
          .append("AND ");
    } else {
      sb.append("WHERE ");
    }
    sb.append(this.containment(region)).append('\n');
    if (null != exclusion && exclusion.isInline()
        && !exclusion.getInlineIds().isEmpty()) {
      List<String> ids = new ArrayList<>();
      for (Long excluded : exclusion.getInlineIds()) {
        ids.add(excluded.toString());
      }
      sb.append("AND A.").append(id).append(" NOT IN (")
          .append(String.join(",", ids)).append(")\n");
    }
    sb.append("ORDER BY A.").append(id).append(" ASC");
    return sb.toString();
  }

  /** Builds the spatial containment predicate for a region. */
  public String containment(final Region region) {
    final String center = literal(region.getRa()) + ", "
        + literal(region.getDec());
    String area = region.getShape().accept(new Shape.Visitor<String>() {
      @Override
      public String visitCircle(Circle circle) {
        double radius = Shape.toDegrees(circle.getDiameter()) * extraSize
            / 2.0;
        return "CIRCLE('ICRS', " + center + ", " + literal(radius) + ")";
      }

      @Override
      public String visitBox(Box box) {
        return "BOX('ICRS', " + center + ", "
            + literal(Shape.toDegrees(box.getWidth()) * extraSize) + ", "
            + literal(Shape.toDegrees(box.getHeight()) * extraSize) + ")";
      }
    });
    return "1 = CONTAINS(POINT('ICRS', A.ra, A.dec), " + area + ")";
  }

  private static String literal(double value) {
    return BigDecimal.valueOf(value).toPlainString();
  }
}
