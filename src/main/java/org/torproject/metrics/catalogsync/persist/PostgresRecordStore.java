/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

import org.torproject.metrics.catalogsync.region.Box;
import org.torproject.metrics.catalogsync.region.Circle;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.region.Shape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * {@link RecordStore} on PostgreSQL, relying on {@code ON CONFLICT} for
 * idempotent writes.
 *
 * <p>The store works on a single connection handed in by the caller, which
 * stays the owner and closes it. Methods are synchronized, because regions
 * synchronized in parallel share the connection.</p>
 */
public class PostgresRecordStore implements RecordStore {

  private static final Logger logger = LoggerFactory.getLogger(
      PostgresRecordStore.class);

  /** Classpath resource creating regions and records tables. */
  static final String INIT_SCRIPT = "db-init.sql";

  private static final double TOLERANCE = 1e-9;

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final Connection conn;

  private final String regionsTable;

  private final String recordsTable;

  private final SchemaDescriptor schema;

  private final int chunkSize;

  private final String insertRegionSql;

  private final String insertRecordSql;

  private final String knownIdsSql;

  /**
   * Creates a store on the given connection, which is switched to manual
   * commit.
   *
   * @param conn Open connection, owned by the caller.
   * @param regionsTable Qualified name of the regions table.
   * @param recordsTable Qualified name of the records table.
   * @param schema Record columns.
   * @param chunkSize Maximum number of records per transaction.
   */
  public PostgresRecordStore(Connection conn, String regionsTable,
      String recordsTable, SchemaDescriptor schema, int chunkSize)
      throws StorageException {
    if (chunkSize < 1) {
      throw new IllegalArgumentException("Chunk size must be positive.");
    }
    this.conn = conn;
    this.regionsTable = regionsTable;
    this.recordsTable = recordsTable;
    this.schema = schema;
    this.chunkSize = chunkSize;
    this.insertRegionSql = "INSERT INTO " + regionsTable
        + " (name, ra, dec, diam, width, height, properties) "
        + "VALUES (?, ?, ?, ?, ?, ?, CAST(? AS jsonb)) "
        + "ON CONFLICT (name) DO UPDATE SET properties = EXCLUDED.properties "
        + "RETURNING id, ra, dec, diam, width, height";
    List<String> marks = new ArrayList<>();
    marks.add("?");
    for (int i = 0; i < schema.getColumns().size(); i++) {
      marks.add("?");
    }
    this.insertRecordSql = "INSERT INTO " + recordsTable + " (region_id, "
        + String.join(", ", schema.getColumns()) + ") VALUES ("
        + String.join(", ", marks) + ") ON CONFLICT (region_id, "
        + schema.getIdColumn() + ") DO NOTHING";
    this.knownIdsSql = "SELECT r." + schema.getIdColumn() + " FROM "
        + recordsTable + " r JOIN " + regionsTable
        + " g ON r.region_id = g.id WHERE g.name = ?";
    try {
      this.conn.setAutoCommit(false);
    } catch (SQLException e) {
      throw new StorageException("Cannot switch connection to manual commit: "
          + e.getMessage(), e);
    }
  }

  /**
   * Creates the regions and records tables, unless they exist.
   */
  public synchronized void initializeSchema() throws StorageException {
    String script;
    try {
      script = readScript().replace("${regions}", this.regionsTable)
          .replace("${records}", this.recordsTable);
    } catch (IOException e) {
      throw new StorageException("Cannot read " + INIT_SCRIPT + ": "
          + e.getMessage(), e);
    }
    try (Statement st = this.conn.createStatement()) {
      st.execute(script);
      this.conn.commit();
      logger.info("Database schema for {} and {} is in place.",
          this.regionsTable, this.recordsTable);
    } catch (SQLException e) {
      this.rollback();
      throw new StorageException("Cannot initialize database schema: "
          + e.getMessage(), e);
    }
  }

  private static String readScript() throws IOException {
    InputStream stream = PostgresRecordStore.class.getClassLoader()
        .getResourceAsStream(INIT_SCRIPT);
    if (null == stream) {
      throw new IOException("Resource not found.");
    }
    StringBuilder sb = new StringBuilder();
    try (BufferedReader br = new BufferedReader(new InputStreamReader(stream,
        StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString();
  }

  @Override
  public synchronized int saveRegion(Region region) throws StorageException {
    logger.debug("Saving region {} into {} ...", region, this.regionsTable);
    try (PreparedStatement ps = this.conn.prepareStatement(
        this.insertRegionSql)) {
      ps.setString(1, region.getName());
      ps.setDouble(2, region.getRa());
      ps.setDouble(3, region.getDec());
      final Double[] size = region.getShape().accept(
          new Shape.Visitor<Double[]>() {
            @Override
            public Double[] visitCircle(Circle circle) {
              return new Double[] { circle.getDiameter(), null, null };
            }

            @Override
            public Double[] visitBox(Box box) {
              return new Double[] { null, box.getWidth(), box.getHeight() };
            }
          });
      for (int i = 0; i < size.length; i++) {
        if (null == size[i]) {
          ps.setNull(4 + i, Types.DOUBLE);
        } else {
          ps.setDouble(4 + i, size[i]);
        }
      }
      ps.setString(7, objectMapper.writeValueAsString(
          region.getProperties()));
      int serial;
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("Upsert of region " + region
              + " returned no row.");
        }
        serial = rs.getInt(1);
        String conflict = this.compareStored(region, rs);
        if (null != conflict) {
          this.rollback();
          throw new StorageException("Region " + region
              + " is stored with different " + conflict
              + "; refusing to change it.");
        }
      }
      this.conn.commit();
      return serial;
    } catch (SQLException e) {
      this.rollback();
      throw new StorageException("Cannot save region " + region + ": "
          + e.getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new StorageException("Cannot serialize properties of region "
          + region + ": " + e.getMessage(), e);
    }
  }

  private String compareStored(Region region, ResultSet rs)
      throws SQLException {
    if (!same(region.getRa(), rs.getDouble(2))
        || !same(region.getDec(), rs.getDouble(3))) {
      return "coordinates";
    }
    final double diam = rs.getDouble(4);
    final boolean hasDiam = !rs.wasNull();
    final double width = rs.getDouble(5);
    final double height = rs.getDouble(6);
    boolean sameShape = region.getShape().accept(
        new Shape.Visitor<Boolean>() {
          @Override
          public Boolean visitCircle(Circle circle) {
            return hasDiam && same(circle.getDiameter(), diam);
          }

          @Override
          public Boolean visitBox(Box box) {
            return !hasDiam && same(box.getWidth(), width)
                && same(box.getHeight(), height);
          }
        });
    return sameShape ? null : "shape";
  }

  private static boolean same(double expected, double stored) {
    return Math.abs(expected - stored) <= TOLERANCE;
  }

  @Override
  public synchronized int saveRecords(int regionSerial, RecordBatch batch)
      throws StorageException {
    List<Object[]> rows = batch.getRows();
    int inserted = 0;
    for (int from = 0; from < rows.size(); from += this.chunkSize) {
      List<Object[]> chunk = rows.subList(from,
          Math.min(from + this.chunkSize, rows.size()));
      inserted += this.insertChunk(regionSerial, chunk, from);
    }
    logger.debug("Inserted {} of {} records for region serial {}.", inserted,
        rows.size(), regionSerial);
    return inserted;
  }

  private int insertChunk(int regionSerial, List<Object[]> chunk, int offset)
      throws StorageException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        this.insertRecordSql)) {
      for (Object[] row : chunk) {
        ps.setInt(1, regionSerial);
        for (int i = 0; i < row.length; i++) {
          if (null == row[i]) {
            ps.setNull(i + 2, Types.NULL);
          } else {
            ps.setObject(i + 2, row[i]);
          }
        }
        ps.addBatch();
      }
      int[] counts = ps.executeBatch();
      this.conn.commit();
      int inserted = 0;
      for (int count : counts) {
        if (count > 0) {
          inserted += count;
        } else if (count == Statement.SUCCESS_NO_INFO) {
          inserted++;
        }
      }
      return inserted;
    } catch (SQLException e) {
      this.rollback();
      throw new StorageException("Cannot insert records " + offset + " to "
          + (offset + chunk.size() - 1) + " for region serial " + regionSerial
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public synchronized SortedSet<Long> getKnownRecordIds(Region region)
      throws StorageException {
    SortedSet<Long> ids = new TreeSet<>();
    try (PreparedStatement ps = this.conn.prepareStatement(this.knownIdsSql)) {
      ps.setString(1, region.getName());
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          ids.add(rs.getLong(1));
        }
      }
      this.conn.commit();
    } catch (SQLException e) {
      this.rollback();
      throw new StorageException("Cannot read known " + schema.getIdColumn()
          + " values of region " + region + ": " + e.getMessage(), e);
    }
    logger.debug("Found {} stored records for region {}.", ids.size(), region);
    return ids;
  }

  private void rollback() {
    try {
      this.conn.rollback();
    } catch (SQLException e) {
      logger.warn("Rollback failed: {}", e.getMessage(), e);
    }
  }
}
