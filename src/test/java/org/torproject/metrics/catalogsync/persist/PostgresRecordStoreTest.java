/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.persist;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.torproject.metrics.catalogsync.region.Box;
import org.torproject.metrics.catalogsync.region.OpenCluster;
import org.torproject.metrics.catalogsync.region.Region;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Arrays;
import java.util.SortedSet;

public class PostgresRecordStoreTest {

  private final SchemaDescriptor schema = new SchemaDescriptor("test",
      Arrays.asList("source_id", "ra", "dec"), "source_id");

  private Connection conn;

  private PreparedStatement ps;

  private ResultSet rs;

  private PostgresRecordStore store;

  /** Creates a store on a mocked connection. */
  @Before
  public void setUp() throws Exception {
    this.conn = mock(Connection.class);
    this.ps = mock(PreparedStatement.class);
    this.rs = mock(ResultSet.class);
    given(this.conn.prepareStatement(anyString())).willReturn(this.ps);
    given(this.ps.executeQuery()).willReturn(this.rs);
    this.store = new PostgresRecordStore(this.conn, "catalogsync.regions",
        "gaiadr2.gaia_source", this.schema, 2);
  }

  private RecordBatch batch(long... ids) {
    Object[][] rows = new Object[ids.length][];
    for (int i = 0; i < ids.length; i++) {
      rows[i] = new Object[] { ids[i], 1.0, null };
    }
    return RecordBatch.project(this.schema, this.schema.getColumns(),
        Arrays.asList(rows));
  }

  @Test
  public void testManualCommit() throws Exception {
    verify(this.conn).setAutoCommit(false);
  }

  @Test
  public void testSaveRecordsInChunks() throws Exception {
    given(this.ps.executeBatch()).willReturn(new int[] { 1, 0 },
        new int[] { Statement.SUCCESS_NO_INFO });
    assertEquals(2, this.store.saveRecords(5, batch(1L, 2L, 3L)));
    verify(this.ps, times(3)).addBatch();
    verify(this.ps, times(2)).executeBatch();
    verify(this.conn, times(2)).commit();
    verify(this.ps, times(3)).setInt(1, 5);
    verify(this.ps).setObject(2, 3L);
    verify(this.ps, times(3)).setNull(4, Types.NULL);
    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    verify(this.conn, times(2)).prepareStatement(sql.capture());
    assertEquals("INSERT INTO gaiadr2.gaia_source (region_id, source_id, ra, "
        + "dec) VALUES (?, ?, ?, ?) ON CONFLICT (region_id, source_id) "
        + "DO NOTHING", sql.getValue());
  }

  @Test
  public void testSaveRecordsFailureRollsBack() throws Exception {
    given(this.ps.executeBatch()).willReturn(new int[] { 1, 1 })
        .willThrow(new SQLException("disk full"));
    try {
      this.store.saveRecords(5, batch(1L, 2L, 3L));
      fail("Failed insert was not reported.");
    } catch (StorageException e) {
      assertThat(e.getMessage(), containsString("records 2 to 2"));
      assertThat(e.getMessage(), containsString("disk full"));
    }
    verify(this.conn).commit();
    verify(this.conn).rollback();
  }

  private void storedRegion(int id, double ra, double dec, Double diam,
      Double width, Double height) throws SQLException {
    given(this.rs.next()).willReturn(true);
    given(this.rs.getInt(1)).willReturn(id);
    given(this.rs.getDouble(2)).willReturn(ra);
    given(this.rs.getDouble(3)).willReturn(dec);
    given(this.rs.getDouble(4)).willReturn(null == diam ? 0.0 : diam);
    given(this.rs.wasNull()).willReturn(null == diam);
    given(this.rs.getDouble(5)).willReturn(null == width ? 0.0 : width);
    given(this.rs.getDouble(6)).willReturn(null == height ? 0.0 : height);
  }

  @Test
  public void testSaveRegion() throws Exception {
    OpenCluster m45 = new OpenCluster("Melotte_22", 56.75, 24.1167, 120.0,
        "b");
    storedRegion(11, 56.75, 24.1167, 120.0, null, null);
    assertEquals(11, this.store.saveRegion(m45));
    verify(this.ps).setString(1, "Melotte_22");
    verify(this.ps).setDouble(4, 120.0);
    verify(this.ps).setNull(5, Types.DOUBLE);
    verify(this.ps).setNull(6, Types.DOUBLE);
    verify(this.ps).setString(7, "{\"g1_class\":\"b\"}");
    verify(this.conn).commit();
    assertNull("Serial is stamped by the caller.", m45.getSerial());
  }

  @Test
  public void testSaveBoxRegion() throws Exception {
    Region field = new Region("field", 10.0, -5.0, new Box(30.0, 12.0));
    storedRegion(3, 10.0, -5.0, null, 30.0, 12.0);
    assertEquals(3, this.store.saveRegion(field));
    verify(this.ps).setNull(4, Types.DOUBLE);
    verify(this.ps).setDouble(5, 30.0);
    verify(this.ps).setDouble(6, 12.0);
    verify(this.ps).setString(7, "{}");
  }

  @Test
  public void testSaveRegionRefusesChangedShape() throws Exception {
    storedRegion(11, 56.75, 24.1167, 90.0, null, null);
    try {
      this.store.saveRegion(new OpenCluster("Melotte_22", 56.75, 24.1167,
          120.0, null));
      fail("Changed diameter was accepted.");
    } catch (StorageException e) {
      assertThat(e.getMessage(), containsString("shape"));
    }
    verify(this.conn).rollback();
    verify(this.conn, never()).commit();
  }

  @Test
  public void testSaveRegionRefusesChangedCoordinates() throws Exception {
    storedRegion(11, 56.0, 24.1167, 120.0, null, null);
    try {
      this.store.saveRegion(new OpenCluster("Melotte_22", 56.75, 24.1167,
          120.0, null));
      fail("Changed coordinates were accepted.");
    } catch (StorageException e) {
      assertThat(e.getMessage(), containsString("coordinates"));
    }
  }

  @Test
  public void testKnownRecordIds() throws Exception {
    given(this.rs.next()).willReturn(true, true, false);
    given(this.rs.getLong(1)).willReturn(9L, 4L);
    SortedSet<Long> ids = this.store.getKnownRecordIds(new Region(
        "field", 10.0, -5.0, new Box(30.0, 12.0)));
    assertEquals(Arrays.asList(4L, 9L), Arrays.asList(ids.toArray()));
    verify(this.ps).setString(1, "field");
    ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
    verify(this.conn).prepareStatement(sql.capture());
    assertThat(sql.getValue(), containsString("WHERE g.name = ?"));
  }

  @Test
  public void testInitializeSchema() throws Exception {
    Statement st = mock(Statement.class);
    given(this.conn.createStatement()).willReturn(st);
    this.store.initializeSchema();
    ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
    verify(st).execute(script.capture());
    assertThat(script.getValue(), containsString(
        "CREATE TABLE IF NOT EXISTS catalogsync.regions"));
    assertThat(script.getValue(), containsString(
        "REFERENCES catalogsync.regions(id)"));
    assertThat(script.getValue(), not(containsString("${")));
    verify(this.conn).commit();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidChunkSize() throws Exception {
    new PostgresRecordStore(this.conn, "a", "b", this.schema, 0);
  }
}
