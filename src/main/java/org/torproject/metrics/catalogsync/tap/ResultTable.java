/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular query result as returned by the remote service.
 *
 * <p>Cell values are {@link Long}, {@link Double}, {@link String},
 * {@link Boolean} or {@code null}.</p>
 */
public class ResultTable {

  private static final JsonFactory jsonFactory = new JsonFactory();

  private final List<String> columns;

  private final List<Object[]> rows;

  /**
   * Creates a table from column names and rows of the same width.
   *
   * @throws IllegalArgumentException if a row does not match the columns.
   */
  public ResultTable(List<String> columns, List<Object[]> rows) {
    for (Object[] row : rows) {
      if (row.length != columns.size()) {
        throw new IllegalArgumentException("Row has " + row.length
            + " values, but there are " + columns.size() + " columns.");
      }
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
  }

  /** Returns an empty table with the given columns. */
  public static ResultTable empty(List<String> columns) {
    return new ResultTable(columns, Collections.emptyList());
  }

  /**
   * Parses a TAP JSON result document, i.e. an object with a
   * {@code metadata} array of column descriptions and a {@code data} array
   * of rows.
   *
   * <p>The document is read token by token, so rows are the only copy of
   * the result held in memory.</p>
   *
   * @throws RemoteServiceException if the document is not a TAP JSON result.
   */
  public static ResultTable fromJson(InputStream json)
      throws IOException, RemoteServiceException {
    List<String> columns = null;
    List<Object[]> rows = null;
    try (JsonParser parser = jsonFactory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new RemoteServiceException("Result document is not a JSON "
            + "object.");
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if ("metadata".equals(field) && value == JsonToken.START_ARRAY) {
          columns = readColumns(parser);
        } else if ("data".equals(field) && value == JsonToken.START_ARRAY) {
          rows = readRows(parser, null == columns ? -1 : columns.size());
        } else {
          parser.skipChildren();
        }
      }
    }
    if (null == columns || null == rows) {
      throw new RemoteServiceException("Result document lacks metadata or "
          + "data.");
    }
    for (int i = 0; i < rows.size(); i++) {
      checkWidth(i, rows.get(i).length, columns.size());
    }
    return new ResultTable(columns, rows);
  }

  private static List<String> readColumns(JsonParser parser)
      throws IOException, RemoteServiceException {
    List<String> columns = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) == JsonToken.START_OBJECT) {
      String name = "";
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        parser.nextToken();
        if ("name".equals(field)) {
          name = parser.getValueAsString("");
        } else {
          parser.skipChildren();
        }
      }
      columns.add(name);
    }
    if (token != JsonToken.END_ARRAY) {
      throw new RemoteServiceException("Unexpected " + token
          + " in result metadata.");
    }
    return columns;
  }

  /** Reads rows; a known width is checked while reading. */
  private static List<Object[]> readRows(JsonParser parser, int width)
      throws IOException, RemoteServiceException {
    List<Object[]> rows = new ArrayList<>();
    List<Object> values = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) == JsonToken.START_ARRAY) {
      values.clear();
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        values.add(toValue(parser, token));
      }
      if (width >= 0) {
        checkWidth(rows.size(), values.size(), width);
      }
      rows.add(values.toArray());
    }
    if (token != JsonToken.END_ARRAY) {
      throw new RemoteServiceException("Unexpected " + token
          + " in result data.");
    }
    return rows;
  }

  private static void checkWidth(int row, int values, int columns)
      throws RemoteServiceException {
    if (values != columns) {
      throw new RemoteServiceException("Result row " + row + " has " + values
          + " values for " + columns + " columns.");
    }
  }

  private static Object toValue(JsonParser parser, JsonToken token)
      throws IOException, RemoteServiceException {
    if (null == token) {
      throw new RemoteServiceException("Result document ends inside a row.");
    }
    switch (token) {
      case VALUE_NULL:
        return null;
      case VALUE_NUMBER_INT:
        return parser.getLongValue();
      case VALUE_NUMBER_FLOAT:
        return parser.getDoubleValue();
      case VALUE_TRUE:
        return Boolean.TRUE;
      case VALUE_FALSE:
        return Boolean.FALSE;
      case VALUE_STRING:
        return parser.getText();
      default:
        throw new RemoteServiceException("Unexpected " + token
            + " in result row.");
    }
  }

  public List<String> getColumns() {
    return this.columns;
  }

  public List<Object[]> getRows() {
    return this.rows;
  }

  public int size() {
    return this.rows.size();
  }

  public boolean isEmpty() {
    return this.rows.isEmpty();
  }

  /** Position of the named column, or -1 if absent. */
  public int indexOf(String column) {
    return this.columns.indexOf(column);
  }
}
