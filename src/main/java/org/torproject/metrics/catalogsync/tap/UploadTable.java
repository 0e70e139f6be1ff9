/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.tap;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Single-column table of 64-bit identifiers uploaded together with a query
 * and visible to it as {@code tap_upload.<name>}.
 */
public class UploadTable {

  private final String name;

  private final String column;

  private final SortedSet<Long> ids;

  /** Creates an upload table holding a snapshot of the given identifiers. */
  public UploadTable(String name, String column, SortedSet<Long> ids) {
    this.name = name;
    this.column = column;
    this.ids = Collections.unmodifiableSortedSet(new TreeSet<>(ids));
  }

  public String getName() {
    return this.name;
  }

  public String getColumn() {
    return this.column;
  }

  public SortedSet<Long> getIds() {
    return this.ids;
  }

  /** Serializes this table as a VOTable document, the TAP upload format. */
  public String toVoTable() {
    StringBuilder sb = new StringBuilder();
    sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
        .append("<VOTABLE version=\"1.3\" ")
        .append("xmlns=\"http://www.ivoa.net/xml/VOTable/v1.3\">\n")
        .append("<RESOURCE type=\"results\">\n")
        .append("<TABLE name=\"").append(this.name).append("\">\n")
        .append("<FIELD name=\"").append(this.column)
        .append("\" datatype=\"long\"/>\n")
        .append("<DATA>\n<TABLEDATA>\n");
    for (Long id : this.ids) {
      sb.append("<TR><TD>").append(id).append("</TD></TR>\n");
    }
    sb.append("</TABLEDATA>\n</DATA>\n</TABLE>\n</RESOURCE>\n</VOTABLE>\n");
    return sb.toString();
  }
}
