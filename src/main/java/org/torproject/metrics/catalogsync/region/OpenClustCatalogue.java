/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync.region;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reader for the fixed-width {@code clusters.dat} file of the OPENCLUST
 * catalogue (Dias et al., CDS B/ocl), optionally gzip-compressed.
 *
 * <p>Lines that cannot be parsed are logged and skipped.</p>
 */
public class OpenClustCatalogue implements RegionCatalogue {

  private static final Logger logger = LoggerFactory.getLogger(
      OpenClustCatalogue.class);

  private final Path catalogueFile;

  public OpenClustCatalogue(Path catalogueFile) {
    this.catalogueFile = catalogueFile;
  }

  @Override
  public SortedMap<String, Region> load() throws IOException {
    logger.info("Loading OpenClust catalogue from {} ...", this.catalogueFile);
    SortedMap<String, Region> catalogue = new TreeMap<>();
    int skipped = 0;
    try (BufferedReader br = new BufferedReader(new InputStreamReader(
        this.openCatalogue(), StandardCharsets.ISO_8859_1))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        lineNumber++;
        if (line.trim().isEmpty()) {
          continue;
        }
        try {
          OpenCluster cluster = parseEntry(line);
          catalogue.put(cluster.getName(), cluster);
        } catch (IllegalArgumentException e) {
          logger.warn("Skipping line {} of {}: {}", lineNumber,
              this.catalogueFile, e.getMessage());
          skipped++;
        }
      }
    }
    logger.info("OpenClust catalogue loaded with {} clusters, {} lines "
        + "skipped.", catalogue.size(), skipped);
    return catalogue;
  }

  private InputStream openCatalogue() throws IOException {
    InputStream in = new BufferedInputStream(
        Files.newInputStream(this.catalogueFile));
    if (this.catalogueFile.getFileName().toString().endsWith(".gz")) {
      return new GzipCompressorInputStream(in);
    }
    return in;
  }

  /**
   * Parses one catalogue line.
   *
   * @throws IllegalArgumentException if a mandatory field is missing or
   *     malformed.
   */
  static OpenCluster parseEntry(String entry) {
    String name = field(entry, 0, 17);
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Cluster without name.");
    }
    double ra;
    double dec;
    try {
      ra = 15.0 * sexagesimal(field(entry, 18, 20), field(entry, 21, 23),
          field(entry, 24, 26));
      String degrees = field(entry, 27, 30);
      double absDec = sexagesimal(degrees.replace("-", "").replace("+", ""),
          field(entry, 31, 33), field(entry, 34, 36));
      dec = degrees.startsWith("-") ? -absDec : absDec;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Cluster " + name
          + " does not have valid coordinates.", e);
    }
    String g1Class = field(entry, 37, 39);
    String diameter = field(entry, 40, 47);
    if (diameter.isEmpty()) {
      throw new IllegalArgumentException("Cluster " + name
          + " does not have diameter info.");
    }
    double diam;
    try {
      diam = Double.parseDouble(diameter);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Cluster " + name
          + " has an invalid diameter: '" + diameter + "'.", e);
    }
    return new OpenCluster(name, ra, dec, diam,
        g1Class.isEmpty() ? null : g1Class);
  }

  private static double sexagesimal(String units, String minutes,
      String seconds) {
    if (units.isEmpty() || minutes.isEmpty() || seconds.isEmpty()) {
      throw new NumberFormatException("Incomplete sexagesimal value.");
    }
    return Integer.parseInt(units) + Integer.parseInt(minutes) / 60.0
        + Integer.parseInt(seconds) / 3600.0;
  }

  private static String field(String line, int from, int to) {
    if (line.length() <= from) {
      return "";
    }
    return line.substring(from, Math.min(to, line.length())).trim();
  }
}
