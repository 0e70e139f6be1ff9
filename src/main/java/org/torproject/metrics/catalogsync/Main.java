/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.catalogsync;

import org.torproject.metrics.catalogsync.conf.Configuration;
import org.torproject.metrics.catalogsync.conf.ConfigurationException;
import org.torproject.metrics.catalogsync.conf.Key;
import org.torproject.metrics.catalogsync.cron.ShutdownHook;
import org.torproject.metrics.catalogsync.persist.PostgresRecordStore;
import org.torproject.metrics.catalogsync.persist.SchemaDescriptor;
import org.torproject.metrics.catalogsync.persist.StorageException;
import org.torproject.metrics.catalogsync.region.OpenClustCatalogue;
import org.torproject.metrics.catalogsync.region.Region;
import org.torproject.metrics.catalogsync.sync.SyncManager;
import org.torproject.metrics.catalogsync.sync.SyncSummary;
import org.torproject.metrics.catalogsync.tap.TapClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Main class for starting a CatalogSync run.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar catalogsync.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "catalogsync.properties";

  /** Value of {@code Regions} selecting the whole catalogue. */
  public static final String ALL_REGIONS = "ALL";

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Path confPath;
    if (args == null || args.length == 0) {
      confPath = Paths.get(CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("CatalogSync takes at most one argument.");
      return;
    }
    if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
      writeDefaultConfig(confPath);
      return;
    }
    Configuration conf = new Configuration();
    try {
      conf.loadAndCheckConfiguration(confPath);
      SyncSummary summary = run(conf);
      if (summary.getFailed() > 0) {
        System.exit(1);
      }
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
    }
  }

  private static SyncSummary run(Configuration conf)
      throws ConfigurationException, IOException, StorageException,
      SQLException {
    SortedMap<String, Region> catalogue = new OpenClustCatalogue(
        conf.getPath(Key.CatalogueFile)).load();
    List<Region> regions = selectRegions(catalogue,
        conf.getStringArray(Key.Regions));
    SchemaDescriptor schema = SchemaDescriptor.fromResource(
        SchemaDescriptor.GAIA_DR2_SOURCE, "source_id");
    try (Connection conn = DriverManager.getConnection(
        conf.getString(Key.DbUrl), conf.getString(Key.DbUser),
        conf.getString(Key.DbPassword))) {
      PostgresRecordStore store = new PostgresRecordStore(conn,
          conf.getString(Key.RegionsTable), conf.getString(Key.RecordsTable),
          schema, conf.getInt(Key.InsertChunkSize));
      if (conf.getBool(Key.DbInitialize)) {
        store.initializeSchema();
      }
      TapClient client = new TapClient(conf.getUrl(Key.TapUrl),
          conf.getInt(Key.TapConnectTimeoutMillis),
          conf.getInt(Key.TapReadTimeoutMillis),
          conf.getLong(Key.TapJobPollMillis),
          conf.getLong(Key.TapJobTimeoutMinutes) * 60_000L);
      SyncManager syncManager = new SyncManager(conf, store, client, schema);
      ShutdownHook hook = new ShutdownHook(syncManager,
          conf.getLong(Key.ShutdownGraceWaitMinutes));
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        return syncManager.run(regions);
      } finally {
        try {
          Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
          log.debug("Shutdown already in progress.");
        }
      }
    }
  }

  /**
   * Returns the regions named in the configuration, or the whole catalogue
   * for {@link #ALL_REGIONS}.
   *
   * @throws ConfigurationException if a name is not in the catalogue.
   */
  static List<Region> selectRegions(SortedMap<String, Region> catalogue,
      String[] names) throws ConfigurationException {
    if (names.length == 0 || (names.length == 1 && (names[0].isEmpty()
        || ALL_REGIONS.equalsIgnoreCase(names[0])))) {
      return new ArrayList<>(catalogue.values());
    }
    List<Region> regions = new ArrayList<>();
    for (String name : names) {
      Region region = catalogue.get(name);
      if (null == region) {
        throw new ConfigurationException("Region '" + name
            + "' is not in the catalogue.");
      }
      regions.add(region);
    }
    return regions;
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar catalogsync.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try {
      Files.copy(Main.class.getClassLoader().getResource(CONF_FILE)
          .openStream(), confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". You need to change it and provide "
          + "at least the catalogue file and the database to write to. "
          + "Credentials can also be given in the environment variables "
          + "GAIA_USERNAME, GAIA_PASSWORD, DB_URL, POSTGRES_USER and "
          + "POSTGRES_PASSWORD.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
