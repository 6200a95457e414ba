package com.tofes.analyzer.aircraft;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only SQLite implementation of {@link AircraftGroupRepository}.
 *
 * <p>Expected schema: {@code aircraft_types(type_code TEXT, caai_group TEXT, complex INTEGER)}
 * where {@code caai_group} holds A-D or the Hebrew form letter. The repository uses:
 * <ul>
 *   <li>prepared lookup by type code</li>
 *   <li>a bounded in-memory LRU cache to reduce repeated DB reads</li>
 * </ul>
 */
public class SqliteAircraftGroupRepository implements AircraftGroupRepository, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteAircraftGroupRepository.class);
  private static final String SELECT_BY_TYPE =
      "SELECT type_code, caai_group, complex FROM aircraft_types WHERE UPPER(type_code) = ? LIMIT 1";

  private final Connection connection;
  private final PreparedStatement byTypeCode;
  private final Map<String, Optional<AircraftProfile>> cache;

  /**
   * Creates a repository bound to a local SQLite file.
   *
   * @param sqlitePath path to the SQLite reference DB
   * @param cacheSize max number of cached type codes (values &lt; 0 are clamped to 0)
   */
  public SqliteAircraftGroupRepository(Path sqlitePath, int cacheSize) {
    if (!Files.exists(sqlitePath)) {
      throw new IllegalStateException("Aircraft DB not found at " + sqlitePath);
    }

    try {
      String url = "jdbc:sqlite:file:" + sqlitePath.toAbsolutePath() + "?mode=ro";
      this.connection = DriverManager.getConnection(url);
      this.byTypeCode = connection.prepareStatement(SELECT_BY_TYPE);
    } catch (SQLException ex) {
      throw new IllegalStateException("Failed to open aircraft SQLite DB", ex);
    }

    int maxEntries = Math.max(0, cacheSize);
    this.cache =
        Collections.synchronizedMap(new LinkedHashMap<>(256, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Optional<AircraftProfile>> eldest) {
            return size() > maxEntries;
          }
        });
  }

  /**
   * Performs a single-row lookup by type code.
   *
   * <p>Blank inputs return {@link Optional#empty()}. Rows whose group is not A-D are ignored so
   * the caller falls back to its other sources. Lookup failures are treated as misses.
   */
  @Override
  public Optional<AircraftProfile> findByTypeCode(String typeCode) {
    if (typeCode == null || typeCode.isBlank()) {
      return Optional.empty();
    }

    String key = typeCode.trim().toUpperCase(Locale.ROOT);
    Optional<AircraftProfile> cached = cache.get(key);
    if (cached != null) {
      return cached;
    }

    Optional<AircraftProfile> profile = query(key);
    cache.put(key, profile);
    return profile;
  }

  private synchronized Optional<AircraftProfile> query(String key) {
    try {
      byTypeCode.setString(1, key);
      try (ResultSet rs = byTypeCode.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        Optional<AircraftGroup> group = AircraftGroup.fromCode(rs.getString("caai_group"));
        boolean complex = rs.getInt("complex") != 0;
        return group.map(g -> new AircraftProfile(key, g, complex));
      }
    } catch (SQLException ex) {
      LOGGER.warn("Aircraft DB lookup failed for type {}: {}", key, ex.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void close() {
    try {
      byTypeCode.close();
    } catch (SQLException ex) {
      LOGGER.debug("Failed to close aircraft DB statement", ex);
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      LOGGER.debug("Failed to close aircraft DB connection", ex);
    }
  }
}
