package com.lingchain.infrastructure;

import com.lingchain.application.port.Dictionary;
import jakarta.annotation.PostConstruct;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

/**
 * Dictionary held entirely in memory, loaded once at startup.
 *
 * <p>Words come either from a newline-delimited word list (one word per line, taken verbatim) or,
 * when a JDBC URL is configured, from the {@code word} column of the {@code dict} table of a
 * SQLite database opened read-only. After {@link #load()} the word set never changes, so lookups
 * need no locking and the instance can be shared by concurrent searches.
 */
@Service
public class DictionaryService implements Dictionary {
  private static final Logger log = LoggerFactory.getLogger(DictionaryService.class);

  private static final String SQL_ALL_WORDS = "SELECT word FROM dict WHERE word IS NOT NULL";
  private static final String SQLITE_PREFIX = "jdbc:sqlite:";

  private final ResourceLoader resources;
  private final String location;
  private final String jdbcUrl;

  private volatile Set<String> words = Set.of();

  public DictionaryService(
      ResourceLoader resources,
      @Value("${lingchain.dictionary-location:classpath:dictionary/words.txt}") String location,
      @Value("${lingchain.dictionary-jdbc-url:}") String jdbcUrl) {
    this.resources = resources;
    this.location = location;
    this.jdbcUrl = jdbcUrl == null ? "" : jdbcUrl.trim();
  }

  /**
   * Read all words into memory.
   *
   * @throws IllegalStateException if the word list or database file does not exist
   * @throws Exception if reading the source fails
   */
  @PostConstruct
  public void load() throws Exception {
    long t0 = System.nanoTime();
    Set<String> loaded;
    String source;
    if (!jdbcUrl.isEmpty()) {
      loaded = readSqlite(jdbcUrl);
      source = jdbcUrl;
    } else {
      loaded = readWordList(location);
      source = location;
    }
    words = Set.copyOf(loaded);
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info("Dictionary ready: {} words from {} ({} ms).", words.size(), source, ms);
  }

  /**
   * Check whether the provided string is a dictionary word. No normalization is applied.
   *
   * @param w string to check (may be null)
   * @return true if the exact string was loaded
   */
  @Override
  public boolean isWord(String w) {
    return w != null && words.contains(w);
  }

  /** Number of loaded words. */
  @Override
  public int size() {
    return words.size();
  }

  private Set<String> readWordList(String loc) {
    Resource r = resources.getResource(loc);
    if (!r.exists()) {
      throw new IllegalStateException("Dictionary file not found: " + loc);
    }
    Set<String> out = new HashSet<>();
    try (BufferedReader in =
        new BufferedReader(new InputStreamReader(r.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = in.readLine()) != null) {
        out.add(line);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read dictionary " + loc, e);
    }
    return out;
  }

  private Set<String> readSqlite(String url) throws Exception {
    if (url.startsWith(SQLITE_PREFIX)) {
      String path = url.substring(SQLITE_PREFIX.length());
      if (!path.startsWith(":")) {
        Path db = Path.of(path).toAbsolutePath().normalize();
        if (Files.notExists(db)) throw new IllegalStateException("Dictionary DB not found: " + db);
      }
    }

    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setReadOnly(true);
    cfg.setOpenMode(SQLiteOpenMode.READONLY);

    Set<String> out = new HashSet<>();
    try (Connection conn = DriverManager.getConnection(url, cfg.toProperties());
        PreparedStatement ps = conn.prepareStatement(SQL_ALL_WORDS);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        out.add(rs.getString(1));
      }
    }
    return out;
  }
}
