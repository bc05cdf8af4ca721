package org.budgetanalyzer.rateanalyzer.cache;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Durable cache layer: a single JSON object mapping key strings to numeric rates.
 *
 * <p>The file is read once, when the store is created. A missing or zero-length file means an
 * empty cache. Every {@link #put} rewrites the whole file: the mapping is serialized to a
 * temporary file in the same directory which then replaces the original.
 *
 * <p>Entries that are null, zero or negative are dropped on load and count as never fetched.
 *
 * <p>Not thread-safe; the fetcher is its only caller and fetches one day at a time.
 *
 * <pre>{@code
 * {"AUD_NZD_2024-03-10":1.072039,"AUD_NZD_2024-03-11":1.072116}
 * }</pre>
 */
public class JsonFileRateStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileRateStore.class);

  private static final TypeReference<LinkedHashMap<String, BigDecimal>> MAPPING_TYPE =
      new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, BigDecimal> rates;

  /**
   * Creates the store and loads the file if it exists.
   *
   * @param file location of the JSON file
   * @param objectMapper mapper used to read and write the file
   * @throws CachePersistenceException if the file exists but cannot be read or parsed
   */
  public JsonFileRateStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.rates = load();
  }

  public Optional<BigDecimal> get(String key) {
    return Optional.ofNullable(rates.get(key));
  }

  /**
   * Stores a rate and synchronously rewrites the file.
   *
   * @param key the key string
   * @param rate the rate
   * @throws CachePersistenceException if the file cannot be written
   */
  public void put(String key, BigDecimal rate) {
    rates.put(key, rate);
    save();
  }

  private Map<String, BigDecimal> load() {
    if (!Files.exists(file)) {
      log.info("Cache file {} not found. Initializing an empty cache.", file);
      return new LinkedHashMap<>();
    }

    try {
      if (Files.size(file) == 0) {
        log.info("Cache file {} is empty. Initializing an empty cache.", file);
        return new LinkedHashMap<>();
      }

      LinkedHashMap<String, BigDecimal> loaded =
          objectMapper.readValue(file.toFile(), MAPPING_TYPE);
      if (loaded == null) {
        return new LinkedHashMap<>();
      }

      // a hand-edited file may hold unusable values, those keys are treated as never fetched
      var entryCount = loaded.size();
      loaded.values().removeIf(rate -> rate == null || rate.signum() <= 0);
      if (loaded.size() < entryCount) {
        log.warn(
            "Ignored {} cache entries without a positive rate in {}",
            entryCount - loaded.size(),
            file);
      }
      log.info("Loaded {} cached exchange rates from {}", loaded.size(), file);
      return loaded;
    } catch (IOException e) {
      throw new CachePersistenceException("Failed to read cache file " + file, e);
    }
  }

  private void save() {
    try {
      var directory = file.toAbsolutePath().getParent();
      if (directory != null) {
        Files.createDirectories(directory);
      }

      var temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), rates);
        moveIntoPlace(temp);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new CachePersistenceException("Failed to write cache file " + file, e);
    }

    log.debug("Cache file {} updated with {} rates", file, rates.size());
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
