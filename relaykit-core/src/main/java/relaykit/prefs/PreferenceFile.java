package relaykit.prefs;

import relaykit.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON file backing a {@link DefaultPreferenceStore}.
 *
 * <p>The file holds one flat JSON object mapping each preference name to
 * {@code "<KIND>:<payload>"}, for example {@code {"launch_count":"INT:3",
 * "tags":"STRING_SET:[\"a\",\"b\"]"}}. Writes replace the whole file through a temporary
 * sibling and an atomic move.
 *
 * <p>A missing file loads as empty. An unreadable or malformed file is logged and loads as
 * empty; individual malformed entries are logged and skipped.
 */
public final class PreferenceFile {
  private static final Logger logger = Logger.getLogger(PreferenceFile.class.getName());

  private final Path path;
  private final JsonCodec codec;

  public PreferenceFile(Path path) {
    this(path, JsonCodec.getDefault());
  }

  public PreferenceFile(Path path, JsonCodec codec) {
    this.path = Objects.requireNonNull(path, "path");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Path path() {
    return path;
  }

  public Map<String, PrefValue> load() {
    if (!Files.exists(path)) {
      return Collections.emptyMap();
    }
    Map<String, String> raw;
    try {
      raw = codec.parseObject(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Could not read preferences from " + path + "; starting empty", e);
      return Collections.emptyMap();
    }
    Map<String, PrefValue> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : raw.entrySet()) {
      try {
        result.put(entry.getKey(), decode(entry.getValue()));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Skipping malformed preference '" + entry.getKey() + "' in " + path, e);
      }
    }
    return result;
  }

  /**
   * Replaces the file content with {@code values}.
   *
   * @throws PreferenceStoreException if the file cannot be written
   */
  public void write(Map<String, PrefValue> values) {
    Map<String, String> raw = new LinkedHashMap<>();
    values.forEach((name, value) -> raw.put(name, encode(value)));
    String json = codec.toJson(raw);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      try {
        Files.writeString(temp, json, StandardCharsets.UTF_8);
        try {
          Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new PreferenceStoreException("Failed to write preferences to " + path, e);
    }
  }

  String encode(PrefValue value) {
    String payload = switch (value.kind()) {
      case STRING, INT, LONG, FLOAT, DOUBLE, BOOLEAN -> String.valueOf(value.raw());
      case STRING_SET -> codec.toJsonArray(((PrefValue.StringSetValue) value).value());
    };
    return value.kind().name() + ":" + payload;
  }

  PrefValue decode(String encoded) {
    int colon = encoded.indexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("Missing kind prefix");
    }
    PrefValue.Kind kind = PrefValue.Kind.valueOf(encoded.substring(0, colon));
    String payload = encoded.substring(colon + 1);
    return switch (kind) {
      case STRING -> new PrefValue.StringValue(payload);
      case INT -> new PrefValue.IntValue(Integer.parseInt(payload));
      case LONG -> new PrefValue.LongValue(Long.parseLong(payload));
      case FLOAT -> new PrefValue.FloatValue(Float.parseFloat(payload));
      case DOUBLE -> new PrefValue.DoubleValue(Double.parseDouble(payload));
      case BOOLEAN -> new PrefValue.BooleanValue(parseBoolean(payload));
      case STRING_SET -> PrefValue.StringSetValue.of(codec.parseArray(payload));
    };
  }

  private static boolean parseBoolean(String payload) {
    if ("true".equals(payload)) return true;
    if ("false".equals(payload)) return false;
    throw new IllegalArgumentException("Invalid boolean: " + payload);
  }
}
