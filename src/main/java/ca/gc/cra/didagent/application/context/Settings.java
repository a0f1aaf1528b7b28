package ca.gc.cra.didagent.application.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable key/value view over the effective agent configuration.
 *
 * <p>Keys are dotted names such as {@code admin.port}. Values keep the type they were loaded with
 * (YAML scalars, lists, or CLI strings); typed accessors coerce on read and reject values that do
 * not parse with {@link IllegalArgumentException}.</p>
 *
 * <p><strong>Thread-safety:</strong> immutable; safe to share.</p>
 */
public final class Settings {
  private static final Settings EMPTY = new Settings(Map.of());

  private final Map<String, Object> values;

  private Settings(Map<String, Object> values) {
    this.values = values;
  }

  /**
   * Creates settings from a map. {@code null} values are dropped and list values copied.
   *
   * @param source source entries; must not be {@code null}
   * @return immutable settings
   */
  public static Settings of(Map<String, ?> source) {
    Objects.requireNonNull(source, "source");
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> {
      Objects.requireNonNull(key, "settings key");
      if (value instanceof Collection<?> collection) {
        copy.put(key, List.copyOf(collection));
      } else if (value != null) {
        copy.put(key, value);
      }
    });
    return new Settings(Collections.unmodifiableMap(copy));
  }

  public static Settings empty() {
    return EMPTY;
  }

  /**
   * Returns a copy with {@code overrides} applied on top of these values.
   *
   * @param overrides entries that win over existing keys
   * @return merged settings
   */
  public Settings with(Map<String, ?> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(values);
    merged.putAll(overrides);
    return of(merged);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * @param key setting name
   * @return string form of the value, or {@code null} when absent
   */
  public String getString(String key) {
    Object value = values.get(key);
    return value == null ? null : value.toString();
  }

  public String getString(String key, String defaultValue) {
    String value = getString(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      case "" -> defaultValue;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was '" + value + "')");
    };
  }

  public int getInt(String key, int defaultValue) {
    long value = getLong(key, defaultValue);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(key + " is out of integer range: " + value);
    }
    return (int) value;
  }

  public long getLong(String key, long defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      return n.longValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  public double getDouble(String key, double defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + value + "')", ex);
    }
  }

  /**
   * Returns a list setting. A scalar string is split on commas so CLI values such as
   * {@code admin.webhook_urls=http://a,http://b} read the same as YAML lists.
   *
   * @param key setting name
   * @return trimmed non-blank entries; empty when absent
   */
  public List<String> getList(String key) {
    return getList(key, List.of());
  }

  public List<String> getList(String key, List<String> defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    List<String> result = new ArrayList<>();
    if (value instanceof Collection<?> collection) {
      for (Object item : collection) {
        if (item != null && !item.toString().isBlank()) {
          result.add(item.toString().trim());
        }
      }
    } else {
      for (String token : value.toString().split(",")) {
        if (!token.isBlank()) {
          result.add(token.trim());
        }
      }
    }
    return List.copyOf(result);
  }

  /**
   * @return unmodifiable view of all entries
   */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "Settings" + values.keySet();
  }
}
