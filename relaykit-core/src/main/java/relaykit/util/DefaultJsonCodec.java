package relaykit.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec}. Accepts only string values; numbers, booleans and
 * nested structures are rejected.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys or values");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, entry.getKey());
      sb.append(':');
      appendString(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public String toJsonArray(Collection<String> values) {
    StringBuilder sb = new StringBuilder("[");
    boolean first = true;
    for (String value : values) {
      if (value == null) {
        throw new IllegalArgumentException("JSON array cannot contain null elements");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, value);
    }
    return sb.append(']').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.consumeIf('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      result.put(key, cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  @Override
  public List<String> parseArray(String json) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON array");
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('[');
    List<String> result = new ArrayList<>();
    if (cursor.consumeIf(']')) {
      cursor.expectEnd();
      return result;
    }
    do {
      result.add(cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect(']');
    cursor.expectEnd();
    return result;
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }

    private void expect(char expected) {
      skipWhitespace();
      if (pos >= input.length() || input.charAt(pos) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at offset " + pos);
      }
      pos++;
    }

    private boolean consumeIf(char candidate) {
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == candidate) {
        pos++;
        return true;
      }
      return false;
    }

    private void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Unexpected trailing content at offset " + pos);
      }
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos++);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
