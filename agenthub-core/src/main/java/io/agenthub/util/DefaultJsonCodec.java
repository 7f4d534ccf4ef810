package io.agenthub.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for record and message value trees.
 * Has no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  @Override
  public Object parse(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    Parser parser = new Parser(json);
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (parser.pos < json.length()) {
      throw new IllegalArgumentException("Trailing characters at index " + parser.pos);
    }
    return value;
  }

  private static void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      sb.append(((Number) value).longValue());
    } else if (value instanceof Number n) {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Non-finite number: " + d);
      }
      sb.append(d);
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("Object keys must be strings, got: " + entry.getKey());
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(key)).append('"').append(':');
        write(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Collection<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, item);
      }
      sb.append(']');
    } else if (value instanceof Enum<?> e) {
      sb.append('"').append(escape(e.name())).append('"');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class Parser {
    private final String input;
    private int pos;

    private Parser(String input) {
      this.input = input;
    }

    private Object readValue() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char c = input.charAt(pos);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          pos++;
          return readString();
        case 't':
          expectLiteral("true");
          return Boolean.TRUE;
        case 'f':
          expectLiteral("false");
          return Boolean.FALSE;
        case 'n':
          expectLiteral("null");
          return null;
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + pos);
      }
    }

    private Map<String, Object> readObject() {
      pos++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at index " + pos);
        }
        pos++;
        String key = readString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' after key at index " + pos);
        }
        pos++;
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == ',') {
          continue;
        }
        if (next == '}') {
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or '}' at index " + (pos - 1));
      }
    }

    private List<Object> readArray() {
      pos++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        pos++;
        return result;
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == ',') {
          continue;
        }
        if (next == ']') {
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or ']' at index " + (pos - 1));
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '"') {
          pos++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          pos++;
          continue;
        }
        if (pos + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos + 2, pos + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        pos += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private Object readNumber() {
      int start = pos;
      boolean integral = true;
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if ((c >= '0' && c <= '9') || c == '-' || c == '+') {
          pos++;
        } else if (c == '.' || c == 'e' || c == 'E') {
          integral = false;
          pos++;
        } else {
          break;
        }
      }
      String text = input.substring(start, pos);
      try {
        if (integral) {
          return Long.parseLong(text);
        }
        return Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number: " + text, ex);
      }
    }

    private void expectLiteral(String literal) {
      if (!input.startsWith(literal, pos)) {
        throw new IllegalArgumentException("Expected '" + literal + "' at index " + pos);
      }
      pos += literal.length();
    }

    private char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      return input.charAt(pos);
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
    }
  }
}
