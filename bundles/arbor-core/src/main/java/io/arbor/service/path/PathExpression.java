package io.arbor.service.path;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.google.common.collect.ImmutableList;
import io.arbor.exception.PathException;
import io.arbor.settings.Fixed;

import java.io.IOException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Parsed dot/bracket path expression.
 *
 * <pre>
 * expression := "." | "." step ( step )*
 * step       := "." name | "." quoted | "[" quoted "]" | "[" integer "]" | "[" integer? ":" integer? "]"
 * name       := any characters except . [ ] "
 * quoted     := JSON string literal
 * </pre>
 *
 * The leading dot may be followed directly by a bracket ({@code .[0]}), and a dot may precede a
 * bracket anywhere ({@code .a.[0]}).
 */
public final class PathExpression {

  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private final String text;

  private final List<PathSegment> segments;

  private PathExpression(final String text, final List<PathSegment> segments) {
    this.text = text;
    this.segments = segments;
  }

  public String getText() {
    return text;
  }

  public List<PathSegment> getSegments() {
    return segments;
  }

  /**
   * Parse an expression.
   *
   * @param expression the expression, surrounding whitespace is ignored
   * @return the parsed expression
   * @throws PathException with {@link PathException.Reason#MALFORMED_SYNTAX} if the expression
   *         does not follow the grammar
   */
  public static PathExpression parse(final String expression) {
    requireNonNull(expression);
    final String text = expression.strip();
    if (text.isEmpty() || text.charAt(0) != '.') {
      throw malformed(text, "a path starts with '.'");
    }
    final ImmutableList.Builder<PathSegment> segments = ImmutableList.builder();
    int position = 1;
    boolean afterDot = true;
    while (position < text.length()) {
      final char current = text.charAt(position);
      if (current == '[') {
        position = parseBracket(text, position, segments);
        afterDot = false;
      } else if (afterDot) {
        position = parseName(text, position, segments);
        afterDot = false;
      } else if (current == '.') {
        position++;
        afterDot = true;
        if (position == text.length()) {
          throw malformed(text, "missing key after '.' at the end");
        }
      } else {
        throw malformed(text, "unexpected '" + current + "' at " + position);
      }
    }
    return new PathExpression(text, segments.build());
  }

  private static int parseName(final String text, final int start, final ImmutableList.Builder<PathSegment> segments) {
    if (text.charAt(start) == '"') {
      final int end = quotedEnd(text, start);
      segments.add(PathSegment.key(unquote(text, start, end), text.substring(start, end)));
      return end;
    }
    int end = start;
    while (end < text.length() && ".[]\"".indexOf(text.charAt(end)) < 0) {
      end++;
    }
    if (end == start) {
      throw malformed(text, "missing key at " + start);
    }
    final String name = text.substring(start, end);
    segments.add(PathSegment.key(name, name));
    return end;
  }

  private static int parseBracket(final String text, final int start,
      final ImmutableList.Builder<PathSegment> segments) {
    final int contentStart = start + 1;
    if (contentStart < text.length() && text.charAt(contentStart) == '"') {
      final int quoteEnd = quotedEnd(text, contentStart);
      if (quoteEnd >= text.length() || text.charAt(quoteEnd) != ']') {
        throw malformed(text, "missing ']' after the quoted key at " + contentStart);
      }
      segments.add(PathSegment.key(unquote(text, contentStart, quoteEnd), text.substring(start, quoteEnd + 1)));
      return quoteEnd + 1;
    }
    final int close = text.indexOf(']', contentStart);
    if (close < 0) {
      throw malformed(text, "missing ']' for the '[' at " + start);
    }
    final String content = text.substring(contentStart, close).strip();
    final String source = text.substring(start, close + 1);
    if (content.matches("-?\\d*:-?\\d*")) {
      segments.add(PathSegment.slice(source));
    } else if (content.matches("-?\\d+")) {
      long index;
      try {
        index = Long.parseLong(content);
      } catch (final NumberFormatException e) {
        index = content.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
      }
      segments.add(PathSegment.index(index, source));
    } else {
      throw malformed(text, "'" + source + "' is neither an index nor a quoted key");
    }
    return close + 1;
  }

  /**
   * Position after the closing quote of the string literal starting at {@code start}.
   */
  private static int quotedEnd(final String text, final int start) {
    for (int i = start + 1; i < text.length(); i++) {
      final char current = text.charAt(i);
      if (current == '\\') {
        i++;
      } else if (current == '"') {
        return i + 1;
      }
    }
    throw malformed(text, "unterminated string at " + start);
  }

  private static String unquote(final String text, final int start, final int end) {
    final String literal = text.substring(start, end);
    try (final JsonParser parser = JSON_FACTORY.createParser(literal)) {
      if (parser.nextToken() != JsonToken.VALUE_STRING) {
        throw malformed(text, "invalid string " + literal);
      }
      return parser.getText();
    } catch (final IOException e) {
      throw malformed(text, "invalid string " + literal + ": " + e.getMessage());
    }
  }

  private static PathException malformed(final String text, final String detail) {
    return new PathException(PathException.Reason.MALFORMED_SYNTAX, Fixed.ROOT_PATH,
        "Malformed path '" + text + "': " + detail);
  }

  @Override
  public String toString() {
    return text;
  }
}
