package io.arbor.service.ingest;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.arbor.exception.ArborIOException;
import io.arbor.exception.DocumentParseException;
import io.arbor.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

import static java.util.Objects.requireNonNull;

/**
 * {@link TokenSource} on top of a Jackson streaming parser. {@code NaN} and {@code Infinity} are
 * accepted and passed on as floats, which the pipeline sanitizes.
 */
public class JacksonTokenSource implements TokenSource {

  /** Shared factory, thread-safe. */
  private static final JsonFactory JSON_FACTORY = createJsonFactory();

  private static JsonFactory createJsonFactory() {
    final JsonFactory factory = new JsonFactory();
    factory.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    return factory;
  }

  protected final JsonParser parser;

  protected JacksonTokenSource(final JsonParser parser) {
    this.parser = requireNonNull(parser);
  }

  /**
   * Source reading JSON from a byte stream. The stream is closed with the source.
   *
   * @param input the input
   * @return the source
   */
  public static JacksonTokenSource json(final InputStream input) {
    try {
      return new JacksonTokenSource(JSON_FACTORY.createParser(input));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  /**
   * Source reading JSON from a character stream. The reader is closed with the source.
   *
   * @param input the input
   * @return the source
   */
  public static JacksonTokenSource json(final Reader input) {
    try {
      return new JacksonTokenSource(JSON_FACTORY.createParser(input));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  /**
   * Source reading JSON from a string.
   *
   * @param json the document
   * @return the source
   */
  public static JacksonTokenSource json(final String json) {
    try {
      return new JacksonTokenSource(JSON_FACTORY.createParser(json));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  @Override
  public @Nullable Token next() {
    try {
      final JsonToken token = parser.nextToken();
      if (token == null) {
        return null;
      }
      return toToken(token);
    } catch (final JsonProcessingException e) {
      throw parseError(e);
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  private Token toToken(final JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> Token.startObject();
      case END_OBJECT -> Token.endObject();
      case START_ARRAY -> Token.startArray();
      case END_ARRAY -> Token.endArray();
      case FIELD_NAME -> Token.key(parser.currentName());
      case VALUE_STRING -> Token.scalar(NodeKind.STRING, parser.getText());
      case VALUE_NUMBER_INT -> Token.scalar(NodeKind.INTEGER, integerText());
      case VALUE_NUMBER_FLOAT -> Token.scalar(NodeKind.FLOAT, floatText());
      case VALUE_TRUE -> Token.scalar(NodeKind.BOOLEAN, "true");
      case VALUE_FALSE -> Token.scalar(NodeKind.BOOLEAN, "false");
      case VALUE_NULL -> Token.scalar(NodeKind.NULL, "null");
      default -> throw new DocumentParseException("Unsupported token " + token, location().getOffset(),
          location().getLine(), location().getColumn());
    };
  }

  /**
   * Text of an integer scalar, as written in the source.
   */
  protected String integerText() throws IOException {
    return parser.getText();
  }

  /**
   * Text of a float scalar, as written in the source.
   */
  protected String floatText() throws IOException {
    return parser.getText();
  }

  @Override
  public SourceLocation location() {
    return toLocation(parser.currentLocation());
  }

  private static SourceLocation toLocation(final @Nullable JsonLocation location) {
    if (location == null) {
      return SourceLocation.UNKNOWN;
    }
    final long offset = location.getByteOffset() >= 0 ? location.getByteOffset() : location.getCharOffset();
    return new SourceLocation(offset, location.getLineNr(), location.getColumnNr());
  }

  protected DocumentParseException parseError(final JsonProcessingException e) {
    final SourceLocation location = toLocation(e.getLocation());
    return new DocumentParseException("Malformed document: " + e.getOriginalMessage(), location.getOffset(),
        location.getLine(), location.getColumn(), e);
  }

  @Override
  public void close() {
    try {
      parser.close();
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }
}
