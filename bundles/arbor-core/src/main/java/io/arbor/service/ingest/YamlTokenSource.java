package io.arbor.service.ingest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.arbor.exception.ArborIOException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * {@link TokenSource} for YAML streams. A stream may hold several documents, so the documents are
 * wrapped in a virtual root array, one element per document. Numbers are passed on in their
 * canonical form ({@code 0x1F} becomes {@code 31}).
 */
public final class YamlTokenSource extends JacksonTokenSource {

  private static final YAMLFactory YAML_FACTORY = new YAMLFactory();

  private enum Phase {
    BEFORE_ROOT,
    DOCUMENTS,
    AFTER_ROOT,
    DONE
  }

  private Phase phase = Phase.BEFORE_ROOT;

  private YamlTokenSource(final JsonParser parser) {
    super(parser);
  }

  /**
   * Source reading a YAML stream. The stream is closed with the source.
   *
   * @param input the input
   * @return the source
   */
  public static YamlTokenSource yaml(final InputStream input) {
    try {
      return new YamlTokenSource(YAML_FACTORY.createParser(input));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  public static YamlTokenSource yaml(final Reader input) {
    try {
      return new YamlTokenSource(YAML_FACTORY.createParser(input));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  public static YamlTokenSource yaml(final String yaml) {
    try {
      return new YamlTokenSource(YAML_FACTORY.createParser(yaml));
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  @Override
  public @Nullable Token next() {
    switch (phase) {
      case BEFORE_ROOT:
        phase = Phase.DOCUMENTS;
        return Token.startArray();
      case DOCUMENTS: {
        final Token token = super.next();
        if (token != null) {
          return token;
        }
        phase = Phase.AFTER_ROOT;
        return next();
      }
      case AFTER_ROOT:
        phase = Phase.DONE;
        return Token.endArray();
      default:
        return null;
    }
  }

  @Override
  protected String integerText() throws IOException {
    return parser.getNumberValue().toString();
  }

  @Override
  protected String floatText() throws IOException {
    try {
      return Double.toString(parser.getDoubleValue());
    } catch (final NumberFormatException | JsonProcessingException e) {
      return parser.getText();
    }
  }
}
