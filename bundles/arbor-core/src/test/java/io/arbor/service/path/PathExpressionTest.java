package io.arbor.service.path;

import io.arbor.exception.PathException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class PathExpressionTest {

  @Test
  public void testRoot() {
    assertTrue(PathExpression.parse(".").getSegments().isEmpty());
    assertTrue(PathExpression.parse("  .  ").getSegments().isEmpty());
  }

  @Test
  public void testDotAndBracketForms() {
    final List<PathSegment> segments = PathExpression.parse(".a.\"b.c\"[\"d e\"][3].[-1]").getSegments();
    assertEquals(5, segments.size());
    assertKey("a", segments.get(0));
    assertKey("b.c", segments.get(1));
    assertKey("d e", segments.get(2));
    assertEquals(PathSegment.Type.INDEX, segments.get(3).getType());
    assertEquals(3, segments.get(3).getIndex());
    assertEquals(-1, segments.get(4).getIndex());
    assertEquals("[-1]", segments.get(4).getSource());
  }

  @Test
  public void testLeadingBracket() {
    final List<PathSegment> segments = PathExpression.parse(".[0].name").getSegments();
    assertEquals(PathSegment.Type.INDEX, segments.get(0).getType());
    assertKey("name", segments.get(1));
  }

  @Test
  public void testEscapesInQuotedKeys() {
    final List<PathSegment> segments = PathExpression.parse(".[\"say \\\"hi\\\"\"].\"tab\\t\"").getSegments();
    assertKey("say \"hi\"", segments.get(0));
    assertKey("tab\t", segments.get(1));
  }

  @Test
  public void testSlices() {
    for (final String slice : List.of(".a[1:3]", ".a[:2]", ".a[-2:]", ".a[:]")) {
      final List<PathSegment> segments = PathExpression.parse(slice).getSegments();
      assertEquals(PathSegment.Type.SLICE, segments.get(1).getType(), slice);
    }
  }

  @ParameterizedTest
  @ValueSource(strings = { "", "a", "..", ".a.", ".a[", ".a[x]", ".a[\"b]", ".a[\"b\"", ".a]", "[0]", ".a\"b\"" })
  public void testMalformed(final String expression) {
    final PathException e = assertThrows(PathException.class, () -> PathExpression.parse(expression));
    assertEquals(PathException.Reason.MALFORMED_SYNTAX, e.getReason());
    assertEquals(".", e.getResolvedPrefix());
  }

  private static void assertKey(final String key, final PathSegment segment) {
    assertEquals(PathSegment.Type.KEY, segment.getType());
    assertEquals(key, segment.getKey());
  }
}
