package io.arbor.node;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NodeValuesTest {

  @Test
  public void testSupportedNumbersAreKept() {
    assertEquals("42", NodeValues.sanitize(NodeKind.INTEGER, "42"));
    assertEquals("-9223372036854775808", NodeValues.sanitize(NodeKind.INTEGER, "-9223372036854775808"));
    assertEquals("1.5e3", NodeValues.sanitize(NodeKind.FLOAT, "1.5e3"));
  }

  @Test
  public void testUnsupportedNumbersAreReplaced() {
    assertEquals(NodeValues.UNSUPPORTED_NUMERIC, NodeValues.sanitize(NodeKind.INTEGER, "9223372036854775808"));
    assertEquals(NodeValues.UNSUPPORTED_NUMERIC, NodeValues.sanitize(NodeKind.FLOAT, "NaN"));
    assertEquals(NodeValues.UNSUPPORTED_NUMERIC, NodeValues.sanitize(NodeKind.FLOAT, "Infinity"));
    assertEquals(NodeValues.UNSUPPORTED_NUMERIC, NodeValues.sanitize(NodeKind.FLOAT, "1e400"));
    assertTrue(NodeValues.isSanitized(NodeValues.sanitize(NodeKind.FLOAT, "-Infinity")));
  }

  @Test
  public void testOtherScalarsAreUntouched() {
    assertEquals("NaN", NodeValues.sanitize(NodeKind.STRING, "NaN"));
    assertEquals("true", NodeValues.sanitize(NodeKind.BOOLEAN, "true"));
    assertFalse(NodeValues.isSanitized("null"));
  }
}
