package io.arbor.service.path;

import io.arbor.ArborTestHelper;
import io.arbor.exception.PathException;
import io.arbor.index.bucket.BucketingEngine;
import io.arbor.node.Node;
import io.arbor.service.navigate.Navigator;
import io.arbor.store.TableNodeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class PathResolverTest {

  private TableNodeStore store;

  private PathResolver resolver;

  @BeforeEach
  public void setUp() {
    store = ArborTestHelper.load(ArborTestHelper.resource(ArborTestHelper.SERVICES_JSON));
    resolver = new PathResolver(store, new Navigator(store, new BucketingEngine(1000), 20));
  }

  @AfterEach
  public void tearDown() {
    store.close();
  }

  @Test
  public void testEveryPathResolvesToItsNode() {
    for (long id = 0; id < store.size(); id++) {
      final Node node = store.getNode(id);
      assertEquals(node, resolver.resolve(node.getPath()).getTarget(), node.getPath());
    }
  }

  @Test
  public void testAlternativeSpellings() {
    final long weight = store.getByPath(".[\"api-gateway-7\"].weight").getId();
    assertEquals(weight, resolver.resolve(".\"api-gateway-7\".weight").getTarget().getId());
    assertEquals(weight, resolver.resolve(".[\"api-gateway-7\"][\"weight\"]").getTarget().getId());
    assertEquals(store.getByPath(".services[2]").getId(), resolver.resolve(".services[-1]").getTarget().getId());
    assertEquals(store.getByPath(".services[0].ports[1]").getId(),
        resolver.resolve(".services.[0].ports.[-1]").getTarget().getId());
    assertEquals(0, resolver.resolve(".").getTarget().getId());
    assertTrue(resolver.resolve(".").getAncestorsToExpand().isEmpty());
  }

  @Test
  public void testAncestorsToExpand() {
    final Resolution resolution = resolver.resolve(".services[1].labels.upstream");
    assertEquals("api-gateway-7", resolution.getTarget().getValue());
    assertEquals(List.of(".", ".services", ".services[1]", ".services[1].labels"),
        resolution.getAncestorsToExpand().stream().map(Node::getPath).collect(Collectors.toList()));
  }

  @Test
  public void testAncestorsIncludeBuckets() {
    try (final TableNodeStore big = ArborTestHelper.load("{\"list\":[" + "0,".repeat(29) + "0]}")) {
      final PathResolver bucketed = new PathResolver(big, new Navigator(big, new BucketingEngine(10), 20));
      final Resolution resolution = bucketed.resolve(".list[25]");
      assertEquals(List.of("root", "list", "[20 … 29]"),
          resolution.getAncestorsToExpand().stream().map(Node::getKey).collect(Collectors.toList()));
      assertTrue(resolution.getAncestorsToExpand().get(2).isBucket());
    }
  }

  @Test
  public void testMissingKey() {
    assertFailure(".nope", PathException.Reason.SEGMENT_NOT_FOUND, ".");
    assertFailure(".services[0].nope", PathException.Reason.SEGMENT_NOT_FOUND, ".services[0]");
  }

  @Test
  public void testKindMismatch() {
    assertFailure(".services.name", PathException.Reason.SEGMENT_NOT_FOUND, ".services");
    assertFailure(".cluster[0]", PathException.Reason.SEGMENT_NOT_FOUND, ".cluster");
    assertFailure(".services[0].name.first", PathException.Reason.SEGMENT_NOT_FOUND, ".services[0].name");
  }

  @Test
  public void testIndexOutOfRange() {
    assertFailure(".services[3]", PathException.Reason.INDEX_OUT_OF_RANGE, ".services");
    assertFailure(".services[-4]", PathException.Reason.INDEX_OUT_OF_RANGE, ".services");
    assertFailure(".services[2].ports[0]", PathException.Reason.INDEX_OUT_OF_RANGE, ".services[2].ports");
  }

  @Test
  public void testSlicesAreUnsupported() {
    assertFailure(".services[0:2]", PathException.Reason.UNSUPPORTED_SEGMENT, ".services");
  }

  @Test
  public void testMalformed() {
    assertFailure(".services[", PathException.Reason.MALFORMED_SYNTAX, ".");
  }

  @Test
  public void testEmptyStore() {
    try (final TableNodeStore empty = ArborTestHelper.memoryStore()) {
      final PathResolver emptyResolver = new PathResolver(empty, new Navigator(empty, new BucketingEngine(10), 20));
      final PathException e = assertThrows(PathException.class, () -> emptyResolver.resolve("."));
      assertEquals(PathException.Reason.SEGMENT_NOT_FOUND, e.getReason());
    }
  }

  private void assertFailure(final String expression, final PathException.Reason reason, final String prefix) {
    final PathException e = assertThrows(PathException.class, () -> resolver.resolve(expression));
    assertEquals(reason, e.getReason(), expression);
    assertEquals(prefix, e.getResolvedPrefix(), expression);
  }
}
