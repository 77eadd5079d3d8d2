package io.arbor.service.navigate;

import io.arbor.ArborTestHelper;
import io.arbor.exception.NodeNotFoundException;
import io.arbor.index.bucket.BucketingEngine;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import io.arbor.store.TableNodeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NavigatorTest {

  private TableNodeStore store;

  @AfterEach
  public void tearDown() {
    if (store != null) {
      store.close();
    }
  }

  private static String array(final int length) {
    final StringBuilder json = new StringBuilder("{\"items\":[");
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append(i);
    }
    return json.append("]}").toString();
  }

  @Test
  public void testLargeArraysAreBucketed() {
    store = ArborTestHelper.load(array(2500));
    final Navigator navigator = new Navigator(store, new BucketingEngine(1000), 20);
    final long items = store.getByPath(".items").getId();

    assertEquals(3, navigator.entryCount(items));
    final List<ChildSummary> buckets = navigator.window(items, 0, 10);
    assertEquals(List.of("[0 … 999]", "[1000 … 1999]", "[2000 … 2499]"),
        buckets.stream().map(ChildSummary::getKey).collect(Collectors.toList()));
    for (final ChildSummary bucket : buckets) {
      assertEquals(NodeKind.BUCKET, bucket.getKind());
      assertNull(bucket.getPreview());
    }
    assertEquals(500, buckets.get(2).getChildCount());

    final List<ChildSummary> last = navigator.window(buckets.get(2).getId(), 0, 3);
    assertEquals(List.of("2000", "2001", "2002"), last.stream().map(ChildSummary::getKey).collect(Collectors.toList()));
    assertEquals("2000", last.get(0).getPreview());
    assertEquals(500, navigator.entryCount(buckets.get(2).getId()));
    assertEquals(2, navigator.window(buckets.get(2).getId(), 498, 10).size());

    assertEquals(buckets, navigator.window(items, 0, 10));
    assertEquals(buckets.subList(1, 2), navigator.window(items, 1, 1));

    final Node bucketNode = navigator.node(buckets.get(1).getId());
    assertEquals(items, bucketNode.getParentId());
    assertEquals(".items", bucketNode.getPath());
    assertEquals(1000, bucketNode.getChildCount());
  }

  @Test
  public void testSmallContainersAreNotBucketed() {
    store = ArborTestHelper.load(array(5));
    final Navigator navigator = new Navigator(store, new BucketingEngine(1000), 20);
    final long items = store.getByPath(".items").getId();

    final List<ChildSummary> window = navigator.window(items, 3, 10);
    assertEquals(2, window.size());
    assertEquals("3", window.get(0).getKey());
    assertEquals(3, window.get(0).getRank());
    assertEquals(NodeKind.INTEGER, window.get(0).getKind());
    assertTrue(navigator.window(items, 5, 10).isEmpty());
    assertTrue(navigator.window(items, 0, 0).isEmpty());
  }

  @Test
  public void testPreview() {
    assertEquals("short", Navigator.preview("short", 10));
    assertEquals("exactly10!", Navigator.preview("exactly10!", 10));
    assertEquals("0123456...", Navigator.preview("0123456789abc", 10));
    assertNull(Navigator.preview(null, 10));

    store = ArborTestHelper.load("{\"long\":\"" + "x".repeat(50) + "\",\"nested\":{\"a\":1}}");
    final Navigator navigator = new Navigator(store, new BucketingEngine(1000), 20);
    final List<ChildSummary> window = navigator.window(0, 0, 10);
    assertEquals("x".repeat(17) + "...", window.get(0).getPreview());
    assertNull(window.get(1).getPreview());
    assertEquals(1, window.get(1).getChildCount());
  }

  @Test
  public void testLineageAndReveal() {
    final StringBuilder json = new StringBuilder("{\"outer\":{\"list\":[");
    for (int i = 0; i < 250; i++) {
      json.append(i == 0 ? "" : ",").append("{\"n\":").append(i).append('}');
    }
    store = ArborTestHelper.load(json.append("]}}").toString());
    final Navigator navigator = new Navigator(store, new BucketingEngine(10), 20);
    final Node target = store.getByPath(".outer.list[157].n");

    final List<Node> lineage = navigator.lineage(target.getId());
    assertEquals(List.of(".", ".outer", ".outer.list", ".outer.list[157]", ".outer.list[157].n"),
        lineage.stream().map(Node::getPath).collect(Collectors.toList()));

    final List<Node> reveal = navigator.reveal(target.getId());
    assertEquals(List.of("root", "outer", "list", "[100 … 199]", "[150 … 159]", "157", "n"),
        reveal.stream().map(Node::getKey).collect(Collectors.toList()));
    assertTrue(reveal.get(3).isBucket());
    assertEquals(reveal.get(3).getId(), reveal.get(4).getParentId());

    final List<ChildSummary> inner = navigator.window(reveal.get(4).getId(), 0, 20);
    assertEquals(10, inner.size());
    assertEquals("157", inner.get(7).getKey());
    assertEquals(navigator.lineage(reveal.get(2).getId()), navigator.lineage(reveal.get(3).getId()));
  }

  @Test
  public void testUnknownIds() {
    store = ArborTestHelper.load(array(3));
    final Navigator navigator = new Navigator(store, new BucketingEngine(1000), 20);
    assertThrows(NodeNotFoundException.class, () -> navigator.window(99, 0, 1));
    assertThrows(NodeNotFoundException.class, () -> navigator.window(-5, 0, 1));
    assertThrows(NodeNotFoundException.class, () -> navigator.node(-5));
  }
}
