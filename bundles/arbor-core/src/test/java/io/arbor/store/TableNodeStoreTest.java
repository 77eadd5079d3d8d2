package io.arbor.store;

import io.arbor.ArborTestHelper;
import io.arbor.access.ArborConfiguration;
import io.arbor.exception.ConstraintViolationException;
import io.arbor.exception.NodeNotFoundException;
import io.arbor.index.search.SearchHit;
import io.arbor.io.StorageType;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TableNodeStoreTest {

  private TableNodeStore store;

  @BeforeEach
  public void setUp() {
    store = ArborTestHelper.memoryStore();
  }

  @AfterEach
  public void tearDown() {
    store.close();
  }

  @Test
  public void testSingleRowInserts() {
    final long root = store.insertNode(-1, "root", NodeKind.OBJECT, null, 0);
    final long list = store.insertNode(root, "list", NodeKind.ARRAY, null, 0);
    final long name = store.insertNode(root, "name", NodeKind.STRING, "arbor", 1);

    assertEquals(0, root);
    assertEquals(3, store.size());

    final Node rootNode = store.getNode(root);
    assertEquals(".", rootNode.getPath());
    assertEquals("root", rootNode.getKey());
    assertFalse(rootNode.hasParent());
    assertEquals(2, rootNode.getChildCount());

    final Node nameNode = store.getByPath(".name");
    assertEquals(name, nameNode.getId());
    assertEquals("arbor", nameNode.getValue());
    assertEquals(NodeKind.STRING, nameNode.getKind());
    assertEquals(1, nameNode.getRank());
    assertEquals(root, nameNode.getParentId());

    assertEquals(list, store.getByPath(".list").getId());
    assertEquals(0, store.getChildCount(list));
    assertNull(store.getNode(list).getValue());
  }

  @Test
  public void testChildrenAreOrderedByRank() {
    final long root = store.insertNode(-1, "root", NodeKind.ARRAY, null, 0);
    final long first = store.insertNode(root, "0", NodeKind.INTEGER, "10", 0);
    final long second = store.insertNode(root, "1", NodeKind.INTEGER, "20", 1);
    final long third = store.insertNode(root, "2", NodeKind.INTEGER, "30", 2);

    final List<Long> ids = store.getChildren(root, 0, 10).stream().map(Node::getId).collect(Collectors.toList());
    assertEquals(List.of(first, second, third), ids);
    assertEquals(List.of(second), store.getChildren(root, 1, 1).stream().map(Node::getId).collect(Collectors.toList()));
    assertTrue(store.getChildren(root, 3, 10).isEmpty());
    assertEquals(third, store.getChildByRank(root, 2).orElseThrow().getId());
    assertTrue(store.getChildByRank(root, 3).isEmpty());
    assertEquals(".[2]", store.getNode(third).getPath());
  }

  @Test
  public void testConstraintViolations() {
    final long root = store.insertNode(-1, "root", NodeKind.OBJECT, null, 0);
    final long scalar = store.insertNode(root, "a", NodeKind.INTEGER, "1", 0);

    assertThrows(ConstraintViolationException.class, () -> store.insertNode(-1, "root", NodeKind.OBJECT, null, 0));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(42, "x", NodeKind.NULL, "null", 0));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(scalar, "x", NodeKind.NULL, "null", 0));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "b", NodeKind.NULL, "null", 0));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "b", NodeKind.NULL, "null", -1));
    assertThrows(IllegalArgumentException.class, () -> store.insertNode(root, "b", NodeKind.OBJECT, "{}", 1));
    assertThrows(IllegalArgumentException.class, () -> store.insertNode(root, "b", NodeKind.BUCKET, null, 1));

    assertEquals(2, store.size());
  }

  @Test
  public void testRanksHaveNoGaps() {
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(-1, "root", NodeKind.ARRAY, null, 1));
    final long root = store.insertNode(-1, "root", NodeKind.ARRAY, null, 0);

    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "5", NodeKind.INTEGER, "7", 5));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "1", NodeKind.INTEGER, "7", 1));
    assertEquals(1, store.size());
    assertEquals(0, store.getChildCount(root));

    final long first = store.insertNode(root, "0", NodeKind.INTEGER, "7", 0);
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "0", NodeKind.INTEGER, "8", 0));
    assertThrows(ConstraintViolationException.class, () -> store.insertNode(root, "2", NodeKind.INTEGER, "8", 2));
    final long second = store.insertNode(root, "1", NodeKind.INTEGER, "8", 1);

    assertEquals(List.of(0, 1), store.getChildren(root, 0, 10).stream().map(Node::getRank).collect(Collectors.toList()));
    assertEquals(first, store.getByPath(".[0]").getId());
    assertEquals(second, store.getByPath(".[1]").getId());
  }

  @Test
  public void testUnknownNodes() {
    assertThrows(NodeNotFoundException.class, () -> store.getNode(0));
    store.insertNode(-1, "root", NodeKind.OBJECT, null, 0);
    assertThrows(NodeNotFoundException.class, () -> store.getNode(1));
    assertThrows(NodeNotFoundException.class, () -> store.getNode(-3));
    assertThrows(NodeNotFoundException.class, () -> store.getByPath(".missing"));
    assertThrows(NodeNotFoundException.class, () -> store.getChildren(7, 0, 1));
    assertThrows(NodeNotFoundException.class, () -> store.getChildCount(7));
    assertTrue(store.findNode(1).isEmpty());
    assertTrue(store.findByPath(".missing").isEmpty());
  }

  @Test
  public void testInsertsAfterABulkLoad() {
    store.close();
    store = ArborTestHelper.load("{\"list\":[1,2],\"name\":\"x\"}");
    final Node list = store.getByPath(".list");
    assertEquals(2, list.getChildCount());

    assertThrows(ConstraintViolationException.class,
        () -> store.insertNode(list.getId(), "1", NodeKind.INTEGER, "99", 1));
    assertThrows(ConstraintViolationException.class,
        () -> store.insertNode(list.getId(), "3", NodeKind.INTEGER, "99", 3));
    final long added = store.insertNode(list.getId(), "2", NodeKind.STRING, "appended-entry", 2);

    assertEquals(3, store.getNode(list.getId()).getChildCount());
    assertEquals(3, store.getChildCount(list.getId()));
    assertEquals(added, store.getByPath(".list[2]").getId());
    final List<Node> children = store.getChildren(list.getId(), 1, 5);
    assertEquals(2, children.size());
    assertEquals("2", children.get(0).getValue());
    assertEquals(added, children.get(1).getId());

    final List<SearchHit> hits = store.searchIndex().search("appended").drain();
    assertEquals(1, hits.size());
    assertEquals(added, hits.get(0).getNodeId());
    assertTrue(store.searchIndex().verifyConsistency());
  }

  @Test
  public void testBulkLoadValidation() {
    try (final NodeStoreWriter writer = store.beginBulkLoad()) {
      writer.append(-1, "root", NodeKind.OBJECT, null, 0, ".");
      writer.append(0, "a", NodeKind.STRING, "x", 0, ".a");
      writer.append(5, "b", NodeKind.STRING, "y", 1, ".b");
      assertThrows(ConstraintViolationException.class, writer::commit);
    }
    assertEquals(0, store.size());

    try (final NodeStoreWriter writer = store.beginBulkLoad()) {
      writer.append(-1, "root", NodeKind.ARRAY, null, 0, ".");
      writer.append(0, "0", NodeKind.STRING, "x", 0, ".[0]");
      writer.append(0, "1", NodeKind.STRING, "y", 0, ".[1]");
      assertThrows(ConstraintViolationException.class, writer::commit);
    }
    assertEquals(0, store.size());

    try (final NodeStoreWriter writer = store.beginBulkLoad()) {
      assertThrows(ConstraintViolationException.class,
          () -> writer.append(-1, "root", NodeKind.OBJECT, "value", 0, "."));
    }
    assertEquals(0, store.size());
  }

  @Test
  public void testAbortedBulkLoad() {
    final NodeStoreWriter aborted = store.beginBulkLoad();
    aborted.append(-1, "root", NodeKind.OBJECT, null, 0, ".");
    aborted.append(0, "dropped", NodeKind.STRING, "x", 0, ".dropped");
    aborted.abort();
    assertEquals(0, store.size());
    assertTrue(store.findByPath(".dropped").isEmpty());

    try (final NodeStoreWriter writer = store.beginBulkLoad()) {
      writer.append(-1, "root", NodeKind.ARRAY, null, 0, ".");
      writer.commit();
    }
    assertEquals(1, store.size());
    assertEquals(NodeKind.ARRAY, store.getNode(0).getKind());
  }

  @Test
  public void testReadersWaitForTheBulkLoad() {
    try (final NodeStoreWriter writer = store.beginBulkLoad()) {
      writer.append(-1, "root", NodeKind.OBJECT, null, 0, ".");
      assertThrows(IllegalStateException.class, () -> store.getNode(0));
      assertThrows(IllegalStateException.class, store::beginBulkLoad);
      writer.commit();
    }
    assertEquals(1, store.size());
    assertEquals(".", store.getNode(0).getPath());
  }

  @Test
  public void testReopen(@TempDir final Path directory) {
    final ArborConfiguration configuration = ArborConfiguration.defaults();
    final long added;
    try (final TableNodeStore fileStore = TableNodeStore.open(StorageType.FILE_CHANNEL.getInstance(directory),
        configuration)) {
      try (final NodeStoreWriter writer = fileStore.beginBulkLoad()) {
        writer.append(-1, "root", NodeKind.OBJECT, null, 0, ".");
        writer.append(0, "items", NodeKind.ARRAY, null, 0, ".items");
        writer.append(1, "0", NodeKind.STRING, "first", 0, ".items[0]");
        writer.commit();
      }
      added = fileStore.insertNode(1, "1", NodeKind.STRING, "second", 1);
      fileStore.sync();
    }

    try (final TableNodeStore reopened = TableNodeStore.open(StorageType.FILE_CHANNEL.getInstance(directory),
        configuration)) {
      assertEquals(4, reopened.size());
      assertEquals(3, reopened.getDescriptor().getBaseRowCount());
      assertEquals(4, reopened.getDescriptor().getNodeCount());
      assertEquals(2, reopened.getChildCount(1));
      assertEquals(added, reopened.getByPath(".items[1]").getId());
      assertEquals("first", reopened.getByPath(".items[0]").getValue());
      assertEquals(added, reopened.searchIndex().search("second").drain().get(0).getNodeId());
      assertTrue(reopened.searchIndex().verifyConsistency());
    }
  }

  @Test
  public void testDiscard() {
    store.insertNode(-1, "root", NodeKind.OBJECT, null, 0);
    store.insertNode(0, "a", NodeKind.BOOLEAN, "true", 0);
    store.discard();
    assertEquals(0, store.size());
    assertEquals(0, store.searchIndex().rowCount());
    assertTrue(store.findByPath(".a").isEmpty());
    assertEquals(0, store.insertNode(-1, "root", NodeKind.ARRAY, null, 0));
  }
}
