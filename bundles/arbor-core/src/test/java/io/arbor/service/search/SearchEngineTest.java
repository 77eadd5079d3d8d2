package io.arbor.service.search;

import io.arbor.ArborTestHelper;
import io.arbor.index.bucket.BucketingEngine;
import io.arbor.index.search.MatchedField;
import io.arbor.index.search.SearchHit;
import io.arbor.index.search.SearchScores;
import io.arbor.node.Node;
import io.arbor.service.navigate.Navigator;
import io.arbor.service.path.PathResolver;
import io.arbor.store.TableNodeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SearchEngineTest {

  private TableNodeStore store;

  private StepExecutor executor;

  private SearchEngine engine;

  @BeforeEach
  public void setUp() {
    store = ArborTestHelper.load(ArborTestHelper.resource(ArborTestHelper.SERVICES_JSON));
    final Navigator navigator = new Navigator(store, new BucketingEngine(1000), 20);
    executor = new StepExecutor();
    engine = new SearchEngine(store, new PathResolver(store, navigator), navigator, executor, 1);
  }

  @AfterEach
  public void tearDown() {
    engine.close();
    store.close();
  }

  @Test
  public void testSearchRunsInSlices() {
    final RecordingListener listener = new RecordingListener();
    final SearchTask task = engine.search("replicas", listener);
    assertEquals(SearchState.SEARCHING, engine.getState());

    assertTrue(executor.step());
    assertEquals(SearchState.SEARCHING, engine.getState());
    assertTrue(executor.pending() <= 1);
    executor.runAll();

    assertEquals(SearchState.MATCHES_FOUND, engine.getState());
    assertEquals(List.of(5L, 14L, 22L), ids(engine.getMatches()));
    assertEquals(List.of(5L, 14L, 22L), ids(listener.hits));
    assertEquals(List.of(SearchState.MATCHES_FOUND), listener.states);
    assertEquals(SearchState.MATCHES_FOUND, task.completion().join());
  }

  @Test
  public void testSearchLeavesIndexWorkToTheExecutor() {
    final long scans = store.searchIndex().getCandidateScans();
    final RecordingListener listener = new RecordingListener();
    final SearchTask task = engine.search("replicas", listener);

    assertEquals(scans, store.searchIndex().getCandidateScans());
    assertEquals(1, executor.pending());
    assertTrue(listener.hits.isEmpty());
    assertFalse(task.completion().isDone());

    assertTrue(executor.step());
    assertEquals(scans + 1, store.searchIndex().getCandidateScans());
    assertTrue(listener.hits.isEmpty());

    executor.runAll();
    assertEquals(scans + 5, store.searchIndex().getCandidateScans());
    assertEquals(List.of(5L, 14L, 22L), ids(listener.hits));
  }

  @Test
  public void testPathInputIsResolvedOnTheExecutor() {
    store.close();
    final SearchTask task = engine.search(".services[1].name", new RecordingListener());
    assertEquals(SearchState.SEARCHING, engine.getState());
    assertFalse(task.completion().isDone());

    executor.runAll();
    assertTrue(task.completion().isCompletedExceptionally());
    assertEquals(SearchState.NO_MATCHES, engine.getState());
  }

  @Test
  public void testNoMatches() {
    final RecordingListener listener = new RecordingListener();
    final SearchTask task = engine.search("zz-not-there", listener);
    executor.runAll();
    assertEquals(SearchState.NO_MATCHES, engine.getState());
    assertEquals(SearchState.NO_MATCHES, task.completion().join());
    assertTrue(listener.hits.isEmpty());
    assertTrue(engine.next().isEmpty());
  }

  @Test
  public void testNewSearchCancelsTheRunningOne() {
    final RecordingListener first = new RecordingListener();
    final SearchTask firstTask = engine.search("api-gateway-7", first);
    executor.step();
    final int deliveredBeforeCancel = first.hits.size();

    final RecordingListener second = new RecordingListener();
    engine.search("replicas", second);
    assertTrue(firstTask.isCancelled());
    assertEquals(SearchState.IDLE, firstTask.completion().join());

    executor.runAll();
    assertEquals(deliveredBeforeCancel, first.hits.size());
    assertTrue(first.states.isEmpty());
    assertEquals(List.of(5L, 14L, 22L), ids(engine.getMatches()));
    assertEquals(List.of(SearchState.MATCHES_FOUND), second.states);
  }

  @Test
  public void testCancel() {
    final RecordingListener listener = new RecordingListener();
    final SearchTask task = engine.search("tier", listener);
    executor.step();
    engine.cancel();

    assertEquals(SearchState.IDLE, engine.getState());
    assertTrue(engine.getMatches().isEmpty());
    assertEquals(SearchState.IDLE, task.completion().join());
    executor.runAll();
    assertEquals(SearchState.IDLE, engine.getState());
    assertTrue(listener.states.isEmpty());
  }

  @Test
  public void testCyclingWrapsAround() {
    engine.search("replicas", new RecordingListener());
    executor.runAll();

    assertEquals(5L, engine.next().orElseThrow().getNode().getId());
    final MatchSelection second = engine.next().orElseThrow();
    assertEquals(14L, second.getNode().getId());
    assertEquals(1, second.getIndex());
    assertEquals(3, second.getTotal());
    assertEquals(List.of(".", ".services", ".services[1]"),
        second.getAncestorsToExpand().stream().map(Node::getPath).collect(Collectors.toList()));
    assertEquals(22L, engine.next().orElseThrow().getNode().getId());
    assertEquals(5L, engine.next().orElseThrow().getNode().getId());
    assertEquals(22L, engine.previous().orElseThrow().getNode().getId());
  }

  @Test
  public void testPreviousStartsAtTheLastMatch() {
    engine.search("replicas", new RecordingListener());
    executor.runAll();
    assertEquals(22L, engine.previous().orElseThrow().getNode().getId());
  }

  @Test
  public void testPathInputJumpsToTheTarget() {
    final RecordingListener listener = new RecordingListener();
    engine.search(".services[1].name", listener);
    executor.runAll();

    assertEquals(SearchState.MATCHES_FOUND, engine.getState());
    assertEquals(List.of(new SearchHit(13, MatchedField.PATH, SearchScores.PATH_RESOLVED)), engine.getMatches());
    assertEquals("billing", engine.next().orElseThrow().getNode().getValue());
  }

  @Test
  public void testUnresolvablePathInputIsSearchedAsText() {
    engine.search(".labels.tier", new RecordingListener());
    executor.runAll();
    assertEquals(List.of(10L, 18L), ids(engine.getMatches()));
    assertTrue(engine.getMatches().stream().allMatch(hit -> hit.getMatchedField() == MatchedField.PATH));
  }

  @Test
  public void testFindNextAndPrevious() {
    assertEquals(14L, engine.findNext("replicas", 5).orElseThrow().getNode().getId());
    assertEquals(5L, engine.findNext("replicas", 22).orElseThrow().getNode().getId());
    assertEquals(22L, engine.findPrevious("replicas", 5).orElseThrow().getNode().getId());
    assertTrue(engine.findNext("zz-not-there", -1).isEmpty());
  }

  @Test
  public void testInvalidUse() {
    assertThrows(IllegalArgumentException.class, () -> engine.search("  ", new RecordingListener()));
    engine.close();
    assertThrows(IllegalStateException.class, () -> engine.search("tier", new RecordingListener()));
  }

  @Test
  public void testFailingListenerFailsTheTask() {
    final SearchTask task = engine.search("replicas", (unused, batch) -> {
      throw new IllegalStateException("boom");
    });
    executor.runAll();
    assertTrue(task.completion().isCompletedExceptionally());
    assertEquals(0, executor.pending());
    assertEquals(SearchState.MATCHES_FOUND, engine.getState());
    assertEquals(List.of(5L), ids(engine.getMatches()));
  }

  private static List<Long> ids(final List<SearchHit> hits) {
    return hits.stream().map(SearchHit::getNodeId).collect(Collectors.toList());
  }

  /**
   * Executor running queued tasks only when asked to.
   */
  private static final class StepExecutor implements Executor {
    private final Queue<Runnable> queue = new ArrayDeque<>();

    @Override
    public void execute(final Runnable command) {
      queue.add(command);
    }

    boolean step() {
      final Runnable next = queue.poll();
      if (next == null) {
        return false;
      }
      next.run();
      return true;
    }

    void runAll() {
      while (step()) {
        // Run until no task resubmits itself.
      }
    }

    int pending() {
      return queue.size();
    }
  }

  /**
   * Listener recording all callbacks.
   */
  private static final class RecordingListener implements SearchListener {
    final List<SearchHit> hits = new ArrayList<>();

    final List<SearchState> states = new ArrayList<>();

    @Override
    public void onMatches(final SearchTask task, final List<SearchHit> batch) {
      hits.addAll(batch);
    }

    @Override
    public void onComplete(final SearchTask task, final SearchState state) {
      states.add(state);
    }
  }
}
