package io.arbor.index.search;

import io.arbor.ArborTestHelper;
import io.arbor.service.ingest.IndexingStrategy;
import io.arbor.store.TableNodeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SearchIndexTest {

  private TableNodeStore store;

  @BeforeEach
  public void setUp() {
    store = ArborTestHelper.load(ArborTestHelper.resource(ArborTestHelper.SERVICES_JSON));
  }

  @AfterEach
  public void tearDown() {
    store.close();
  }

  @Test
  public void testHitsAreOrderedByScoreThenDocumentOrder() {
    final List<SearchHit> hits = store.searchIndex().search("api-gateway-7").drain();

    assertEquals(List.of(
        new SearchHit(25, MatchedField.KEY, SearchScores.KEY_EQUALS),
        new SearchHit(4, MatchedField.VALUE, SearchScores.VALUE_EQUALS),
        new SearchHit(19, MatchedField.VALUE, SearchScores.VALUE_EQUALS),
        new SearchHit(21, MatchedField.VALUE, SearchScores.VALUE_CONTAINS),
        new SearchHit(26, MatchedField.PATH, SearchScores.PATH_CONTAINS),
        new SearchHit(27, MatchedField.PATH, SearchScores.PATH_CONTAINS)), hits);
  }

  @Test
  public void testSearchIsCaseInsensitive() {
    final List<SearchHit> hits = store.searchIndex().search("PROD-EU").drain();
    assertEquals(new SearchHit(1, MatchedField.VALUE, SearchScores.VALUE_EQUALS), hits.get(0));
  }

  @ParameterizedTest
  @ValueSource(strings = { "api-gateway-7", "gateway", "ateway-", "-7", "tier", "er", "a.b", "c d", "0",
      "[0]", ".services[1]", "\"", "8", "0.75", "latfor", "zz-not-there", "."})
  public void testCompleteness(final String query) {
    assertCompleteAndOrdered(store, query);
  }

  @Test
  public void testCompletenessWithSingleRowInserts() {
    try (final TableNodeStore perRow = ArborTestHelper.load(ArborTestHelper.resource(ArborTestHelper.SERVICES_JSON),
        IndexingStrategy.PER_ROW)) {
      for (final String query : List.of("api-gateway-7", "tier", "services", "8")) {
        assertCompleteAndOrdered(perRow, query);
      }
    }
  }

  private static void assertCompleteAndOrdered(final TableNodeStore store, final String query) {
    final String normalized = SearchScores.normalize(query);
    final Set<SearchHit> expected = new HashSet<>();
    for (long id = 0; id < store.size(); id++) {
      final SearchHit hit = SearchScores.score(store.getNode(id), normalized);
      if (hit != null) {
        expected.add(hit);
      }
    }

    final List<SearchHit> hits = store.searchIndex().search(query).drain();
    assertEquals(expected, new HashSet<>(hits), query);
    assertEquals(hits.size(), new HashSet<>(hits).size(), "duplicate hits for " + query);
    for (int i = 1; i < hits.size(); i++) {
      final SearchHit previous = hits.get(i - 1);
      final SearchHit current = hits.get(i);
      assertTrue(previous.getScore() > current.getScore()
          || (previous.getScore() == current.getScore() && previous.getNodeId() < current.getNodeId()), query);
    }
  }

  @Test
  public void testCursorAdvancesInSlices() {
    final List<SearchHit> all = store.searchIndex().search("tier").drain();
    final List<SearchHit> sliced = new ArrayList<>();
    try (final SearchCursor cursor = store.searchIndex().search("tier")) {
      while (!cursor.isExhausted()) {
        final int examined = cursor.advance(1, sliced::add);
        assertTrue(examined <= 1);
      }
      assertEquals(0, cursor.advance(5, sliced::add));
    }
    assertEquals(all, sliced);
  }

  @Test
  public void testTierCandidatesAreLookedUpOnDemand() {
    final SearchIndex index = store.searchIndex();
    final long scans = index.getCandidateScans();
    final List<SearchHit> hits = new ArrayList<>();
    try (final SearchCursor cursor = index.search("replicas")) {
      assertEquals(scans, index.getCandidateScans());

      assertEquals(0, cursor.advance(10, hits::add));
      assertEquals(scans + 1, index.getCandidateScans());
      assertTrue(hits.isEmpty());

      assertEquals(3, cursor.advance(10, hits::add));
      assertEquals(scans + 2, index.getCandidateScans());
      assertEquals(3, hits.size());
    }
    assertEquals(scans + 2, index.getCandidateScans());
  }

  @Test
  public void testClosedCursorIsExhausted() {
    final SearchCursor cursor = store.searchIndex().search("tier");
    cursor.close();
    cursor.close();
    assertTrue(cursor.isExhausted());
    assertTrue(cursor.drain().isEmpty());
  }

  @Test
  public void testNextAndPreviousMatchWrapAround() {
    final SearchIndex index = store.searchIndex();
    final List<Long> ids = index.search("replicas").drain().stream().map(SearchHit::getNodeId).sorted()
                                .collect(Collectors.toList());
    assertEquals(List.of(5L, 14L, 22L), ids);

    assertEquals(5L, index.nextMatch("replicas", -1).orElseThrow().getNodeId());
    assertEquals(14L, index.nextMatch("replicas", 5).orElseThrow().getNodeId());
    assertEquals(5L, index.nextMatch("replicas", 22).orElseThrow().getNodeId());

    assertEquals(22L, index.prevMatch("replicas", -1).orElseThrow().getNodeId());
    assertEquals(5L, index.prevMatch("replicas", 14).orElseThrow().getNodeId());
    assertEquals(22L, index.prevMatch("replicas", 5).orElseThrow().getNodeId());

    assertTrue(index.nextMatch("zz-not-there", -1).isEmpty());
    assertTrue(index.prevMatch("zz-not-there", -1).isEmpty());
  }

  @Test
  public void testMatch() {
    assertEquals(new SearchHit(13, MatchedField.VALUE, SearchScores.VALUE_EQUALS), store.searchIndex().match(13, "Billing"));
    assertNull(store.searchIndex().match(13, "gateway"));
  }

  @Test
  public void testBlankQueriesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> store.searchIndex().search(" "));
    assertThrows(IllegalArgumentException.class, () -> store.searchIndex().nextMatch("", 0));
  }

  @Test
  public void testConsistency() {
    assertTrue(store.searchIndex().verifyConsistency());
    assertEquals(store.size(), store.searchIndex().rowCount());
  }
}
