package io.arbor.index.bucket;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class BucketingEngineTest {

  @Test
  public void testSpan() {
    final BucketingEngine engine = new BucketingEngine(1000);
    assertFalse(engine.needsBuckets(1000));
    assertTrue(engine.needsBuckets(1001));
    assertEquals(1000, engine.span(2500));
    assertEquals(1000, engine.span(1_000_000));
    assertEquals(1_000_000, engine.span(1_000_001));
    assertThrows(IllegalArgumentException.class, () -> engine.span(1000));
  }

  @Test
  public void testBucketsOfAFlatRange() {
    final BucketingEngine engine = new BucketingEngine(1000);
    final List<Bucket> buckets = engine.buckets(7, 0, 2500, 7);

    assertEquals(3, buckets.size());
    assertEquals("[0 … 999]", buckets.get(0).getLabel());
    assertEquals("[1000 … 1999]", buckets.get(1).getLabel());
    assertEquals("[2000 … 2499]", buckets.get(2).getLabel());
    assertEquals(500, buckets.get(2).length());
    for (int i = 0; i < buckets.size(); i++) {
      final Bucket bucket = buckets.get(i);
      assertTrue(BucketingEngine.isBucketId(bucket.getId()));
      assertEquals(7, bucket.getParentId());
      assertEquals(7, bucket.getApparentParentId());
      assertEquals(i, bucket.getRank());
      assertSame(bucket, engine.getBucket(bucket.getId()).orElseThrow());
    }
    assertNotEquals(buckets.get(0).getId(), buckets.get(1).getId());
  }

  @Test
  public void testBucketsAreInterned() {
    final BucketingEngine engine = new BucketingEngine(1000);
    final List<Bucket> first = engine.buckets(7, 0, 2500, 7);
    final List<Bucket> second = engine.buckets(7, 0, 2500, 7);
    assertEquals(first, second);
    assertEquals(3, engine.size());

    engine.buckets(8, 0, 2500, 8);
    assertEquals(6, engine.size());
  }

  @Test
  public void testBucketChain() {
    final BucketingEngine engine = new BucketingEngine(10);
    final List<Bucket> chain = engine.bucketChain(3, 250, 157);

    assertEquals(2, chain.size());
    final Bucket outer = chain.get(0);
    final Bucket inner = chain.get(1);
    assertEquals(100, outer.getStart());
    assertEquals(199, outer.getEnd());
    assertEquals(3, outer.getApparentParentId());
    assertEquals(1, outer.getRank());
    assertEquals(150, inner.getStart());
    assertEquals(159, inner.getEnd());
    assertEquals(outer.getId(), inner.getApparentParentId());
    assertEquals(5, inner.getRank());
    assertTrue(inner.contains(157));

    assertSame(outer, engine.buckets(3, 0, 250, 3).get(1));
    assertSame(inner, engine.buckets(3, 100, 100, outer.getId()).get(5));
  }

  @Test
  public void testNoChainBelowTheThreshold() {
    final BucketingEngine engine = new BucketingEngine(10);
    assertTrue(engine.bucketChain(3, 10, 4).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> engine.bucketChain(3, 10, 10));
  }

  @Test
  public void testUnknownBucket() {
    assertTrue(new BucketingEngine(10).getBucket(-2).isEmpty());
    assertFalse(BucketingEngine.isBucketId(-1));
    assertFalse(BucketingEngine.isBucketId(0));
  }
}
