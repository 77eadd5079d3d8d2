package io.arbor.index.bucket;

import io.arbor.settings.Fixed;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Presents parents with more than {@code threshold} children through bucket nodes.
 *
 * <p>A range of {@code length > threshold} children is split at multiples of a span, the smallest
 * power {@code threshold^k} ({@code k >= 1}) that yields at most {@code threshold} buckets. A
 * bucket which is still larger than the threshold is split the same way, so every level of the
 * presented tree has at most {@code threshold} entries.
 *
 * <p>Buckets are interned per {@code (parentId, start, end)} for the lifetime of the engine.
 * Ids are negative and count down from {@code -2}.
 */
public final class BucketingEngine {

  private final int threshold;

  private final ConcurrentMap<BucketKey, Bucket> bucketsByRange = new ConcurrentHashMap<>();

  private final ConcurrentMap<Long, Bucket> bucketsById = new ConcurrentHashMap<>();

  private final AtomicLong nextId = new AtomicLong(Fixed.FIRST_BUCKET_ID.getStandardProperty());

  public BucketingEngine(final int threshold) {
    checkArgument(threshold >= 2, "threshold must be >= 2");
    this.threshold = threshold;
  }

  public int getThreshold() {
    return threshold;
  }

  public boolean needsBuckets(final long childCount) {
    return childCount > threshold;
  }

  /**
   * Width of the buckets a range of {@code length} children is split into.
   *
   * @param length number of children, larger than the threshold
   * @return the span
   */
  public long span(final long length) {
    checkArgument(length > threshold, "A range of %s needs no buckets.", length);
    long span = threshold;
    while ((length + span - 1) / span > threshold) {
      span = Math.multiplyExact(span, threshold);
    }
    return span;
  }

  /**
   * Buckets of the children {@code start ... start + length - 1} of a real parent.
   *
   * @param parentId the real parent
   * @param start first position of the range
   * @param length length of the range, larger than the threshold
   * @param apparentParentId the node the buckets are shown under
   * @return the buckets in order
   */
  public List<Bucket> buckets(final long parentId, final long start, final long length,
      final long apparentParentId) {
    final long span = span(length);
    final long end = start + length;
    final List<Bucket> buckets = new ArrayList<>((int) ((length + span - 1) / span));
    int rank = 0;
    for (long bucketStart = start; bucketStart < end; bucketStart += span) {
      final long bucketEnd = Math.min(end, bucketStart + span) - 1;
      buckets.add(intern(parentId, bucketStart, bucketEnd, apparentParentId, rank++));
    }
    return buckets;
  }

  /**
   * The bucket of a range, creating it if needed.
   */
  private Bucket intern(final long parentId, final long start, final long end, final long apparentParentId,
      final int rank) {
    return bucketsByRange.computeIfAbsent(new BucketKey(parentId, start, end), key -> {
      final Bucket bucket = new Bucket(nextId.getAndDecrement(), parentId, apparentParentId, start, end, rank);
      bucketsById.put(bucket.getId(), bucket);
      return bucket;
    });
  }

  /**
   * Look up a bucket handed out by this engine.
   *
   * @param bucketId the id
   * @return the bucket, empty if the id is unknown
   */
  public Optional<Bucket> getBucket(final long bucketId) {
    return Optional.ofNullable(bucketsById.get(bucketId));
  }

  public static boolean isBucketId(final long id) {
    return id <= Fixed.FIRST_BUCKET_ID.getStandardProperty();
  }

  /**
   * Buckets containing the child at a position of a parent with {@code childCount} children,
   * outermost first. Empty if the parent is not bucketed.
   *
   * @param parentId the real parent
   * @param childCount number of children of the parent
   * @param position position of the child
   * @return the bucket chain
   */
  public List<Bucket> bucketChain(final long parentId, final long childCount, final long position) {
    checkArgument(position >= 0 && position < childCount, "position %s outside 0..%s", position, childCount - 1);
    final List<Bucket> chain = new ArrayList<>();
    long start = 0;
    long length = childCount;
    long apparentParentId = parentId;
    while (needsBuckets(length)) {
      final long span = span(length);
      final long index = (position - start) / span;
      final long bucketStart = start + index * span;
      final long bucketEnd = Math.min(start + length, bucketStart + span) - 1;
      final Bucket bucket = intern(parentId, bucketStart, bucketEnd, apparentParentId, (int) index);
      chain.add(bucket);
      start = bucketStart;
      length = bucket.length();
      apparentParentId = bucket.getId();
    }
    return chain;
  }

  /**
   * Number of buckets handed out so far.
   *
   * @return the count
   */
  public int size() {
    return bucketsById.size();
  }

  /**
   * Identity of a bucket.
   */
  private static final class BucketKey {
    private final long parentId;

    private final long start;

    private final long end;

    BucketKey(final long parentId, final long start, final long end) {
      this.parentId = parentId;
      this.start = start;
      this.end = end;
    }

    @Override
    public boolean equals(final Object other) {
      if (!(other instanceof BucketKey)) {
        return false;
      }
      final BucketKey key = (BucketKey) other;
      return parentId == key.parentId && start == key.start && end == key.end;
    }

    @Override
    public int hashCode() {
      return Objects.hash(parentId, start, end);
    }
  }
}
