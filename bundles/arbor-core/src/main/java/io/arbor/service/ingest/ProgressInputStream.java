package io.arbor.service.ingest;

import com.google.common.io.CountingInputStream;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import static java.util.Objects.requireNonNull;

/**
 * Input stream reporting the number of bytes read to an {@link IngestionListener}, at most once
 * per {@link #REPORT_INTERVAL} bytes and once at the end.
 */
public final class ProgressInputStream extends FilterInputStream {

  /** Bytes between two progress reports. */
  public static final long REPORT_INTERVAL = 1L << 20;

  private final CountingInputStream counter;

  private final long totalBytes;

  private final IngestionListener listener;

  private long nextReport = REPORT_INTERVAL;

  private boolean endReported;

  private ProgressInputStream(final CountingInputStream counter, final long totalBytes,
      final IngestionListener listener) {
    super(counter);
    this.counter = counter;
    this.totalBytes = totalBytes;
    this.listener = requireNonNull(listener);
  }

  /**
   * Wrap a stream.
   *
   * @param input the stream
   * @param totalBytes expected length, {@code -1} if unknown
   * @param listener the listener
   * @return the wrapping stream
   */
  public static ProgressInputStream wrap(final InputStream input, final long totalBytes,
      final IngestionListener listener) {
    return new ProgressInputStream(new CountingInputStream(requireNonNull(input)), totalBytes, listener);
  }

  @Override
  public int read() throws IOException {
    final int value = super.read();
    report(value < 0);
    return value;
  }

  @Override
  public int read(final byte[] bytes, final int offset, final int length) throws IOException {
    final int read = super.read(bytes, offset, length);
    report(read < 0);
    return read;
  }

  private void report(final boolean end) {
    final long count = counter.getCount();
    if (end) {
      if (!endReported) {
        endReported = true;
        listener.onProgress(count, totalBytes);
      }
    } else if (count >= nextReport) {
      nextReport = (count / REPORT_INTERVAL + 1) * REPORT_INTERVAL;
      listener.onProgress(count, totalBytes);
    }
  }
}
