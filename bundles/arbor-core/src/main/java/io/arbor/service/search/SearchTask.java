package io.arbor.service.search;

import io.arbor.index.search.SearchCursor;
import io.arbor.index.search.SearchHit;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * One cooperative search run. Every execution verifies one slice of candidates, delivers the hits
 * and resubmits the task, so a long scan never holds the executor and cancellation takes effect
 * at the next slice boundary. The first execution resolves path input and opens the cursor.
 */
public final class SearchTask implements Runnable {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(SearchTask.class));

  private final SearchEngine engine;

  private final long generation;

  private final String query;

  /** Set by the first execution. */
  private @Nullable SearchCursor cursor;

  private @Nullable SearchHit jump;

  private boolean started;

  private final SearchListener listener;

  private final Executor executor;

  private final int chunkSize;

  private final AtomicBoolean cancelled = new AtomicBoolean();

  private final CompletableFuture<SearchState> completion = new CompletableFuture<>();

  SearchTask(final SearchEngine engine, final long generation, final String query, final SearchListener listener,
      final Executor executor, final int chunkSize) {
    this.engine = requireNonNull(engine);
    this.generation = generation;
    this.query = requireNonNull(query);
    this.listener = requireNonNull(listener);
    this.executor = requireNonNull(executor);
    this.chunkSize = chunkSize;
  }

  @Override
  public void run() {
    if (cancelled.get()) {
      release();
      return;
    }
    try {
      if (!started) {
        started = true;
        jump = engine.tryJump(query.strip());
        if (jump == null) {
          cursor = engine.openCursor(query);
        }
      }
      if (jump != null) {
        engine.deliver(this, List.of(jump));
        engine.complete(this);
        return;
      }
      final List<SearchHit> batch = new ArrayList<>();
      cursor.advance(chunkSize, batch::add);
      if (!batch.isEmpty() && !engine.deliver(this, batch)) {
        cancel();
        release();
        return;
      }
      if (cursor.isExhausted()) {
        release();
        engine.complete(this);
        return;
      }
      executor.execute(this);
    } catch (final RejectedExecutionException e) {
      LOGWRAPPER.debug("Search for '{}' stopped, the executor is shut down.", query);
      cancel();
      release();
    } catch (final RuntimeException e) {
      LOGWRAPPER.error("Search for '{}' failed: {}", query, e.getMessage());
      release();
      engine.fail(this, e);
    }
  }

  private void release() {
    if (cursor != null) {
      cursor.close();
    }
  }

  /**
   * Stop the task at its next yield point. The completion future finishes with
   * {@link SearchState#IDLE}.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      completion.complete(SearchState.IDLE);
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public String getQuery() {
    return query;
  }

  long getGeneration() {
    return generation;
  }

  SearchListener getListener() {
    return listener;
  }

  /**
   * Completes with the final state of the task, or exceptionally if the scan failed.
   *
   * @return the completion
   */
  public CompletableFuture<SearchState> completion() {
    return completion;
  }
}
