package com.eliteorm.reactive;

import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.Dao;
import com.eliteorm.db.Repository;
import com.eliteorm.model.Entity;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import org.tinylog.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Keeps subscribers in step with a table: every successful create, update or delete is followed by
 * a full reload of the table, and the reloaded list is broadcast on {@link #all()}.
 *
 * <p>The channel is a multicast without replay. Subscribers receive the lists published after they
 * subscribed, buffered per subscriber until requested; lists published while nobody listens are
 * dropped. A failed operation publishes
 * nothing. After {@link #dispose()} the channel completes and every further call throws
 * {@link IllegalStateException}.
 *
 * <p>Operations block the calling thread on the store. A reload is not atomic with the mutation
 * before it, so concurrent callers may observe each other's intermediate states.
 *
 * @param <T> the entity type
 */
public final class EntityPublisher<T extends Entity<T>> {
  private final Repository<T> repository;
  private final Sinks.Many<List<T>> sink = Sinks.many().multicast().directBestEffort();
  private volatile boolean disposed;

  public EntityPublisher(Dao<T> dao) {
    this(new Repository<>(dao));
  }

  public EntityPublisher(Repository<T> repository) {
    this.repository = repository;
  }

  /** The stream of full table snapshots. Each subscriber gets its own unbounded buffer. */
  @Nonnull
  public Flux<List<T>> all() {
    return sink.asFlux().onBackpressureBuffer();
  }

  /**
   * Reloads the table and publishes the result.
   *
   * @return StatusOr containing the published list, or the load failure (nothing published)
   */
  @Nonnull
  public StatusOr<List<T>> get() {
    checkNotDisposed();
    StatusOr<List<T>> allOr = repository.get();
    if (allOr.isNotOk()) {
      Logger.warn("Reload failed, nothing published: {}", allOr.getStatus());
      return allOr;
    }
    publish(allOr.getValue());
    return allOr;
  }

  /** Stores a new object, then reloads and publishes. */
  @Nonnull
  public StatusOr<Long> create(T obj) {
    return mutate(() -> repository.create(obj));
  }

  /** Overwrites the stored object with the same primary key, then reloads and publishes. */
  @Nonnull
  public StatusOr<Integer> update(T obj) {
    return mutate(() -> repository.update(obj));
  }

  /**
   * Removes the objects matching {@code target} (an object of type {@code T} or a first-column
   * value), then reloads and publishes.
   */
  @Nonnull
  public StatusOr<Integer> delete(Object target) {
    return mutate(() -> repository.delete(target));
  }

  /** Removes every object, then reloads and publishes. */
  @Nonnull
  public StatusOr<Integer> deleteAll() {
    return mutate(repository::deleteAll);
  }

  /** Completes the channel. Subsequent calls on this publisher throw. */
  public synchronized void dispose() {
    checkNotDisposed();
    disposed = true;
    sink.tryEmitComplete();
    Logger.info("Entity publisher disposed");
  }

  /**
   * Runs a mutation and reloads on success. When the mutation succeeds but the reload fails, the
   * reload failure is returned so the caller knows no fresh list went out.
   */
  private <R> StatusOr<R> mutate(Supplier<StatusOr<R>> operation) {
    checkNotDisposed();
    StatusOr<R> resultOr = operation.get();
    if (resultOr.isNotOk()) {
      return resultOr;
    }
    StatusOr<List<T>> reloadOr = get();
    if (reloadOr.isNotOk()) {
      return StatusOr.ofStatus(reloadOr.getStatus());
    }
    return resultOr;
  }

  private synchronized void publish(List<T> snapshot) {
    checkNotDisposed();
    Sinks.EmitResult result = sink.tryEmitNext(snapshot);
    if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
      throw new IllegalStateException("Could not publish snapshot: " + result);
    }
    if (result.isFailure()) {
      // no subscriber
      Logger.debug("Snapshot of {} objects dropped: {}", snapshot.size(), result);
    }
  }

  private void checkNotDisposed() {
    Preconditions.checkState(!disposed, "EntityPublisher has been disposed");
  }
}
