package com.eliteorm.reactive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusCode;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.Dao;
import com.eliteorm.db.InMemoryStore;
import com.eliteorm.db.Repository;
import com.eliteorm.fixtures.Release;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.Disposable;
import reactor.core.publisher.BaseSubscriber;
import reactor.test.StepVerifier;

public class EntityPublisherTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private EntityPublisher<Release> publisher;

  @BeforeEach
  void setUp() {
    publisher = new EntityPublisher<>(new Dao<>(new Release(), new InMemoryStore()));
  }

  @Test
  public void testEveryMutationPublishesTheFullTable() {
    StepVerifier.create(publisher.all())
        .then(() -> publisher.create(new Release("A", 2000, 1)))
        .expectNext(List.of(new Release("A", 2000, 1)))
        .then(() -> publisher.create(new Release("A", 2001, 2)))
        .expectNext(List.of(new Release("A", 2000, 1), new Release("A", 2001, 2)))
        .then(() -> publisher.update(new Release("A", 2001, 5)))
        .expectNext(List.of(new Release("A", 2000, 1), new Release("A", 2001, 5)))
        .then(() -> publisher.delete(new Release("A", 2000, 1)))
        .expectNext(List.of(new Release("A", 2001, 5)))
        .then(() -> publisher.deleteAll())
        .expectNext(List.of())
        .then(publisher::dispose)
        .expectComplete()
        .verify(TIMEOUT);
  }

  @Test
  public void testSlowSubscriberReceivesEverySnapshot() {
    // Given: A subscriber that asks for one snapshot at a time
    List<List<Release>> received = new ArrayList<>();
    BaseSubscriber<List<Release>> subscriber =
        new BaseSubscriber<>() {
          @Override
          protected void hookOnSubscribe(Subscription subscription) {
            request(1);
          }

          @Override
          protected void hookOnNext(List<Release> snapshot) {
            received.add(snapshot);
          }
        };
    publisher.all().subscribe(subscriber);

    // When: Two snapshots are published before it asks for the second
    publisher.create(new Release("A", 2000, 1));
    publisher.create(new Release("B", 2000, 1));
    subscriber.request(1);

    // Then: Both arrive in order
    assertEquals(
        List.of(
            List.of(new Release("A", 2000, 1)),
            List.of(new Release("A", 2000, 1), new Release("B", 2000, 1))),
        received);
    subscriber.dispose();
  }

  @Test
  public void testGetPublishes() {
    StepVerifier.create(publisher.all())
        .then(() -> publisher.get())
        .expectNext(List.of())
        .thenCancel()
        .verify(TIMEOUT);
  }

  @Test
  public void testFailedMutationPublishesNothing() {
    List<List<Release>> received = new ArrayList<>();
    Disposable subscription = publisher.all().subscribe(received::add);

    StatusOr<Integer> update = publisher.update(new Release("missing", 1, 1));
    StatusOr<Integer> delete = publisher.delete(42);

    assertEquals(StatusCode.NOT_FOUND, update.getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, delete.getStatus().getCode());
    assertTrue(received.isEmpty(), "Nothing should be published: " + received);
    subscription.dispose();
  }

  @Test
  public void testSnapshotsWithoutSubscribersAreDropped() {
    publisher.create(new Release("A", 2000, 1));

    StepVerifier.create(publisher.all())
        .then(() -> publisher.create(new Release("B", 2000, 1)))
        .expectNext(List.of(new Release("A", 2000, 1), new Release("B", 2000, 1)))
        .thenCancel()
        .verify(TIMEOUT);
  }

  @Test
  public void testReloadFailureIsReturned() {
    // Given: A repository whose mutation succeeds but whose reload fails
    @SuppressWarnings("unchecked")
    Repository<Release> repository = mock(Repository.class);
    Release release = new Release("A", 2000, 1);
    when(repository.create(release)).thenReturn(StatusOr.ofValue(1L));
    when(repository.get())
        .thenReturn(StatusOr.ofStatus(Status.internal("gone", new SQLException("gone"))));
    EntityPublisher<Release> failing = new EntityPublisher<>(repository);
    List<List<Release>> received = new ArrayList<>();
    Disposable subscription = failing.all().subscribe(received::add);

    // When: We create an object
    StatusOr<Long> result = failing.create(release);

    // Then: The reload failure is reported and nothing is published
    assertEquals(StatusCode.INTERNAL, result.getStatus().getCode());
    assertTrue(received.isEmpty());
    subscription.dispose();
  }

  @Test
  public void testDisposeCompletesAndRejectsFurtherCalls() {
    StepVerifier.create(publisher.all()).then(publisher::dispose).verifyComplete();

    assertThrows(IllegalStateException.class, () -> publisher.get());
    assertThrows(IllegalStateException.class, () -> publisher.create(new Release("A", 1, 1)));
    assertThrows(IllegalStateException.class, () -> publisher.deleteAll());
    assertThrows(IllegalStateException.class, publisher::dispose);
  }

  @Test
  public void testLateSubscriberSeesCompletion() {
    publisher.dispose();

    StepVerifier.create(publisher.all()).verifyComplete();
  }
}
