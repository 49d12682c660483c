/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package retlog.streaming;

import com.google.common.collect.ImmutableList;
import org.jetlang.fibers.Fiber;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import retlog.RetlogCommonTestUtil;
import retlog.decoding.ChangeRecordWriter;
import retlog.decoding.LogicalDecoder;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.decoding.Decoder;
import retlog.interfaces.decoding.Operation;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.log.RecordKind;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;
import retlog.interfaces.streaming.ConsumerChannel;
import retlog.interfaces.streaming.SessionEvent;
import retlog.interfaces.streaming.SnapshotSource;
import retlog.interfaces.streaming.StreamingSession.SlotTooFarBehind;
import retlog.interfaces.streaming.StreamingSession.State;
import retlog.log.SegmentedLogStore;
import retlog.slots.NioSlotTableReaderWriter;
import retlog.slots.PersistentSlotRegistry;
import retlog.util.JUnitRuleFiberExceptions;
import retlog.util.ThreadFiberSupplier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static retlog.AsyncChannelAsserts.ChannelListener;
import static retlog.AsyncChannelAsserts.assertEventually;
import static retlog.AsyncChannelAsserts.listenTo;
import static retlog.FutureMatchers.resultsIn;
import static retlog.FutureMatchers.resultsInException;
import static retlog.streaming.StreamingMatchers.aBatchOfTransaction;
import static retlog.streaming.StreamingMatchers.aClosingCausedBy;
import static retlog.streaming.StreamingMatchers.aTransitionTo;

public class StreamingSessionInstanceTest {
  private static final long SEGMENT_SIZE = 512;
  private static final int WAIT_SECONDS = 5;
  private static final SessionSettings SETTINGS = new SessionSettings(5, 5, 40, 0);
  private static final Publication EVERYTHING =
      Publication.forAllEntities("everything", EnumSet.allOf(Operation.class));
  private static final Decoder.Factory DECODERS = LogicalDecoder.factory(1000);

  @Rule
  public JUnitRuleFiberExceptions fiberExceptions = new JUnitRuleFiberExceptions();

  private final RetlogCommonTestUtil testUtil = new RetlogCommonTestUtil();
  private final List<StreamingSessionInstance> sessions = new ArrayList<>();
  private SegmentedLogStore store;
  private PersistentSlotRegistry registry;
  private ChangeRecordWriter writer;
  private BoundedConsumerChannel consumer;

  @Before
  public void openStoreAndRegistry() throws Exception {
    Path dataDirectory = testUtil.getDataTestDir("streaming-session-test");
    store = SegmentedLogStore.open(dataDirectory, SEGMENT_SIZE);
    registry = new PersistentSlotRegistry(new NioSlotTableReaderWriter(dataDirectory));
    writer = new ChangeRecordWriter(store);
    consumer = new BoundedConsumerChannel(16);
    registry.create("s1", SlotKind.LOGICAL);
  }

  @After
  public void stopSessionsAndCloseEverything() throws Exception {
    for (StreamingSessionInstance session : sessions) {
      session.stop().get(WAIT_SECONDS, TimeUnit.SECONDS);
      session.dispose();
    }
    registry.close();
    store.close();
    testUtil.cleanupTestDir();
  }

  @Test
  public void deliversCommittedTransactionsInCommitOrder() throws Exception {
    writer.insert(1, "accounts", image("first"));
    writer.insert(2, "accounts", image("second"));
    long secondCommit = writer.commit(2);
    long firstCommit = writer.commit(1);

    StreamingSessionInstance session = newSession("s1", EVERYTHING, consumer);
    assertThat(session.start(), resultsIn(equalTo(State.STREAMING)));

    ChangeBatch delivered = nextBatch();
    assertThat(delivered.getCommitSeq(), is(equalTo(secondCommit)));
    assertThat(delivered.getChanges().get(0).getAfterImage(), is(equalTo(image("second"))));
    assertThat(nextBatch().getCommitSeq(), is(equalTo(firstCommit)));
  }

  @Test
  public void neverDeliversAbortedTransactions() throws Exception {
    writer.insert(1, "accounts", image("rolled-back"));
    writer.abort(1);
    writer.insert(2, "accounts", image("kept"));
    writer.commit(2);

    startSession("s1", EVERYTHING, consumer);

    assertThat(nextBatch(), is(aBatchOfTransaction(2)));
  }

  @Test
  public void deliversTransactionsCommittedAfterTheSessionStarted() throws Exception {
    startSession("s1", EVERYTHING, consumer);

    writer.delete(4, "orders", image("o-1"));
    writer.commit(4);

    ChangeBatch delivered = nextBatch();
    assertThat(delivered, is(aBatchOfTransaction(4)));
    assertThat(delivered.getChanges().get(0).getOperation(), is(equalTo(Operation.DELETE)));
  }

  @Test
  public void acknowledgmentAdvancesALogicalSlotToTheCommit() throws Exception {
    writer.insert(1, "accounts", image("a"));
    long commit = writer.commit(1);
    StreamingSessionInstance session = startSession("s1", EVERYTHING, consumer);
    nextBatch();

    assertThat(session.acknowledge(commit), resultsIn(equalTo(commit)));
    assertThat(registry.get("s1").getRestartSeq(), is(equalTo(commit)));
    assertThat(registry.get("s1").getConfirmedSeq(), is(equalTo(commit)));
  }

  @Test
  public void acknowledgmentKeepsTheRestartPositionAtTheOldestOpenTransaction() throws Exception {
    long openTransactionStart = writer.insert(1, "accounts", image("still open"));
    writer.insert(2, "accounts", image("b"));
    long commit = writer.commit(2);
    StreamingSessionInstance session = startSession("s1", EVERYTHING, consumer);
    nextBatch();

    assertThat(session.acknowledge(commit), resultsIn(equalTo(commit)));
    assertThat(registry.get("s1").getRestartSeq(), is(equalTo(openTransactionStart)));
    assertThat(registry.get("s1").getConfirmedSeq(), is(equalTo(commit)));
  }

  @Test
  public void physicalSlotRestartLagsTheAcknowledgedCommit() throws Exception {
    registry.create("p1", SlotKind.PHYSICAL);
    for (long tx = 1; tx <= 3; tx++) {
      writer.insert(tx, "accounts", image("row"));
      writer.commit(tx);
    }
    StreamingSessionInstance session = newSession("p1", EVERYTHING, consumer, new SessionSettings(5, 5, 40, 3));
    session.start();
    nextBatch();
    nextBatch();
    ChangeBatch last = nextBatch();

    assertThat(session.acknowledge(last.getCommitSeq()), resultsIn(equalTo(last.getCommitSeq())));
    assertThat(registry.get("p1").getRestartSeq(), is(equalTo(last.getCommitSeq() - 3)));
  }

  @Test
  public void refusesToAcknowledgeWhatWasNotSent() throws Exception {
    StreamingSessionInstance session = startSession("s1", EVERYTHING, consumer);

    assertThat(session.acknowledge(1000), resultsInException(IllegalArgumentException.class));
  }

  @Test
  public void resumedSessionSkipsAcknowledgedTransactions() throws Exception {
    writer.insert(1, "accounts", image("a"));
    long firstCommit = writer.commit(1);
    StreamingSessionInstance first = startSession("s1", EVERYTHING, consumer);
    nextBatch();
    first.acknowledge(firstCommit).get(WAIT_SECONDS, TimeUnit.SECONDS);
    first.stop().get(WAIT_SECONDS, TimeUnit.SECONDS);

    writer.insert(2, "accounts", image("b"));
    writer.commit(2);
    consumer = new BoundedConsumerChannel(16);
    startSession("s1", EVERYTHING, consumer);

    assertThat(nextBatch(), is(aBatchOfTransaction(2)));
  }

  @Test
  public void unacknowledgedTransactionsAreDeliveredAgainToTheNextSession() throws Exception {
    writer.insert(1, "accounts", image("a"));
    writer.commit(1);
    StreamingSessionInstance first = startSession("s1", EVERYTHING, consumer);
    nextBatch();
    first.stop().get(WAIT_SECONDS, TimeUnit.SECONDS);

    consumer = new BoundedConsumerChannel(16);
    startSession("s1", EVERYTHING, consumer);

    assertThat(nextBatch(), is(aBatchOfTransaction(1)));
  }

  @Test
  public void failsWhenTheSlotPositionHasBeenReclaimed() throws Throwable {
    for (long tx = 1; tx <= 40; tx++) {
      writer.insert(tx, "accounts", image("filler filler filler"));
      writer.commit(tx);
    }
    store.roll();
    store.reclaim(store.lastSeq());
    assertThat(store.firstRetainedSeq() > 1, is(true));

    StreamingSessionInstance session = newSession("s1", EVERYTHING, consumer);
    ChannelListener<SessionEvent> events = listenTo(session.getEventChannel());

    assertThat(session.start(), resultsInException(SlotTooFarBehind.class));
    assertEventually(events, aClosingCausedBy(SlotTooFarBehind.class));
    assertThat(registry.get("s1").isActive(), is(false));
    events.dispose();
  }

  @Test
  public void startsASlotCreatedAtTheEndOfAFullyReclaimedLog() throws Exception {
    for (long tx = 1; tx <= 40; tx++) {
      writer.insert(tx, "accounts", image("filler filler filler"));
      writer.commit(tx);
    }
    store.roll();
    store.reclaim(Long.MAX_VALUE);
    long lastCommit = store.lastSeq();
    assertThat(store.firstRetainedSeq(), is(equalTo(lastCommit + 1)));
    registry.create("late", SlotKind.LOGICAL, lastCommit);

    StreamingSessionInstance session = newSession("late", EVERYTHING, consumer);
    assertThat(session.start(), resultsIn(equalTo(State.STREAMING)));

    writer.insert(41, "accounts", image("after the slot"));
    writer.commit(41);

    assertThat(nextBatch(), is(aBatchOfTransaction(41)));
  }

  @Test
  public void failsWhenAnOpenTransactionTheSlotStillNeedsHasBeenReclaimed() throws Throwable {
    for (long tx = 1; tx <= 40; tx++) {
      writer.insert(tx, "accounts", image("filler filler filler"));
      writer.commit(tx);
    }
    store.roll();
    long lastCommit = store.lastSeq();
    registry.create("open", SlotKind.LOGICAL, lastCommit - 1);
    registry.advance("open", lastCommit - 1, lastCommit);
    store.reclaim(Long.MAX_VALUE);

    StreamingSessionInstance session = newSession("open", EVERYTHING, consumer);

    assertThat(session.start(), resultsInException(SlotTooFarBehind.class));
  }

  @Test
  public void failsWhenTheSlotIsHeldByAnotherSession() throws Exception {
    registry.acquire("s1", "someone-else");

    StreamingSessionInstance session = newSession("s1", EVERYTHING, consumer);

    assertThat(session.start(), resultsInException(SlotRegistry.SlotBusy.class));
    assertThat(registry.get("s1").getHolderId(), is(equalTo("someone-else")));
  }

  @Test
  public void closesOnACorruptRecordAndReleasesTheSlot() throws Throwable {
    store.append(new byte[]{(byte) 0xff, (byte) 0xff, (byte) 0xff}, RecordKind.DATA);

    StreamingSessionInstance session = newSession("s1", EVERYTHING, consumer);
    ChannelListener<SessionEvent> events = listenTo(session.getEventChannel());
    session.start();

    assertEventually(events, aClosingCausedBy(Decoder.DecodeCorruption.class));
    assertThat(session.getFailure(), is(instanceOf(Decoder.DecodeCorruption.class)));
    waitUntil(() -> !isActive("s1"));
    events.dispose();
  }

  @Test
  public void stopReleasesButKeepsTheSlot() throws Exception {
    StreamingSessionInstance session = startSession("s1", EVERYTHING, consumer);
    assertThat(registry.get("s1").getHolderId(), is(equalTo(session.getSessionId())));

    assertThat(session.stop(), resultsIn(nullValue()));

    assertThat(session.getState(), is(equalTo(State.CLOSED)));
    assertThat(session.getFailure(), is(nullValue()));
    assertThat(registry.get("s1").isActive(), is(false));
    assertThat(consumer.isClosed(), is(true));
  }

  @Test
  public void backpressurePausesTheSessionWithoutLosingData() throws Throwable {
    consumer = new BoundedConsumerChannel(1);
    for (long tx = 1; tx <= 4; tx++) {
      writer.insert(tx, "accounts", image("row " + tx));
      writer.commit(tx);
    }
    StreamingSessionInstance session = newSession("s1", EVERYTHING, consumer);
    ChannelListener<SessionEvent> events = listenTo(session.getEventChannel());
    session.start();

    assertEventually(events, aTransitionTo(State.PAUSED));
    List<Long> received = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      received.add(nextBatch().getTransactionId());
    }

    assertThat(received, contains(1L, 2L, 3L, 4L));
    assertEventually(events, aTransitionTo(State.STREAMING));
    assertThat(consumer.poll(50, TimeUnit.MILLISECONDS), is(nullValue()));
    events.dispose();
  }

  @Test
  public void retriesTransportErrorsWithoutClosing() throws Exception {
    FlakyConsumerChannel flaky = new FlakyConsumerChannel(consumer, 3);
    writer.insert(1, "accounts", image("a"));
    writer.commit(1);
    writer.insert(2, "accounts", image("b"));
    writer.commit(2);

    StreamingSessionInstance session = startSession("s1", EVERYTHING, flaky);

    assertThat(nextBatch(), is(aBatchOfTransaction(1)));
    assertThat(nextBatch(), is(aBatchOfTransaction(2)));
    assertThat(flaky.failedPushes.get(), is(equalTo(3)));
    assertThat(session.getState(), is(equalTo(State.STREAMING)));
  }

  @Test
  public void operatorPauseStopsDeliveryUntilResumed() throws Throwable {
    StreamingSessionInstance session = startSession("s1", EVERYTHING, consumer);
    ChannelListener<SessionEvent> events = listenTo(session.getEventChannel());

    session.pause();
    assertEventually(events, aTransitionTo(State.PAUSED));
    writer.insert(1, "accounts", image("a"));
    writer.commit(1);
    assertThat(consumer.poll(100, TimeUnit.MILLISECONDS), is(nullValue()));

    session.resume();
    assertEventually(events, aTransitionTo(State.STREAMING));
    assertThat(nextBatch(), is(aBatchOfTransaction(1)));
    events.dispose();
  }

  @Test
  public void snapshotIsDeliveredFirstAndCoversEarlierTransactions() throws Exception {
    writer.insert(1, "accounts", image("before snapshot"));
    long snapshotSeq = writer.commit(1);
    SnapshotSource snapshotSource = () -> ImmutableList.of(
        new SnapshotSource.SnapshotRow("accounts", image("before snapshot")),
        new SnapshotSource.SnapshotRow("audit", image("not published")));
    Publication accountsOnly = Publication.forEntities("accounts-only", ImmutableList.of("accounts"),
        EnumSet.allOf(Operation.class));

    StreamingSessionInstance session = new StreamingSessionInstance("snap", "s1", accountsOnly,
        newFiber(), store, registry, DECODERS, consumer, snapshotSource, true, SETTINGS);
    sessions.add(session);
    assertThat(session.start(), resultsIn(equalTo(State.STREAMING)));

    ChangeBatch snapshot = nextBatch();
    assertThat(snapshot.getCommitSeq(), is(equalTo(snapshotSeq)));
    assertThat(snapshot.getChanges().size(), is(equalTo(1)));
    assertThat(snapshot.getChanges().get(0).getOperation(), is(equalTo(Operation.INSERT)));

    writer.insert(2, "accounts", image("after snapshot"));
    writer.commit(2);
    assertThat(nextBatch(), is(aBatchOfTransaction(2)));
  }

  @Test
  public void slotMovesPastTransactionsThePublicationFiltersOut() throws Exception {
    Publication accountsOnly = Publication.forEntities("accounts-only", ImmutableList.of("accounts"),
        EnumSet.allOf(Operation.class));
    writer.insert(1, "orders", image("unpublished"));
    long commit = writer.commit(1);

    startSession("s1", accountsOnly, consumer);

    waitUntil(() -> confirmedSeq("s1") >= commit);
    assertThat(registry.get("s1").getRestartSeq(), is(greaterThanOrEqualTo(commit)));
    assertThat(consumer.poll(50, TimeUnit.MILLISECONDS), is(nullValue()));
  }

  private StreamingSessionInstance startSession(String slotName, Publication publication, ConsumerChannel channel)
      throws Exception {
    StreamingSessionInstance session = newSession(slotName, publication, channel);
    assertThat(session.start(), resultsIn(notNullValue()));
    return session;
  }

  private StreamingSessionInstance newSession(String slotName, Publication publication, ConsumerChannel channel) {
    return newSession(slotName, publication, channel, SETTINGS);
  }

  private StreamingSessionInstance newSession(String slotName, Publication publication, ConsumerChannel channel,
                                              SessionSettings settings) {
    String sessionId = "session-" + (sessions.size() + 1);
    StreamingSessionInstance session = new StreamingSessionInstance(sessionId, slotName, publication,
        newFiber(), store, registry, DECODERS, channel, null, false, settings);
    sessions.add(session);
    return session;
  }

  private Fiber newFiber() {
    return new ThreadFiberSupplier().getNewFiber("session-fiber", fiberExceptions);
  }

  private ChangeBatch nextBatch() throws InterruptedException {
    ChangeBatch batch = consumer.poll(WAIT_SECONDS, TimeUnit.SECONDS);
    assertThat("a batch arrives within " + WAIT_SECONDS + " seconds", batch, is(notNullValue()));
    return batch;
  }

  private boolean isActive(String slotName) {
    try {
      return registry.get(slotName).isActive();
    } catch (SlotRegistry.SlotNotFound e) {
      throw new AssertionError(e);
    }
  }

  private long confirmedSeq(String slotName) {
    try {
      return registry.get(slotName).getConfirmedSeq();
    } catch (SlotRegistry.SlotNotFound e) {
      throw new AssertionError(e);
    }
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(WAIT_SECONDS);
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("condition not met within " + WAIT_SECONDS + " seconds");
      }
      Thread.sleep(10);
    }
  }

  private static byte[] image(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
