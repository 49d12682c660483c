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
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Subscriber;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.RetentionException;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.decoding.DecodedChange;
import retlog.interfaces.decoding.Decoder;
import retlog.interfaces.decoding.Operation;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.log.LogRecord;
import retlog.interfaces.log.LogStore;
import retlog.interfaces.log.SequentialEntryIterator;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;
import retlog.interfaces.streaming.ConsumerChannel;
import retlog.interfaces.streaming.SessionEvent;
import retlog.interfaces.streaming.SnapshotSource;
import retlog.interfaces.streaming.StreamingSession;
import retlog.util.FiberOnly;

import java.io.IOException;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * A StreamingSession whose state is confined to a single fiber. Every public method hands its work
 * to the fiber; a periodic poll on the same fiber reads the log from the session's read position,
 * decodes it, and pushes each completed batch to the consumer channel.
 * <p>
 * The session never buffers a batch it failed to push. On backpressure or a channel error it moves
 * its read position back far enough to decode the batch again, and discards its decoder; batches
 * already pushed are suppressed when they are decoded a second time.
 */
public class StreamingSessionInstance implements StreamingSession {
  private static final int MAX_RECORDS_PER_POLL = 1024;
  private static final long SNAPSHOT_TRANSACTION_ID = 0;

  private final Channel<SessionEvent> eventChannel = new MemoryChannel<>();

  private final String sessionId;
  private final String slotName;
  private final Publication publication;
  private final Fiber fiber;
  private final LogStore store;
  private final SlotRegistry registry;
  private final Decoder.Factory decoderFactory;
  private final ConsumerChannel channel;
  @Nullable
  private final SnapshotSource snapshotSource;
  private final boolean withSnapshot;
  private final SessionSettings settings;
  private final Logger logger;

  private volatile State state = State.INIT;
  private volatile long lastSentSeq;
  private volatile Throwable failure;

  /**
   * state, fiber only
   */

  private SlotKind slotKind;
  private long slotRestartSeq;
  private long slotConfirmedSeq;

  private Decoder decoder;
  private long readPosition;

  // Commit sequence number of every batch pushed but not yet acknowledged, mapped to the batch's restartSeq.
  private final NavigableMap<Long, Long> unacknowledged = new TreeMap<>();

  // An empty batch decoded after everything pushed had been acknowledged; the slot may move up to it.
  private ChangeBatch idleBatch;

  private ChangeBatch pendingSnapshot;
  private boolean pausedByOperator;
  private long channelRetryDelay;
  private long nextChannelAttempt;
  private Disposable poller;

  public StreamingSessionInstance(String sessionId,
                                  String slotName,
                                  Publication publication,
                                  Fiber fiber,
                                  LogStore store,
                                  SlotRegistry registry,
                                  Decoder.Factory decoderFactory,
                                  ConsumerChannel channel,
                                  @Nullable SnapshotSource snapshotSource,
                                  boolean withSnapshot,
                                  SessionSettings settings) {
    this.sessionId = sessionId;
    this.slotName = slotName;
    this.publication = publication;
    this.fiber = fiber;
    this.store = store;
    this.registry = registry;
    this.decoderFactory = decoderFactory;
    this.channel = channel;
    this.snapshotSource = snapshotSource;
    this.withSnapshot = withSnapshot;
    this.settings = settings;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + sessionId + ")");
    this.channelRetryDelay = settings.channelRetryBaseMillis;
  }

  /**
   * public API
   */

  @Override
  public String getSessionId() {
    return sessionId;
  }

  @Override
  public String getSlotName() {
    return slotName;
  }

  @Override
  public String getPublicationName() {
    return publication.getName();
  }

  @Override
  public State getState() {
    return state;
  }

  @Override
  public long getLastSentSeq() {
    return lastSentSeq;
  }

  @Nullable
  @Override
  public Throwable getFailure() {
    return failure;
  }

  @Override
  public Subscriber<SessionEvent> getEventChannel() {
    return eventChannel;
  }

  @Override
  public ListenableFuture<State> start() {
    if (state != State.INIT) {
      return Futures.immediateFailedFuture(new IllegalStateException("Session " + sessionId + " already started"));
    }

    final SettableFuture<State> started = SettableFuture.create();
    fiber.start();
    fiber.execute(() -> {
      try {
        initialize();
        started.set(state);
      } catch (RetentionException | IOException | RuntimeException e) {
        logger.error("could not start session on slot {}: {}", slotName, e.toString());
        close(e);
        started.setException(e);
      }
    });
    return started;
  }

  @Override
  public ListenableFuture<Long> acknowledge(long seqNum) {
    if (state == State.CLOSED) {
      return Futures.immediateFailedFuture(new IllegalStateException("Session " + sessionId + " is closed"));
    }

    final SettableFuture<Long> confirmed = SettableFuture.create();
    fiber.execute(() -> {
      try {
        confirmed.set(onAcknowledge(seqNum));
      } catch (RetentionException | IOException | RuntimeException e) {
        logger.warn("acknowledgment of {} failed: {}", seqNum, e.toString());
        confirmed.setException(e);
      }
    });
    return confirmed;
  }

  @Override
  public void pause() {
    fiber.execute(() -> {
      pausedByOperator = true;
      if (state == State.STREAMING || state == State.CATCHUP) {
        setState(State.PAUSED, null);
      }
    });
  }

  @Override
  public void resume() {
    fiber.execute(() -> {
      pausedByOperator = false;
      if (state == State.PAUSED) {
        setState(pendingSnapshot == null ? State.STREAMING : State.CATCHUP, null);
      }
    });
  }

  @Override
  public ListenableFuture<Void> stop() {
    if (state == State.CLOSED) {
      return Futures.immediateFuture(null);
    }

    final SettableFuture<Void> stopped = SettableFuture.create();
    fiber.execute(() -> {
      close(null);
      stopped.set(null);
    });
    return stopped;
  }

  /**
   * Release the session's thread. Only meaningful once the session is closed; a session that is
   * disposed while open leaves its slot held until the registry is reloaded.
   */
  public void dispose() {
    fiber.dispose();
  }

  @Override
  public String toString() {
    return "StreamingSessionInstance{" +
        "sessionId='" + sessionId + '\'' +
        ", slotName='" + slotName + '\'' +
        ", publication='" + publication.getName() + '\'' +
        ", state=" + state +
        ", lastSentSeq=" + lastSentSeq +
        '}';
  }

  /**
   * INIT
   */

  @FiberOnly
  private void initialize() throws RetentionException, IOException {
    final RetentionSlot slot = registry.acquire(slotName, sessionId);
    slotKind = slot.getKind();
    slotRestartSeq = slot.getRestartSeq();
    slotConfirmedSeq = slot.getConfirmedSeq();

    // A restart position equal to the confirmed commit only re-reads that commit, which is suppressed.
    final long firstNeeded = Math.max(
        slotRestartSeq < slotConfirmedSeq ? slotRestartSeq : slotConfirmedSeq + 1, 1);
    final long firstRetained = store.firstRetainedSeq();
    if (firstNeeded < firstRetained) {
      throw new SlotTooFarBehind(slotName, firstNeeded, firstRetained);
    }

    readPosition = Math.max(Math.max(slotRestartSeq, 1), firstRetained);
    lastSentSeq = slotConfirmedSeq;
    decoder = decoderFactory.create(publication);
    logger.info("acquired {} slot {} at restart {} confirmed {}", slotKind, slotName, slotRestartSeq, slotConfirmedSeq);

    setState(State.CATCHUP, null);
    if (withSnapshot && snapshotSource != null) {
      pendingSnapshot = takeSnapshot();
      if (!deliverSnapshot()) {
        logger.debug("snapshot delivery deferred");
      }
    } else {
      setState(State.STREAMING, null);
    }

    poller = fiber.scheduleWithFixedDelay(this::poll, settings.pollIntervalMillis, settings.pollIntervalMillis,
        TimeUnit.MILLISECONDS);
  }

  /**
   * CATCHUP
   */

  @FiberOnly
  private ChangeBatch takeSnapshot() throws IOException {
    final long snapshotSeq = store.lastSeq();
    final ImmutableList.Builder<DecodedChange> rows = ImmutableList.builder();
    int count = 0;
    for (SnapshotSource.SnapshotRow row : snapshotSource.snapshot()) {
      if (publication.includesEntity(row.entity)) {
        rows.add(new DecodedChange(row.entity, Operation.INSERT, null, row.image, snapshotSeq, SNAPSHOT_TRANSACTION_ID));
        count++;
      }
    }
    logger.info("took snapshot of {} row(s) at {}", count, snapshotSeq);

    // The snapshot leaves the slot's restart position where it is: transactions open at snapshotSeq
    // still have to be decoded from their first record.
    return new ChangeBatch(SNAPSHOT_TRANSACTION_ID, snapshotSeq, snapshotSeq,
        Math.min(slotRestartSeq, snapshotSeq), rows.build());
  }

  @FiberOnly
  private boolean deliverSnapshot() {
    if (pausedByOperator || !push(pendingSnapshot)) {
      return false;
    }
    pendingSnapshot = null;
    setState(State.STREAMING, null);
    return true;
  }

  /**
   * STREAMING / PAUSED
   */

  @FiberOnly
  private void poll() {
    if (state == State.CLOSED || pausedByOperator || System.currentTimeMillis() < nextChannelAttempt) {
      return;
    }

    try {
      if (pendingSnapshot != null) {
        if (!deliverSnapshot()) {
          return;
        }
      }
      readAndPush();
      advanceWhileIdle();
    } catch (RetentionException e) {
      logger.error("closing session: {}", e.toString());
      close(e);
    } catch (LogStore.RecordNotFound e) {
      final SlotTooFarBehind behind = new SlotTooFarBehind(slotName, readPosition, store.firstRetainedSeq());
      logger.error("closing session: {}", behind.toString());
      close(behind);
    } catch (IOException | RuntimeException e) {
      logger.error("closing session after log read failure", e);
      close(e);
    }
  }

  @FiberOnly
  private void readAndPush() throws RetentionException, IOException, LogStore.RecordNotFound {
    if (readPosition > store.lastSeq()) {
      return;
    }

    try (SequentialEntryIterator<LogRecord> records = store.read(readPosition)) {
      int read = 0;
      while (read < MAX_RECORDS_PER_POLL && records.hasNext()) {
        final LogRecord record = records.next();
        final ChangeBatch batch = decoder.decode(record);
        readPosition = record.getSeqNum() + 1;
        read++;

        if (batch == null || batch.getCommitSeq() <= lastSentSeq) {
          continue;
        }
        if (batch.isEmpty()) {
          if (unacknowledged.isEmpty()) {
            idleBatch = batch;
          }
          continue;
        }
        if (!push(batch)) {
          return;
        }
      }
    }
  }

  /**
   * Push one batch, handling a refusal by rewinding so the batch is decoded again later.
   *
   * @return true if the consumer accepted the batch.
   */
  @FiberOnly
  private boolean push(ChangeBatch batch) {
    try {
      channel.push(batch);
    } catch (ConsumerChannel.ConsumerBackpressure e) {
      logger.debug("consumer backpressure at {}: {}", batch.getCommitSeq(), e.getMessage());
      if (state == State.STREAMING) {
        setState(State.PAUSED, null);
      }
      rewindFor(batch);
      return false;
    } catch (ConsumerChannel.ChannelIOError e) {
      logger.warn("channel error pushing {}; retrying in {} ms: {}", batch.getCommitSeq(), channelRetryDelay, e.toString());
      nextChannelAttempt = System.currentTimeMillis() + channelRetryDelay;
      channelRetryDelay = Math.min(channelRetryDelay * 2, settings.channelRetryMaxMillis);
      rewindFor(batch);
      return false;
    }

    channelRetryDelay = settings.channelRetryBaseMillis;
    nextChannelAttempt = 0;
    lastSentSeq = Math.max(lastSentSeq, batch.getCommitSeq());
    unacknowledged.put(batch.getCommitSeq(), batch.getRestartSeq());
    idleBatch = null;
    if (state == State.PAUSED && !pausedByOperator && pendingSnapshot == null) {
      setState(State.STREAMING, null);
    }
    return true;
  }

  @FiberOnly
  private void rewindFor(ChangeBatch batch) {
    if (batch == pendingSnapshot) {
      return;
    }
    readPosition = Math.max(1, Math.min(batch.getFirstSeq(), batch.getRestartSeq()));
    decoder = decoderFactory.create(publication);
  }

  /**
   * Transactions the publication filters out entirely are never pushed, so the consumer never
   * acknowledges them. Once everything pushed has been acknowledged, the slot may move past them.
   */
  @FiberOnly
  private void advanceWhileIdle() throws RetentionException, IOException {
    if (idleBatch == null || !unacknowledged.isEmpty()) {
      return;
    }
    final ChangeBatch batch = idleBatch;
    idleBatch = null;
    if (batch.getCommitSeq() > slotConfirmedSeq) {
      advanceSlot(batch.getRestartSeq(), batch.getCommitSeq());
    }
  }

  /**
   * Acknowledgments
   */

  @FiberOnly
  private long onAcknowledge(long seqNum) throws RetentionException, IOException {
    if (state == State.CLOSED) {
      throw new IllegalStateException("Session " + sessionId + " is closed");
    }
    if (seqNum > lastSentSeq) {
      throw new IllegalArgumentException("Sequence " + seqNum + " has not been sent; last sent is " + lastSentSeq);
    }

    final Map.Entry<Long, Long> acknowledged = unacknowledged.floorEntry(seqNum);
    if (acknowledged == null) {
      return slotConfirmedSeq;
    }
    unacknowledged.headMap(seqNum, true).clear();

    advanceSlot(acknowledged.getValue(), acknowledged.getKey());
    return slotConfirmedSeq;
  }

  @FiberOnly
  private void advanceSlot(long batchRestartSeq, long commitSeq) throws RetentionException, IOException {
    long restartSeq = batchRestartSeq;
    if (slotKind == SlotKind.PHYSICAL) {
      restartSeq = Math.min(batchRestartSeq, commitSeq - settings.physicalSlotLag);
    }
    restartSeq = Math.max(slotRestartSeq, restartSeq);
    final long confirmedSeq = Math.max(slotConfirmedSeq, commitSeq);

    final RetentionSlot advanced = registry.advance(slotName, restartSeq, confirmedSeq);
    slotRestartSeq = advanced.getRestartSeq();
    slotConfirmedSeq = advanced.getConfirmedSeq();
    logger.debug("slot {} advanced to restart {} confirmed {}", slotName, slotRestartSeq, slotConfirmedSeq);
  }

  /**
   * CLOSED
   */

  @FiberOnly
  private void close(@Nullable Throwable error) {
    if (state == State.CLOSED) {
      return;
    }
    if (poller != null) {
      poller.dispose();
    }
    channel.close();

    if (slotKind != null) {
      try {
        registry.release(slotName, sessionId);
      } catch (RetentionException | IOException e) {
        logger.warn("could not release slot {}: {}", slotName, e.toString());
      }
    }

    failure = error;
    setState(State.CLOSED, error);
    logger.info("closed at {}{}", lastSentSeq, error == null ? "" : " after " + error);
  }

  @FiberOnly
  private void setState(State newState, @Nullable Throwable error) {
    final State previousState = state;
    state = newState;
    logger.debug("{} -> {}", previousState, newState);
    eventChannel.publish(new SessionEvent(this, previousState, newState, System.currentTimeMillis(), error));
  }
}
