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

package retlog.server;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.RetentionConstants;
import retlog.decoding.LogicalDecoder;
import retlog.decoding.PublicationCatalog;
import retlog.decoding.PublicationCatalog.DuplicatePublication;
import retlog.decoding.PublicationCatalog.PublicationNotFound;
import retlog.interfaces.RetentionException;
import retlog.interfaces.decoding.Decoder;
import retlog.interfaces.decoding.Operation;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.log.LogStore;
import retlog.interfaces.maintenance.DeadRowScanner;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;
import retlog.interfaces.slots.SlotRegistry.DuplicateSlot;
import retlog.interfaces.slots.SlotRegistry.SlotBusy;
import retlog.interfaces.slots.SlotRegistry.SlotNotFound;
import retlog.interfaces.streaming.SessionEvent;
import retlog.interfaces.streaming.SnapshotSource;
import retlog.interfaces.streaming.StreamingSession;
import retlog.log.SegmentedLogStore;
import retlog.maintenance.MaintenanceService;
import retlog.maintenance.MaintenanceWorker;
import retlog.maintenance.RetentionPolicy;
import retlog.slots.NioSlotTableReaderWriter;
import retlog.slots.PersistentSlotRegistry;
import retlog.streaming.BoundedConsumerChannel;
import retlog.streaming.SessionSettings;
import retlog.streaming.StreamingSessionInstance;
import retlog.util.FiberOnly;
import retlog.util.FiberSupplier;
import retlog.util.RetlogFutures;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the log, the slot registry, the background maintenance and every streaming session of one
 * data directory, and exposes them to operators.
 * <p>
 * Startup opens the log and then the slot registry (releasing any holders left over from a previous
 * run) before starting maintenance. Shutdown stops every session, stops maintenance, flushes and
 * closes the registry, and finally closes the log.
 * <p>
 * A session that fails stays listed, with its failure, until it is stopped or the service shuts
 * down; it does not hold its slot meanwhile.
 */
public class RetentionService extends AbstractService implements OperatorInterface {
  private static final Logger LOG = LoggerFactory.getLogger(RetentionService.class);

  private final RetentionConfiguration configuration;
  private final FiberSupplier fiberSupplier;
  @Nullable
  private final SnapshotSource snapshotSource;
  private final ImmutableList<DeadRowScanner> scanners;
  private final PublicationCatalog publications = new PublicationCatalog();
  private final Map<String, ManagedSession> sessions = new ConcurrentHashMap<>();
  private final AtomicLong sessionIdGen = new AtomicLong();

  // Set up in doStart; not null while the service is running.
  private SegmentedLogStore store;
  private PersistentSlotRegistry registry;
  private MaintenanceService maintenance;
  private SessionSettings sessionSettings;
  private Decoder.Factory decoderFactory;
  private Fiber fiber;

  public RetentionService(RetentionConfiguration configuration, FiberSupplier fiberSupplier) {
    this(configuration, fiberSupplier, null, ImmutableList.of());
  }

  /**
   * @param snapshotSource Source of the initial snapshot for sessions started with one, or null if
   *                       snapshots are not available.
   * @param scanners       One scanner per shard for maintenance to clean; with none, maintenance
   *                       only reclaims log space.
   */
  public RetentionService(RetentionConfiguration configuration,
                          FiberSupplier fiberSupplier,
                          @Nullable SnapshotSource snapshotSource,
                          Collection<DeadRowScanner> scanners) {
    this.configuration = configuration;
    this.fiberSupplier = fiberSupplier;
    this.snapshotSource = snapshotSource;
    this.scanners = ImmutableList.copyOf(scanners);
  }

  /**
   * The log producers append to.
   */
  public LogStore getLogStore() {
    checkRunning();
    return store;
  }

  public SlotRegistry getSlotRegistry() {
    checkRunning();
    return registry;
  }

  public BoundedConsumerChannel getSessionChannel(String sessionId) throws SessionNotFound {
    return lookup(sessionId).channel;
  }

  /**
   * Run a maintenance pass over every shard now, outside the regular schedule.
   */
  public ListenableFuture<List<MaintenanceWorker.PassResult>> runMaintenance() {
    checkRunning();
    return maintenance.runOnce();
  }

  /**
   * ************* Lifecycle ***********************************
   */

  @Override
  protected void doStart() {
    try {
      Files.createDirectories(configuration.dataDirectory);
      store = SegmentedLogStore.open(configuration.dataDirectory, configuration.segmentSizeBytes);
      registry = new PersistentSlotRegistry(new NioSlotTableReaderWriter(configuration.dataDirectory));

      final RetentionPolicy policy = new RetentionPolicy(configuration.maxRetainedBytes,
          configuration.maxRetainedAgeMillis);
      maintenance = new MaintenanceService(fiberSupplier,
          new MaintenanceWorker.LogReclaimer(store, registry, policy),
          configuration.naptimeMillis,
          configuration.maintenanceWorkers,
          configuration.costLimit,
          configuration.costSleepMillis);
      scanners.forEach(maintenance::addShard);

      sessionSettings = new SessionSettings(configuration.streamPollIntervalMillis,
          configuration.channelRetryBaseMillis,
          configuration.channelRetryMaxMillis,
          configuration.physicalSlotLag);
      decoderFactory = LogicalDecoder.factory(configuration.maxTransactionChanges);

      fiber = fiberSupplier.getNewFiber("retention-service", this::failModule);
      fiber.start();
      maintenance.start();

      LOG.info("Started retention service on {}: log {}..{}, {} slot(s)", configuration.dataDirectory,
          store.firstRetainedSeq(), store.lastSeq(), registry.slots().size());
      notifyStarted();
    } catch (IOException | RuntimeException e) {
      LOG.error("Unable to start retention service on {}", configuration.dataDirectory, e);
      try {
        closeComponents();
      } catch (Exception closeFailure) {
        e.addSuppressed(closeFailure);
      }
      notifyFailed(e);
    }
  }

  @Override
  protected void doStop() {
    try {
      closeComponents();
      LOG.info("Stopped retention service on {}", configuration.dataDirectory);
      notifyStopped();
    } catch (IOException | TimeoutException | RuntimeException e) {
      LOG.error("Error while stopping retention service", e);
      notifyFailed(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      notifyFailed(e);
    }
  }

  private void failModule(Throwable t) {
    LOG.error("Retention service failure", t);
    try {
      closeComponents();
    } catch (Exception closeFailure) {
      LOG.warn("Error while closing after failure: {}", closeFailure.toString());
    } finally {
      notifyFailed(t);
    }
  }

  private void closeComponents() throws IOException, InterruptedException, TimeoutException {
    stopAllSessions();
    try {
      if (maintenance != null) {
        maintenance.stop();
      }
    } finally {
      try {
        if (registry != null) {
          registry.flush();
          registry.close();
        }
      } finally {
        if (store != null) {
          store.close();
        }
        if (fiber != null) {
          fiber.dispose();
        }
      }
    }
  }

  private void stopAllSessions() throws InterruptedException {
    for (ManagedSession managed : sessions.values()) {
      try {
        managed.session.stop().get(RetentionConstants.SESSION_CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (ExecutionException | TimeoutException e) {
        LOG.warn("Session {} did not stop cleanly: {}", managed.session.getSessionId(), e.toString());
      } finally {
        managed.dispose();
      }
    }
    sessions.clear();
  }

  /**
   * ************* Slots and publications ***********************************
   */

  @Override
  public RetentionSlot createSlot(String name, SlotKind kind) throws IOException, DuplicateSlot {
    checkRunning();
    return registry.create(name, kind, store.lastSeq());
  }

  @Override
  public void dropSlot(String name) throws IOException, SlotNotFound, SlotBusy {
    checkRunning();
    registry.drop(name);
  }

  @Override
  public void createPublication(Publication publication) throws DuplicatePublication {
    publications.create(publication);
  }

  @Override
  public void alterPublication(Publication publication) throws PublicationNotFound {
    publications.alter(publication);
  }

  @Override
  public void dropPublication(String name) throws PublicationNotFound {
    publications.drop(name);
  }

  /**
   * ************* Sessions ***********************************
   */

  @Override
  public ListenableFuture<SessionHandle> startSession(String slotName, String publicationName, boolean withSnapshot)
      throws SlotNotFound, PublicationNotFound {
    checkRunning();
    registry.get(slotName);
    final Publication publication = publications.get(publicationName);

    final String sessionId = "session-" + sessionIdGen.incrementAndGet();
    final BoundedConsumerChannel channel = new BoundedConsumerChannel(configuration.consumerChannelCapacity);
    final StreamingSessionInstance session = new StreamingSessionInstance(
        sessionId,
        slotName,
        publication,
        fiberSupplier.getNewFiber(sessionId, t -> LOG.error("Uncaught error in {}", sessionId, t)),
        store,
        registry,
        decoderFactory,
        channel,
        snapshotSource,
        withSnapshot,
        sessionSettings);
    final ManagedSession managed = new ManagedSession(session, channel,
        session.getEventChannel().subscribe(fiber, this::onSessionEvent));
    sessions.put(sessionId, managed);

    final SettableFuture<SessionHandle> started = SettableFuture.create();
    RetlogFutures.addCallback(session.start(),
        state -> started.set(new SessionHandle(sessionId, channel)),
        failure -> {
          sessions.remove(sessionId);
          managed.dispose();
          started.setException(failure);
        },
        fiber);
    return started;
  }

  @Override
  public ListenableFuture<Long> acknowledge(String sessionId, long seqNum) throws SessionNotFound {
    return lookup(sessionId).session.acknowledge(seqNum);
  }

  @Override
  public void pauseSession(String sessionId) throws SessionNotFound {
    lookup(sessionId).session.pause();
  }

  @Override
  public void resumeSession(String sessionId) throws SessionNotFound {
    lookup(sessionId).session.resume();
  }

  @Override
  public ListenableFuture<Void> stopSession(String sessionId) throws SessionNotFound {
    final ManagedSession managed = sessions.remove(sessionId);
    if (managed == null) {
      throw new SessionNotFound(sessionId);
    }
    final ListenableFuture<Void> stopped = managed.session.stop();
    stopped.addListener(managed::dispose, MoreExecutors.directExecutor());
    return stopped;
  }

  @FiberOnly
  private void onSessionEvent(SessionEvent event) {
    if (event.newState == StreamingSession.State.CLOSED && event.error != null) {
      LOG.error("Session {} on slot {} failed: {}", event.session.getSessionId(), event.session.getSlotName(),
          event.error.toString());
    } else {
      LOG.debug("Session state change {}", event);
    }
  }

  private ManagedSession lookup(String sessionId) throws SessionNotFound {
    final ManagedSession managed = sessions.get(sessionId);
    if (managed == null) {
      throw new SessionNotFound(sessionId);
    }
    return managed;
  }

  /**
   * ************* Monitoring ***********************************
   */

  @Override
  public MonitoringSnapshot monitor() {
    checkRunning();
    final long currentMaxSeq = store.lastSeq();

    final List<MonitoringSnapshot.SlotStatus> slotStatuses = new ArrayList<>();
    for (RetentionSlot slot : registry.slots()) {
      slotStatuses.add(new MonitoringSnapshot.SlotStatus(slot, currentMaxSeq));
    }

    final List<MonitoringSnapshot.SessionStatus> sessionStatuses = new ArrayList<>();
    for (ManagedSession managed : sessions.values()) {
      sessionStatuses.add(new MonitoringSnapshot.SessionStatus(managed.session));
    }
    sessionStatuses.sort(Comparator.comparing(status -> status.sessionId));

    final List<MonitoringSnapshot.WorkerStatus> workerStatuses = new ArrayList<>();
    for (MaintenanceWorker worker : maintenance.getWorkers()) {
      workerStatuses.add(new MonitoringSnapshot.WorkerStatus(worker));
    }
    workerStatuses.sort(Comparator.comparing(status -> status.shard));

    return new MonitoringSnapshot(currentMaxSeq,
        store.firstRetainedSeq(),
        registry.watermark(),
        ImmutableList.copyOf(slotStatuses),
        ImmutableList.copyOf(sessionStatuses),
        ImmutableList.copyOf(workerStatuses));
  }

  /**
   * ************* Text commands ***********************************
   */

  /**
   * Run one operator command given as a line of text, e.g. {@code CREATE_SLOT s1 LOGICAL}.
   *
   * @return "OK" followed by the command's result, or "ERROR", an error kind and a message.
   */
  public String acceptCommand(String commandString) {
    final List<String> words = Splitter.on(CharMatcher.whitespace())
        .omitEmptyStrings()
        .splitToList(commandString);
    if (words.isEmpty()) {
      return error("INVALID_COMMAND", "empty command");
    }

    final String command = words.get(0).toUpperCase(Locale.ROOT);
    final List<String> args = words.subList(1, words.size());
    try {
      return "OK" + runCommand(command, args);
    } catch (RetentionException e) {
      return error(e.getKind().name(), e.getMessage());
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RetentionException) {
        return error(((RetentionException) cause).getKind().name(), cause.getMessage());
      }
      return error("INTERNAL_ERROR", cause.toString());
    } catch (IOException e) {
      return error("IO_ERROR", e.toString());
    } catch (TimeoutException e) {
      return error("TIMEOUT", command + " did not complete in time");
    } catch (IllegalArgumentException | IllegalStateException e) {
      return error("INVALID_COMMAND", e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return error("INTERRUPTED", command + " was interrupted");
    }
  }

  private String runCommand(String command, List<String> args)
      throws RetentionException, IOException, ExecutionException, InterruptedException, TimeoutException {
    switch (command) {
      case "CREATE_SLOT": {
        expectArgs(args, 2, 2, "CREATE_SLOT name LOGICAL|PHYSICAL");
        final RetentionSlot slot = createSlot(args.get(0), SlotKind.valueOf(args.get(1).toUpperCase(Locale.ROOT)));
        return " " + slot.getName() + " " + slot.getRestartSeq();
      }
      case "DROP_SLOT":
        expectArgs(args, 1, 1, "DROP_SLOT name");
        dropSlot(args.get(0));
        return "";
      case "CREATE_PUBLICATION":
        expectArgs(args, 2, 3, "CREATE_PUBLICATION name ALL|entity,... [INSERT,UPDATE,DELETE,TRUNCATE]");
        createPublication(parsePublication(args));
        return "";
      case "ALTER_PUBLICATION":
        expectArgs(args, 2, 3, "ALTER_PUBLICATION name ALL|entity,... [INSERT,UPDATE,DELETE,TRUNCATE]");
        alterPublication(parsePublication(args));
        return "";
      case "DROP_PUBLICATION":
        expectArgs(args, 1, 1, "DROP_PUBLICATION name");
        dropPublication(args.get(0));
        return "";
      case "START_SESSION": {
        expectArgs(args, 2, 3, "START_SESSION slot publication [SNAPSHOT]");
        final boolean withSnapshot = args.size() == 3;
        if (withSnapshot && !args.get(2).equalsIgnoreCase("SNAPSHOT")) {
          throw new IllegalArgumentException("unknown option " + args.get(2));
        }
        final SessionHandle handle = startSession(args.get(0), args.get(1), withSnapshot)
            .get(RetentionConstants.COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return " " + handle.sessionId;
      }
      case "ADVANCE_ACK": {
        expectArgs(args, 2, 2, "ADVANCE_ACK sessionId seq");
        final long confirmed = acknowledge(args.get(0), parseSeq(args.get(1)))
            .get(RetentionConstants.COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return " " + confirmed;
      }
      case "PAUSE_SESSION":
        expectArgs(args, 1, 1, "PAUSE_SESSION sessionId");
        pauseSession(args.get(0));
        return "";
      case "RESUME_SESSION":
        expectArgs(args, 1, 1, "RESUME_SESSION sessionId");
        resumeSession(args.get(0));
        return "";
      case "STOP_SESSION":
        expectArgs(args, 1, 1, "STOP_SESSION sessionId");
        stopSession(args.get(0)).get(RetentionConstants.COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return "";
      case "STATUS":
        expectArgs(args, 0, 0, "STATUS");
        return " " + monitor();
      default:
        throw new IllegalArgumentException("unknown command " + command);
    }
  }

  private static Publication parsePublication(List<String> args) {
    final String name = args.get(0);
    final EnumSet<Operation> operations = EnumSet.noneOf(Operation.class);
    if (args.size() == 3) {
      for (String operation : Splitter.on(',').omitEmptyStrings().trimResults().split(args.get(2))) {
        operations.add(Operation.valueOf(operation.toUpperCase(Locale.ROOT)));
      }
    } else {
      operations.addAll(EnumSet.allOf(Operation.class));
    }

    if (args.get(1).equalsIgnoreCase("ALL")) {
      return Publication.forAllEntities(name, operations);
    }
    return Publication.forEntities(name, Splitter.on(',').omitEmptyStrings().trimResults().splitToList(args.get(1)),
        operations);
  }

  private static long parseSeq(String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a sequence number: " + value);
    }
  }

  private static void expectArgs(List<String> args, int min, int max, String usage) {
    if (args.size() < min || args.size() > max) {
      throw new IllegalArgumentException("usage: " + usage);
    }
  }

  private static String error(String kind, String message) {
    return "ERROR " + kind + " " + message;
  }

  private void checkRunning() {
    if (state() != State.RUNNING) {
      throw new IllegalStateException("retention service is " + state());
    }
  }

  private static class ManagedSession {
    final StreamingSessionInstance session;
    final BoundedConsumerChannel channel;
    final Disposable eventSubscription;

    ManagedSession(StreamingSessionInstance session, BoundedConsumerChannel channel, Disposable eventSubscription) {
      this.session = session;
      this.channel = channel;
      this.eventSubscription = eventSubscription;
    }

    void dispose() {
      eventSubscription.dispose();
      session.dispose();
    }
  }
}
