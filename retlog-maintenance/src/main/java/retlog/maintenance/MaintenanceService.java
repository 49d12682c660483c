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

package retlog.maintenance;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.RetentionConstants;
import retlog.interfaces.maintenance.DeadRowScanner;
import retlog.util.FiberSupplier;
import retlog.util.KeySerializingExecutor;
import retlog.util.WrappingKeySerializingExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs maintenance passes every naptime. A fiber wakes up on schedule and submits one pass per shard
 * to a fixed-size pool, keyed by shard so that passes of the same shard never overlap. A shard
 * whose previous pass is still running is skipped. With no shards registered, each wake-up only
 * reclaims log space.
 */
public class MaintenanceService {
  private static final Logger LOG = LoggerFactory.getLogger(MaintenanceService.class);
  private static final String LOG_ONLY_KEY = "(log)";

  private final FiberSupplier fiberSupplier;
  private final MaintenanceWorker.LogReclaimer reclaimer;
  private final long naptimeMillis;
  private final long costLimit;
  private final long costSleepMillis;
  private final KeySerializingExecutor executor;
  private final Map<String, MaintenanceWorker> workers = new ConcurrentHashMap<>();

  private Fiber fiber;
  private Disposable schedule;

  public MaintenanceService(FiberSupplier fiberSupplier,
                            MaintenanceWorker.LogReclaimer reclaimer,
                            long naptimeMillis,
                            int workerThreads,
                            long costLimit,
                            long costSleepMillis) {
    if (naptimeMillis <= 0 || workerThreads <= 0) {
      throw new IllegalArgumentException("naptime and worker count must be positive");
    }
    this.fiberSupplier = fiberSupplier;
    this.reclaimer = reclaimer;
    this.naptimeMillis = naptimeMillis;
    this.costLimit = costLimit;
    this.costSleepMillis = costSleepMillis;
    this.executor = new WrappingKeySerializingExecutor(Executors.newFixedThreadPool(workerThreads));
  }

  /**
   * Register a shard, giving it its own worker and cost limiter.
   */
  public MaintenanceWorker addShard(DeadRowScanner scanner) {
    final MaintenanceWorker worker = new MaintenanceWorker(scanner,
        new CostLimiter(costLimit, costSleepMillis), reclaimer);
    if (workers.putIfAbsent(scanner.getShard(), worker) != null) {
      throw new IllegalArgumentException("Shard " + scanner.getShard() + " already registered");
    }
    return worker;
  }

  public ImmutableList<MaintenanceWorker> getWorkers() {
    return ImmutableList.copyOf(workers.values());
  }

  public synchronized void start() {
    if (fiber != null) {
      throw new IllegalStateException("MaintenanceService already started");
    }
    fiber = fiberSupplier.getNewFiber("maintenance", this::onFiberException);
    fiber.start();
    schedule = fiber.scheduleWithFixedDelay(this::launchPasses, naptimeMillis, naptimeMillis, TimeUnit.MILLISECONDS);
    LOG.info("Started maintenance with naptime {} ms over {} shard(s)", naptimeMillis, workers.size());
  }

  /**
   * Run one pass over every shard now.
   *
   * @return A future completing once every pass has finished.
   */
  public ListenableFuture<List<MaintenanceWorker.PassResult>> runOnce() {
    final List<ListenableFuture<MaintenanceWorker.PassResult>> passes = new ArrayList<>();
    if (workers.isEmpty()) {
      passes.add(executor.submit(LOG_ONLY_KEY,
          () -> new MaintenanceWorker.PassResult(LOG_ONLY_KEY, 0, 0, reclaimer.reclaim())));
    }
    for (MaintenanceWorker worker : workers.values()) {
      passes.add(executor.submit(worker.getShard(), worker::runPass));
    }
    return Futures.allAsList(passes);
  }

  public synchronized void stop() throws InterruptedException, TimeoutException {
    if (schedule != null) {
      schedule.dispose();
    }
    if (fiber != null) {
      fiber.dispose();
    }
    executor.shutdownAndAwaitTermination(RetentionConstants.MAINTENANCE_CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    LOG.info("Stopped maintenance");
  }

  private void launchPasses() {
    if (workers.isEmpty()) {
      if (executor.pendingTasks(LOG_ONLY_KEY) == 0) {
        executor.submit(LOG_ONLY_KEY, reclaimer::reclaim);
      }
      return;
    }

    for (MaintenanceWorker worker : workers.values()) {
      if (executor.pendingTasks(worker.getShard()) > 0) {
        LOG.debug("Previous pass over {} still running; skipping", worker.getShard());
        continue;
      }
      executor.submit(worker.getShard(), worker::runPass);
    }
  }

  private void onFiberException(Throwable t) {
    LOG.error("Maintenance scheduler error", t);
  }
}
