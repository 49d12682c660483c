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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.log.LogStore;
import retlog.interfaces.log.SegmentDescriptor;
import retlog.interfaces.maintenance.DeadRowScanner;
import retlog.interfaces.maintenance.ScanPosition;
import retlog.interfaces.slots.SlotRegistry;

import java.io.IOException;
import java.util.List;

/**
 * Performs maintenance passes over one shard. A pass cleans the shard's dead units, paced by the
 * worker's CostLimiter, then reclaims whatever log space no slot needs.
 * <p>
 * Passes of one worker must not overlap; {@link MaintenanceService} runs them serially.
 */
public class MaintenanceWorker {
  private static final Logger LOG = LoggerFactory.getLogger(MaintenanceWorker.class);

  private final DeadRowScanner scanner;
  private final CostLimiter limiter;
  private final LogReclaimer reclaimer;

  private volatile ScanPosition position = ScanPosition.START;

  public MaintenanceWorker(DeadRowScanner scanner, CostLimiter limiter, LogReclaimer reclaimer) {
    this.scanner = scanner;
    this.limiter = limiter;
    this.reclaimer = reclaimer;
  }

  public String getShard() {
    return scanner.getShard();
  }

  public CostLimiter getLimiter() {
    return limiter;
  }

  /**
   * Where the next pass resumes scanning; START once a scan has covered the whole shard.
   */
  public ScanPosition getPosition() {
    return position;
  }

  public PassResult runPass() throws IOException, InterruptedException {
    long units = 0;
    long cost = 0;

    try (DeadRowScanner.Scan scan = scanner.scanFrom(position)) {
      DeadRowScanner.DeadUnit unit;
      while ((unit = scan.nextDeadUnit()) != null) {
        position = unit.resumePosition;
        units++;
        cost += unit.cost;
        limiter.charge(unit.cost);
      }
    }
    position = ScanPosition.START;

    final ImmutableList<SegmentDescriptor> reclaimed = reclaimer.reclaim();
    LOG.debug("Pass over {} cleaned {} unit(s) costing {}; reclaimed {} segment(s)",
        getShard(), units, cost, reclaimed.size());
    return new PassResult(getShard(), units, cost, reclaimed);
  }

  /**
   * Reclaims the log segments that neither a slot nor the retention policy keeps.
   */
  public static class LogReclaimer {
    private final LogStore store;
    private final SlotRegistry registry;
    private final RetentionPolicy policy;

    public LogReclaimer(LogStore store, SlotRegistry registry, RetentionPolicy policy) {
      this.store = store;
      this.registry = registry;
      this.policy = policy;
    }

    /**
     * @return The segments reclaimed; empty if a reader still pins the oldest reclaimable one.
     */
    public ImmutableList<SegmentDescriptor> reclaim() throws IOException {
      final long watermark = registry.watermark();
      final long belowSeq = watermark == SlotRegistry.UNBOUNDED ? policyBoundary() : watermark;
      if (belowSeq <= 0) {
        return ImmutableList.of();
      }

      try {
        return store.reclaim(belowSeq);
      } catch (LogStore.SegmentInUse e) {
        LOG.error("Could not reclaim below {}; will retry on the next pass: {}", belowSeq, e.toString());
        return ImmutableList.of();
      }
    }

    private long policyBoundary() throws IOException {
      List<SegmentDescriptor> segments = store.segments();
      if (policy.shouldSeal(segments.get(segments.size() - 1))) {
        LOG.debug("Sealing the active segment so the age bound can release it");
        store.roll();
        segments = store.segments();
      }
      return policy.reclaimBoundary(segments);
    }
  }

  public static class PassResult {
    public final String shard;
    public final long unitsCleaned;
    public final long cost;
    public final ImmutableList<SegmentDescriptor> reclaimedSegments;

    public PassResult(String shard, long unitsCleaned, long cost, ImmutableList<SegmentDescriptor> reclaimedSegments) {
      this.shard = shard;
      this.unitsCleaned = unitsCleaned;
      this.cost = cost;
      this.reclaimedSegments = reclaimedSegments;
    }

    @Override
    public String toString() {
      return "PassResult{" +
          "shard='" + shard + '\'' +
          ", unitsCleaned=" + unitsCleaned +
          ", cost=" + cost +
          ", reclaimedSegments=" + reclaimedSegments.size() +
          '}';
    }
  }
}
