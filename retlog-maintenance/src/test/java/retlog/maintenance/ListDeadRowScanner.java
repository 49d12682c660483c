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

import org.jetbrains.annotations.Nullable;
import retlog.interfaces.maintenance.DeadRowScanner;
import retlog.interfaces.maintenance.ScanPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DeadRowScanner over a fixed list of unit costs; the scan position is an index into the list.
 * Optionally fails once, at a given index.
 */
class ListDeadRowScanner implements DeadRowScanner {
  private final String shard;
  private final List<Long> costs;
  private int failAt;
  final List<ScanPosition> startPositions = new ArrayList<>();
  final AtomicInteger completedScans = new AtomicInteger();

  ListDeadRowScanner(String shard, List<Long> costs) {
    this(shard, costs, -1);
  }

  ListDeadRowScanner(String shard, List<Long> costs, int failAt) {
    this.shard = shard;
    this.costs = costs;
    this.failAt = failAt;
  }

  @Override
  public String getShard() {
    return shard;
  }

  @Override
  public synchronized Scan scanFrom(ScanPosition position) {
    startPositions.add(position);
    return new Scan() {
      private int index = (int) position.getOffset();

      @Nullable
      @Override
      public DeadUnit nextDeadUnit() throws IOException {
        if (index == failAt) {
          failAt = -1;
          throw new IOException("scan failed at " + index);
        }
        if (index >= costs.size()) {
          completedScans.incrementAndGet();
          return null;
        }
        long cost = costs.get(index);
        index++;
        return new DeadUnit(cost, new ScanPosition(index));
      }

      @Override
      public void close() {
      }
    };
  }
}
