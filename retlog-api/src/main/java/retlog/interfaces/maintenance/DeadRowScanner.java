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

package retlog.interfaces.maintenance;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Finds reclaimable units (obsolete row versions, dead pages) in one shard of the data store.
 */
public interface DeadRowScanner {

  String getShard();

  /**
   * Start a scan at the given position. A scan is finite: it ends once it has covered the shard.
   */
  Scan scanFrom(ScanPosition position) throws IOException;

  interface Scan extends AutoCloseable {
    /**
     * Clean up the next dead unit and report what it cost.
     *
     * @return The unit processed, or null once the scan has covered the shard.
     */
    @Nullable
    DeadUnit nextDeadUnit() throws IOException;

    @Override
    void close() throws IOException;
  }

  /**
   * A unit of cleanup work: its cost in limiter units, and the position to resume from after it.
   */
  final class DeadUnit {
    public final long cost;
    public final ScanPosition resumePosition;

    public DeadUnit(long cost, ScanPosition resumePosition) {
      this.cost = cost;
      this.resumePosition = resumePosition;
    }
  }
}
