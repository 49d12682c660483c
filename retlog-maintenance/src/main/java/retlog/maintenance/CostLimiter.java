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

/**
 * Cooperative throttle for one maintenance worker. The worker charges the cost of each unit of
 * work as it goes; once the accumulated cost reaches the limit, the charging call sleeps for one
 * sleep unit and the count starts again from zero.
 * <p>
 * A single charge larger than the limit still sleeps only once. A sleep unit of zero disables
 * pacing: costs are still counted, but the worker never sleeps.
 * <p>
 * Only the owning worker may call {@link #charge}; the getters may be read from any thread.
 */
public class CostLimiter {
  private final long limit;
  private final long sleepMillis;
  private final Sleeper sleeper;

  private volatile long accumulated;
  private volatile long sleeps;

  public CostLimiter(long limit, long sleepMillis) {
    this(limit, sleepMillis, Thread::sleep);
  }

  public CostLimiter(long limit, long sleepMillis, Sleeper sleeper) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Cost limit must be positive");
    }
    if (sleepMillis < 0) {
      throw new IllegalArgumentException("Sleep unit must not be negative");
    }
    this.limit = limit;
    this.sleepMillis = sleepMillis;
    this.sleeper = sleeper;
  }

  /**
   * Account for units of work, sleeping if they bring the accumulated cost to the limit.
   *
   * @throws InterruptedException if the worker is interrupted while sleeping; the accumulated
   *                              cost has been reset regardless.
   */
  public void charge(long units) throws InterruptedException {
    if (units < 0) {
      throw new IllegalArgumentException("Cannot charge negative cost");
    }

    final long total = accumulated + units;
    if (total < limit) {
      accumulated = total;
      return;
    }

    accumulated = 0;
    if (sleepMillis > 0) {
      sleeps++;
      sleeper.sleep(sleepMillis);
    }
  }

  public long getAccumulated() {
    return accumulated;
  }

  public long getLimit() {
    return limit;
  }

  public long getSleepMillis() {
    return sleepMillis;
  }

  /**
   * Number of times a charge has put the worker to sleep.
   */
  public long getSleeps() {
    return sleeps;
  }

  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
