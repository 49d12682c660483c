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

import retlog.RetentionConstants;

/**
 * Timing and slot-advance parameters shared by the streaming sessions of one service.
 */
public class SessionSettings {
  public static final SessionSettings DEFAULT = new SessionSettings(
      RetentionConstants.DEFAULT_STREAM_POLL_INTERVAL_MILLIS,
      RetentionConstants.DEFAULT_CHANNEL_RETRY_BASE_MILLIS,
      RetentionConstants.DEFAULT_CHANNEL_RETRY_MAX_MILLIS,
      RetentionConstants.DEFAULT_PHYSICAL_SLOT_LAG);

  public final long pollIntervalMillis;
  public final long channelRetryBaseMillis;
  public final long channelRetryMaxMillis;
  public final long physicalSlotLag;

  public SessionSettings(long pollIntervalMillis,
                         long channelRetryBaseMillis,
                         long channelRetryMaxMillis,
                         long physicalSlotLag) {
    if (pollIntervalMillis <= 0 || channelRetryBaseMillis <= 0 || channelRetryMaxMillis < channelRetryBaseMillis) {
      throw new IllegalArgumentException("Invalid session timing: poll " + pollIntervalMillis
          + ", retry " + channelRetryBaseMillis + ".." + channelRetryMaxMillis);
    }
    if (physicalSlotLag < 0) {
      throw new IllegalArgumentException("physicalSlotLag must not be negative");
    }
    this.pollIntervalMillis = pollIntervalMillis;
    this.channelRetryBaseMillis = channelRetryBaseMillis;
    this.channelRetryMaxMillis = channelRetryMaxMillis;
    this.physicalSlotLag = physicalSlotLag;
  }

  @Override
  public String toString() {
    return "SessionSettings{" +
        "pollIntervalMillis=" + pollIntervalMillis +
        ", channelRetryBaseMillis=" + channelRetryBaseMillis +
        ", channelRetryMaxMillis=" + channelRetryMaxMillis +
        ", physicalSlotLag=" + physicalSlotLag +
        '}';
  }
}
