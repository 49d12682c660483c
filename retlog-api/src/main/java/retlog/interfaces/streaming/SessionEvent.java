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

package retlog.interfaces.streaming;

import static retlog.interfaces.streaming.StreamingSession.State;

/**
 * Published by a streaming session each time it changes state. A transition to CLOSED caused by
 * an error carries that error.
 */
public class SessionEvent {
  public final StreamingSession session;
  public final State previousState;
  public final State newState;
  public final long eventTime;
  public final Throwable error;

  public SessionEvent(StreamingSession session,
                      State previousState,
                      State newState,
                      long eventTime,
                      Throwable error) {
    this.session = session;
    this.previousState = previousState;
    this.newState = newState;
    this.eventTime = eventTime;
    this.error = error;
  }

  @Override
  public String toString() {
    return "SessionEvent{" +
        "session=" + session.getSessionId() +
        ", previousState=" + previousState +
        ", newState=" + newState +
        ", eventTime=" + eventTime +
        ", error=" + error +
        '}';
  }
}
