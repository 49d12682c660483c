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

package retlog.interfaces;

/**
 * Stable error identifiers surfaced through the operator interface.
 */
public enum ErrorKind {
  DUPLICATE_SLOT(false),
  SLOT_NOT_FOUND(false),
  SLOT_BUSY(false),
  NON_MONOTONIC_ADVANCE(false),
  SLOT_INVARIANT_VIOLATION(false),
  SLOT_TOO_FAR_BEHIND(true),
  SEGMENT_IN_USE(false),
  DECODE_CORRUPTION(true),
  TRANSACTION_TOO_LARGE(true),
  CONSUMER_BACKPRESSURE(false),
  CHANNEL_IO_ERROR(false),
  PUBLICATION_NOT_FOUND(false),
  DUPLICATE_PUBLICATION(false),
  SESSION_NOT_FOUND(false);

  private final boolean fatalToSession;

  ErrorKind(boolean fatalToSession) {
    this.fatalToSession = fatalToSession;
  }

  /**
   * True if an error of this kind terminates the streaming session that hit it; such errors
   * need remedial action by an operator and are never retried.
   */
  public boolean isFatalToSession() {
    return fatalToSession;
  }
}
