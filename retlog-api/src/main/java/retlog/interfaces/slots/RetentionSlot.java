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

package retlog.interfaces.slots;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Immutable snapshot of a named, persistent cursor into the log. Records at or above
 * restartSeq are retained for the slot's consumer; confirmedSeq is the last position the
 * consumer durably acknowledged. restartSeq never exceeds confirmedSeq.
 */
public final class RetentionSlot {
  private final String name;
  private final SlotKind kind;
  private final long restartSeq;
  private final long confirmedSeq;
  @Nullable
  private final String holderId;

  public RetentionSlot(@NotNull String name, @NotNull SlotKind kind, long restartSeq, long confirmedSeq,
                       @Nullable String holderId) {
    this.name = name;
    this.kind = kind;
    this.restartSeq = restartSeq;
    this.confirmedSeq = confirmedSeq;
    this.holderId = holderId;
  }

  public String getName() {
    return name;
  }

  public SlotKind getKind() {
    return kind;
  }

  public long getRestartSeq() {
    return restartSeq;
  }

  public long getConfirmedSeq() {
    return confirmedSeq;
  }

  public boolean isActive() {
    return holderId != null;
  }

  @Nullable
  public String getHolderId() {
    return holderId;
  }

  public RetentionSlot withHolder(@Nullable String newHolderId) {
    return new RetentionSlot(name, kind, restartSeq, confirmedSeq, newHolderId);
  }

  public RetentionSlot withPosition(long newRestartSeq, long newConfirmedSeq) {
    return new RetentionSlot(name, kind, newRestartSeq, newConfirmedSeq, holderId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RetentionSlot that = (RetentionSlot) o;
    return restartSeq == that.restartSeq
        && confirmedSeq == that.confirmedSeq
        && name.equals(that.name)
        && kind == that.kind
        && Objects.equals(holderId, that.holderId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, restartSeq, confirmedSeq, holderId);
  }

  @Override
  public String toString() {
    return "RetentionSlot{" +
        "name='" + name + '\'' +
        ", kind=" + kind +
        ", restartSeq=" + restartSeq +
        ", confirmedSeq=" + confirmedSeq +
        ", holderId=" + holderId +
        '}';
  }
}
