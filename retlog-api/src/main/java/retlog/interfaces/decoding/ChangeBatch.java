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

package retlog.interfaces.decoding;

import com.google.common.collect.ImmutableList;

/**
 * The published changes of one committed transaction, delivered contiguously and in order.
 * The batch ends at commitSeq, which acts as its transaction-boundary marker.
 * <p>
 * restartSeq is the position a reader must go back to in order to decode every transaction that
 * commits after this one: the commit position itself, or the first record of the oldest transaction
 * still open when this one committed.
 */
public final class ChangeBatch {
  private final long transactionId;
  private final long firstSeq;
  private final long commitSeq;
  private final long restartSeq;
  private final ImmutableList<DecodedChange> changes;

  public ChangeBatch(long transactionId, long firstSeq, long commitSeq, long restartSeq,
                     ImmutableList<DecodedChange> changes) {
    if (restartSeq > commitSeq) {
      throw new IllegalArgumentException("restartSeq " + restartSeq + " is after commitSeq " + commitSeq);
    }
    this.transactionId = transactionId;
    this.firstSeq = firstSeq;
    this.commitSeq = commitSeq;
    this.restartSeq = restartSeq;
    this.changes = changes;
  }

  public long getTransactionId() {
    return transactionId;
  }

  public long getFirstSeq() {
    return firstSeq;
  }

  public long getCommitSeq() {
    return commitSeq;
  }

  public long getRestartSeq() {
    return restartSeq;
  }

  public ImmutableList<DecodedChange> getChanges() {
    return changes;
  }

  public boolean isEmpty() {
    return changes.isEmpty();
  }

  @Override
  public String toString() {
    return "ChangeBatch{" +
        "transactionId=" + transactionId +
        ", firstSeq=" + firstSeq +
        ", commitSeq=" + commitSeq +
        ", restartSeq=" + restartSeq +
        ", changes=" + changes.size() +
        '}';
  }
}
