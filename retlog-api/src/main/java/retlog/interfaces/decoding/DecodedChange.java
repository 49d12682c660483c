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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * One logical change of a committed transaction, as seen by a consumer.
 */
public final class DecodedChange {
  private final String entity;
  private final Operation operation;
  @Nullable
  private final byte[] beforeImage;
  @Nullable
  private final byte[] afterImage;
  private final long commitSeq;
  private final long transactionId;

  public DecodedChange(@NotNull String entity, @NotNull Operation operation, @Nullable byte[] beforeImage,
                       @Nullable byte[] afterImage, long commitSeq, long transactionId) {
    this.entity = entity;
    this.operation = operation;
    this.beforeImage = beforeImage;
    this.afterImage = afterImage;
    this.commitSeq = commitSeq;
    this.transactionId = transactionId;
  }

  public String getEntity() {
    return entity;
  }

  public Operation getOperation() {
    return operation;
  }

  @Nullable
  public byte[] getBeforeImage() {
    return beforeImage;
  }

  @Nullable
  public byte[] getAfterImage() {
    return afterImage;
  }

  public long getCommitSeq() {
    return commitSeq;
  }

  public long getTransactionId() {
    return transactionId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DecodedChange that = (DecodedChange) o;
    return commitSeq == that.commitSeq
        && transactionId == that.transactionId
        && entity.equals(that.entity)
        && operation == that.operation
        && Arrays.equals(beforeImage, that.beforeImage)
        && Arrays.equals(afterImage, that.afterImage);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(entity, operation, commitSeq, transactionId);
    result = 31 * result + Arrays.hashCode(beforeImage);
    result = 31 * result + Arrays.hashCode(afterImage);
    return result;
  }

  @Override
  public String toString() {
    return "DecodedChange{" +
        "entity='" + entity + '\'' +
        ", operation=" + operation +
        ", commitSeq=" + commitSeq +
        ", transactionId=" + transactionId +
        '}';
  }
}
